package com.eainde.nsgx.merge;

import com.eainde.nsgx.model.Condition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Merges the conditions of duplicate facts, type by type.
 *
 * <h3>Merge rules:</h3>
 * <ol>
 *   <li>Range types (date and time windows): complete ranges are sorted by start and
 *       swept; a range whose start is {@code <=} the current end is absorbed, the end
 *       becomes the later of the two, and the non-range fields come from the
 *       higher-confidence condition. One condition per disjoint interval, in start order.</li>
 *   <li>Range-typed conditions missing a bound are kept as they are, and so are ranges
 *       that wrap around (start after end, e.g. {@code 01.11.} to {@code 28.02.} or
 *       {@code 22:00} to {@code 06:00}): they are never swept, so a wrapped range and
 *       an ordinary one covering the same days stay two conditions.</li>
 *   <li>Other types: if all conditions carry the same value, exactly one is kept
 *       (the most confident); otherwise every distinct value is kept.</li>
 * </ol>
 *
 * <p>Inputs are sorted on a total order before merging, so the output does not
 * depend on the order the conditions arrive in.</p>
 */
public class ConditionMerger {

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.<String>naturalOrder());

    static final Comparator<Condition> CONDITION_ORDER = Comparator
            .comparing(Condition::type)
            .thenComparing(Condition::from, RangeBound.ORDER)
            .thenComparing(Condition::to, RangeBound.ORDER)
            .thenComparing(Condition::value, TEXT)
            .thenComparing(Condition::confidence, Comparator.nullsFirst(Comparator.<Double>naturalOrder()));

    /** Highest confidence first, then the total order. */
    private static final Comparator<Condition> MOST_CONFIDENT_FIRST = Comparator
            .comparingDouble(Condition::confidenceOrZero).reversed()
            .thenComparing(CONDITION_ORDER);

    private final Set<String> rangeTypes;

    public ConditionMerger(Set<String> rangeTypes) {
        this.rangeTypes = Set.copyOf(rangeTypes);
    }

    public List<Condition> merge(List<Condition> conditions) {
        Map<String, List<Condition>> byType = new TreeMap<>();
        for (Condition condition : conditions) {
            byType.computeIfAbsent(condition.type(), k -> new ArrayList<>()).add(condition);
        }

        List<Condition> merged = new ArrayList<>();
        byType.forEach((type, group) -> {
            if (rangeTypes.contains(type)) {
                merged.addAll(mergeRanges(group));
            } else {
                merged.addAll(mergeValues(group));
            }
        });
        return merged;
    }

    public boolean isRangeType(String type) {
        return rangeTypes.contains(type);
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private static List<Condition> mergeRanges(List<Condition> group) {
        List<Condition> complete = new ArrayList<>();
        List<Condition> unswept = new ArrayList<>();
        for (Condition condition : group) {
            boolean sweepable = condition.isRange()
                    && RangeBound.ORDER.compare(condition.from(), condition.to()) <= 0;
            (sweepable ? complete : unswept).add(condition);
        }
        complete.sort(CONDITION_ORDER);

        List<Condition> merged = new ArrayList<>();
        Condition current = null;
        for (Condition next : complete) {
            if (current == null) {
                current = next;
            } else if (RangeBound.ORDER.compare(next.from(), current.to()) <= 0) {
                String end = RangeBound.max(current.to(), next.to());
                Condition carrier = next.confidenceOrZero() > current.confidenceOrZero() ? next : current;
                current = carrier.withRange(current.from(), end);
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }

        unswept.stream().distinct().sorted(CONDITION_ORDER).forEach(merged::add);
        return merged;
    }

    private static List<Condition> mergeValues(List<Condition> group) {
        // one condition per (value, from, to): the most confident
        Map<List<String>, Condition> distinct = new LinkedHashMap<>();
        group.stream()
                .sorted(MOST_CONFIDENT_FIRST)
                .forEach(c -> distinct.putIfAbsent(
                        Arrays.asList(c.value(), c.from(), c.to()), c));

        List<Condition> kept = new ArrayList<>(distinct.values());
        boolean sameValue = kept.stream().map(Condition::value).filter(Objects::nonNull).distinct().count() == 1
                && kept.stream().allMatch(c -> c.value() != null);
        if (sameValue) {
            return List.of(kept.stream().min(MOST_CONFIDENT_FIRST).orElseThrow());
        }
        kept.sort(CONDITION_ORDER);
        return kept;
    }
}
