package com.eainde.nsgx.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Equivalence key of a {@link Fact}: activity, place, permission and zone.
 */
public record FactKey(String activity, String place, String permission,
                      String zoneType, String zoneName) implements Comparable<FactKey> {

    private static final Comparator<String> NULLS_FIRST =
            Comparator.nullsFirst(Comparator.<String>naturalOrder());

    private static final Comparator<FactKey> ORDER = Comparator
            .comparing(FactKey::activity, NULLS_FIRST)
            .thenComparing(FactKey::place, NULLS_FIRST)
            .thenComparing(FactKey::permission, NULLS_FIRST)
            .thenComparing(FactKey::zoneType, NULLS_FIRST)
            .thenComparing(FactKey::zoneName, NULLS_FIRST);

    @Override
    public int compareTo(FactKey other) {
        return ORDER.compare(this, Objects.requireNonNull(other));
    }
}
