package com.eainde.nsgx.client;

import com.eainde.nsgx.model.Candidate;
import com.eainde.nsgx.model.CandidateDecision;
import com.eainde.nsgx.model.Condition;
import com.eainde.nsgx.model.DroppedEntry;
import com.eainde.nsgx.model.ExtractionOutcome;
import com.eainde.nsgx.model.Fact;
import com.eainde.nsgx.model.FailureKind;
import com.eainde.nsgx.model.StructuredResult;
import com.eainde.nsgx.model.Zone;
import com.eainde.nsgx.proposal.CandidateNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the service's message content into a {@link StructuredResult}.
 *
 * <h3>Accepted shapes:</h3>
 * <pre>
 * { "rules": [ {activity, place, permission, zone, conditions, citations, confidence, normalization_reason} ],
 *   "new_candidates": { "activities": [ {key_snake, original, quote, confidence, why_new, decision?} ] } }
 *
 * { "proposals": [ {type, candidate, decision, target_or_key, reason, citation, confidence} ] }
 * </pre>
 *
 * <p>Content that is not a JSON object, or that has none of the expected sections,
 * is a {@link FailureKind#MALFORMED_RESPONSE}. Individual entries failing field
 * validation are dropped and reported; the rest of the result is kept.</p>
 */
@Log4j2
public class ExtractionResponseParser {

    /** Proposal {@code type} values of the enum-diff shape mapped onto candidate categories. */
    private static final Map<String, String> PROPOSAL_CATEGORIES = Map.of(
            "aktivitaet", "activities",
            "zone", "zone_terms",
            "zone_typ", "zone_terms",
            "ort", "place_terms");

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ExtractionOutcome parse(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            log.error("Response content is not valid JSON: {} | raw content: {}", e.getOriginalMessage(), content);
            return ExtractionOutcome.failure(FailureKind.MALFORMED_RESPONSE,
                    "Content is not valid JSON: " + e.getOriginalMessage(), content);
        }
        if (root == null || !root.isObject()) {
            return ExtractionOutcome.failure(FailureKind.MALFORMED_RESPONSE,
                    "Content is not a JSON object", content);
        }

        JsonNode rules = root.get("rules");
        JsonNode candidates = root.get("new_candidates");
        JsonNode proposals = root.get("proposals");
        if (rules == null && candidates == null && proposals == null) {
            return ExtractionOutcome.failure(FailureKind.MALFORMED_RESPONSE,
                    "Content has none of rules, new_candidates, proposals", content);
        }
        if ((rules != null && !rules.isArray())
                || (candidates != null && !candidates.isObject())
                || (proposals != null && !proposals.isArray())) {
            return ExtractionOutcome.failure(FailureKind.MALFORMED_RESPONSE,
                    "Unexpected section type in content", content);
        }

        List<DroppedEntry> dropped = new ArrayList<>();
        List<Fact> facts = new ArrayList<>();
        Map<String, List<Candidate>> byCategory = new LinkedHashMap<>();

        if (rules != null) {
            for (int i = 0; i < rules.size(); i++) {
                Validated<Fact> fact = toFact(rules.get(i));
                if (fact.value != null) {
                    facts.add(fact.value);
                } else {
                    dropped.add(new DroppedEntry("rules", i, fact.error));
                }
            }
        }

        if (candidates != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = candidates.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String category = entry.getKey();
                JsonNode list = entry.getValue();
                if (!list.isArray()) {
                    dropped.add(new DroppedEntry(category, -1, "category is not a list"));
                    continue;
                }
                for (int i = 0; i < list.size(); i++) {
                    Validated<Candidate> candidate = toCandidate(list.get(i));
                    if (candidate.value != null) {
                        byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(candidate.value);
                    } else {
                        dropped.add(new DroppedEntry(category, i, candidate.error));
                    }
                }
            }
        }

        if (proposals != null) {
            for (int i = 0; i < proposals.size(); i++) {
                JsonNode node = proposals.get(i);
                String category = PROPOSAL_CATEGORIES.get(text(node, "type").toLowerCase(Locale.ROOT));
                if (category == null) {
                    dropped.add(new DroppedEntry("proposals", i, "unknown proposal type '" + text(node, "type") + "'"));
                    continue;
                }
                Validated<Candidate> candidate = fromProposal(node);
                if (candidate.value != null) {
                    byCategory.computeIfAbsent(category, k -> new ArrayList<>()).add(candidate.value);
                } else {
                    dropped.add(new DroppedEntry("proposals", i, candidate.error));
                }
            }
        }

        for (DroppedEntry entry : dropped) {
            log.warn("Dropped invalid entry {}[{}]: {}", entry.section(), entry.index(), entry.reason());
        }
        return ExtractionOutcome.success(new StructuredResult(facts, byCategory), dropped);
    }

    // =========================================================================
    //  Field validation
    // =========================================================================

    private Validated<Fact> toFact(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Validated.error("rule is not an object");
        }
        for (String required : List.of("activity", "place", "permission")) {
            if (text(node, required).isBlank()) {
                return Validated.error("missing " + required);
            }
        }
        Optional<Double> confidence = confidence(node);
        if (confidence.isEmpty()) {
            return Validated.error("confidence outside [0, 1]");
        }

        Zone zone = null;
        JsonNode zoneNode = node.get("zone");
        if (zoneNode != null && !zoneNode.isNull()) {
            if (!zoneNode.isObject() || text(zoneNode, "zone_typ").isBlank()) {
                return Validated.error("zone without zone_typ");
            }
            zone = new Zone(text(zoneNode, "zone_typ"), nullableText(zoneNode, "zone_name"));
        }

        List<Condition> conditions = new ArrayList<>();
        JsonNode conditionNodes = node.path("conditions");
        for (JsonNode c : conditionNodes) {
            if (!c.isObject() || text(c, "type").isBlank()) {
                return Validated.error("condition without type");
            }
            JsonNode conf = c.get("confidence");
            conditions.add(new Condition(
                    text(c, "type"),
                    nullableText(c, "value"),
                    nullableText(c, "from"),
                    nullableText(c, "to"),
                    conf != null && conf.isNumber() ? conf.asDouble() : null));
        }

        List<String> citations = new ArrayList<>();
        for (JsonNode citation : node.path("citations")) {
            if (!citation.asText().isBlank()) {
                citations.add(citation.asText());
            }
        }

        return Validated.ok(new Fact(
                text(node, "activity"),
                text(node, "place"),
                text(node, "permission"),
                zone,
                conditions,
                citations,
                confidence.get(),
                text(node, "normalization_reason")));
    }

    private Validated<Candidate> toCandidate(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Validated.error("candidate is not an object");
        }
        String original = text(node, "original");
        String key = text(node, "key_snake");
        if (original.isBlank()) {
            return Validated.error("missing original");
        }
        if (key.isBlank()) {
            return Validated.error("missing key_snake");
        }
        Optional<Double> confidence = confidence(node);
        if (confidence.isEmpty()) {
            return Validated.error("confidence outside [0, 1]");
        }
        CandidateDecision decision = null;
        if (node.hasNonNull("decision")) {
            decision = CandidateDecision.fromLabel(text(node, "decision")).orElse(null);
            if (decision == null) {
                return Validated.error("unknown decision '" + text(node, "decision") + "'");
            }
        }
        return Validated.ok(new Candidate(
                key,
                original,
                text(node, "quote"),
                confidence.get(),
                nullableText(node, "why_new"),
                decision,
                nullableText(node, "target_or_key")));
    }

    private Validated<Candidate> fromProposal(JsonNode node) {
        String original = text(node, "candidate");
        if (original.isBlank()) {
            return Validated.error("missing candidate");
        }
        Optional<Double> confidence = confidence(node);
        if (confidence.isEmpty()) {
            return Validated.error("confidence outside [0, 1]");
        }
        Optional<CandidateDecision> decision = CandidateDecision.fromLabel(text(node, "decision"));
        if (decision.isEmpty()) {
            return Validated.error("unknown decision '" + text(node, "decision") + "'");
        }
        return Validated.ok(new Candidate(
                CandidateNormalizer.toSnakeCase(original),
                original,
                text(node, "citation"),
                confidence.get(),
                nullableText(node, "reason"),
                decision.get(),
                nullableText(node, "target_or_key")));
    }

    /**
     * Missing confidence defaults to 0; present values must be numbers in [0, 1].
     */
    private static Optional<Double> confidence(JsonNode node) {
        JsonNode value = node.get("confidence");
        if (value == null || value.isNull()) {
            return Optional.of(0.0);
        }
        if (!value.isNumber()) {
            return Optional.empty();
        }
        double d = value.asDouble();
        return d >= 0.0 && d <= 1.0 ? Optional.of(d) : Optional.empty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }

    private static String nullableText(JsonNode node, String field) {
        String value = text(node, field);
        return value.isEmpty() ? null : value;
    }

    private record Validated<T>(T value, String error) {
        static <T> Validated<T> ok(T value) {
            return new Validated<>(value, null);
        }

        static <T> Validated<T> error(String error) {
            return new Validated<>(null, error);
        }
    }
}
