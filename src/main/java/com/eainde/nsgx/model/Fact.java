package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A rule extracted from regulation text: who may (or may not) do what, where,
 * under which conditions.
 *
 * <p>Two facts with the same {@link #key()} describe the same statement and are
 * merged by the merge engine rather than kept side by side.</p>
 *
 * @param activity            catalog activity, e.g. {@code drohnen_flugmodelle}
 * @param place               catalog place, e.g. {@code pfade}
 * @param permission          {@code verboten}, {@code erlaubt}, {@code genehmigungspflichtig}, ...
 * @param zone                zone scope, or null when the rule covers the whole area
 * @param conditions          qualifying conditions
 * @param citations           paragraph references (set semantics)
 * @param confidence          service confidence in [0, 1]
 * @param normalizationReason why the service mapped the text onto these catalog values
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Fact(
        @JsonProperty("activity")             String activity,
        @JsonProperty("place")                String place,
        @JsonProperty("permission")           String permission,
        @JsonProperty("zone")                 Zone zone,
        @JsonProperty("conditions")           List<Condition> conditions,
        @JsonProperty("citations")            List<String> citations,
        @JsonProperty("confidence")           double confidence,
        @JsonProperty("normalization_reason") String normalizationReason
) {

    public Fact {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    /**
     * Equivalence key used to detect duplicate statements.
     */
    @JsonIgnore
    public FactKey key() {
        return new FactKey(activity, place, permission,
                zone != null ? zone.zoneType() : null,
                zone != null ? zone.zoneName() : null);
    }

    public Fact withConditions(List<Condition> newConditions) {
        return new Fact(activity, place, permission, zone, newConditions, citations,
                confidence, normalizationReason);
    }
}
