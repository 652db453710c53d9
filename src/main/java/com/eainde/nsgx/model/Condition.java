package com.eainde.nsgx.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A typed qualifier attached to a {@link Fact}, e.g. a closed season, a time window
 * or an engine-power limit.
 *
 * <p>Range conditions carry {@code from}/{@code to}; scalar conditions carry
 * {@code value}. Bounds are kept as the text the service returned ("1", "01.03.",
 * "22:00") and compared through {@code RangeBound} when merging.</p>
 *
 * @param type       condition type, e.g. {@code datumspanne}, {@code tageszeit}, {@code motor_leistung_kw}
 * @param value      scalar value, or null for pure ranges
 * @param from       inclusive range start, or null
 * @param to         inclusive range end, or null
 * @param confidence confidence the service attached to this condition, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Condition(
        @JsonProperty("type")       String type,
        @JsonProperty("value")      String value,
        @JsonProperty("from")       String from,
        @JsonProperty("to")         String to,
        @JsonProperty("confidence") Double confidence
) {

    public Condition {
        Objects.requireNonNull(type, "type");
    }

    public static Condition scalar(String type, String value) {
        return new Condition(type, value, null, null, null);
    }

    public static Condition range(String type, String from, String to) {
        return new Condition(type, null, from, to, null);
    }

    /**
     * @return true if both range bounds are present
     */
    @JsonIgnore
    public boolean isRange() {
        return from != null && to != null;
    }

    /**
     * @return this condition's confidence, treating a missing value as 0
     */
    @JsonIgnore
    public double confidenceOrZero() {
        return confidence != null ? confidence : 0.0;
    }

    public Condition withRange(String newFrom, String newTo) {
        return new Condition(type, value, newFrom, newTo, confidence);
    }

    public Condition withTypeAndValue(String newType, String newValue) {
        return new Condition(newType, newValue, from, to, confidence);
    }
}
