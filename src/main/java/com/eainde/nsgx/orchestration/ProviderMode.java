package com.eainde.nsgx.orchestration;

import java.util.Locale;

/**
 * Which model(s) a unit is sent to.
 */
public enum ProviderMode {

    /** Cheap model only. */
    FAST("chat"),

    /** Expensive model only. */
    THOROUGH("reasoner"),

    /** Cheap model first, escalating low-confidence results to the expensive one. */
    ADAPTIVE("auto");

    private final String alias;

    ProviderMode(String alias) {
        this.alias = alias;
    }

    /**
     * Accepts the enum name in any case, or the aliases {@code chat},
     * {@code reasoner} and {@code auto}.
     */
    public static ProviderMode fromLabel(String label) {
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (ProviderMode mode : values()) {
            if (mode.name().toLowerCase(Locale.ROOT).equals(normalized) || mode.alias.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown provider mode: " + label);
    }
}
