package com.eainde.nsgx.client;

import java.time.Duration;

/**
 * Model identifier plus the request parameters used with it.
 *
 * @param modelId     model name sent to the service, also part of the cache key
 * @param timeout     per-call ceiling
 * @param temperature sampling temperature
 * @param maxTokens   completion token limit
 */
public record ModelProfile(String modelId, Duration timeout, double temperature, int maxTokens) {

    public static ModelProfile fast(String modelId, Duration timeout) {
        return new ModelProfile(modelId, timeout, 0.2, 2000);
    }

    public static ModelProfile thorough(String modelId, Duration timeout) {
        return new ModelProfile(modelId, timeout, 0.1, 1500);
    }
}
