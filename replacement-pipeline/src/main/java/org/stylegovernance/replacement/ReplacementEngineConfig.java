package org.stylegovernance.replacement;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import org.stylegovernance.replacement.retry.RetryPolicy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Tuning for the batch scheduler and the per-element retry policy. The defaults are what the engine was
 * designed around; most callers should not need to change them.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReplacementEngineConfig {
    private static final ObjectMapper objectMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    @Builder.Default
    int initialBatchSize = 100;
    @Builder.Default
    int minBatchSize = 25;
    @Builder.Default
    int maxBatchSize = 100;
    /** Consecutive clean batches required before the batch size grows. */
    @Builder.Default
    int successThreshold = 5;
    @Builder.Default
    int growthStep = 25;
    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    List<Long> retryDelaysMillis = List.of(1000L, 2000L, 4000L);

    public static ReplacementEngineConfig defaults() {
        return builder().build().validate();
    }

    public static ReplacementEngineConfig fromJson(InputStream json) throws IOException {
        return objectMapper.readValue(json, ReplacementEngineConfig.class).validate();
    }

    /**
     * @return this config
     * @throws IllegalArgumentException if the values cannot describe a working scheduler
     */
    public ReplacementEngineConfig validate() {
        if (minBatchSize < 1) {
            throw new IllegalArgumentException("minBatchSize must be positive but was " + minBatchSize);
        }
        if (maxBatchSize < minBatchSize) {
            throw new IllegalArgumentException(
                "maxBatchSize (" + maxBatchSize + ") must not be below minBatchSize (" + minBatchSize + ")");
        }
        if (initialBatchSize < minBatchSize || initialBatchSize > maxBatchSize) {
            throw new IllegalArgumentException("initialBatchSize " + initialBatchSize
                + " is outside [" + minBatchSize + ", " + maxBatchSize + "]");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be positive but was " + successThreshold);
        }
        if (growthStep < 1) {
            throw new IllegalArgumentException("growthStep must be positive but was " + growthStep);
        }
        toRetryPolicy();
        return this;
    }

    public RetryPolicy toRetryPolicy() {
        if (retryDelaysMillis == null) {
            throw new IllegalArgumentException("retryDelaysMillis is required");
        }
        return RetryPolicy.ofMillis(maxAttempts, retryDelaysMillis);
    }
}
