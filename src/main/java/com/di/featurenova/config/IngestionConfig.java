package com.di.featurenova.config;

import java.time.Duration;

/** Immutable settings of the ingestion stage. */
public record IngestionConfig(int batchSize, Duration batchTimeout, double testFraction, long randomSeed) {

    public static final IngestionConfig DEFAULTS = new IngestionConfig(5_000, Duration.ofSeconds(120), 0.2, 42L);

    public IngestionConfig {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (batchTimeout == null || batchTimeout.isZero() || batchTimeout.isNegative()) {
            throw new IllegalArgumentException("batchTimeout must be positive, got " + batchTimeout);
        }
        if (!(testFraction > 0.0 && testFraction < 1.0)) {
            throw new IllegalArgumentException("testFraction must be in (0, 1), got " + testFraction);
        }
    }
}
