package com.di.featurenova.config;

/** Immutable settings of the validation stage. */
public record ValidationConfig(double driftAlpha) {

    public static final ValidationConfig DEFAULTS = new ValidationConfig(0.05);

    public ValidationConfig {
        if (!(driftAlpha > 0.0 && driftAlpha < 1.0)) {
            throw new IllegalArgumentException("driftAlpha must be in (0, 1), got " + driftAlpha);
        }
    }
}
