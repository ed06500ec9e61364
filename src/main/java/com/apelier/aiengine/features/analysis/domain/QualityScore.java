package com.apelier.aiengine.features.analysis.domain;

/**
 * Quality sub-scores, each in [0, 100] and rounded to one decimal.
 * Overall is the weighted sum 0.30 exposure + 0.30 sharpness + 0.20 noise + 0.20 composition.
 */
public record QualityScore(
    double overall,
    double exposure,
    double sharpness,
    double noise,
    double composition
) {
    
    public static final double EXPOSURE_WEIGHT = 0.30;
    public static final double SHARPNESS_WEIGHT = 0.30;
    public static final double NOISE_WEIGHT = 0.20;
    public static final double COMPOSITION_WEIGHT = 0.20;
    
    public static QualityScore of(double exposure, double sharpness, double noise, double composition) {
        double overall = exposure * EXPOSURE_WEIGHT
                + sharpness * SHARPNESS_WEIGHT
                + noise * NOISE_WEIGHT
                + composition * COMPOSITION_WEIGHT;
        return new QualityScore(
            round1(overall),
            round1(exposure),
            round1(sharpness),
            round1(noise),
            round1(composition)
        );
    }
    
    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
