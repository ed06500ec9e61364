package com.apelier.aiengine.features.analysis.domain;

/**
 * Colour and tone statistics used to adapt later edits to the image.
 * Luminance values are on the 8-bit LAB scale (0..255); white balance
 * warmth/tint are the mean LAB b/a channels, where 128 is neutral.
 */
public record ImageCharacteristics(
    double meanBrightness,
    double exposureBias,
    double contrast,
    ContrastClass contrastClass,
    double darkClipFraction,
    double brightClipFraction,
    boolean backlit,
    double whiteBalanceWarmth,
    double whiteBalanceTint,
    double meanSaturation,
    SaturationClass saturationClass,
    double noiseSigma,
    boolean noisy,
    double luminanceP2,
    double luminanceP98,
    double dynamicRange
) {
}
