package com.apelier.aiengine.features.output.domain;

/**
 * JPEG encodings of one photo for each delivery tier.
 */
public record GeneratedOutputs(
    byte[] fullRes,
    byte[] webRes,
    byte[] thumbnail,
    int fullWidth,
    int fullHeight
) {
}
