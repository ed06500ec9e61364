package com.apelier.aiengine.features.analysis.domain;

public enum SaturationClass {
    DESATURATED,
    NORMAL,
    OVERSATURATED
}
