package com.apelier.aiengine.features.analysis.domain;

public enum ContrastClass {
    LOW,
    NORMAL,
    HIGH
}
