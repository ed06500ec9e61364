package com.apelier.aiengine.features.composition.domain;

public record CropRect(int x, int y, int width, int height) {
}
