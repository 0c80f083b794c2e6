package com.productgap.engine.model;

public enum GrowthPattern {
    EMERGING,
    REGULAR,
    ACCELERATING,
    DECLINING
}
