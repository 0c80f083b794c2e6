package com.productgap.engine.model;

public enum OpportunityStatus {
    ACTIVE,
    ARCHIVED
}
