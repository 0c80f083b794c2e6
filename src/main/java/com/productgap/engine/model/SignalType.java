package com.productgap.engine.model;

/**
 * Why a post counts as evidence for an opportunity. One post may carry several types.
 */
public enum SignalType {
    PROBLEM_STATEMENT,
    WILLINGNESS_TO_PAY,
    COMPETITOR_MENTION
}
