package com.productgap.engine.service;

/**
 * The post analyzer failed or returned output that cannot be used. The post stays unprocessed
 * and is picked up again by a later batch.
 */
public class AnalysisUnavailableException extends RuntimeException {
    public AnalysisUnavailableException(String message) {
        super(message);
    }

    public AnalysisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
