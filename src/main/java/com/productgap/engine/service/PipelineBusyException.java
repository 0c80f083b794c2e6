package com.productgap.engine.service;

public class PipelineBusyException extends RuntimeException {
    public PipelineBusyException(String message) {
        super(message);
    }
}
