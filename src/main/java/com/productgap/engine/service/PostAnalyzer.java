package com.productgap.engine.service;

import com.productgap.engine.model.PostAnalysisResult;

/**
 * Turns raw post text into a structured analysis.
 * <p>
 * Implementations call an external model. Transient and permanent failures are both reported as
 * {@link AnalysisUnavailableException}; callers never retry within the same batch.
 */
public interface PostAnalyzer {

    PostAnalysisResult analyze(String rawText);
}
