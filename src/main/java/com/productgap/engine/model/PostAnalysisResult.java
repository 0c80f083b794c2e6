package com.productgap.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured analysis of one post as returned by a {@code PostAnalyzer}.
 * Fields are boxed so that a missing value in the model output stays distinguishable from a default.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PostAnalysisResult(
        @JsonProperty("problem_summary") String problemSummary,
        @JsonProperty("pain_severity") Integer painSeverity,
        @JsonProperty("willingness_to_pay") Boolean willingnessToPay,
        @JsonProperty("product_category") String category,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("model_id") String modelId) {

    public PostAnalysisResult withModelId(String modelId) {
        return new PostAnalysisResult(problemSummary, painSeverity, willingnessToPay, category, keywords, modelId);
    }
}
