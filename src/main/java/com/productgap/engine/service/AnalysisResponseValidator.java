package com.productgap.engine.service;

import com.productgap.engine.model.PostAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class AnalysisResponseValidator {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisResponseValidator.class);

    /**
     * Lists what is wrong with an analyzer result. An empty list means the result can be stored.
     *
     * @param result the analyzer output, possibly null
     * @return human readable problems, in field order
     */
    public List<String> problems(PostAnalysisResult result) {
        List<String> problems = new ArrayList<>();
        if (result == null) {
            problems.add("analysis is missing");
            logger.warn("Validation failed: analyzer returned no result.");
            return problems;
        }
        if (result.problemSummary() == null) {
            problems.add("'problem_summary' is missing");
        }
        if (result.painSeverity() == null) {
            problems.add("'pain_severity' is missing");
        } else if (result.painSeverity() < 0 || result.painSeverity() > 10) {
            problems.add("'pain_severity' " + result.painSeverity() + " is outside [0,10]");
        }
        if (result.willingnessToPay() == null) {
            problems.add("'willingness_to_pay' is missing");
        }
        if (result.category() == null || result.category().isBlank()) {
            problems.add("'product_category' is missing");
        }
        if (result.keywords() == null) {
            problems.add("'keywords' is missing");
        }

        if (!problems.isEmpty()) {
            logger.warn("Validation failed: {}", String.join("; ", problems));
        } else {
            logger.debug("Analysis validation successful.");
        }
        return problems;
    }
}
