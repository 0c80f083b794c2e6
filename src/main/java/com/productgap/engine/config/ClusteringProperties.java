package com.productgap.engine.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Similarity weights and attachment threshold for assigning signals to opportunities.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "opportunity.clustering")
public class ClusteringProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double keywordWeight = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double categoryWeight = 0.2;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double summaryWeight = 0.3;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double attachThreshold = 0.45;

    @AssertTrue(message = "the normalized categoryWeight must stay below attachThreshold so a category match alone never attaches")
    public boolean isCategoryAloneBelowThreshold() {
        double total = totalWeight();
        return total <= 0.0 || categoryWeight / total < attachThreshold;
    }

    @AssertTrue(message = "at least one similarity weight must be positive")
    public boolean isAnyWeightPositive() {
        return totalWeight() > 0.0;
    }

    public double totalWeight() {
        return keywordWeight + categoryWeight + summaryWeight;
    }
}
