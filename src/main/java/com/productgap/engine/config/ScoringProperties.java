package com.productgap.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "opportunity.scoring")
public class ScoringProperties {

    // saturation constant k in 100 * (1 - e^(-k * n))
    @DecimalMin(value = "0.0", inclusive = false)
    private double confidenceSaturation = 0.35;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private double willingnessToPayBonus = 10.0;

    private Duration narrowWindow = Duration.ofHours(1);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double narrowWindowFactor = 0.6;

    private Duration trendWindow = Duration.ofDays(7);

    @Min(1)
    private int emergingMaxPosts = 2;

    @DecimalMin(value = "1.0")
    private double accelerationFactor = 1.5;

    @Min(0)
    private long communityEngagementThreshold = 500;
}
