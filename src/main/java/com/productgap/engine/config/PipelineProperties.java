package com.productgap.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "opportunity.pipeline")
public class PipelineProperties {

    // also the lock name and the scraper_metadata row written after each run
    @NotBlank
    private String name = "opportunity-pipeline";

    @Min(1)
    private int defaultBatchSize = 50;

    @Min(1)
    private int maxBatchSize = 500;

    private Duration lockLease = Duration.ofMinutes(30);

    @Min(1)
    private int excerptLength = 200;
}
