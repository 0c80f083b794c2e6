package com.productgap.engine.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Bean
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter analyzerPacingRateLimiter(
            @Value("${app.ratelimit.analyzerQps:2.0}") double analyzerQps
    ) {
        // Paces analyzer calls so the resilience4j limiter rarely has to reject
        return RateLimiter.create(Math.max(0.1, analyzerQps));
    }
}
