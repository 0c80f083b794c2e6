package com.productgap.engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;

@Configuration
public class BedrockClientConfiguration {

    @Value("${aws.region}")
    private String awsRegion;

    // Upper bound for one analyzer call including SDK retries; a timeout counts as an extraction failure
    @Value("${aws.bedrock.api-call-timeout:PT30S}")
    private Duration apiCallTimeout;

    @Value("${aws.bedrock.api-call-attempt-timeout:PT20S}")
    private Duration apiCallAttemptTimeout;

    @Bean
    public BedrockRuntimeClient bedrockRuntimeClient() {
        // Standard chain: env vars, system properties, profile file, instance metadata
        DefaultCredentialsProvider credentialsProvider = DefaultCredentialsProvider.create();

        return BedrockRuntimeClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(credentialsProvider)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .apiCallAttemptTimeout(apiCallAttemptTimeout)
                        .build())
                .build();
    }
}
