package com.productgap.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productgap.engine.model.PostAnalysisResult;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

@Service
public class BedrockPostAnalyzer implements PostAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(BedrockPostAnalyzer.class);

    static final int MAX_CONTENT_LENGTH = 1000;

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String bedrockModelId;
    private final int maxTokens;

    public BedrockPostAnalyzer(BedrockRuntimeClient bedrockClient,
                               ObjectMapper objectMapper,
                               @Value("${aws.bedrock.modelId}") String modelId,
                               @Value("${aws.bedrock.maxTokens:1000}") int maxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.bedrockModelId = modelId;
        this.maxTokens = maxTokens;
        logger.info("BedrockPostAnalyzer initialized with model ID: {}", modelId);
    }

    @Override
    @RateLimiter(name = "postAnalyzer")
    public PostAnalysisResult analyze(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new AnalysisUnavailableException("Post has no text to analyze");
        }
        String content = rawText.length() > MAX_CONTENT_LENGTH ? rawText.substring(0, MAX_CONTENT_LENGTH) : rawText;

        try {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("anthropic_version", "bedrock-2023-05-31");
            payload.put("max_tokens", maxTokens);
            payload.put("temperature", 0.0);
            ArrayNode messages = objectMapper.createArrayNode();
            ObjectNode message = objectMapper.createObjectNode();
            message.put("role", "user");
            message.put("content", createAnalysisPrompt(content));
            messages.add(message);
            payload.set("messages", messages);

            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(bedrockModelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();

            InvokeModelResponse response = bedrockClient.invokeModel(request);
            String responseBody = response.body().asUtf8String();
            logger.debug("Bedrock analysis response: {}", responseBody);

            JsonNode contentBlock = objectMapper.readTree(responseBody).path("content");
            if (!contentBlock.isArray() || contentBlock.isEmpty()) {
                throw new AnalysisUnavailableException("Bedrock response does not contain a content block");
            }
            String textContent = stripCodeFence(contentBlock.get(0).path("text").asText(""));
            int jsonStart = textContent.indexOf('{');
            int jsonEnd = textContent.lastIndexOf('}');
            if (jsonStart == -1 || jsonEnd < jsonStart) {
                throw new AnalysisUnavailableException("Bedrock response content is not a JSON object");
            }
            PostAnalysisResult result = objectMapper.readValue(
                    textContent.substring(jsonStart, jsonEnd + 1), PostAnalysisResult.class);
            return result.withModelId(bedrockModelId);
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during analysis for model {}: {}", bedrockModelId, detail);
            throw new AnalysisUnavailableException("Bedrock API error: " + detail, e);
        } catch (SdkException e) {
            logger.error("Bedrock call failed for model {}: {}", bedrockModelId, e.getMessage());
            throw new AnalysisUnavailableException("Bedrock call failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            logger.error("Could not parse Bedrock analysis for model {}: {}", bedrockModelId, e.getOriginalMessage());
            throw new AnalysisUnavailableException("Unparseable analysis: " + e.getOriginalMessage(), e);
        }
    }

    static String stripCodeFence(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            trimmed = firstLineEnd == -1 ? trimmed.substring(3) : trimmed.substring(firstLineEnd + 1);
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3);
            }
        }
        return trimmed.trim();
    }

    private String createAnalysisPrompt(String content) {
        return """
                Analyze this social media post for product opportunity signals.

                Extract:
                1. problem_summary: One sentence description of the core problem (or "none" if no problem)
                2. pain_severity: Rate 1-10 how severe the problem is (0 if no problem)
                3. willingness_to_pay: Does the post indicate willingness to pay? (true/false)
                4. product_category: What type of solution? (new_invention | better_alternative | cheaper_option | quality_improvement | none)
                5. keywords: 3-5 relevant keywords

                Post:
                %s

                Respond with ONLY a JSON object, no other text:
                {"problem_summary": "...", "pain_severity": 8, "willingness_to_pay": true, "product_category": "better_alternative", "keywords": ["keyword1", "keyword2"]}
                """.formatted(content);
    }
}
