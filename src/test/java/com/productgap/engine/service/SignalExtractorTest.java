package com.productgap.engine.service;

import com.google.common.util.concurrent.RateLimiter;
import com.productgap.engine.config.PipelineProperties;
import com.productgap.engine.model.PostAnalysis;
import com.productgap.engine.model.PostAnalysisResult;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.model.SignalType;
import com.productgap.engine.repository.PostAnalysisRepository;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignalExtractorTest {

    @Mock
    private PostAnalyzer postAnalyzer;

    @Mock
    private PostAnalysisRepository postAnalysisRepository;

    @Mock
    private RateLimiter analyzerPacing;

    private SignalExtractor extractor;

    @BeforeEach
    @SuppressWarnings("UnstableApiUsage")
    void setUp() {
        Clock clock = Clock.fixed(Signals.BASE_TIME.toInstant(), ZoneOffset.UTC);
        extractor = new SignalExtractor(postAnalyzer, new AnalysisResponseValidator(), postAnalysisRepository,
                new PipelineProperties(), analyzerPacing, clock);
    }

    @Test
    void normalizesAnalysisIntoSignal() {
        RawPost post = post("I'd pay $50 for a leash that doesn't tangle", Map.of("upvotes", 120, "comments", 30));
        when(postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId())).thenReturn(Optional.empty());
        when(postAnalyzer.analyze(anyString())).thenReturn(new PostAnalysisResult(
                " Leashes tangle ", 8, true, " better_alternative ", List.of("Dog Leash", "dog  leash", " ", "Tangle"), "m1"));
        when(postAnalysisRepository.save(any(PostAnalysis.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Signal signal = extractor.extract(post);

        assertThat(signal.rawPostId()).isEqualTo(post.getId());
        assertThat(signal.category()).isEqualTo("better_alternative");
        assertThat(signal.keywords()).containsExactly("dog leash", "tangle");
        assertThat(signal.problemSummary()).isEqualTo("Leashes tangle");
        assertThat(signal.painSeverity()).isEqualTo(8);
        assertThat(signal.signalTypes()).containsExactlyInAnyOrder(
                SignalType.PROBLEM_STATEMENT, SignalType.WILLINGNESS_TO_PAY, SignalType.COMPETITOR_MENTION);
        assertThat(signal.weight()).isCloseTo(1.0 + Math.log10(151) / 4.0, within(1e-9));
        assertThat(signal.observedAt()).isEqualTo(post.getCreatedAt());

        verify(analyzerPacing).acquire();
        ArgumentCaptor<PostAnalysis> saved = ArgumentCaptor.forClass(PostAnalysis.class);
        verify(postAnalysisRepository).save(saved.capture());
        assertThat(saved.getValue().getModelId()).isEqualTo("m1");
        assertThat(saved.getValue().getKeywords()).containsExactly("dog leash", "tangle");
    }

    @Test
    void reusesStoredAnalysisWithoutCallingAnalyzer() {
        RawPost post = post("Vacuum cords are too short", Map.of());
        PostAnalysis stored = new PostAnalysis();
        stored.setRawPostId(post.getId());
        stored.setProblemSummary("Cords too short");
        stored.setPainSeverity(5);
        stored.setProductCategory("quality_improvement");
        stored.setKeywords(List.of("vacuum", "cord"));
        when(postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId())).thenReturn(Optional.of(stored));

        Signal signal = extractor.extract(post);

        assertThat(signal.keywords()).containsExactly("cord", "vacuum");
        assertThat(signal.signalTypes()).containsExactly(SignalType.PROBLEM_STATEMENT);
        assertThat(signal.weight()).isEqualTo(1.0);
        verify(postAnalyzer, never()).analyze(anyString());
        verify(analyzerPacing, never()).acquire();
        verify(postAnalysisRepository, never()).save(any());
    }

    @Test
    void painOutsideRangeIsRejectedAndNothingStored() {
        RawPost post = post("Everything is broken", Map.of());
        when(postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId())).thenReturn(Optional.empty());
        when(postAnalyzer.analyze(anyString())).thenReturn(
                new PostAnalysisResult("Broken", 14, false, "none", List.of("broken"), "m1"));

        assertThatThrownBy(() -> extractor.extract(post))
                .isInstanceOf(AnalysisUnavailableException.class)
                .hasMessageContaining("pain_severity");
        verify(postAnalysisRepository, never()).save(any());
    }

    @Test
    void missingFieldIsRejected() {
        RawPost post = post("Something", Map.of());
        when(postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId())).thenReturn(Optional.empty());
        when(postAnalyzer.analyze(anyString())).thenReturn(
                new PostAnalysisResult("Something", 3, null, "none", List.of(), "m1"));

        assertThatThrownBy(() -> extractor.extract(post))
                .isInstanceOf(AnalysisUnavailableException.class)
                .hasMessageContaining("willingness_to_pay");
    }

    @Test
    void rateLimitRejectionBecomesAnalysisUnavailable() {
        RawPost post = post("Something", Map.of());
        when(postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId())).thenReturn(Optional.empty());
        when(postAnalyzer.analyze(anyString())).thenThrow(RequestNotPermitted.createRequestNotPermitted(
                io.github.resilience4j.ratelimiter.RateLimiter.of("postAnalyzer", RateLimiterConfig.ofDefaults())));

        assertThatThrownBy(() -> extractor.extract(post))
                .isInstanceOf(AnalysisUnavailableException.class)
                .hasCauseInstanceOf(RequestNotPermitted.class);
        verify(postAnalysisRepository, never()).save(any());
    }

    @Test
    void refusesProcessedPost() {
        RawPost post = post("Done already", Map.of());
        post.setProcessed(true);

        assertThatThrownBy(() -> extractor.extract(post)).isInstanceOf(IllegalStateException.class);
        verify(postAnalyzer, never()).analyze(anyString());
    }

    @Test
    void engagementWeightStaysWithinOneAndTwo() {
        assertThat(SignalExtractor.engagementWeight(post("a", Map.of()))).isEqualTo(1.0);
        assertThat(SignalExtractor.engagementWeight(post("a", Map.of("upvotes", 5_000_000, "comments", "70000"))))
                .isEqualTo(2.0);
    }

    private static RawPost post(String content, Map<String, Object> metrics) {
        RawPost post = new RawPost();
        post.setId(UUID.randomUUID());
        post.setPlatform("reddit");
        post.setPostId("t3_" + content.hashCode());
        post.setContent(content);
        post.setUrl("https://reddit.com/r/test");
        post.setMetrics(new HashMap<>(metrics));
        post.setContentHash(Integer.toHexString(content.hashCode()));
        post.setCreatedAt(Signals.BASE_TIME.minusHours(2));
        post.setScrapedAt(Signals.BASE_TIME);
        return post;
    }
}
