package com.productgap.engine.service;

import com.google.common.util.concurrent.RateLimiter;
import com.productgap.engine.config.PipelineProperties;
import com.productgap.engine.model.PostAnalysis;
import com.productgap.engine.model.PostAnalysisResult;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.model.SignalType;
import com.productgap.engine.repository.PostAnalysisRepository;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;

/**
 * Turns an unprocessed raw post into a {@link Signal}.
 * <p>
 * The analyzer is called at most once per post: a stored {@link PostAnalysis} from an earlier run is
 * reused. A fresh analysis is saved in its own transaction before any clustering happens, so it
 * survives a failure further down the pipeline. Not transactional: the analyzer call never runs
 * inside a database transaction.
 */
@Service
public class SignalExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SignalExtractor.class);

    static final String UNCATEGORIZED = "none";
    private static final Set<String> COMPETITOR_CATEGORIES = Set.of("better_alternative", "cheaper_option");

    private final PostAnalyzer postAnalyzer;
    private final AnalysisResponseValidator validator;
    private final PostAnalysisRepository postAnalysisRepository;
    private final PipelineProperties pipelineProperties;
    @SuppressWarnings("UnstableApiUsage")
    private final RateLimiter analyzerPacing;
    private final Clock clock;

    public SignalExtractor(PostAnalyzer postAnalyzer,
                           AnalysisResponseValidator validator,
                           PostAnalysisRepository postAnalysisRepository,
                           PipelineProperties pipelineProperties,
                           @Qualifier("analyzerPacingRateLimiter") RateLimiter analyzerPacing,
                           Clock clock) {
        this.postAnalyzer = postAnalyzer;
        this.validator = validator;
        this.postAnalysisRepository = postAnalysisRepository;
        this.pipelineProperties = pipelineProperties;
        this.analyzerPacing = analyzerPacing;
        this.clock = clock;
    }

    public Signal extract(RawPost post) {
        if (post.isProcessed()) {
            throw new IllegalStateException("Raw post " + post.getId() + " is already processed");
        }
        Optional<PostAnalysis> stored = postAnalysisRepository.findTopByRawPostIdOrderByAnalyzedAtDesc(post.getId());
        PostAnalysis analysis;
        if (stored.isPresent()) {
            logger.debug("Reusing stored analysis {} for raw post {}", stored.get().getId(), post.getId());
            analysis = stored.get();
        } else {
            analysis = analyzeAndStore(post);
        }
        return toSignal(post, analysis);
    }

    @SuppressWarnings("UnstableApiUsage")
    private PostAnalysis analyzeAndStore(RawPost post) {
        analyzerPacing.acquire();
        PostAnalysisResult result;
        try {
            result = postAnalyzer.analyze(post.getContent());
        } catch (AnalysisUnavailableException e) {
            throw e;
        } catch (RequestNotPermitted rnp) {
            logger.warn("Rate limit exceeded for analyzer call (raw post {}). Post left for the next batch.", post.getId());
            throw new AnalysisUnavailableException("Analyzer rate limit exceeded", rnp);
        } catch (RuntimeException e) {
            throw new AnalysisUnavailableException("Analyzer failed: " + e.getMessage(), e);
        }

        List<String> problems = validator.problems(result);
        if (!problems.isEmpty()) {
            throw new AnalysisUnavailableException("Malformed analysis for raw post " + post.getId() + ": "
                    + String.join("; ", problems));
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        PostAnalysis analysis = new PostAnalysis();
        analysis.setRawPostId(post.getId());
        analysis.setProblemSummary(result.problemSummary().trim());
        analysis.setPainSeverity(result.painSeverity());
        analysis.setWillingnessToPay(result.willingnessToPay());
        analysis.setProductCategory(result.category().trim());
        analysis.setKeywords(new ArrayList<>(TextSimilarity.normalizeKeywords(result.keywords())));
        analysis.setModelId(result.modelId());
        analysis.setAnalyzedAt(now);
        analysis.setCreatedAt(now);
        PostAnalysis saved = postAnalysisRepository.save(analysis);
        logger.debug("Stored analysis {} for raw post {}", saved.getId(), post.getId());
        return saved;
    }

    Signal toSignal(RawPost post, PostAnalysis analysis) {
        String category = analysis.getProductCategory() == null || analysis.getProductCategory().isBlank()
                ? UNCATEGORIZED
                : analysis.getProductCategory().trim();
        SortedSet<String> keywords = TextSimilarity.normalizeKeywords(analysis.getKeywords());
        String summary = analysis.getProblemSummary() == null ? "" : analysis.getProblemSummary().trim();
        if (summary.equalsIgnoreCase("none")) {
            summary = "";
        }
        int pain = Math.max(0, Math.min(10, analysis.getPainSeverity()));

        Set<SignalType> types = EnumSet.of(SignalType.PROBLEM_STATEMENT);
        if (analysis.isWillingnessToPay()) {
            types.add(SignalType.WILLINGNESS_TO_PAY);
        }
        if (COMPETITOR_CATEGORIES.contains(category.toLowerCase(Locale.ROOT))) {
            types.add(SignalType.COMPETITOR_MENTION);
        }

        return new Signal(post.getId(), category, keywords, pain, analysis.isWillingnessToPay(), summary,
                types, engagementWeight(post), excerpt(post.getContent()), post.observedAt());
    }

    /**
     * 1 + min(1, log10(1 + upvotes + comments) / 4), so always within [1, 2].
     */
    static double engagementWeight(RawPost post) {
        long engagement = post.metric("upvotes") + post.metric("comments");
        return 1.0 + Math.min(1.0, Math.log10(1.0 + engagement) / 4.0);
    }

    private String excerpt(String content) {
        if (content == null) {
            return "";
        }
        int limit = pipelineProperties.getExcerptLength();
        return content.length() > limit ? content.substring(0, limit) : content;
    }
}
