package com.productgap.engine.service;

import com.productgap.engine.config.PipelineProperties;
import com.productgap.engine.model.RawPost;
import com.productgap.engine.model.Signal;
import com.productgap.engine.repository.RawPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final String PIPELINE = "opportunity-pipeline";

    @Mock
    private RawPostRepository rawPostRepository;
    @Mock
    private SignalExtractor signalExtractor;
    @Mock
    private PostProcessingService postProcessingService;
    @Mock
    private PipelineLockService lockService;
    @Mock
    private RunMetadataService runMetadataService;

    private final PipelineProperties properties = new PipelineProperties();
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Signals.BASE_TIME.toInstant(), ZoneOffset.UTC);
        orchestrator = new PipelineOrchestrator(rawPostRepository, signalExtractor, postProcessingService,
                lockService, runMetadataService, properties, clock);
    }

    @Test
    void failedPostIsCountedAndOthersContinue() {
        RawPost first = post();
        RawPost broken = post();
        RawPost last = post();
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenReturn(List.of(first, broken, last));
        when(lockService.renew(eq(PIPELINE), eq("owner-1"), any())).thenReturn(true);
        Signal signal = Signals.signal("tools", List.of("drill"), "Drill batteries die");
        when(signalExtractor.extract(first)).thenReturn(signal);
        when(signalExtractor.extract(broken)).thenThrow(new AnalysisUnavailableException("model down"));
        when(signalExtractor.extract(last)).thenReturn(signal);
        when(postProcessingService.apply(first, signal)).thenReturn(PostOutcome.created(1L, 1));
        when(postProcessingService.apply(last, signal)).thenReturn(PostOutcome.updated(List.of(1L), 1));

        BatchSummary summary = orchestrator.runBatch(10);

        assertThat(summary.getProcessed()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getOpportunitiesCreated()).isEqualTo(1);
        assertThat(summary.getOpportunitiesUpdated()).isZero();
        assertThat(summary.getFailures()).singleElement()
                .satisfies(failure -> {
                    assertThat(failure.rawPostId()).isEqualTo(broken.getId());
                    assertThat(failure.reason()).isEqualTo(BatchSummary.REASON_ANALYSIS_UNAVAILABLE);
                });
        verify(runMetadataService).recordFinished(PIPELINE, summary);
        verify(lockService).release(PIPELINE, "owner-1");
    }

    @Test
    void constraintViolationOnOnePostDoesNotAbortBatch() {
        RawPost post = post();
        Signal signal = Signals.signal("tools", List.of("drill"), "Drill batteries die");
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenReturn(List.of(post));
        when(lockService.renew(eq(PIPELINE), eq("owner-1"), any())).thenReturn(true);
        when(signalExtractor.extract(post)).thenReturn(signal);
        when(postProcessingService.apply(post, signal)).thenThrow(new DataIntegrityViolationException("duplicate"));

        BatchSummary summary = orchestrator.runBatch(10);

        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getFailures().get(0).reason()).isEqualTo(BatchSummary.REASON_PROCESSING_ERROR);
    }

    @Test
    void lostLeaseStopsBeforeNextPost() {
        RawPost first = post();
        RawPost second = post();
        RawPost third = post();
        Signal signal = Signals.signal("tools", List.of("drill"), "Drill batteries die");
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenReturn(List.of(first, second, third));
        when(lockService.renew(eq(PIPELINE), eq("owner-1"), any())).thenReturn(true, false);
        when(signalExtractor.extract(first)).thenReturn(signal);
        when(postProcessingService.apply(first, signal)).thenReturn(PostOutcome.created(1L, 1));

        BatchSummary summary = orchestrator.runBatch(10);

        assertThat(summary.getProcessed()).isEqualTo(1);
        assertThat(summary.isLeaseLost()).isTrue();
        assertThat(summary.isStoppedEarly()).isTrue();
        verify(postProcessingService, times(1)).apply(any(), any());
        verify(signalExtractor, never()).extract(second);
        verify(signalExtractor, never()).extract(third);
    }

    @Test
    void leaseLostBeforeFirstPostProcessesNothing() {
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenReturn(List.of(post(), post()));
        when(lockService.renew(eq(PIPELINE), eq("owner-1"), any())).thenReturn(false);

        BatchSummary summary = orchestrator.runBatch(10);

        assertThat(summary.getProcessed()).isZero();
        assertThat(summary.isLeaseLost()).isTrue();
        verify(signalExtractor, never()).extract(any());
        verify(postProcessingService, never()).apply(any(), any());
    }

    @Test
    void storageOutageAbortsBatchAndReleasesLock() {
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> orchestrator.runBatch(10))
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        verify(runMetadataService).recordFailed(eq(PIPELINE), anyString());
        verify(lockService).release(PIPELINE, "owner-1");
    }

    @Test
    void busyPipelineFailsFast() {
        when(lockService.acquire(eq(PIPELINE), any())).thenThrow(new PipelineBusyException("busy"));

        assertThatThrownBy(() -> orchestrator.runBatch(10)).isInstanceOf(PipelineBusyException.class);
        verify(rawPostRepository, never()).findUnprocessed(any());
        verify(lockService, never()).release(anyString(), anyString());
    }

    @Test
    void exhaustedTimeBudgetStopsBetweenPosts() {
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenReturn(List.of(post(), post()));

        BatchSummary summary = orchestrator.runBatch(10, Duration.ZERO);

        assertThat(summary.isStoppedEarly()).isTrue();
        assertThat(summary.getProcessed()).isZero();
        assertThat(summary.getSelected()).isEqualTo(2);
        verify(signalExtractor, never()).extract(any());
    }

    @Test
    void batchSizeIsCappedAndValidated() {
        properties.setMaxBatchSize(5);
        when(lockService.acquire(eq(PIPELINE), any())).thenReturn("owner-1");
        when(rawPostRepository.findUnprocessed(any(Pageable.class))).thenAnswer(invocation -> {
            Pageable page = invocation.getArgument(0);
            assertThat(page.getPageSize()).isEqualTo(5);
            return List.of();
        });

        orchestrator.runBatch(100);

        assertThatThrownBy(() -> orchestrator.runBatch(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static RawPost post() {
        RawPost post = new RawPost();
        post.setId(UUID.randomUUID());
        post.setContent("content");
        return post;
    }
}
