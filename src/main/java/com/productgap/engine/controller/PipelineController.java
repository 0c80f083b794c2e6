package com.productgap.engine.controller;

import com.productgap.engine.config.PipelineProperties;
import com.productgap.engine.service.BatchSummary;
import com.productgap.engine.service.PipelineBusyException;
import com.productgap.engine.service.PipelineOrchestrator;
import com.productgap.engine.service.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties pipelineProperties;

    public PipelineController(PipelineOrchestrator orchestrator, PipelineProperties pipelineProperties) {
        this.orchestrator = orchestrator;
        this.pipelineProperties = pipelineProperties;
    }

    @PostMapping("/runs")
    public ResponseEntity<?> runBatch(
            @RequestParam(name = "maxPosts", required = false) Integer maxPosts,
            @RequestParam(name = "timeBudgetSeconds", required = false) Long timeBudgetSeconds) {
        int limit = maxPosts != null ? maxPosts : pipelineProperties.getDefaultBatchSize();
        Duration budget = timeBudgetSeconds != null ? Duration.ofSeconds(timeBudgetSeconds) : null;
        logger.info("Received request to run a batch of up to {} posts (time budget: {})", limit, budget);

        try {
            BatchSummary summary = orchestrator.runBatch(limit, budget);
            return ResponseEntity.ok(summary);
        } catch (PipelineBusyException e) {
            logger.warn("Batch request rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (StorageUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
