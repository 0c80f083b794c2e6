package com.productgap.engine.controller;

import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.OpportunityStatus;
import com.productgap.engine.service.OpportunityService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/opportunities")
public class OpportunityController {

    private final OpportunityService opportunityService;

    public OpportunityController(OpportunityService opportunityService) {
        this.opportunityService = opportunityService;
    }

    @GetMapping
    public ResponseEntity<List<Opportunity>> list(
            @RequestParam(name = "status", defaultValue = "ACTIVE") OpportunityStatus status) {
        return ResponseEntity.ok(opportunityService.list(status));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Opportunity> get(@PathVariable Long id) {
        return ResponseEntity.of(opportunityService.find(id));
    }

    @GetMapping("/{id}/evidence")
    public ResponseEntity<List<EvidenceView>> evidence(@PathVariable Long id) {
        return ResponseEntity.of(opportunityService.evidence(id)
                .map(rows -> rows.stream().map(row -> EvidenceView.of(row, id)).toList()));
    }

    @PostMapping("/{id}/archive")
    public ResponseEntity<Opportunity> archive(@PathVariable Long id) {
        return ResponseEntity.of(opportunityService.archive(id));
    }

    @PostMapping("/{id}/rescore")
    public ResponseEntity<Opportunity> rescore(@PathVariable Long id) {
        return ResponseEntity.of(opportunityService.rescore(id));
    }
}
