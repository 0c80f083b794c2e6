package com.productgap.engine.controller;

import com.productgap.engine.model.Evidence;
import com.productgap.engine.model.Opportunity;
import com.productgap.engine.model.OpportunityStatus;
import com.productgap.engine.model.SignalType;
import com.productgap.engine.service.OpportunityService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OpportunityController.class)
class OpportunityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OpportunityService opportunityService;

    @Test
    void listsActiveOpportunitiesByDefault() throws Exception {
        when(opportunityService.list(OpportunityStatus.ACTIVE)).thenReturn(List.of(opportunity(1L, 72), opportunity(2L, 40)));

        mockMvc.perform(get("/api/opportunities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].confidenceScore").value(72))
                .andExpect(jsonPath("$[1].id").value(2));
    }

    @Test
    void unknownOpportunityIsNotFound() throws Exception {
        when(opportunityService.find(99L)).thenReturn(Optional.empty());
        when(opportunityService.evidence(99L)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/opportunities/99")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/opportunities/99/evidence")).andExpect(status().isNotFound());
    }

    @Test
    void returnsEvidenceRows() throws Exception {
        Evidence evidence = new Evidence();
        evidence.setId(5L);
        evidence.setRawPostId(UUID.fromString("00000000-0000-0000-0000-000000000001"));
        evidence.setSignalType(SignalType.WILLINGNESS_TO_PAY);
        evidence.setWeight(1.5);
        evidence.setContent("I'd pay for this");
        when(opportunityService.evidence(1L)).thenReturn(Optional.of(List.of(evidence)));

        mockMvc.perform(get("/api/opportunities/1/evidence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].opportunityId").value(1))
                .andExpect(jsonPath("$[0].signalType").value("WILLINGNESS_TO_PAY"))
                .andExpect(jsonPath("$[0].weight").value(1.5));
    }

    @Test
    void archivesOpportunity() throws Exception {
        Opportunity archived = opportunity(3L, 50);
        archived.setStatus(OpportunityStatus.ARCHIVED);
        when(opportunityService.archive(3L)).thenReturn(Optional.of(archived));

        mockMvc.perform(post("/api/opportunities/3/archive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ARCHIVED"));
    }

    private static Opportunity opportunity(Long id, int confidence) {
        Opportunity opportunity = new Opportunity();
        opportunity.setId(id);
        opportunity.setTitle("Opportunity " + id);
        opportunity.setConfidenceScore(confidence);
        opportunity.setPainSeverity(new BigDecimal("7.5"));
        return opportunity;
    }
}
