package com.openmandi.pricing.api;

import com.openmandi.pricing.core.InvalidInputException;
import com.openmandi.pricing.core.PriceDiscoveryService;
import com.openmandi.pricing.domain.EstimateInputs;
import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.NegotiationAdvice;
import com.openmandi.pricing.domain.NegotiationStrategy;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.QualityGrade;
import com.openmandi.pricing.domain.Role;
import com.openmandi.pricing.domain.Verdict;
import com.openmandi.pricing.ethics.InteractionContext;
import com.openmandi.pricing.ethics.VulnerabilityCohort;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NegotiationController.class)
class NegotiationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PriceDiscoveryService service;

    @Test
    void assessBindsOfferEstimateAndContext() throws Exception {
        when(service.assessOffer(any(), any(), any())).thenAnswer(invocation -> FairnessAssessment.builder()
                .offer(invocation.getArgument(0))
                .referencePrice(new BigDecimal("2500"))
                .deviationPct(0.12)
                .verdict(Verdict.FAVORABLE)
                .build());

        mockMvc.perform(post("/api/v1/negotiation/assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"offer":{"role":"SELLER","unitPrice":2800,"quantity":20,"product":"rice","location":"Mumbai"},
                                 "estimate":{"product":"rice","location":"Mumbai","unit":"quintal","pointPrice":2500,
                                             "lowerBound":2300,"upperBound":2700,"confidence":0.8},
                                 "context":{"counterpartId":"farmer-1","counterpartCohorts":["NEW_USER"]}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("FAVORABLE"));

        ArgumentCaptor<Offer> offer = ArgumentCaptor.forClass(Offer.class);
        ArgumentCaptor<PriceEstimate> estimate = ArgumentCaptor.forClass(PriceEstimate.class);
        ArgumentCaptor<InteractionContext> context = ArgumentCaptor.forClass(InteractionContext.class);
        verify(service).assessOffer(offer.capture(), estimate.capture(), context.capture());
        assertEquals(Role.SELLER, offer.getValue().getRole());
        assertEquals(0, new BigDecimal("2700").compareTo(estimate.getValue().getUpperBound()));
        assertTrue(context.getValue().getCounterpartCohorts().contains(VulnerabilityCohort.NEW_USER));
    }

    @Test
    void guardedAssessBindsInputsAndReturnsAdvice() throws Exception {
        when(service.guardedAssess(any(), any(), any())).thenAnswer(invocation -> FairnessAssessment.builder()
                .offer(invocation.getArgument(0))
                .referencePrice(new BigDecimal("3250"))
                .deviationPct(0.2)
                .verdict(Verdict.UNFAVORABLE)
                .requiresIntervention(true)
                .advice(NegotiationAdvice.builder()
                        .audience(Role.BUYER)
                        .strategy(NegotiationStrategy.AGGRESSIVE)
                        .point("Counter with around 3450 per quintal")
                        .build())
                .build());

        mockMvc.perform(post("/api/v1/negotiation/guarded-assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"offer":{"role":"SELLER","unitPrice":3900,"quantity":20,"product":"rice","location":"Mumbai"},
                                 "date":"2024-03-15","qualityGrade":"PREMIUM",
                                 "context":{"counterpartId":"farmer-1"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("UNFAVORABLE"))
                .andExpect(jsonPath("$.requiresIntervention").value(true))
                .andExpect(jsonPath("$.advice.strategy").value("AGGRESSIVE"))
                .andExpect(jsonPath("$.advice.audience").value("BUYER"));

        ArgumentCaptor<EstimateInputs> inputs = ArgumentCaptor.forClass(EstimateInputs.class);
        ArgumentCaptor<InteractionContext> context = ArgumentCaptor.forClass(InteractionContext.class);
        verify(service).guardedAssess(any(Offer.class), inputs.capture(), context.capture());
        assertEquals(LocalDate.of(2024, 3, 15), inputs.getValue().getDate());
        assertEquals(QualityGrade.PREMIUM, inputs.getValue().getQualityGrade());
        assertEquals("farmer-1", context.getValue().getCounterpartId());
    }

    @Test
    void guardedAssessRejectionFromServiceIsBadRequest() throws Exception {
        when(service.guardedAssess(any(), any(), any()))
                .thenThrow(new InvalidInputException("offer unit price must be positive, got 0"));

        mockMvc.perform(post("/api/v1/negotiation/guarded-assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"offer\":{\"role\":\"SELLER\",\"unitPrice\":0,\"quantity\":20,"
                                + "\"product\":\"rice\",\"location\":\"Mumbai\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }

    @Test
    void unknownRoleIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/negotiation/guarded-assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"offer\":{\"role\":\"BROKER\",\"unitPrice\":2800,\"quantity\":20}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
        verifyNoInteractions(service);
    }

    @Test
    void missingOfferIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/negotiation/guarded-assess")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-03-15\"}"))
                .andExpect(status().isBadRequest());
    }
}
