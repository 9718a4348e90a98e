package com.openmandi.pricing.api;

import com.openmandi.pricing.core.NoComparableDataException;
import com.openmandi.pricing.core.PriceDiscoveryService;
import com.openmandi.pricing.domain.DataQuality;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.QualityGrade;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PriceController.class)
class PriceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PriceDiscoveryService service;

    @Test
    void estimateWithExplanationAndSummary() throws Exception {
        PriceEstimate estimate = PriceEstimate.builder()
                .product("rice")
                .location("Mumbai")
                .unit("quintal")
                .pointPrice(new BigDecimal("3087.50"))
                .lowerBound(new BigDecimal("3056.62"))
                .upperBound(new BigDecimal("3118.38"))
                .confidence(0.99)
                .dataQuality(DataQuality.HIGH)
                .asOf(LocalDate.of(2024, 3, 15))
                .build();
        when(service.getPriceEstimate(eq("rice"), any(), eq("Mumbai"), eq(QualityGrade.PREMIUM),
                eq(LocalDate.of(2024, 3, 15)))).thenReturn(estimate);
        when(service.explainEstimate(estimate)).thenReturn(List.of());
        when(service.summarizeEstimate(estimate)).thenReturn("Suggested price for rice: 3087.50 per quintal");

        mockMvc.perform(get("/api/v1/prices/estimate")
                        .param("product", "rice")
                        .param("quantity", "500")
                        .param("location", "Mumbai")
                        .param("qualityGrade", "premium")
                        .param("date", "2024-03-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.estimate.pointPrice").value(3087.50))
                .andExpect(jsonPath("$.estimate.asOf").value("2024-03-15"))
                .andExpect(jsonPath("$.summary").value("Suggested price for rice: 3087.50 per quintal"));
    }

    @Test
    void noComparableDataIsNotFound() throws Exception {
        when(service.getPriceEstimate(any(), any(), any(), any(), any()))
                .thenThrow(new NoComparableDataException("dragonfruit", "Mumbai"));

        mockMvc.perform(get("/api/v1/prices/estimate")
                        .param("product", "dragonfruit")
                        .param("quantity", "10")
                        .param("location", "Mumbai"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NO_COMPARABLE_DATA"));
    }

    @Test
    void unknownGradeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/prices/estimate")
                        .param("product", "rice")
                        .param("quantity", "10")
                        .param("location", "Mumbai")
                        .param("qualityGrade", "platinum"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
        verifyNoInteractions(service);
    }

    @Test
    void missingParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/prices/estimate").param("product", "rice"))
                .andExpect(status().isBadRequest());
    }
}
