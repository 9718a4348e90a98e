package com.openmandi.pricing.api;

import com.openmandi.pricing.api.model.PriceEstimateResponse;
import com.openmandi.pricing.core.InvalidInputException;
import com.openmandi.pricing.core.PriceDiscoveryService;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.QualityGrade;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.LocalDate;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/prices")
public class PriceController {
    private final PriceDiscoveryService service;

    @GetMapping("/estimate")
    public ResponseEntity<PriceEstimateResponse> estimate(
            @RequestParam String product,
            @RequestParam BigDecimal quantity,
            @RequestParam String location,
            @RequestParam(defaultValue = "STANDARD") String qualityGrade,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PriceEstimate estimate = service.getPriceEstimate(product, quantity, location, grade(qualityGrade), date);
        return ResponseEntity.ok(new PriceEstimateResponse(
                estimate,
                service.explainEstimate(estimate),
                service.summarizeEstimate(estimate)));
    }

    static QualityGrade grade(String value) {
        try {
            return QualityGrade.parse(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("unknown quality grade: " + value);
        }
    }
}
