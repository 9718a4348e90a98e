package com.openmandi.pricing.api;

import com.openmandi.pricing.api.model.AssessOfferRequest;
import com.openmandi.pricing.api.model.GuardedAssessRequest;
import com.openmandi.pricing.core.InvalidInputException;
import com.openmandi.pricing.core.PriceDiscoveryService;
import com.openmandi.pricing.domain.FairnessAssessment;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/negotiation")
public class NegotiationController {
    private final PriceDiscoveryService service;

    @PostMapping("/assess")
    public ResponseEntity<FairnessAssessment> assess(@RequestBody AssessOfferRequest request) {
        if (request.offer() == null || request.estimate() == null) {
            throw new InvalidInputException("offer and estimate are required");
        }
        return ResponseEntity.ok(service.assessOffer(request.offer(), request.estimate(), request.context()));
    }

    @PostMapping("/guarded-assess")
    public ResponseEntity<FairnessAssessment> guardedAssess(@RequestBody GuardedAssessRequest request) {
        if (request.offer() == null) {
            throw new InvalidInputException("offer is required");
        }
        return ResponseEntity.ok(service.guardedAssess(request.offer(), request.inputs(), request.context()));
    }
}
