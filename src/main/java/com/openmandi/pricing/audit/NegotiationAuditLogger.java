package com.openmandi.pricing.audit;

import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.ethics.EthicsFlag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * One key=value line per engine decision, for offline review of what was
 * suggested to whom and why.
 */
@Slf4j
@Component
public class NegotiationAuditLogger {

    public void logEstimate(String requestId, PriceEstimate estimate, long processingMs) {
        log.info(
                "event=price_estimate request_id={} product={} location={} quantity={} grade={} source={}/{} point={} lower={} upper={} confidence={} data_quality={} degraded={} processing_ms={}",
                requestId,
                estimate.getProduct(),
                estimate.getLocation(),
                estimate.getQuantity(),
                estimate.getQualityGrade(),
                estimate.getSourceProduct(),
                estimate.getSourceLocation(),
                estimate.getPointPrice(),
                estimate.getLowerBound(),
                estimate.getUpperBound(),
                String.format("%.3f", estimate.getConfidence()),
                estimate.getDataQuality(),
                estimate.isDegradedConfidence(),
                processingMs
        );
    }

    public void logAssessment(String requestId, FairnessAssessment assessment, long processingMs) {
        Offer offer = assessment.getOffer();
        String flags = assessment.getRiskFlags().stream()
                .map(EthicsFlag::getType)
                .map(Enum::name)
                .collect(Collectors.joining(","));
        log.info(
                "event=offer_assessment request_id={} role={} party={} counterpart={} product={} unit_price={} reference={} deviation={} verdict={} counter={} flags=[{}] intervention={} processing_ms={}",
                requestId,
                offer.getRole(),
                redact(offer.getPartyId()),
                redact(offer.getCounterpartId()),
                offer.getProduct(),
                offer.getUnitPrice(),
                assessment.getReferencePrice(),
                String.format("%.4f", assessment.getDeviationPct()),
                assessment.getVerdict(),
                assessment.getCounterOffer() != null ? assessment.getCounterOffer().getUnitPrice() : "none",
                flags,
                assessment.isRequiresIntervention(),
                processingMs
        );
        if (!assessment.getRiskFlags().isEmpty()) {
            for (EthicsFlag flag : assessment.getRiskFlags()) {
                log.warn("event=ethics_flag request_id={} type={} severity={} rationale=\"{}\"",
                        requestId, flag.getType(), flag.getSeverity(), flag.getRationale());
            }
        }
    }

    static String redact(String id) {
        if (id == null || id.isBlank()) {
            return "unknown";
        }
        if (id.length() <= 4) {
            return "****";
        }
        return "****" + id.substring(id.length() - 4);
    }
}
