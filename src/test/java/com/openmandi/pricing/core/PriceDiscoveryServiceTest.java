package com.openmandi.pricing.core;

import com.openmandi.pricing.audit.NegotiationAuditLogger;
import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.domain.DataQuality;
import com.openmandi.pricing.domain.EstimateInputs;
import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.PriceEstimate;
import com.openmandi.pricing.domain.QualityGrade;
import com.openmandi.pricing.domain.Role;
import com.openmandi.pricing.domain.Verdict;
import com.openmandi.pricing.ethics.EthicsGuard;
import com.openmandi.pricing.ethics.FlagType;
import com.openmandi.pricing.ethics.InteractionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PriceDiscoveryServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T06:00:00Z"), ZoneId.of("Asia/Kolkata"));

    private OfferHistoryRepository historyRepository;
    private MarketSnapshotRepository snapshotRepository;
    private MarketSnapshotCache cache;
    private PriceDiscoveryService service;

    @BeforeEach
    void setUp() {
        PricingProperties properties = new PricingProperties();
        properties.getUnitGranularity().put("quintal", BigDecimal.ONE);
        EthicsGuard guard = new EthicsGuard(properties);

        historyRepository = mock(OfferHistoryRepository.class);
        snapshotRepository = mock(MarketSnapshotRepository.class);
        cache = new MarketSnapshotCache(CLOCK);
        cache.replaceAll(List.of(PricingModelTest.stableSnapshot("rice", "Mumbai", "2500", DataQuality.HIGH)));

        service = new PriceDiscoveryService(
                cache,
                new PricingModel(properties, new ConfidenceEstimator(properties),
                        new MarketRiskAssessor(properties), CLOCK),
                new ExplanationGenerator(),
                new FairnessScorer(properties, guard, new NegotiationAdvisor()),
                guard,
                historyRepository,
                snapshotRepository,
                new NegotiationAuditLogger(),
                properties,
                CLOCK);
    }

    @Test
    void estimateReadsCurrentGeneration() {
        PriceEstimate estimate = service.getPriceEstimate("rice", new BigDecimal("500"), "Mumbai",
                QualityGrade.PREMIUM, TODAY);

        assertEquals(0, new BigDecimal("3087.50").compareTo(estimate.getPointPrice()));
        assertEquals(2, service.explainEstimate(estimate).size());
        assertTrue(service.summarizeEstimate(estimate).contains("3087.50"));
    }

    @Test
    void unknownProductSurfacesNoComparableData() {
        when(snapshotRepository.fetchSnapshot("dragonfruit", "Mumbai", TODAY)).thenReturn(Optional.empty());

        assertThrows(NoComparableDataException.class, () -> service.getPriceEstimate(
                "dragonfruit", BigDecimal.TEN, "Mumbai", QualityGrade.STANDARD, TODAY));
        assertEquals(1, cache.current().getGeneration());
    }

    @Test
    void cacheMissFetchesSnapshotAndPublishesIt() {
        when(snapshotRepository.fetchSnapshot("wheat", "Delhi", TODAY)).thenReturn(Optional.of(
                PricingModelTest.stableSnapshot("wheat", "Delhi", "2200", DataQuality.HIGH)));

        PriceEstimate estimate = service.getPriceEstimate("wheat", BigDecimal.TEN, "Delhi",
                QualityGrade.STANDARD, null);

        assertEquals("wheat", estimate.getSourceProduct());
        assertEquals(2, cache.current().getGeneration());
        assertEquals(1, cache.current().forProduct("wheat").size());
        assertEquals(1, cache.current().forProduct("rice").size());

        service.getPriceEstimate("wheat", BigDecimal.TEN, "Delhi", QualityGrade.STANDARD, TODAY);
        verify(snapshotRepository, times(1)).fetchSnapshot("wheat", "Delhi", TODAY);
    }

    @Test
    void cacheHitNeverCallsRepository() {
        service.getPriceEstimate("rice", BigDecimal.TEN, "Mumbai", QualityGrade.STANDARD, TODAY);

        verifyNoInteractions(snapshotRepository);
    }

    @Test
    void assessOfferWithoutContext() {
        PriceEstimate estimate = service.getPriceEstimate("rice", BigDecimal.TEN, "Mumbai",
                QualityGrade.STANDARD, TODAY);

        FairnessAssessment assessment = service.assessOffer(offer(Role.BUYER, "1200", null), estimate, null);

        assertEquals(Verdict.EXPLOITATIVE, assessment.getVerdict());
        assertTrue(assessment.hasFlag(FlagType.PREDATORY_PRICING));
        verifyNoInteractions(historyRepository);
    }

    @Test
    void guardedAssessLoadsHistoryForNamedCounterpart() {
        when(historyRepository.fetchHistory("rice", "farmer-1", Duration.ofDays(7))).thenReturn(List.of(
                offer(Role.SELLER, "2750", "farmer-1"),
                offer(Role.SELLER, "2900", "farmer-1")));

        FairnessAssessment assessment = service.guardedAssess(
                offer(Role.SELLER, "2800", "farmer-1"),
                EstimateInputs.builder().date(TODAY).build(),
                InteractionContext.builder().counterpartId("farmer-1").build());

        assertEquals(0, new BigDecimal("2500.00").compareTo(assessment.getReferencePrice()));
        assertTrue(assessment.hasFlag(FlagType.MARKET_MANIPULATION_SUSPECTED));
        assertEquals(Verdict.UNFAVORABLE, assessment.getVerdict());
        verify(historyRepository).fetchHistory("rice", "farmer-1", Duration.ofDays(7));
    }

    @Test
    void guardedAssessUsesSuppliedHistory() {
        InteractionContext context = InteractionContext.builder()
                .counterpartId("farmer-1")
                .recentOffer(offer(Role.SELLER, "2900", "farmer-1"))
                .build();

        FairnessAssessment assessment = service.guardedAssess(offer(Role.SELLER, "2800", "farmer-1"),
                EstimateInputs.builder().date(TODAY).build(), context);

        assertFalse(assessment.hasFlag(FlagType.MARKET_MANIPULATION_SUSPECTED));
        verifyNoInteractions(historyRepository);
    }

    @Test
    void guardedAssessTakesGradeFromOffer() {
        Offer premium = offer(Role.SELLER, "3250", null).toBuilder().qualityGrade(QualityGrade.PREMIUM).build();

        FairnessAssessment assessment = service.guardedAssess(premium, null, null);

        assertEquals(0, new BigDecimal("3250.00").compareTo(assessment.getReferencePrice()));
        assertEquals(Verdict.FAIR, assessment.getVerdict());
        verifyNoInteractions(historyRepository);
    }

    @Test
    void guardedAssessRejectsMissingOffer() {
        assertThrows(InvalidInputException.class,
                () -> service.guardedAssess(null, EstimateInputs.none(), InteractionContext.empty()));
    }

    @Test
    void guardedAssessRejectsBadOfferBeforePricing() {
        Offer unpriced = offer(Role.SELLER, "2800", "farmer-1").toBuilder().unitPrice(BigDecimal.ZERO).build();
        Offer noRole = offer(Role.SELLER, "2800", "farmer-1").toBuilder().role(null).build();
        Offer dragonfruit = offer(Role.SELLER, "-5", "farmer-1").toBuilder().product("dragonfruit").build();

        assertThrows(InvalidInputException.class, () -> service.guardedAssess(unpriced, EstimateInputs.none(), null));
        assertThrows(InvalidInputException.class, () -> service.guardedAssess(noRole, EstimateInputs.none(), null));
        // an unknown product with a bad price fails validation, not pricing
        assertThrows(InvalidInputException.class, () -> service.guardedAssess(dragonfruit, EstimateInputs.none(), null));

        verifyNoInteractions(historyRepository, snapshotRepository);
        assertEquals(1, cache.current().getGeneration());
    }

    private static Offer offer(Role role, String price, String counterpart) {
        return Offer.builder()
                .role(role)
                .unitPrice(new BigDecimal(price))
                .quantity(BigDecimal.TEN)
                .product("rice")
                .location("Mumbai")
                .partyId("trader-9")
                .counterpartId(counterpart)
                .build();
    }
}
