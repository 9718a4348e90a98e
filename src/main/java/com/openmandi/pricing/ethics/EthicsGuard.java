package com.openmandi.pricing.ethics;

import com.openmandi.pricing.config.PricingProperties;
import com.openmandi.pricing.core.InvalidInputException;
import com.openmandi.pricing.domain.FairnessAssessment;
import com.openmandi.pricing.domain.Offer;
import com.openmandi.pricing.domain.Verdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Threshold rules over a scored offer and its interaction context. Rules only
 * add flags and only make the verdict more severe; they never improve the
 * outcome for the protected party.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EthicsGuard {

    private static final int SQUEEZE_SEQUENCE = 3;

    private final PricingProperties properties;

    public FairnessAssessment guard(FairnessAssessment assessment, InteractionContext context) {
        InteractionContext ctx = context == null ? InteractionContext.empty() : context;
        Set<EthicsFlag> flags = new LinkedHashSet<>(assessment.getRiskFlags());
        Verdict verdict = assessment.getVerdict();

        Optional<EthicsFlag> predatory = predatoryPricing(assessment);
        if (predatory.isPresent()) {
            flags.add(predatory.get());
            verdict = verdict.atLeast(Verdict.EXPLOITATIVE);
        }

        List<Offer> history = relevantHistory(assessment.getOffer(), ctx);

        Optional<EthicsFlag> manipulation = manipulationRun(assessment, history);
        if (manipulation.isPresent()) {
            flags.add(manipulation.get());
            verdict = verdict.atLeast(Verdict.UNFAVORABLE);
        }

        Optional<EthicsFlag> vulnerable = vulnerableCounterpart(assessment, ctx);
        if (vulnerable.isPresent()) {
            flags.add(vulnerable.get());
            verdict = verdict.atLeast(Verdict.UNFAVORABLE);
        }

        squeeze(assessment, history).ifPresent(flags::add);

        if (flags.size() > assessment.getRiskFlags().size()) {
            log.debug("Guard raised {} flag(s) for {} offer on {}: verdict {} -> {}",
                    flags.size() - assessment.getRiskFlags().size(),
                    assessment.getOffer().getRole(), assessment.getOffer().getProduct(),
                    assessment.getVerdict(), verdict);
        }

        boolean intervention = assessment.isRequiresIntervention()
                || flags.stream().anyMatch(flag -> flag.getSeverity().requiresIntervention());

        return assessment.toBuilder()
                .clearRiskFlags()
                .riskFlags(flags)
                .verdict(verdict)
                .requiresIntervention(intervention)
                .build();
    }

    /**
     * Applies only the predatory-pricing rule. The scorer uses this so that an
     * EXPLOITATIVE verdict never leaves it without a flag.
     */
    public FairnessAssessment applyPredatoryRule(FairnessAssessment assessment) {
        Optional<EthicsFlag> predatory = predatoryPricing(assessment);
        if (predatory.isEmpty()) {
            return assessment;
        }
        return assessment.toBuilder()
                .riskFlag(predatory.get())
                .verdict(assessment.getVerdict().atLeast(Verdict.EXPLOITATIVE))
                .requiresIntervention(assessment.isRequiresIntervention()
                        || predatory.get().getSeverity().requiresIntervention())
                .build();
    }

    Optional<EthicsFlag> predatoryPricing(FairnessAssessment assessment) {
        double magnitude = Math.abs(assessment.getDeviationPct());
        if (magnitude <= properties.getFairness().getExploitativeThreshold()) {
            return Optional.empty();
        }
        Severity severity = magnitude >= properties.getEthics().getCriticalDeviation()
                ? Severity.CRITICAL : Severity.HIGH;
        String side = assessment.getRawDeviationPct() < 0 ? "below" : "above";
        String rationale = String.format("%s offer is %.0f%% %s the fair price of %s",
                assessment.getOffer().getRole().name().toLowerCase(),
                Math.abs(assessment.getRawDeviationPct()) * 100, side,
                assessment.getReferencePrice().toPlainString());
        return Optional.of(new EthicsFlag(FlagType.PREDATORY_PRICING, severity, rationale));
    }

    Optional<EthicsFlag> manipulationRun(FairnessAssessment assessment, List<Offer> history) {
        double fair = properties.getFairness().getFairThreshold();
        if (assessment.getDeviationPct() <= fair) {
            return Optional.empty();
        }
        int run = 1;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).deviationFrom(assessment.getReferencePrice()) <= fair) {
                break;
            }
            run++;
        }
        int threshold = properties.getEthics().getManipulationRunThreshold();
        if (run < threshold) {
            return Optional.empty();
        }
        Severity severity = run >= threshold * 2 ? Severity.HIGH : Severity.MEDIUM;
        return Optional.of(new EthicsFlag(FlagType.MARKET_MANIPULATION_SUSPECTED, severity,
                run + " consecutive offers against the same counterpart outside the fair band"));
    }

    Optional<EthicsFlag> vulnerableCounterpart(FairnessAssessment assessment, InteractionContext context) {
        if (!context.counterpartVulnerable()
                || assessment.getDeviationPct() <= properties.getFairness().getFairThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new EthicsFlag(FlagType.VULNERABLE_USER_EXPOSURE, Severity.HIGH,
                "counterpart belongs to " + context.getCounterpartCohorts()
                        + " and the offer is to their disadvantage"));
    }

    Optional<EthicsFlag> squeeze(FairnessAssessment assessment, List<Offer> history) {
        if (history.size() < SQUEEZE_SEQUENCE - 1) {
            return Optional.empty();
        }
        List<Offer> sequence = new ArrayList<>(history.subList(history.size() - (SQUEEZE_SEQUENCE - 1), history.size()));
        sequence.add(assessment.getOffer());

        int sign = assessment.getOffer().getRole().priceInterestSign();
        for (int i = 1; i < sequence.size(); i++) {
            int step = sequence.get(i).getUnitPrice().compareTo(sequence.get(i - 1).getUnitPrice());
            if (step * sign <= 0) {
                return Optional.empty();
            }
        }
        BigDecimal first = sequence.get(0).getUnitPrice();
        BigDecimal last = sequence.get(sequence.size() - 1).getUnitPrice();
        double shift = last.subtract(first).divide(first, MathContext.DECIMAL64).doubleValue() * sign;
        if (shift <= properties.getEthics().getSqueezeThreshold()) {
            return Optional.empty();
        }
        return Optional.of(new EthicsFlag(FlagType.PREDATORY_PRICING, Severity.MEDIUM,
                String.format("price moved %.0f%% against the counterpart over %d successive offers",
                        shift * 100, sequence.size())));
    }

    /**
     * The submitter's earlier offers on the same product toward the same
     * counterpart, oldest first, capped at the configured history limit.
     * Any earlier offer without a role or a positive price is rejected.
     */
    List<Offer> relevantHistory(Offer current, InteractionContext context) {
        String counterpart = context.getCounterpartId() != null
                ? context.getCounterpartId() : current.getCounterpartId();
        List<Offer> relevant = new ArrayList<>();
        for (Offer past : context.getRecentOffers()) {
            requireWellFormed(past);
            if (past.getRole() != current.getRole()) {
                continue;
            }
            if (current.getProduct() != null && !current.getProduct().equalsIgnoreCase(past.getProduct())) {
                continue;
            }
            if (counterpart != null && past.getCounterpartId() != null
                    && !counterpart.equals(past.getCounterpartId())) {
                continue;
            }
            relevant.add(past);
        }
        int limit = properties.getEthics().getHistoryLimit();
        if (relevant.size() > limit) {
            return relevant.subList(relevant.size() - limit, relevant.size());
        }
        return relevant;
    }

    private static void requireWellFormed(Offer past) {
        if (past == null || past.getRole() == null) {
            throw new InvalidInputException("every earlier offer needs a role");
        }
        if (past.getUnitPrice() == null || past.getUnitPrice().signum() <= 0) {
            throw new InvalidInputException("earlier offer unit price must be positive, got "
                    + past.getUnitPrice());
        }
    }
}
