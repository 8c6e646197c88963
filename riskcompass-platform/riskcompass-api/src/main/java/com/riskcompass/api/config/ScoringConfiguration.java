package com.riskcompass.api.config;

import com.riskcompass.scoring.engine.ScoringEngine;
import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.entitlement.SubscriptionDirectory;
import com.riskcompass.scoring.evidence.EvidenceTierPolicy;
import com.riskcompass.scoring.gap.GapAnalysisGenerator;
import com.riskcompass.scoring.gap.GapPrioritizer;
import com.riskcompass.scoring.risk.RiskClassifier;
import com.riskcompass.scoring.strategy.StrategyMatrixBuilder;
import com.riskcompass.scoring.template.WeightNormalizer;
import com.riskcompass.scoring.vendor.VendorCatalog;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the scoring engine. All engine objects are stateless singletons.
 */
@Configuration
public class ScoringConfiguration {

    @Bean
    public WeightNormalizer weightNormalizer() {
        return new WeightNormalizer();
    }

    @Bean
    public EvidenceTierPolicy evidenceTierPolicy() {
        return new EvidenceTierPolicy();
    }

    @Bean
    public ScoringEngine scoringEngine(EvidenceTierPolicy evidenceTierPolicy) {
        return new ScoringEngine(evidenceTierPolicy);
    }

    @Bean
    public RiskClassifier riskClassifier() {
        return new RiskClassifier();
    }

    @Bean
    public EntitlementGate entitlementGate(SubscriptionDirectory subscriptionDirectory) {
        return new EntitlementGate(subscriptionDirectory);
    }

    @Bean
    public GapPrioritizer gapPrioritizer() {
        return new GapPrioritizer();
    }

    @Bean
    public GapAnalysisGenerator gapAnalysisGenerator(
            EntitlementGate entitlementGate,
            GapPrioritizer gapPrioritizer,
            VendorCatalog vendorCatalog,
            @Value("${riskcompass.gaps.threshold:70}") double threshold) {
        return new GapAnalysisGenerator(entitlementGate, gapPrioritizer, vendorCatalog, threshold);
    }

    @Bean
    public StrategyMatrixBuilder strategyMatrixBuilder(
            EntitlementGate entitlementGate,
            VendorCatalog vendorCatalog,
            @Value("${riskcompass.strategy.top-vendor-limit:3}") int topVendorLimit) {
        return new StrategyMatrixBuilder(entitlementGate, vendorCatalog, topVendorLimit);
    }
}
