package com.riskcompass.api.gap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcompass.api.ApiFixtures;
import com.riskcompass.api.entitlement.JpaSubscriptionDirectory;
import com.riskcompass.api.scoring.AssessmentScoringService;
import com.riskcompass.api.scoring.AssessmentScoringService.AssessmentNotFoundException;
import com.riskcompass.api.template.TemplateDefinitionMapper;
import com.riskcompass.api.vendor.JpaVendorCatalog;
import com.riskcompass.core.domain.Assessment;
import com.riskcompass.core.domain.AssessmentAnswer;
import com.riskcompass.core.domain.AssessmentTemplate;
import com.riskcompass.core.domain.Subscription;
import com.riskcompass.core.domain.Subscription.SubscriptionStatus;
import com.riskcompass.core.domain.Vendor;
import com.riskcompass.core.repository.AssessmentAnswerRepository;
import com.riskcompass.core.repository.AssessmentRepository;
import com.riskcompass.core.repository.SubscriptionRepository;
import com.riskcompass.core.repository.VendorRepository;
import com.riskcompass.scoring.engine.ScoringEngine;
import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.entitlement.SubscriptionPlan;
import com.riskcompass.scoring.evidence.EvidenceTier;
import com.riskcompass.scoring.evidence.EvidenceTierPolicy;
import com.riskcompass.scoring.gap.Gap;
import com.riskcompass.scoring.gap.GapAnalysisGenerator;
import com.riskcompass.scoring.gap.GapPrioritizer;
import com.riskcompass.scoring.gap.Severity;
import com.riskcompass.scoring.risk.RiskClassifier;
import com.riskcompass.scoring.template.TemplateConfigurationException;
import com.riskcompass.scoring.template.WeightNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class GapAnalysisServiceTest {

    private AssessmentRepository assessmentRepository;
    private AssessmentAnswerRepository answerRepository;
    private SubscriptionRepository subscriptionRepository;
    private VendorRepository vendorRepository;
    private GapAnalysisService service;

    private final UUID organizationId = UUID.randomUUID();
    private AssessmentTemplate template;
    private Assessment assessment;

    @BeforeEach
    void setUp() {
        assessmentRepository = mock(AssessmentRepository.class);
        answerRepository = mock(AssessmentAnswerRepository.class);
        subscriptionRepository = mock(SubscriptionRepository.class);
        vendorRepository = mock(VendorRepository.class);

        JpaVendorCatalog vendorCatalog = new JpaVendorCatalog(vendorRepository);
        EntitlementGate gate = new EntitlementGate(new JpaSubscriptionDirectory(subscriptionRepository));
        AssessmentScoringService scoringService = new AssessmentScoringService(
                assessmentRepository, answerRepository, new TemplateDefinitionMapper(), new WeightNormalizer(),
                new ScoringEngine(new EvidenceTierPolicy()), new RiskClassifier(), new ObjectMapper());
        service = new GapAnalysisService(scoringService, gate,
                new GapAnalysisGenerator(gate, new GapPrioritizer(), vendorCatalog, 70.0));

        template = ApiFixtures.securityTemplate(0.6, 0.4);
        assessment = ApiFixtures.assessmentOn(template, organizationId);
        when(assessmentRepository.findByIdAndOrganizationId(assessment.getId(), organizationId))
                .thenReturn(Optional.of(assessment));
        when(answerRepository.findByAssessmentIdAndSupersededAtIsNull(assessment.getId())).thenReturn(List.of(
                AssessmentAnswer.yesNo(assessment.getId(), ApiFixtures.questionId(template, 0, 0), false)
                        .withEvidence(EvidenceTier.TIER_2, "doc-1", 0.9),
                AssessmentAnswer.yesNo(assessment.getId(), ApiFixtures.questionId(template, 0, 1), true)
                        .withEvidence(EvidenceTier.TIER_2, "doc-1", 0.9)));

        Vendor vendor = Vendor.create("Acme Identity", "https://acme.example", List.of("access-control"));
        vendor.approve();
        when(vendorRepository.findByStatusOrderByNameAsc(Vendor.VendorStatus.APPROVED)).thenReturn(List.of(vendor));
    }

    @Test
    void freePlanReceivesRestrictedGaps() {
        subscribe(SubscriptionPlan.FREE);

        List<Gap> gaps = service.getGapAnalysis(assessment.getId(), organizationId);

        assertThat(gaps).hasSizeBetween(3, 5).allMatch(Gap::restricted);
        assertThat(gaps).allSatisfy(g -> assertThat(g.suggestedVendors()).isEmpty());
        assertThat(gaps.stream().map(Gap::severity).distinct().count()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void freePlanIsNotScored() {
        subscribe(SubscriptionPlan.FREE);

        service.getGapAnalysis(assessment.getId(), organizationId);

        verify(answerRepository, never()).findByAssessmentIdAndSupersededAtIsNull(any());
        verify(vendorRepository, never()).findByStatusOrderByNameAsc(any());
    }

    @Test
    void freePlanWithMisconfiguredTemplateStillReceivesRestrictedGaps() {
        AssessmentTemplate broken = ApiFixtures.securityTemplate(0.9, 0.4);
        Assessment onBroken = ApiFixtures.assessmentOn(broken, organizationId);
        when(assessmentRepository.findByIdAndOrganizationId(onBroken.getId(), organizationId))
                .thenReturn(Optional.of(onBroken));
        subscribe(SubscriptionPlan.FREE);

        List<Gap> gaps = service.getGapAnalysis(onBroken.getId(), organizationId);

        assertThat(gaps).isNotEmpty().allMatch(Gap::restricted);
    }

    @Test
    void paidPlanWithMisconfiguredTemplateIsRejected() {
        AssessmentTemplate broken = ApiFixtures.securityTemplate(0.9, 0.4);
        Assessment onBroken = ApiFixtures.assessmentOn(broken, organizationId);
        when(assessmentRepository.findByIdAndOrganizationId(onBroken.getId(), organizationId))
                .thenReturn(Optional.of(onBroken));
        subscribe(SubscriptionPlan.ENTERPRISE);

        assertThatThrownBy(() -> service.getGapAnalysis(onBroken.getId(), organizationId))
                .isInstanceOf(TemplateConfigurationException.class);
    }

    @Test
    void enterprisePlanReceivesRealGaps() {
        subscribe(SubscriptionPlan.ENTERPRISE);

        List<Gap> gaps = service.getGapAnalysis(assessment.getId(), organizationId);

        UUID mfa = ApiFixtures.questionId(template, 0, 0);
        UUID offsite = ApiFixtures.questionId(template, 1, 0);
        assertThat(gaps).extracting(Gap::questionId).containsExactly(mfa.toString(), offsite.toString());
        assertThat(gaps).noneMatch(Gap::restricted);
        assertThat(gaps.get(0).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(gaps.get(0).suggestedVendors()).containsExactly("Acme Identity");
        assertThat(gaps.get(1).description()).startsWith("No answer provided");
    }

    @Test
    void canceledSubscriptionFailsClosed() {
        Subscription subscription = subscribe(SubscriptionPlan.ENTERPRISE);
        subscription.updateStatus(SubscriptionStatus.CANCELED);

        assertThat(service.getGapAnalysis(assessment.getId(), organizationId)).allMatch(Gap::restricted);
    }

    @Test
    void missingSubscriptionFailsClosed() {
        when(subscriptionRepository.findByOrganizationId(organizationId)).thenReturn(Optional.empty());

        assertThat(service.getGapAnalysis(assessment.getId(), organizationId)).allMatch(Gap::restricted);
    }

    @Test
    void otherOrganizationCannotSeeGaps() {
        UUID stranger = UUID.randomUUID();
        when(assessmentRepository.findByIdAndOrganizationId(assessment.getId(), stranger)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getGapAnalysis(assessment.getId(), stranger))
                .isInstanceOf(AssessmentNotFoundException.class);
    }

    private Subscription subscribe(SubscriptionPlan plan) {
        Subscription subscription = Subscription.create(organizationId, plan);
        when(subscriptionRepository.findByOrganizationId(organizationId)).thenReturn(Optional.of(subscription));
        return subscription;
    }
}
