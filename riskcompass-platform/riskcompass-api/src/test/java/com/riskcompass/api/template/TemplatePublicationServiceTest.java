package com.riskcompass.api.template;

import com.riskcompass.api.ApiFixtures;
import com.riskcompass.api.template.TemplatePublicationService.PublishedTemplate;
import com.riskcompass.api.template.TemplatePublicationService.TemplateAlreadyPublishedException;
import com.riskcompass.api.template.TemplatePublicationService.TemplateNotFoundException;
import com.riskcompass.core.domain.AssessmentTemplate;
import com.riskcompass.core.domain.TemplateQuestion;
import com.riskcompass.core.repository.AssessmentTemplateRepository;
import com.riskcompass.scoring.template.TemplateConfigurationException;
import com.riskcompass.scoring.template.WeightNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TemplatePublicationServiceTest {

    private AssessmentTemplateRepository templateRepository;
    private TemplatePublicationService service;

    @BeforeEach
    void setUp() {
        templateRepository = mock(AssessmentTemplateRepository.class);
        service = new TemplatePublicationService(templateRepository, new TemplateDefinitionMapper(), new WeightNormalizer());
    }

    @Test
    void publishesValidTemplateAndCachesWeights() {
        AssessmentTemplate template = ApiFixtures.securityTemplate(0.6, 0.4);
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));

        PublishedTemplate published = service.publish(template.getId());

        assertThat(template.isPublished()).isTrue();
        assertThat(published.questionCount()).isEqualTo(3);
        assertThat(published.publishedAt()).isNotNull();
        assertThat(template.getSections().get(0).getQuestions())
                .extracting(TemplateQuestion::getNormalizedWeight)
                .satisfiesExactly(
                        w -> assertThat(w).isCloseTo(2.0 / 3.0, within(1e-9)),
                        w -> assertThat(w).isCloseTo(1.0 / 3.0, within(1e-9)));
        verify(templateRepository).save(template);
    }

    @Test
    void refusesTemplateWithBadSectionWeights() {
        AssessmentTemplate template = ApiFixtures.securityTemplate(0.5, 0.4);
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));

        assertThatThrownBy(() -> service.publish(template.getId()))
                .isInstanceOf(TemplateConfigurationException.class)
                .satisfies(e -> assertThat(((TemplateConfigurationException) e).getActualSum())
                        .isCloseTo(0.9, within(1e-9)));
        assertThat(template.isPublished()).isFalse();
        verify(templateRepository, never()).save(any());
    }

    @Test
    void refusesToPublishTwice() {
        AssessmentTemplate template = ApiFixtures.securityTemplate(0.6, 0.4);
        template.markPublished();
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));

        assertThatThrownBy(() -> service.publish(template.getId()))
                .isInstanceOf(TemplateAlreadyPublishedException.class);
    }

    @Test
    void unknownTemplateIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(templateRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.publish(missing)).isInstanceOf(TemplateNotFoundException.class);
    }
}
