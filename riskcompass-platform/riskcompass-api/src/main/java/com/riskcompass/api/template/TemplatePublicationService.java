package com.riskcompass.api.template;

import com.riskcompass.core.domain.AssessmentTemplate;
import com.riskcompass.core.domain.TemplateQuestion;
import com.riskcompass.core.domain.TemplateSection;
import com.riskcompass.core.repository.AssessmentTemplateRepository;
import com.riskcompass.scoring.template.NormalizedQuestion;
import com.riskcompass.scoring.template.NormalizedSection;
import com.riskcompass.scoring.template.NormalizedTemplate;
import com.riskcompass.scoring.template.TemplateConfigurationException;
import com.riskcompass.scoring.template.WeightNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Template Publication Service - validates and freezes templates.
 *
 * Only published templates can back assessments, so a template with section weights that do
 * not sum to 1.0 never reaches scoring.
 */
@Service
public class TemplatePublicationService {

    private static final Logger log = LoggerFactory.getLogger(TemplatePublicationService.class);

    private final AssessmentTemplateRepository templateRepository;
    private final TemplateDefinitionMapper templateMapper;
    private final WeightNormalizer weightNormalizer;

    public TemplatePublicationService(
            AssessmentTemplateRepository templateRepository,
            TemplateDefinitionMapper templateMapper,
            WeightNormalizer weightNormalizer) {
        this.templateRepository = templateRepository;
        this.templateMapper = templateMapper;
        this.weightNormalizer = weightNormalizer;
    }

    /**
     * Validates section weights, caches normalized question weights and marks the template published.
     *
     * @throws TemplateNotFoundException if no template has this id
     * @throws TemplateAlreadyPublishedException if the template is already published
     * @throws TemplateConfigurationException if section weights are off by more than the tolerance
     */
    @Transactional
    public PublishedTemplate publish(UUID templateId) {
        if (templateId == null) {
            throw new IllegalArgumentException("Template ID cannot be null");
        }
        AssessmentTemplate template = templateRepository.findById(templateId)
                .orElseThrow(() -> new TemplateNotFoundException(templateId));
        if (template.isPublished()) {
            throw new TemplateAlreadyPublishedException(templateId);
        }

        NormalizedTemplate normalized;
        try {
            normalized = weightNormalizer.normalize(templateMapper.toDefinition(template));
        } catch (TemplateConfigurationException e) {
            log.warn("Refusing to publish template {}: {}", templateId, e.getMessage());
            throw e;
        }

        Map<String, Double> weights = new HashMap<>();
        for (NormalizedSection section : normalized.sections()) {
            for (NormalizedQuestion question : section.questions()) {
                weights.put(question.id(), question.normalizedWeight());
            }
        }
        for (TemplateSection section : template.getSections()) {
            for (TemplateQuestion question : section.getQuestions()) {
                question.cacheNormalizedWeight(weights.get(question.getId().toString()));
            }
        }

        template.markPublished();
        templateRepository.save(template);

        log.info("Published template {} '{}' v{} with {} questions",
                templateId, template.getName(), template.getVersion(), normalized.questionCount());
        return new PublishedTemplate(templateId, template.getName(), template.getVersion(),
                normalized.questionCount(), template.getPublishedAt());
    }

    // ==================== Inner Types ====================

    public record PublishedTemplate(UUID templateId, String name, int version, int questionCount,
                                    Instant publishedAt) {}


    public static class TemplateNotFoundException extends RuntimeException {
        public TemplateNotFoundException(UUID templateId) {
            super("Template not found: " + templateId);
        }
    }

    public static class TemplateAlreadyPublishedException extends RuntimeException {
        public TemplateAlreadyPublishedException(UUID templateId) {
            super("Template already published: " + templateId);
        }
    }
}
