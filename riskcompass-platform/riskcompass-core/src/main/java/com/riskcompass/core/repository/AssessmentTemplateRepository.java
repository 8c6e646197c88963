package com.riskcompass.core.repository;

import com.riskcompass.core.domain.AssessmentTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssessmentTemplateRepository extends JpaRepository<AssessmentTemplate, UUID> {

    Optional<AssessmentTemplate> findByNameAndVersion(String name, int version);

    List<AssessmentTemplate> findByPublishedTrueOrderByNameAscVersionDesc();
}
