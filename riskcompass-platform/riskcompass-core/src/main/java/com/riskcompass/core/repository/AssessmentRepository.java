package com.riskcompass.core.repository;

import com.riskcompass.core.domain.Assessment;
import com.riskcompass.core.domain.Assessment.AssessmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssessmentRepository extends JpaRepository<Assessment, UUID> {

    /**
     * Lookup scoped to the owning organization. Empty for other organizations' assessments.
     */
    Optional<Assessment> findByIdAndOrganizationId(UUID id, UUID organizationId);

    List<Assessment> findByOrganizationIdAndStatus(UUID organizationId, AssessmentStatus status);
}
