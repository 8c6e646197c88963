package com.riskcompass.core.repository;

import com.riskcompass.core.domain.AssessmentAnswer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Answers are append-only; "current" means not superseded.
 */
@Repository
public interface AssessmentAnswerRepository extends JpaRepository<AssessmentAnswer, UUID> {

    List<AssessmentAnswer> findByAssessmentIdAndSupersededAtIsNull(UUID assessmentId);

    Optional<AssessmentAnswer> findByAssessmentIdAndQuestionIdAndSupersededAtIsNull(UUID assessmentId, UUID questionId);

    List<AssessmentAnswer> findByAssessmentIdAndQuestionIdOrderByAnsweredAtDesc(UUID assessmentId, UUID questionId);
}
