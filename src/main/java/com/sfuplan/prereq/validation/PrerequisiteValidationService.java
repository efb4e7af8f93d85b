package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.config.SuggestionProperties;
import com.sfuplan.prereq.recommendation.SuggestionEngine;
import com.sfuplan.prereq.recommendation.SuggestionModels.CourseSuggestion;
import com.sfuplan.prereq.repository.CourseJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

@Service
public class PrerequisiteValidationService {
    private final CourseJdbcRepository repository;
    private final PrerequisiteEvaluator evaluator;
    private final SuggestionEngine suggestionEngine;
    private final SuggestionProperties suggestionProperties;

    public PrerequisiteValidationService(CourseJdbcRepository repository,
                                         PrerequisiteEvaluator evaluator,
                                         SuggestionEngine suggestionEngine,
                                         SuggestionProperties suggestionProperties) {
        this.repository = repository;
        this.evaluator = evaluator;
        this.suggestionEngine = suggestionEngine;
        this.suggestionProperties = suggestionProperties;
    }

    public ValidationSession openSession() {
        return new ValidationSession(repository.findAll(), evaluator, suggestionEngine);
    }

    public List<CourseSuggestion> suggestNext(Collection<String> transcript, Integer limit) {
        return openSession().suggestNext(transcript, suggestionProperties.effectiveLimit(limit));
    }
}
