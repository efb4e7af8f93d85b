package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.domain.PrerequisiteNode;

import java.util.List;

public class ValidationModels {
    public record EvaluationResult(boolean satisfied, List<String> missing) {
        public static EvaluationResult passed() {
            return new EvaluationResult(true, List.of());
        }
    }

    public record PrerequisiteValidationRequest(String targetCourse, List<String> transcript) {}

    public record PrerequisiteValidationResponse(String targetCourse,
                                                 boolean valid,
                                                 List<String> missingCourses,
                                                 PrerequisiteNode prerequisiteTree,
                                                 String message) {}

    public record SuggestRequest(List<String> transcript, Integer limit) {}
}
