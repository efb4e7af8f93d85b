package com.sfuplan.prereq.recommendation;

import com.sfuplan.prereq.domain.PrerequisiteNode;

import java.util.List;

public class SuggestionModels {
    public record CourseSuggestion(String courseId,
                                   String title,
                                   String dept,
                                   String number,
                                   int credits,
                                   String prerequisites,
                                   PrerequisiteNode prerequisitesLogic,
                                   boolean eligible,
                                   List<String> missingPrerequisites,
                                   int unlocks) {}
}
