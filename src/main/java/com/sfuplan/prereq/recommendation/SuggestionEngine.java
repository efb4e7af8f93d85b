package com.sfuplan.prereq.recommendation;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.domain.PrerequisiteTrees;
import com.sfuplan.prereq.graph.PrerequisiteGraph;
import com.sfuplan.prereq.recommendation.SuggestionModels.CourseSuggestion;
import com.sfuplan.prereq.validation.PrerequisiteEvaluator;
import com.sfuplan.prereq.validation.ValidationModels.EvaluationResult;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class SuggestionEngine {
    private static final Comparator<CourseSuggestion> RANKING = Comparator
            .comparing((CourseSuggestion s) -> !s.eligible())
            .thenComparingInt(s -> s.missingPrerequisites().size())
            .thenComparing(Comparator.comparingInt(CourseSuggestion::unlocks).reversed())
            .thenComparing(CourseSuggestion::courseId);

    private final PrerequisiteEvaluator evaluator;

    public SuggestionEngine(PrerequisiteEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    public List<CourseSuggestion> suggest(List<CatalogCourse> catalog, PrerequisiteGraph graph,
                                          Set<String> transcript, int limit) {
        if (limit <= 0) return List.of();

        List<CourseSuggestion> suggestions = new ArrayList<>();
        for (CatalogCourse course : catalog) {
            if (transcript.contains(course.id())) continue;

            int unlocks = graph.unlockedBy(course.id()).size();
            if (course.prerequisites() == null) {
                suggestions.add(toSuggestion(course, true, List.of(), unlocks));
                continue;
            }

            EvaluationResult result = evaluator.evaluate(course.prerequisites(), transcript);
            boolean realPrerequisites = PrerequisiteTrees.hasRealCourse(course.prerequisites());
            boolean progress = PrerequisiteTrees.hasCompletedAny(course.prerequisites(), transcript);

            if (result.satisfied() || !realPrerequisites) {
                suggestions.add(toSuggestion(course, true, List.of(), unlocks));
            } else if (progress) {
                suggestions.add(toSuggestion(course, false, result.missing(), unlocks));
            }
        }

        return suggestions.stream().sorted(RANKING).limit(limit).toList();
    }

    private CourseSuggestion toSuggestion(CatalogCourse course, boolean eligible, List<String> missing, int unlocks) {
        return new CourseSuggestion(
                course.id(),
                course.title(),
                course.dept(),
                course.number(),
                course.credits(),
                course.prerequisitesRaw() == null ? "" : course.prerequisitesRaw(),
                course.prerequisites(),
                eligible,
                missing,
                unlocks
        );
    }
}
