package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.domain.DomainModels.PrerequisiteEntry;
import com.sfuplan.prereq.graph.PrerequisiteGraph;
import com.sfuplan.prereq.graph.PrerequisiteGraphModels.GraphValidationIssue;
import com.sfuplan.prereq.parser.CourseIds;
import com.sfuplan.prereq.recommendation.SuggestionEngine;
import com.sfuplan.prereq.recommendation.SuggestionModels.CourseSuggestion;
import com.sfuplan.prereq.validation.ValidationModels.EvaluationResult;
import com.sfuplan.prereq.validation.ValidationModels.PrerequisiteValidationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ValidationSession {
    private static final Logger log = LoggerFactory.getLogger(ValidationSession.class);

    private final List<CatalogCourse> catalog;
    private final Map<String, CatalogCourse> byId;
    private final PrerequisiteEvaluator evaluator;
    private final SuggestionEngine suggestionEngine;
    private PrerequisiteGraph graph;

    public ValidationSession(List<CatalogCourse> catalog, PrerequisiteEvaluator evaluator, SuggestionEngine suggestionEngine) {
        this.catalog = List.copyOf(catalog);
        this.byId = this.catalog.stream().collect(Collectors.toMap(CatalogCourse::id, Function.identity(), (a, b) -> a));
        this.evaluator = evaluator;
        this.suggestionEngine = suggestionEngine;
    }

    public PrerequisiteValidationResponse validate(String targetCourse, Collection<String> transcript) {
        String target = CourseIds.normalize(targetCourse);
        CatalogCourse course = byId.get(target);
        if (course == null) {
            return new PrerequisiteValidationResponse(target, false, List.of(), null, "Course " + target + " not found");
        }
        if (course.prerequisites() == null) {
            return new PrerequisiteValidationResponse(target, true, List.of(), null, target + " has no prerequisites");
        }

        EvaluationResult result = evaluator.evaluate(course.prerequisites(), CourseIds.normalizeAll(transcript));
        String message = result.satisfied()
                ? "You meet all prerequisites for " + target
                : "Missing prerequisites: " + String.join(", ", result.missing());
        return new PrerequisiteValidationResponse(target, result.satisfied(), result.missing(), course.prerequisites(), message);
    }

    public List<String> prerequisiteChain(String courseId) {
        return graph().prerequisiteChain(CourseIds.normalize(courseId));
    }

    public List<String> unlockedBy(String courseId) {
        return graph().unlockedBy(CourseIds.normalize(courseId));
    }

    public List<CourseSuggestion> suggestNext(Collection<String> transcript, int limit) {
        return suggestionEngine.suggest(catalog, graph(), CourseIds.normalizeAll(transcript), limit);
    }

    public List<GraphValidationIssue> graphIssues() {
        return graph().validate();
    }

    public PrerequisiteGraph graph() {
        if (graph == null) {
            List<PrerequisiteEntry> entries = catalog.stream().map(CatalogCourse::toEntry).toList();
            graph = PrerequisiteGraph.build(entries);
            log.info("Built prerequisite graph with {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
            graph.validate().forEach(issue ->
                    log.warn("Prerequisite graph issue {} at {}: {}", issue.code(), issue.node(), issue.message()));
        }
        return graph;
    }
}
