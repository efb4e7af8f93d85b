package com.sfuplan.prereq.recommendation;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.domain.PrerequisiteNode;
import com.sfuplan.prereq.domain.PrerequisiteNode.And;
import com.sfuplan.prereq.domain.PrerequisiteNode.Course;
import com.sfuplan.prereq.domain.PrerequisiteNode.Unknown;
import com.sfuplan.prereq.graph.PrerequisiteGraph;
import com.sfuplan.prereq.recommendation.SuggestionModels.CourseSuggestion;
import com.sfuplan.prereq.validation.PrerequisiteEvaluator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SuggestionEngineTest {
    private final SuggestionEngine engine = new SuggestionEngine(new PrerequisiteEvaluator());

    private static CatalogCourse course(String id, String raw, PrerequisiteNode tree) {
        String[] parts = id.split("-");
        return new CatalogCourse(id, parts[0], parts[1], id + " title", null, 3, raw, tree);
    }

    private final List<CatalogCourse> catalog = List.of(
            course("CMPT-120", null, null),
            course("CMPT-125", "CMPT 120", new Course("CMPT-120")),
            course("CMPT-225", "CMPT 125 and MACM 101", new And(List.of(new Course("CMPT-125"), new Course("MACM-101")))),
            course("CMPT-300", "CMPT 225", new Course("CMPT-225")),
            course("EDUC-100", "Recommended: interest in teaching", new Unknown("Recommended: interest in teaching")),
            course("MATH-152", "MATH 151", new Course("MATH-151")));

    private List<CourseSuggestion> suggest(Set<String> transcript, int limit) {
        PrerequisiteGraph graph = PrerequisiteGraph.build(catalog.stream().map(CatalogCourse::toEntry).toList());
        return engine.suggest(catalog, graph, transcript, limit);
    }

    private static List<String> ids(List<CourseSuggestion> suggestions) {
        return suggestions.stream().map(CourseSuggestion::courseId).toList();
    }

    @Test
    void newStudentSeesOpenCoursesRankedByWhatTheyUnlock() {
        List<CourseSuggestion> suggestions = suggest(Set.of(), 10);

        assertEquals(List.of("CMPT-120", "EDUC-100"), ids(suggestions));
        assertTrue(suggestions.stream().allMatch(CourseSuggestion::eligible));
        assertEquals(3, suggestions.get(0).unlocks());
        assertEquals("", suggestions.get(0).prerequisites());
    }

    @Test
    void satisfiedCoursesAreEligibleAndTakenOnesAreSkipped() {
        List<CourseSuggestion> suggestions = suggest(Set.of("CMPT-120"), 10);

        assertEquals(List.of("CMPT-125", "EDUC-100"), ids(suggestions));
        assertFalse(ids(suggestions).contains("CMPT-225"));
    }

    @Test
    void partialProgressIsListedAsNotEligible() {
        List<CourseSuggestion> suggestions = suggest(Set.of("CMPT-120", "CMPT-125"), 10);

        assertEquals(List.of("EDUC-100", "CMPT-225"), ids(suggestions));
        CourseSuggestion partial = suggestions.get(1);
        assertFalse(partial.eligible());
        assertEquals(List.of("MACM-101"), partial.missingPrerequisites());
        assertEquals("CMPT 125 and MACM 101", partial.prerequisites());
    }

    @Test
    void limitCapsTheList() {
        assertEquals(List.of("CMPT-120"), ids(suggest(Set.of(), 1)));
        assertTrue(suggest(Set.of(), 0).isEmpty());
    }
}
