package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.domain.PrerequisiteNode;
import com.sfuplan.prereq.domain.PrerequisiteNode.And;
import com.sfuplan.prereq.domain.PrerequisiteNode.Course;
import com.sfuplan.prereq.domain.PrerequisiteNode.Or;
import com.sfuplan.prereq.domain.PrerequisiteNode.Unknown;
import com.sfuplan.prereq.validation.ValidationModels.EvaluationResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteEvaluatorTest {
    private final PrerequisiteEvaluator evaluator = new PrerequisiteEvaluator();

    private static PrerequisiteNode c(String id) {
        return new Course(id);
    }

    @Test
    void andReportsEveryMissingCourse() {
        EvaluationResult result = evaluator.evaluate(new And(List.of(c("A-100"), c("B-100"))), Set.of("A-100"));
        assertFalse(result.satisfied());
        assertEquals(List.of("B-100"), result.missing());

        EvaluationResult none = evaluator.evaluate(new And(List.of(c("A-100"), c("B-100"), c("C-100"))), Set.of());
        assertEquals(List.of("A-100", "B-100", "C-100"), none.missing());
    }

    @Test
    void orIsSatisfiedByAnyOption() {
        EvaluationResult result = evaluator.evaluate(new Or(List.of(c("A-100"), c("B-100"))), Set.of("B-100"));
        assertTrue(result.satisfied());
        assertTrue(result.missing().isEmpty());
    }

    @Test
    void failedOrListsEveryOptionOnce() {
        PrerequisiteNode tree = new Or(List.of(new And(List.of(c("A-100"), c("B-100"))), new And(List.of(c("A-100"), c("C-100")))));
        EvaluationResult result = evaluator.evaluate(tree, Set.of());
        assertFalse(result.satisfied());
        assertEquals(List.of("A-100", "B-100", "C-100"), result.missing());
    }

    @Test
    void satisfiedOrInsideAndAddsNothingMissing() {
        PrerequisiteNode tree = new And(List.of(new Or(List.of(c("CMPT-125"), c("CMPT-135"))), c("MACM-101")));
        EvaluationResult result = evaluator.evaluate(tree, Set.of("CMPT-135"));
        assertFalse(result.satisfied());
        assertEquals(List.of("MACM-101"), result.missing());
    }

    @Test
    void absentTreeAndUnknownNeverBlock() {
        assertTrue(evaluator.evaluate(null, Set.of()).satisfied());
        assertTrue(evaluator.evaluate(new Unknown("permission of the instructor"), Set.of()).satisfied());

        EvaluationResult mixed = evaluator.evaluate(new And(List.of(c("A-100"), new Unknown("60 units"))), Set.of("A-100"));
        assertTrue(mixed.satisfied());
        assertTrue(mixed.missing().isEmpty());
    }

    @Test
    void addingCoursesNeverBreaksSatisfaction() {
        PrerequisiteNode tree = new And(List.of(
                new Or(List.of(c("A-100"), c("B-100"))),
                new Or(List.of(c("C-100"), new And(List.of(c("D-100"), c("E-100")))))));
        List<String> order = List.of("A-100", "D-100", "E-100", "B-100", "C-100");

        Set<String> transcript = new HashSet<>();
        boolean satisfiedBefore = evaluator.evaluate(tree, transcript).satisfied();
        for (String course : order) {
            transcript.add(course);
            boolean satisfiedNow = evaluator.evaluate(tree, transcript).satisfied();
            assertTrue(!satisfiedBefore || satisfiedNow, "lost satisfaction after adding " + course);
            satisfiedBefore = satisfiedNow;
        }
        assertTrue(satisfiedBefore);
    }
}
