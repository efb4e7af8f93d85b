package com.sfuplan.prereq.domain;

import com.sfuplan.prereq.domain.PrerequisiteNode.And;
import com.sfuplan.prereq.domain.PrerequisiteNode.Course;
import com.sfuplan.prereq.domain.PrerequisiteNode.Or;
import com.sfuplan.prereq.domain.PrerequisiteNode.Unknown;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrerequisiteTreesTest {

    @Test
    void flattenKeepsFirstOccurrenceOrder() {
        PrerequisiteNode tree = new Or(List.of(new Course("B-200"), new Course("A-100"), new Course("B-200"), new Course("C-300")));
        assertEquals(List.of("B-200", "A-100", "C-300"), PrerequisiteTrees.flatten(tree));

        PrerequisiteNode nested = new And(List.of(new Course("X-100"), new Or(List.of(new Course("Y-100"), new Unknown("note")))));
        assertEquals(List.of("X-100", "Y-100"), PrerequisiteTrees.flatten(nested));
        assertTrue(PrerequisiteTrees.flatten(null).isEmpty());
    }

    @Test
    void displayParenthesizesOnlyMixedOperators() {
        PrerequisiteNode mixed = new And(List.of(new Or(List.of(new Course("CMPT-125"), new Course("CMPT-135"))), new Course("MACM-101")));
        assertEquals("(CMPT-125 OR CMPT-135) AND MACM-101", PrerequisiteTrees.toDisplayString(mixed));

        PrerequisiteNode same = new And(List.of(new And(List.of(new Course("A-100"), new Course("B-100"))), new Course("C-100")));
        assertEquals("A-100 AND B-100 AND C-100", PrerequisiteTrees.toDisplayString(same));

        PrerequisiteNode withText = new Or(List.of(new Course("A-100"), new And(List.of(new Course("B-100"), new Unknown("60 units")))));
        assertEquals("A-100 OR (B-100 AND 60 units)", PrerequisiteTrees.toDisplayString(withText));
        assertEquals("", PrerequisiteTrees.toDisplayString(null));
    }

    @Test
    void detectsRealCoursesAndProgress() {
        PrerequisiteNode onlyText = new And(List.of(new Unknown("interest in teaching"), new Unknown("W course")));
        PrerequisiteNode tree = new And(List.of(new Course("CMPT-125"), new Unknown("60 units")));

        assertFalse(PrerequisiteTrees.hasRealCourse(onlyText));
        assertTrue(PrerequisiteTrees.hasRealCourse(tree));
        assertTrue(PrerequisiteTrees.hasCompletedAny(tree, Set.of("CMPT-125")));
        assertFalse(PrerequisiteTrees.hasCompletedAny(tree, Set.of("CMPT-120")));
        assertEquals(List.of("60 units"), PrerequisiteTrees.unresolvedFragments(tree));
    }

    @Test
    void singleChildGroupsCollapse() {
        Course only = new Course("CMPT-120");
        assertSame(only, PrerequisiteNode.and(List.of(only)));
        assertSame(only, PrerequisiteNode.or(List.of(only)));
        assertThrows(IllegalArgumentException.class, () -> new And(List.of()));
    }
}
