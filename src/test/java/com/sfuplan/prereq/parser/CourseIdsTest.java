package com.sfuplan.prereq.parser;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CourseIdsTest {

    @Test
    void canonicalizesCommonSpellings() {
        assertEquals("CMPT-120", CourseIds.normalize("CMPT 120"));
        assertEquals("CMPT-120", CourseIds.normalize("cmpt120"));
        assertEquals("CMPT-120", CourseIds.normalize("CMPT-120"));
        assertEquals("CMPT-105W", CourseIds.normalize(" cmpt 105w "));
    }

    @Test
    void normalizationIsIdempotent() {
        for (String raw : List.of("CMPT 120", "cmpt120", "MATH-151", "macm 101", "120", "", "EDUC")) {
            String once = CourseIds.normalize(raw);
            assertEquals(once, CourseIds.normalize(once), raw);
        }
    }

    @Test
    void normalizeAllSkipsBlanksAndDuplicates() {
        Set<String> ids = CourseIds.normalizeAll(Arrays.asList("cmpt 120", "CMPT-120", null, " ", "MATH151"));
        assertEquals(Set.of("CMPT-120", "MATH-151"), ids);
        assertTrue(CourseIds.normalizeAll(null).isEmpty());
    }

    @Test
    void recognisesCanonicalIdsAndSplitsThem() {
        assertTrue(CourseIds.isCanonical("CMPT-105W"));
        assertFalse(CourseIds.isCanonical("12345"));
        assertFalse(CourseIds.isCanonical("CMPT-12"));
        assertEquals("MACM", CourseIds.dept("MACM-101"));
        assertEquals("101", CourseIds.number("MACM-101"));
    }
}
