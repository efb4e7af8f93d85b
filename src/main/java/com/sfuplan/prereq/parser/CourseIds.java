package com.sfuplan.prereq.parser;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

public final class CourseIds {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CANONICAL = Pattern.compile("^[A-Z]{2,5}-\\d{3}[A-Z]?$");

    private CourseIds() {}

    public static String normalize(String courseId) {
        if (courseId == null) return "";
        String id = WHITESPACE.matcher(courseId).replaceAll("").toUpperCase();
        if (id.indexOf('-') >= 0) return id;
        for (int i = 0; i < id.length(); i++) {
            if (Character.isDigit(id.charAt(i))) {
                return i == 0 ? id : id.substring(0, i) + "-" + id.substring(i);
            }
        }
        return id;
    }

    public static Set<String> normalizeAll(Collection<String> courseIds) {
        Set<String> normalized = new LinkedHashSet<>();
        if (courseIds == null) return normalized;
        courseIds.stream()
                .filter(Objects::nonNull)
                .map(CourseIds::normalize)
                .filter(id -> !id.isEmpty())
                .forEach(normalized::add);
        return normalized;
    }

    public static boolean isCanonical(String courseId) {
        return courseId != null && CANONICAL.matcher(courseId).matches();
    }

    public static String dept(String courseId) {
        int dash = courseId.indexOf('-');
        return dash < 0 ? courseId : courseId.substring(0, dash);
    }

    public static String number(String courseId) {
        int dash = courseId.indexOf('-');
        return dash < 0 ? "" : courseId.substring(dash + 1);
    }
}
