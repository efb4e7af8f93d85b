package com.sfuplan.prereq.parser;

import java.util.regex.Pattern;

public final class RequirementText {
    private static final Pattern LABEL = Pattern.compile(
            "^\\s*(?:Prerequisite|Corequisite|Pre-?req)s?\\s*:?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCLUSION = Pattern.compile(
            "\\.?\\s*\\bStudents?\\b.*?\\b(?:may not|cannot)\\b.*?further credit.*?(?=\\.|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern GRADE = Pattern.compile(
            ",?\\s*(?:all\\s+|both\\s+)?with\\s+(?:a\\s+)?(?:minimum\\s+grade\\s+of|grade\\s+of\\s+at\\s+least|minimum\\s+of|grade\\s+of)"
                    + "\\s+(?:a\\s+)?[A-F][+-]?(?![A-Za-z])(?:\\s+or\\s+(?:better|higher|above)\\b)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern W_COURSE = Pattern.compile("\\bOne\\s+W\\s+course,?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BOTH = Pattern.compile("\\bboth\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AND = Pattern.compile("\\bAND\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR = Pattern.compile("\\bOR\\b", Pattern.CASE_INSENSITIVE);

    private RequirementText() {}

    public static String clean(String raw) {
        if (raw == null) return "";
        String s = LABEL.matcher(raw).replaceFirst("");
        s = EXCLUSION.matcher(s).replaceAll("");
        s = GRADE.matcher(s).replaceAll("");
        s = W_COURSE.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        s = BOTH.matcher(s).replaceAll("and");
        s = AND.matcher(s).replaceAll("and");
        s = OR.matcher(s).replaceAll("or");
        return stripTrailingPunctuation(s);
    }

    private static String stripTrailingPunctuation(String s) {
        int end = s.length();
        while (end > 0) {
            char c = s.charAt(end - 1);
            if (c == '.' || c == ',' || c == ';' || Character.isWhitespace(c)) {
                end--;
            } else {
                break;
            }
        }
        return s.substring(0, end);
    }
}
