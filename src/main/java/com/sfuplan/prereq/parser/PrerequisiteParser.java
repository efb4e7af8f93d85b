package com.sfuplan.prereq.parser;

import com.sfuplan.prereq.domain.PrerequisiteNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns catalog prerequisite prose into a {@link PrerequisiteNode} tree.
 * <p>
 * Precedence, outermost first: {@code " and "}, then {@code ","} (also AND: every comma item is
 * required), then {@code " or "}, then the atom. Splits only happen at parenthesis depth zero and a
 * fully parenthesized atom is parsed again from the top. A bare three digit number takes the
 * department of the last qualified course seen earlier in the same string, so
 * {@code "CMPT 120 or 125"} reads as CMPT-120 or CMPT-125.
 */
@Component
public class PrerequisiteParser {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteParser.class);

    private static final Pattern COURSE_REF = Pattern.compile(
            "\\b([A-Z]{3,4})[ -](\\d{3}[A-Z]?)\\b"
                    + "|\\b(\\d{3}[A-Z]?)\\b(?![ -]*(?:(?i:or|and)\\s+\\d{3}[A-Z]?[ -]*)*(?i:units?|credits?|level|division)\\b)");
    private static final Pattern TRAILING_BARE_NUMBER = Pattern.compile("(?<![A-Z][ -])\\b\\d{3}[A-Z]?$");
    private static final Pattern LEADING_LEVEL = Pattern.compile(
            "^\\d{3}[A-Z]?[ -]*(?:level|division)\\b", Pattern.CASE_INSENSITIVE);

    public Optional<PrerequisiteNode> parse(String rawText) {
        if (rawText == null || rawText.isBlank()) return Optional.empty();
        return parseCleaned(RequirementText.clean(rawText));
    }

    public Optional<PrerequisiteNode> parseCleaned(String cleaned) {
        if (cleaned == null || cleaned.isBlank()) return Optional.empty();
        return Optional.ofNullable(new Descent().expression(cleaned));
    }

    private static final class Descent {
        private String lastDept;

        PrerequisiteNode expression(String fragment) {
            List<String> parts = split(fragment, " and ");
            if (parts.isEmpty()) return null;
            if (parts.size() == 1) return commaGroup(parts.get(0));
            return group(parts, true, this::commaGroup);
        }

        PrerequisiteNode commaGroup(String fragment) {
            List<String> parts = split(fragment, ",");
            if (parts.isEmpty()) return null;
            if (parts.size() == 1) return orGroup(parts.get(0));
            return group(parts, true, this::orGroup);
        }

        PrerequisiteNode orGroup(String fragment) {
            List<String> parts = joinLevelRanges(split(fragment, " or "));
            if (parts.isEmpty()) return null;
            if (parts.size() == 1) return atom(parts.get(0));
            return group(parts, false, this::atom);
        }

        PrerequisiteNode atom(String fragment) {
            String text = fragment.trim();
            if (text.isEmpty()) return null;
            if (isWrapped(text)) {
                return expression(text.substring(1, text.length() - 1).trim());
            }

            List<String> courses = extractCourses(text);
            if (courses.isEmpty()) {
                log.debug("No course reference in requirement fragment '{}'", text);
                return PrerequisiteNode.unknown(text);
            }
            return PrerequisiteNode.or(courses.stream().map(PrerequisiteNode::course).toList());
        }

        private PrerequisiteNode group(List<String> parts, boolean conjunction,
                                       Function<String, PrerequisiteNode> next) {
            List<PrerequisiteNode> children = new ArrayList<>();
            for (String part : parts) {
                PrerequisiteNode child = next.apply(part);
                if (child != null) children.add(child);
            }
            if (children.isEmpty()) return null;
            return conjunction ? PrerequisiteNode.and(children) : PrerequisiteNode.or(children);
        }

        private List<String> extractCourses(String text) {
            Set<String> courses = new LinkedHashSet<>();
            Matcher m = COURSE_REF.matcher(text);
            while (m.find()) {
                if (m.group(1) != null) {
                    lastDept = m.group(1);
                    courses.add(lastDept + "-" + m.group(2));
                } else if (lastDept != null) {
                    courses.add(lastDept + "-" + m.group(3));
                }
            }
            return List.copyOf(courses);
        }
    }

    static List<String> split(String text, String delimiter) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (depth == 0 && text.startsWith(delimiter, i)) {
                addPart(parts, text.substring(start, i));
                i += delimiter.length();
                start = i;
                continue;
            }
            if (c == '(') depth++;
            else if (c == ')') depth--;
            i++;
        }
        addPart(parts, text.substring(start));
        return parts;
    }

    static boolean isWrapped(String text) {
        if (text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') return false;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            if (depth == 0 && i < text.length() - 1) return false;
        }
        return depth == 0;
    }

    // "300 or 400 level" names a course level, not two alternatives
    static List<String> joinLevelRanges(List<String> parts) {
        List<String> joined = new ArrayList<>();
        for (String part : parts) {
            int last = joined.size() - 1;
            if (last >= 0 && TRAILING_BARE_NUMBER.matcher(joined.get(last)).find()
                    && LEADING_LEVEL.matcher(part).find()) {
                joined.set(last, joined.get(last) + " or " + part);
            } else {
                joined.add(part);
            }
        }
        return joined;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) parts.add(trimmed);
    }
}
