package com.sfuplan.prereq.domain;

import com.sfuplan.prereq.domain.PrerequisiteNode.And;
import com.sfuplan.prereq.domain.PrerequisiteNode.Course;
import com.sfuplan.prereq.domain.PrerequisiteNode.Or;
import com.sfuplan.prereq.domain.PrerequisiteNode.Unknown;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public final class PrerequisiteTrees {

    private PrerequisiteTrees() {}

    public static List<String> flatten(PrerequisiteNode tree) {
        if (tree == null) return List.of();
        Set<String> courses = new LinkedHashSet<>();
        collectCourses(tree, courses);
        return List.copyOf(courses);
    }

    public static List<String> unresolvedFragments(PrerequisiteNode tree) {
        if (tree == null) return List.of();
        List<String> fragments = new ArrayList<>();
        collectUnknown(tree, fragments);
        return fragments;
    }

    public static boolean hasRealCourse(PrerequisiteNode tree) {
        if (tree == null) return false;
        if (tree instanceof Course) return true;
        return children(tree).stream().anyMatch(PrerequisiteTrees::hasRealCourse);
    }

    public static boolean hasCompletedAny(PrerequisiteNode tree, Set<String> completed) {
        if (tree == null) return false;
        if (tree instanceof Course c) return completed.contains(c.course());
        return children(tree).stream().anyMatch(child -> hasCompletedAny(child, completed));
    }

    public static String toDisplayString(PrerequisiteNode tree) {
        if (tree == null) return "";
        if (tree instanceof Course c) return c.course();
        if (tree instanceof Unknown u) return u.expression();
        String operator = tree instanceof And ? " AND " : " OR ";
        return children(tree).stream()
                .map(child -> isGroup(child) && child.getClass() != tree.getClass()
                        ? "(" + toDisplayString(child) + ")"
                        : toDisplayString(child))
                .collect(Collectors.joining(operator));
    }

    static List<PrerequisiteNode> children(PrerequisiteNode node) {
        if (node instanceof And group) return group.children();
        if (node instanceof Or group) return group.children();
        return List.of();
    }

    private static boolean isGroup(PrerequisiteNode node) {
        return node instanceof And || node instanceof Or;
    }

    private static void collectCourses(PrerequisiteNode node, Set<String> out) {
        if (node instanceof Course c) {
            out.add(c.course());
            return;
        }
        children(node).forEach(child -> collectCourses(child, out));
    }

    private static void collectUnknown(PrerequisiteNode node, List<String> out) {
        if (node instanceof Unknown u) {
            out.add(u.expression());
            return;
        }
        children(node).forEach(child -> collectUnknown(child, out));
    }
}
