package com.sfuplan.prereq.domain;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PrerequisiteNode.Course.class, name = "COURSE"),
        @JsonSubTypes.Type(value = PrerequisiteNode.And.class, name = "AND"),
        @JsonSubTypes.Type(value = PrerequisiteNode.Or.class, name = "OR"),
        @JsonSubTypes.Type(value = PrerequisiteNode.Unknown.class, name = "UNKNOWN")
})
public sealed interface PrerequisiteNode
        permits PrerequisiteNode.Course, PrerequisiteNode.And, PrerequisiteNode.Or, PrerequisiteNode.Unknown {

    record Course(String course) implements PrerequisiteNode {
        public Course {
            Objects.requireNonNull(course, "course");
        }
    }

    record And(List<PrerequisiteNode> children) implements PrerequisiteNode {
        public And {
            children = requireChildren(children, "AND");
        }
    }

    record Or(List<PrerequisiteNode> children) implements PrerequisiteNode {
        public Or {
            children = requireChildren(children, "OR");
        }
    }

    record Unknown(String expression) implements PrerequisiteNode {
        public Unknown {
            expression = expression == null ? "" : expression;
        }
    }

    static PrerequisiteNode course(String courseId) {
        return new Course(courseId);
    }

    static PrerequisiteNode unknown(String expression) {
        return new Unknown(expression);
    }

    static PrerequisiteNode and(List<PrerequisiteNode> children) {
        return children.size() == 1 ? children.get(0) : new And(children);
    }

    static PrerequisiteNode or(List<PrerequisiteNode> children) {
        return children.size() == 1 ? children.get(0) : new Or(children);
    }

    private static List<PrerequisiteNode> requireChildren(List<PrerequisiteNode> children, String type) {
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException(type + " node requires at least one child");
        }
        if (children.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(type + " node has a null child");
        }
        return List.copyOf(children);
    }
}
