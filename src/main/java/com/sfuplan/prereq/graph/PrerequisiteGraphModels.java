package com.sfuplan.prereq.graph;

public class PrerequisiteGraphModels {
    public record GraphEdge(String from, String to) {}

    public record GraphValidationIssue(String code, String message, String node) {}
}
