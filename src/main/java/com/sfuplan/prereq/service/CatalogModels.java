package com.sfuplan.prereq.service;

import com.sfuplan.prereq.domain.PrerequisiteNode;

import java.util.List;

public class CatalogModels {
    public record CourseImportEntry(String courseId,
                                    String title,
                                    String description,
                                    Integer credits,
                                    String prerequisites) {}

    public record ImportIssue(String code, String message, String courseId) {}

    public record ParsedCourse(String courseId,
                               PrerequisiteNode prerequisites,
                               String display,
                               List<String> unresolvedFragments) {}

    public record ImportResult(boolean dryRun,
                               boolean valid,
                               int imported,
                               List<ParsedCourse> courses,
                               List<ImportIssue> issues) {}

    public record ReparseResult(int scanned, int updated) {}

    public record ParsePreview(String raw,
                               String cleaned,
                               PrerequisiteNode tree,
                               String display,
                               List<String> courses,
                               List<String> unresolvedFragments) {}
}
