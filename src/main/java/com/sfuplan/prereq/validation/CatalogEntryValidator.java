package com.sfuplan.prereq.validation;

import com.sfuplan.prereq.parser.CourseIds;
import com.sfuplan.prereq.service.CatalogModels.CourseImportEntry;
import com.sfuplan.prereq.service.CatalogModels.ImportIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class CatalogEntryValidator {
    public List<ImportIssue> validate(List<CourseImportEntry> entries) {
        List<ImportIssue> issues = new ArrayList<>();

        for (CourseImportEntry entry : entries) {
            if (entry.courseId() == null || entry.courseId().isBlank()) {
                issues.add(new ImportIssue("MISSING_FIELD", "courseId required", null));
                continue;
            }
            String id = CourseIds.normalize(entry.courseId());
            if (!CourseIds.isCanonical(id)) {
                issues.add(new ImportIssue("INVALID_COURSE_ID", "Not a DEPT-NUMBER course id: " + entry.courseId(), id));
            }
            if (entry.title() == null || entry.title().isBlank()) {
                issues.add(new ImportIssue("MISSING_FIELD", "title required", id));
            }
            if (entry.credits() != null && entry.credits() < 0) {
                issues.add(new ImportIssue("INVALID_FIELD", "credits must not be negative", id));
            }
        }

        Map<String, Long> counts = entries.stream()
                .map(CourseImportEntry::courseId)
                .filter(Objects::nonNull)
                .map(CourseIds::normalize)
                .filter(id -> !id.isEmpty())
                .collect(Collectors.groupingBy(id -> id, Collectors.counting()));
        counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .forEach(id -> issues.add(new ImportIssue("DUPLICATE_COURSE", "Duplicate course id: " + id, id)));

        return issues;
    }
}
