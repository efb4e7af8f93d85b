package com.sfuplan.prereq.domain;

public class DomainModels {
    public record CatalogCourse(String id, String dept, String number, String title, String description,
                                int credits, String prerequisitesRaw, PrerequisiteNode prerequisites) {
        public PrerequisiteEntry toEntry() {
            return new PrerequisiteEntry(id, prerequisitesRaw == null ? "" : prerequisitesRaw, prerequisites);
        }
    }

    public record PrerequisiteEntry(String courseId, String rawText, PrerequisiteNode tree) {}
}
