package com.sfuplan.prereq.service;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.domain.PrerequisiteNode;
import com.sfuplan.prereq.domain.PrerequisiteTrees;
import com.sfuplan.prereq.exception.CourseNotFoundException;
import com.sfuplan.prereq.exception.MalformedPrerequisiteTreeException;
import com.sfuplan.prereq.parser.CourseIds;
import com.sfuplan.prereq.parser.PrerequisiteParser;
import com.sfuplan.prereq.parser.PrerequisiteTreeCodec;
import com.sfuplan.prereq.parser.RequirementText;
import com.sfuplan.prereq.repository.CourseJdbcRepository;
import com.sfuplan.prereq.repository.CourseJdbcRepository.RawPrerequisiteRow;
import com.sfuplan.prereq.service.CatalogModels.*;
import com.sfuplan.prereq.validation.CatalogEntryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class CourseCatalogService {
    private static final Logger log = LoggerFactory.getLogger(CourseCatalogService.class);
    private static final int DEFAULT_CREDITS = 3;

    private final PrerequisiteParser parser;
    private final PrerequisiteTreeCodec codec;
    private final CatalogEntryValidator validator;
    private final CourseJdbcRepository repository;

    public CourseCatalogService(PrerequisiteParser parser,
                                PrerequisiteTreeCodec codec,
                                CatalogEntryValidator validator,
                                CourseJdbcRepository repository) {
        this.parser = parser;
        this.codec = codec;
        this.validator = validator;
        this.repository = repository;
    }

    @Transactional
    public ImportResult importCourses(List<CourseImportEntry> entries, boolean dryRun) {
        List<CourseImportEntry> batch = entries == null ? List.of() : entries.stream().filter(Objects::nonNull).toList();
        List<ImportIssue> issues = validator.validate(batch);
        if (!issues.isEmpty()) {
            return new ImportResult(dryRun, false, 0, List.of(), issues);
        }

        List<ParsedCourse> parsed = new ArrayList<>();
        List<CatalogCourse> courses = new ArrayList<>();
        for (CourseImportEntry entry : batch) {
            CatalogCourse course = toCourse(entry);
            courses.add(course);
            parsed.add(new ParsedCourse(course.id(), course.prerequisites(),
                    PrerequisiteTrees.toDisplayString(course.prerequisites()),
                    PrerequisiteTrees.unresolvedFragments(course.prerequisites())));
        }

        if (!dryRun) {
            courses.forEach(repository::save);
        }
        long unresolved = parsed.stream().filter(p -> !p.unresolvedFragments().isEmpty()).count();
        log.info("Catalog import: {} courses parsed, {} with unresolved text, dryRun={}", parsed.size(), unresolved, dryRun);
        return new ImportResult(dryRun, true, dryRun ? 0 : courses.size(), parsed, issues);
    }

    @Transactional
    public ReparseResult reparseAll() {
        List<RawPrerequisiteRow> rows = repository.loadRawPrerequisites();
        int updated = 0;
        for (RawPrerequisiteRow row : rows) {
            PrerequisiteNode fresh = parser.parse(row.rawText()).orElse(null);
            if (needsRewrite(row, fresh)) {
                repository.updatePrerequisites(row.courseId(), codec.encode(fresh));
                updated++;
            }
        }
        log.info("Reparsed {} stored requirements, {} trees changed", rows.size(), updated);
        return new ReparseResult(rows.size(), updated);
    }

    public ParsePreview previewParse(String raw) {
        String cleaned = RequirementText.clean(raw);
        PrerequisiteNode tree = parser.parseCleaned(cleaned).orElse(null);
        return new ParsePreview(raw, cleaned, tree,
                PrerequisiteTrees.toDisplayString(tree),
                PrerequisiteTrees.flatten(tree),
                PrerequisiteTrees.unresolvedFragments(tree));
    }

    public CatalogCourse findCourse(String courseId) {
        String id = CourseIds.normalize(courseId);
        return repository.findById(id).orElseThrow(() -> new CourseNotFoundException(id));
    }

    private CatalogCourse toCourse(CourseImportEntry entry) {
        String id = CourseIds.normalize(entry.courseId());
        String raw = entry.prerequisites() == null || entry.prerequisites().isBlank() ? null : entry.prerequisites().trim();
        return new CatalogCourse(
                id,
                CourseIds.dept(id),
                CourseIds.number(id),
                entry.title().trim(),
                entry.description(),
                entry.credits() == null ? DEFAULT_CREDITS : entry.credits(),
                raw,
                parser.parse(raw).orElse(null));
    }

    private boolean needsRewrite(RawPrerequisiteRow row, PrerequisiteNode fresh) {
        try {
            return !Objects.equals(fresh, codec.decode(row.logicJson()));
        } catch (MalformedPrerequisiteTreeException e) {
            log.warn("Stored prerequisite tree for {} is unreadable and will be rewritten: {}", row.courseId(), e.getMessage());
            return true;
        }
    }
}
