package com.sfuplan.prereq.api;

import com.sfuplan.prereq.domain.DomainModels.CatalogCourse;
import com.sfuplan.prereq.service.CatalogModels.CourseImportEntry;
import com.sfuplan.prereq.service.CatalogModels.ImportResult;
import com.sfuplan.prereq.service.CatalogModels.ParsePreview;
import com.sfuplan.prereq.service.CatalogModels.ReparseResult;
import com.sfuplan.prereq.service.CourseCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseCatalogController {
    private final CourseCatalogService catalogService;

    public CourseCatalogController(CourseCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/import")
    public ResponseEntity<ImportResult> importCourses(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(catalogService.importCourses(request.courses(), request.dryRun()));
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<CatalogCourse> course(@PathVariable String courseId) {
        return ResponseEntity.ok(catalogService.findCourse(courseId));
    }

    @PostMapping("/reparse")
    public ResponseEntity<ReparseResult> reparse() {
        return ResponseEntity.ok(catalogService.reparseAll());
    }

    @PostMapping("/prerequisites/parse")
    public ResponseEntity<ParsePreview> parse(@RequestBody ParseRequest request) {
        return ResponseEntity.ok(catalogService.previewParse(request.text()));
    }

    public record ImportRequest(List<CourseImportEntry> courses, boolean dryRun) {}

    public record ParseRequest(String text) {}
}
