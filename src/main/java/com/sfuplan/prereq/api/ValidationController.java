package com.sfuplan.prereq.api;

import com.sfuplan.prereq.graph.PrerequisiteGraphModels.GraphValidationIssue;
import com.sfuplan.prereq.recommendation.SuggestionModels.CourseSuggestion;
import com.sfuplan.prereq.validation.PrerequisiteValidationService;
import com.sfuplan.prereq.validation.ValidationModels.PrerequisiteValidationRequest;
import com.sfuplan.prereq.validation.ValidationModels.PrerequisiteValidationResponse;
import com.sfuplan.prereq.validation.ValidationModels.SuggestRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/validate")
public class ValidationController {
    private final PrerequisiteValidationService validationService;

    public ValidationController(PrerequisiteValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/prereqs")
    public ResponseEntity<PrerequisiteValidationResponse> validate(@RequestBody PrerequisiteValidationRequest request) {
        return ResponseEntity.ok(validationService.openSession().validate(request.targetCourse(), request.transcript()));
    }

    @GetMapping("/prereq-chain/{courseId}")
    public ResponseEntity<List<String>> prerequisiteChain(@PathVariable String courseId) {
        return ResponseEntity.ok(validationService.openSession().prerequisiteChain(courseId));
    }

    @GetMapping("/unlocked-by/{courseId}")
    public ResponseEntity<List<String>> unlockedBy(@PathVariable String courseId) {
        return ResponseEntity.ok(validationService.openSession().unlockedBy(courseId));
    }

    @PostMapping("/suggest-next")
    public ResponseEntity<List<CourseSuggestion>> suggestNext(@RequestBody SuggestRequest request) {
        return ResponseEntity.ok(validationService.suggestNext(request.transcript(), request.limit()));
    }

    @GetMapping("/graph/issues")
    public ResponseEntity<List<GraphValidationIssue>> graphIssues() {
        return ResponseEntity.ok(validationService.openSession().graphIssues());
    }
}
