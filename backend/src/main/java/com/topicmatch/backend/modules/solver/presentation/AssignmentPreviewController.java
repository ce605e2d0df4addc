package com.topicmatch.backend.modules.solver.presentation;

import java.util.UUID;

import com.topicmatch.backend.modules.solver.application.AssignmentPreviewService;
import com.topicmatch.backend.modules.solver.presentation.dto.AssignmentPreviewRequest;
import com.topicmatch.backend.modules.solver.presentation.dto.AssignmentPreviewResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}/assignment-preview")
public class AssignmentPreviewController {

    private final AssignmentPreviewService assignmentPreviewService;

    public AssignmentPreviewController(AssignmentPreviewService assignmentPreviewService) {
        this.assignmentPreviewService = assignmentPreviewService;
    }

    @Operation(summary = "Preview solver request", description = "Compiles the period without creating a job.")
    @PostMapping
    public ResponseEntity<AssignmentPreviewResponse> preview(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody(required = false) AssignmentPreviewRequest request
    ) {
        return ResponseEntity.ok(assignmentPreviewService.preview(periodId, request));
    }
}
