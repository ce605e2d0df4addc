package com.topicmatch.backend.modules.assignment.presentation;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.assignment.application.AssignmentQueryService;
import com.topicmatch.backend.modules.assignment.presentation.dto.BatchStatsResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.BatchSummaryResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.CurrentBatchResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.StudentAssignmentResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}")
public class AssignmentController {

    private final AssignmentQueryService assignmentQueryService;

    public AssignmentController(AssignmentQueryService assignmentQueryService) {
        this.assignmentQueryService = assignmentQueryService;
    }

    @Operation(summary = "Current assignment batch", description = "Assignments of the latest batch grouped by topic.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current batch"),
            @ApiResponse(responseCode = "204", description = "No batch has been materialized yet")
    })
    @GetMapping("/assignments")
    public ResponseEntity<CurrentBatchResponse> currentBatch(@PathVariable("periodId") UUID periodId) {
        return assignmentQueryService.currentBatch(periodId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/assignments/stats")
    public ResponseEntity<BatchStatsResponse> stats(@PathVariable("periodId") UUID periodId) {
        return assignmentQueryService.batchStats(periodId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/assignments/students/{studentId}")
    public ResponseEntity<StudentAssignmentResponse> studentAssignment(
            @PathVariable("periodId") UUID periodId,
            @PathVariable("studentId") String studentId
    ) {
        return assignmentQueryService.findStudentAssignment(periodId, studentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/assignment-batches")
    public ResponseEntity<List<BatchSummaryResponse>> batches(@PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(assignmentQueryService.listBatches(periodId));
    }
}
