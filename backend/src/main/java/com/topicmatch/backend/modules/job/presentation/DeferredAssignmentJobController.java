package com.topicmatch.backend.modules.job.presentation;

import java.util.UUID;

import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.presentation.dto.JobStatusResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/deferred-assignments")
public class DeferredAssignmentJobController {

    private final DeferredAssignmentJobService jobService;

    public DeferredAssignmentJobController(DeferredAssignmentJobService jobService) {
        this.jobService = jobService;
    }

    @Operation(summary = "Job status", description = "Status, age and staleness of a deferred assignment job.")
    @GetMapping("/{jobId}/status")
    public ResponseEntity<JobStatusResponse> getStatus(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobService.getStatus(jobId));
    }
}
