package com.topicmatch.backend.modules.trigger.presentation;

import java.util.UUID;

import com.topicmatch.backend.modules.trigger.application.SolverCallbackService;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverCallbackRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverCallbackResponse;
import com.topicmatch.backend.modules.trigger.presentation.dto.SolverFailureRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/deferred-assignments")
public class SolverCallbackController {

    private final SolverCallbackService solverCallbackService;

    public SolverCallbackController(SolverCallbackService solverCallbackService) {
        this.solverCallbackService = solverCallbackService;
    }

    @Operation(summary = "Solver completion callback")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Result stored (or already stored)"),
            @ApiResponse(responseCode = "401", description = "Hash mismatch"),
            @ApiResponse(responseCode = "500", description = "Result stored but could not be materialized")
    })
    @PostMapping("/callback")
    public ResponseEntity<SolverCallbackResponse> complete(@Valid @RequestBody SolverCallbackRequest request) {
        SolverCallbackService.CallbackResult result = solverCallbackService.handleCompletion(request);
        return ResponseEntity.status(result.status()).body(result.body());
    }

    @Operation(summary = "Solver failure callback")
    @PostMapping("/{jobId}/failure")
    public ResponseEntity<SolverCallbackResponse> fail(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody SolverFailureRequest request
    ) {
        return ResponseEntity.ok(solverCallbackService.handleFailure(jobId, request));
    }
}
