package com.topicmatch.backend.modules.trigger.presentation;

import java.util.UUID;

import com.topicmatch.backend.modules.trigger.application.AssignmentTriggerService;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}/assign-now")
public class AssignmentTriggerController {

    private final AssignmentTriggerService assignmentTriggerService;

    public AssignmentTriggerController(AssignmentTriggerService assignmentTriggerService) {
        this.assignmentTriggerService = assignmentTriggerService;
    }

    @Operation(
            summary = "Run assignment now",
            description = "Compiles the period, replaces any pending job and submits the new one to the solver."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job created and submitted"),
            @ApiResponse(responseCode = "409", description = "Period not closed, questionnaires incomplete or job conflict"),
            @ApiResponse(responseCode = "422", description = "Request could not be compiled"),
            @ApiResponse(responseCode = "502", description = "Job created but the solver rejected it")
    })
    @PostMapping
    public ResponseEntity<AssignNowResponse> assignNow(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody(required = false) AssignNowRequest request
    ) {
        AssignNowResponse response = assignmentTriggerService.assignNow(periodId, request);
        HttpStatus status = response.submitted() ? HttpStatus.ACCEPTED : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(response);
    }
}
