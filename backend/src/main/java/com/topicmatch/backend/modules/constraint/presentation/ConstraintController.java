package com.topicmatch.backend.modules.constraint.presentation;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.modules.constraint.application.ConstraintService;
import com.topicmatch.backend.modules.constraint.presentation.dto.ConstraintResponse;
import com.topicmatch.backend.modules.constraint.presentation.dto.CreateConstraintRequest;
import com.topicmatch.backend.modules.constraint.presentation.dto.UpdateConstraintRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}/constraints")
public class ConstraintController {

    private final ConstraintService constraintService;

    public ConstraintController(ConstraintService constraintService) {
        this.constraintService = constraintService;
    }

    @GetMapping
    public ResponseEntity<List<ConstraintResponse>> list(@PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(constraintService.list(periodId));
    }

    @Operation(summary = "Create constraint", description = "minRatio is given as a percentage and stored as a ratio.")
    @PostMapping
    public ResponseEntity<ConstraintResponse> create(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody CreateConstraintRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(constraintService.create(periodId, request));
    }

    @PatchMapping("/{constraintId}")
    public ResponseEntity<ConstraintResponse> update(
            @PathVariable("periodId") UUID periodId,
            @PathVariable("constraintId") UUID constraintId,
            @Valid @RequestBody UpdateConstraintRequest request
    ) {
        return ResponseEntity.ok(constraintService.update(periodId, constraintId, request));
    }

    @Operation(summary = "Delete constraint", description = "Linked questions are unlinked, never deleted.")
    @DeleteMapping("/{constraintId}")
    public ResponseEntity<Void> delete(
            @PathVariable("periodId") UUID periodId,
            @PathVariable("constraintId") UUID constraintId
    ) {
        constraintService.delete(periodId, constraintId);
        return ResponseEntity.noContent().build();
    }
}
