package com.topicmatch.backend.modules.period.presentation;

import java.util.UUID;

import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.period.presentation.dto.PeriodResponse;
import com.topicmatch.backend.modules.period.presentation.dto.UpdateCloseDateRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}")
public class SelectionPeriodController {

    private final SelectionPeriodService selectionPeriodService;

    public SelectionPeriodController(SelectionPeriodService selectionPeriodService) {
        this.selectionPeriodService = selectionPeriodService;
    }

    @GetMapping
    public ResponseEntity<PeriodResponse> getPeriod(@PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(selectionPeriodService.describe(periodId));
    }

    @Operation(summary = "Activate period", description = "Makes this period the only active one.")
    @PostMapping("/activate")
    public ResponseEntity<PeriodResponse> activate(@PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(selectionPeriodService.activate(periodId));
    }

    @Operation(
            summary = "Move close date",
            description = "Cancels the pending close trigger and re-arms it for the new date."
    )
    @PatchMapping("/close-date")
    public ResponseEntity<PeriodResponse> rescheduleClose(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody UpdateCloseDateRequest request
    ) {
        return ResponseEntity.ok(selectionPeriodService.rescheduleClose(periodId, request.closeDate()));
    }
}
