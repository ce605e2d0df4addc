package com.topicmatch.backend.modules.preference.presentation;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.topicmatch.backend.modules.preference.application.PreferenceService;
import com.topicmatch.backend.modules.preference.application.QuestionnaireCompletionService;
import com.topicmatch.backend.modules.preference.presentation.dto.AddExclusionRequest;
import com.topicmatch.backend.modules.preference.presentation.dto.AddRosterRequest;
import com.topicmatch.backend.modules.preference.presentation.dto.AnswerResponse;
import com.topicmatch.backend.modules.preference.presentation.dto.IncompleteStudentResponse;
import com.topicmatch.backend.modules.preference.presentation.dto.PreferenceResponse;
import com.topicmatch.backend.modules.preference.presentation.dto.SaveAnswersRequest;
import com.topicmatch.backend.modules.preference.presentation.dto.SavePreferenceRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/periods/{periodId}")
public class PreferenceController {

    private final PreferenceService preferenceService;
    private final QuestionnaireCompletionService questionnaireCompletionService;

    public PreferenceController(
            PreferenceService preferenceService,
            QuestionnaireCompletionService questionnaireCompletionService
    ) {
        this.preferenceService = preferenceService;
        this.questionnaireCompletionService = questionnaireCompletionService;
    }

    @PutMapping("/preferences/{studentId}")
    public ResponseEntity<PreferenceResponse> savePreference(
            @PathVariable("periodId") UUID periodId,
            @PathVariable("studentId") String studentId,
            @Valid @RequestBody SavePreferenceRequest request
    ) {
        return ResponseEntity.ok(preferenceService.savePreference(periodId, studentId, request.topicOrder()));
    }

    @PutMapping("/answers/{studentId}")
    public ResponseEntity<List<AnswerResponse>> saveAnswers(
            @PathVariable("periodId") UUID periodId,
            @PathVariable("studentId") String studentId,
            @Valid @RequestBody SaveAnswersRequest request
    ) {
        return ResponseEntity.ok(preferenceService.saveAnswers(periodId, studentId, request));
    }

    @GetMapping("/incomplete-students")
    public ResponseEntity<List<IncompleteStudentResponse>> incompleteStudents(@PathVariable("periodId") UUID periodId) {
        return ResponseEntity.ok(questionnaireCompletionService.findIncompleteStudents(periodId));
    }

    @PostMapping("/roster")
    public ResponseEntity<Map<String, Integer>> addToRoster(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody AddRosterRequest request
    ) {
        return ResponseEntity.ok(Map.of("added", preferenceService.addToRoster(periodId, request.studentIds())));
    }

    @PostMapping("/exclusions")
    public ResponseEntity<Void> addExclusion(
            @PathVariable("periodId") UUID periodId,
            @Valid @RequestBody AddExclusionRequest request
    ) {
        preferenceService.addExclusion(periodId, request.studentA(), request.studentB());
        return ResponseEntity.noContent().build();
    }
}
