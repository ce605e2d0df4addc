package com.topicmatch.backend.modules.solver.domain;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

import com.topicmatch.backend.modules.constraint.domain.CriterionType;

/**
 * Detached snapshot of everything the compiler reads. Built inside a read-only transaction and
 * then compiled without touching the database.
 */
public record CompilationInput(
        UUID periodId,
        List<TopicInput> topics,
        List<ConstraintInput> constraints,
        List<PreferenceInput> preferences,
        List<AnswerInput> answers,
        List<ExclusionInput> exclusions,
        Set<String> roster,
        Map<UUID, Integer> groupSizes,
        Double rankingPercentage,
        Integer maxTimeSeconds
) {

    public CompilationInput {
        topics = List.copyOf(topics);
        constraints = List.copyOf(constraints);
        preferences = List.copyOf(preferences);
        answers = List.copyOf(answers);
        exclusions = List.copyOf(exclusions);
        roster = Set.copyOf(roster);
        groupSizes = groupSizes == null ? Map.of() : Map.copyOf(groupSizes);
    }

    public record TopicInput(UUID id, String title, boolean active, boolean preferenceWeighted, Set<UUID> constraintIds) {
    }

    public record ConstraintInput(
            UUID id,
            String name,
            CriterionType criterionType,
            Double minRatio,
            Integer minStudents,
            Integer maxStudents
    ) {
    }

    public record PreferenceInput(String studentId, List<UUID> topicOrder) {
    }

    public record AnswerInput(String studentId, UUID questionId, String characteristicName, double normalizedAnswer) {
    }

    public record ExclusionInput(String studentA, String studentB) {
    }

    /**
     * Active topics ordered by title, then id. The position is the solver group index.
     */
    public List<TopicInput> orderedActiveTopics() {
        return topics.stream()
                .filter(TopicInput::active)
                .sorted(Comparator.comparing(TopicInput::title).thenComparing(TopicInput::id))
                .toList();
    }

    /**
     * Students with at least one preference or answer, ordered by id. The position is the solver student index.
     */
    public List<String> orderedParticipants() {
        TreeSet<String> participants = new TreeSet<>();
        preferences.forEach(preference -> participants.add(preference.studentId()));
        answers.forEach(answer -> participants.add(answer.studentId()));
        return List.copyOf(participants);
    }

    public CompilationInput withGroupSizes(Map<UUID, Integer> sizes) {
        return new CompilationInput(periodId, topics, constraints, preferences, answers, exclusions, roster,
                sizes, rankingPercentage, maxTimeSeconds);
    }
}
