package com.topicmatch.backend.modules.solver.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.IntStream;

import com.topicmatch.backend.modules.solver.domain.CompilationInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.AnswerInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.ConstraintInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.ExclusionInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.PreferenceInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.TopicInput;
import com.topicmatch.backend.modules.solver.domain.CompiledRequest;
import com.topicmatch.backend.modules.solver.domain.SolverRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a period snapshot into a solver request. Reads and writes nothing; identical input yields an
 * identical request.
 */
@Component
public class SolverRequestCompiler {

    public static final int MIN_MAX_TIME_SECONDS = 15;
    public static final int MAX_MAX_TIME_SECONDS = 540;

    private final int defaultMaxTimeSeconds;

    public SolverRequestCompiler(@Value("${app.solver.default-max-time-seconds:60}") int defaultMaxTimeSeconds) {
        this.defaultMaxTimeSeconds = defaultMaxTimeSeconds;
    }

    public CompiledRequest compile(CompilationInput input) {
        List<TopicInput> topics = input.orderedActiveTopics();
        if (topics.isEmpty()) {
            throw new CompilationException("NO_ACTIVE_TOPICS", "Period %s has no active topics".formatted(input.periodId()));
        }
        List<String> students = input.orderedParticipants();
        if (students.isEmpty()) {
            throw new CompilationException("NO_STUDENTS",
                    "No student has submitted preferences or answers for period %s".formatted(input.periodId()));
        }
        List<UUID> topicIds = topics.stream().map(TopicInput::id).toList();
        List<Integer> sizes = resolveGroupSizes(topicIds, input.groupSizes(), students.size());

        Map<UUID, ConstraintInput> activeConstraints = new LinkedHashMap<>();
        input.constraints().stream()
                .filter(constraint -> constraint.criterionType() != null)
                .forEach(constraint -> activeConstraints.put(constraint.id(), constraint));
        List<ConstraintInput> periodWide = periodWideConstraints(input, activeConstraints);

        List<SolverRequest.Group> groups = new ArrayList<>();
        for (int index = 0; index < topics.size(); index++) {
            TopicInput topic = topics.get(index);
            groups.add(new SolverRequest.Group(index, sizes.get(index), criteriaFor(topic, activeConstraints, periodWide)));
        }

        Map<UUID, Integer> groupIndex = new HashMap<>();
        IntStream.range(0, topicIds.size()).forEach(i -> groupIndex.put(topicIds.get(i), i));
        List<SolverRequest.Student> solverStudents = buildStudents(input, students, groupIndex);

        SolverRequest request = new SolverRequest(
                students.size(),
                topics.size(),
                List.copyOf(groups),
                solverStudents,
                buildExclusions(input.exclusions(), students),
                resolveRankingPercentage(input, topics),
                clampMaxTime(input.maxTimeSeconds())
        );

        Set<String> participantSet = new HashSet<>(students);
        List<String> withoutData = input.roster().stream()
                .filter(studentId -> !participantSet.contains(studentId))
                .sorted()
                .toList();

        return new CompiledRequest(request, students, topicIds, withoutData);
    }

    public int clampMaxTime(Integer requested) {
        int value = requested == null ? defaultMaxTimeSeconds : requested;
        return Math.max(MIN_MAX_TIME_SECONDS, Math.min(MAX_MAX_TIME_SECONDS, value));
    }

    private List<Integer> resolveGroupSizes(List<UUID> topicIds, Map<UUID, Integer> groupSizes, int studentCount) {
        Set<UUID> known = new HashSet<>(topicIds);
        List<UUID> unknown = groupSizes.keySet().stream().filter(topicId -> !known.contains(topicId)).sorted().toList();
        if (!unknown.isEmpty()) {
            throw new CompilationException("INVALID_GROUP_SIZE", "Group sizes were given for topics that are not active")
                    .with("topicIds", unknown);
        }
        List<UUID> missing = topicIds.stream().filter(topicId -> !groupSizes.containsKey(topicId)).toList();
        if (!missing.isEmpty()) {
            throw new CompilationException("GROUP_SIZE_MISSING", "Every active topic needs a group size")
                    .with("topicIds", missing);
        }
        List<UUID> negative = topicIds.stream().filter(topicId -> groupSizes.get(topicId) < 0).toList();
        if (!negative.isEmpty()) {
            throw new CompilationException("INVALID_GROUP_SIZE", "Group sizes must not be negative")
                    .with("topicIds", negative);
        }
        List<UUID> oversized = topicIds.stream().filter(topicId -> groupSizes.get(topicId) > studentCount).toList();
        if (!oversized.isEmpty()) {
            throw new CompilationException("INVALID_GROUP_SIZE",
                    "Group sizes must not exceed the %d students taking part".formatted(studentCount))
                    .with("topicIds", oversized);
        }
        List<Integer> sizes = topicIds.stream().map(groupSizes::get).toList();
        long total = sizes.stream().mapToLong(Integer::longValue).sum();
        if (total != studentCount) {
            throw new CompilationException("GROUP_SIZE_MISMATCH",
                    "Group sizes sum to %d but %d students take part".formatted(total, studentCount))
                    .with("sum", total)
                    .with("numStudents", studentCount);
        }
        return sizes;
    }

    private List<ConstraintInput> periodWideConstraints(CompilationInput input, Map<UUID, ConstraintInput> activeConstraints) {
        Set<UUID> attached = new HashSet<>();
        input.topics().forEach(topic -> attached.addAll(topic.constraintIds()));
        return activeConstraints.values().stream()
                .filter(constraint -> !attached.contains(constraint.id()))
                .toList();
    }

    private Map<String, List<SolverRequest.Criterion>> criteriaFor(
            TopicInput topic,
            Map<UUID, ConstraintInput> activeConstraints,
            List<ConstraintInput> periodWide
    ) {
        List<ConstraintInput> applicable = new ArrayList<>();
        topic.constraintIds().stream()
                .map(activeConstraints::get)
                .filter(constraint -> constraint != null)
                .forEach(applicable::add);
        applicable.addAll(periodWide);
        applicable.sort(Comparator.comparing(ConstraintInput::name).thenComparing(ConstraintInput::id));

        Map<String, List<SolverRequest.Criterion>> criteria = new TreeMap<>();
        for (ConstraintInput constraint : applicable) {
            criteria.computeIfAbsent(constraint.name(), key -> new ArrayList<>())
                    .add(new SolverRequest.Criterion(
                            constraint.criterionType().getWireName(),
                            constraint.minRatio(),
                            constraint.minStudents(),
                            constraint.maxStudents()
                    ));
        }
        Map<String, List<SolverRequest.Criterion>> frozen = new LinkedHashMap<>();
        criteria.forEach((trait, entries) -> frozen.put(trait, List.copyOf(entries)));
        return frozen;
    }

    private List<SolverRequest.Student> buildStudents(
            CompilationInput input,
            List<String> students,
            Map<UUID, Integer> groupIndex
    ) {
        Map<String, List<UUID>> orders = new HashMap<>();
        for (PreferenceInput preference : input.preferences()) {
            orders.put(preference.studentId(), preference.topicOrder());
        }
        Map<String, Map<String, double[]>> traitSums = new HashMap<>();
        for (AnswerInput answer : input.answers()) {
            if (answer.characteristicName() == null) {
                continue;
            }
            double[] sum = traitSums
                    .computeIfAbsent(answer.studentId(), key -> new TreeMap<>())
                    .computeIfAbsent(answer.characteristicName(), key -> new double[2]);
            sum[0] += answer.normalizedAnswer();
            sum[1] += 1;
        }

        List<Integer> allGroups = IntStream.range(0, groupIndex.size()).boxed().toList();
        List<SolverRequest.Student> result = new ArrayList<>();
        for (int index = 0; index < students.size(); index++) {
            String studentId = students.get(index);
            List<Integer> possible = orders.getOrDefault(studentId, List.of()).stream()
                    .map(groupIndex::get)
                    .filter(group -> group != null)
                    .toList();
            Map<String, Double> values = new LinkedHashMap<>();
            traitSums.getOrDefault(studentId, Map.of())
                    .forEach((trait, sum) -> values.put(trait, sum[0] / sum[1]));
            result.add(new SolverRequest.Student(index, possible.isEmpty() ? allGroups : possible, values));
        }
        return List.copyOf(result);
    }

    private List<List<Integer>> buildExclusions(List<ExclusionInput> exclusions, List<String> students) {
        Map<String, Integer> studentIndex = new HashMap<>();
        IntStream.range(0, students.size()).forEach(i -> studentIndex.put(students.get(i), i));

        TreeSet<List<Integer>> pairs = new TreeSet<>(
                Comparator.<List<Integer>>comparingInt(pair -> pair.get(0)).thenComparingInt(pair -> pair.get(1)));
        for (ExclusionInput exclusion : exclusions) {
            Integer a = studentIndex.get(exclusion.studentA());
            Integer b = studentIndex.get(exclusion.studentB());
            if (a != null && b != null && !a.equals(b)) {
                pairs.add(List.of(Math.min(a, b), Math.max(a, b)));
            }
        }
        return List.copyOf(pairs);
    }

    private Double resolveRankingPercentage(CompilationInput input, List<TopicInput> topics) {
        Double percentage = input.rankingPercentage();
        if (percentage == null || topics.stream().noneMatch(TopicInput::preferenceWeighted)) {
            return null;
        }
        if (percentage.isNaN() || percentage < 0 || percentage > 100) {
            throw new CompilationException("INVALID_RANKING_PERCENTAGE",
                    "rankingPercentage must be between 0 and 100 but was %s".formatted(percentage));
        }
        return percentage;
    }
}
