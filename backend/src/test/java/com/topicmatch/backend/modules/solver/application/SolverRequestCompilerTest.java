package com.topicmatch.backend.modules.solver.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.topicmatch.backend.modules.constraint.domain.CriterionType;
import com.topicmatch.backend.modules.solver.domain.CompilationInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.AnswerInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.ConstraintInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.ExclusionInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.PreferenceInput;
import com.topicmatch.backend.modules.solver.domain.CompilationInput.TopicInput;
import com.topicmatch.backend.modules.solver.domain.CompiledRequest;
import com.topicmatch.backend.modules.solver.domain.SolverRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SolverRequestCompilerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SolverRequestCompiler compiler;
    private UUID periodId;
    private TopicInput alpha;
    private TopicInput beta;
    private List<TopicInput> topics;
    private List<ConstraintInput> constraints;
    private List<PreferenceInput> preferences;
    private List<AnswerInput> answers;
    private List<ExclusionInput> exclusions;
    private Set<String> roster;
    private Map<UUID, Integer> groupSizes;
    private Double rankingPercentage;
    private Integer maxTimeSeconds;

    @BeforeEach
    void setUp() {
        compiler = new SolverRequestCompiler(60);
        periodId = UUID.randomUUID();
        alpha = topic("Alpha", Set.of());
        beta = topic("Beta", Set.of());
        topics = new ArrayList<>(List.of(beta, alpha));
        constraints = new ArrayList<>();
        preferences = new ArrayList<>();
        answers = new ArrayList<>();
        exclusions = new ArrayList<>();
        roster = Set.of();
        groupSizes = new HashMap<>();
        rankingPercentage = null;
        maxTimeSeconds = null;
    }

    @Test
    @DisplayName("six students ranking both topics compile into two groups of three")
    void sixStudentScenario() {
        for (int i = 1; i <= 6; i++) {
            preferences.add(new PreferenceInput("s" + i, List.of(alpha.id(), beta.id())));
        }
        groupSizes.put(alpha.id(), 3);
        groupSizes.put(beta.id(), 3);

        CompiledRequest compiled = compiler.compile(input());
        SolverRequest request = compiled.request();

        assertThat(request.numStudents()).isEqualTo(6);
        assertThat(request.numGroups()).isEqualTo(2);
        assertThat(request.exclude()).isEmpty();
        assertThat(request.groups()).extracting(SolverRequest.Group::size).containsExactly(3, 3);
        assertThat(request.groups()).allSatisfy(group -> assertThat(group.criteria()).isEmpty());
        assertThat(request.students()).allSatisfy(student ->
                assertThat(student.possibleGroups()).containsExactly(0, 1));
        assertThat(compiled.studentIds()).containsExactly("s1", "s2", "s3", "s4", "s5", "s6");
        assertThat(compiled.topicIds()).containsExactly(alpha.id(), beta.id());
    }

    @Test
    @DisplayName("topics are indexed by title and students by id")
    void indexOrdering() {
        preferences.add(new PreferenceInput("zoe", List.of(beta.id())));
        preferences.add(new PreferenceInput("adam", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 1);

        CompiledRequest compiled = compiler.compile(input());

        assertThat(compiled.topicIds()).containsExactly(alpha.id(), beta.id());
        assertThat(compiled.studentIds()).containsExactly("adam", "zoe");
        assertThat(compiled.request().students().get(0).possibleGroups()).containsExactly(0, 1);
        assertThat(compiled.request().students().get(1).possibleGroups()).containsExactly(1);
    }

    @Test
    @DisplayName("compiling the same snapshot twice yields equal requests")
    void deterministic() {
        preferences.add(new PreferenceInput("s1", List.of(alpha.id())));
        preferences.add(new PreferenceInput("s2", List.of(beta.id())));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 1);

        assertThat(compiler.compile(input())).isEqualTo(compiler.compile(input()));
    }

    @Test
    @DisplayName("inert constraints never reach the request; unattached ones apply to every group")
    void criteria() {
        UUID gpaId = UUID.randomUUID();
        UUID labelId = UUID.randomUUID();
        UUID teamId = UUID.randomUUID();
        constraints.add(new ConstraintInput(gpaId, "gpa", CriterionType.MINIMIZE, 0.5, null, null));
        constraints.add(new ConstraintInput(labelId, "label", null, null, null, null));
        constraints.add(new ConstraintInput(teamId, "team", CriterionType.PULL, null, 1, 2));
        alpha = topic("Alpha", Set.of(gpaId, labelId));
        topics = new ArrayList<>(List.of(alpha, beta));
        preferences.add(new PreferenceInput("s1", List.of()));
        preferences.add(new PreferenceInput("s2", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 1);

        SolverRequest request = compiler.compile(input()).request();

        Map<String, List<SolverRequest.Criterion>> alphaCriteria = request.groups().get(0).criteria();
        assertThat(alphaCriteria).containsOnlyKeys("gpa", "team");
        assertThat(alphaCriteria.get("gpa"))
                .containsExactly(new SolverRequest.Criterion("minimize", 0.5, null, null));
        assertThat(request.groups().get(1).criteria()).containsOnlyKeys("team");
        assertThat(request.groups().get(1).criteria().get("team"))
                .containsExactly(new SolverRequest.Criterion("pull", null, 1, 2));
    }

    @Test
    void studentValuesAverageAnswersPerTrait() {
        answers.add(new AnswerInput("s1", UUID.randomUUID(), "gpa", 1.0));
        answers.add(new AnswerInput("s1", UUID.randomUUID(), "gpa", 0.5));
        answers.add(new AnswerInput("s1", UUID.randomUUID(), null, 0.2));
        answers.add(new AnswerInput("s2", UUID.randomUUID(), "team", 0.0));
        groupSizes.put(alpha.id(), 2);
        groupSizes.put(beta.id(), 0);

        SolverRequest request = compiler.compile(input()).request();

        assertThat(request.students().get(0).values()).containsExactly(Map.entry("gpa", 0.75));
        assertThat(request.students().get(1).values()).containsExactly(Map.entry("team", 0.0));
    }

    @Test
    @DisplayName("exclusions become sorted index pairs; pairs with outsiders are dropped")
    void exclusions() {
        preferences.add(new PreferenceInput("a", List.of()));
        preferences.add(new PreferenceInput("b", List.of()));
        preferences.add(new PreferenceInput("c", List.of()));
        exclusions.add(new ExclusionInput("b", "c"));
        exclusions.add(new ExclusionInput("a", "c"));
        exclusions.add(new ExclusionInput("a", "ghost"));
        groupSizes.put(alpha.id(), 2);
        groupSizes.put(beta.id(), 1);

        SolverRequest request = compiler.compile(input()).request();

        assertThat(request.exclude()).containsExactly(List.of(0, 2), List.of(1, 2));
    }

    @Test
    @DisplayName("ranking_percentage is omitted when not supplied, never sent as zero")
    void rankingPercentageOmitted() {
        preferences.add(new PreferenceInput("s1", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 0);

        JsonNode json = objectMapper.valueToTree(compiler.compile(input()).request());

        assertThat(json.has("ranking_percentage")).isFalse();
        assertThat(json.get("max_time_in_seconds").asInt()).isEqualTo(60);
        assertThat(json.get("num_students").asInt()).isEqualTo(1);
    }

    @Test
    void rankingPercentageRequiresAWeightedTopic() {
        preferences.add(new PreferenceInput("s1", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 0);
        rankingPercentage = 80.0;

        assertThat(compiler.compile(input()).request().rankingPercentage()).isEqualTo(80.0);

        alpha = new TopicInput(alpha.id(), "Alpha", true, false, Set.of());
        beta = new TopicInput(beta.id(), "Beta", true, false, Set.of());
        topics = new ArrayList<>(List.of(alpha, beta));

        assertThat(compiler.compile(input()).request().rankingPercentage()).isNull();
    }

    @Test
    void invalidRankingPercentageIsRejected() {
        preferences.add(new PreferenceInput("s1", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 0);
        rankingPercentage = 120.0;

        assertCompilationError("INVALID_RANKING_PERCENTAGE");
    }

    @Test
    void maxTimeIsClamped() {
        assertThat(compiler.clampMaxTime(null)).isEqualTo(60);
        assertThat(compiler.clampMaxTime(1)).isEqualTo(15);
        assertThat(compiler.clampMaxTime(10_000)).isEqualTo(540);
        assertThat(compiler.clampMaxTime(120)).isEqualTo(120);
    }

    @Test
    void missingGroupSizeListsTopics() {
        preferences.add(new PreferenceInput("s1", List.of()));
        groupSizes.put(alpha.id(), 1);

        CompilationException ex = assertCompilationError("GROUP_SIZE_MISSING");
        assertThat(ex.getProperties()).containsEntry("topicIds", List.of(beta.id()));
    }

    @Test
    void groupSizesMustSumToStudentCount() {
        preferences.add(new PreferenceInput("s1", List.of()));
        preferences.add(new PreferenceInput("s2", List.of()));
        groupSizes.put(alpha.id(), 2);
        groupSizes.put(beta.id(), 2);

        CompilationException ex = assertCompilationError("GROUP_SIZE_MISMATCH");
        assertThat(ex.getProperties()).containsEntry("sum", 4L).containsEntry("numStudents", 2);
    }

    @Test
    void sizeAboveStudentCountIsInvalidEvenWhenTheSumWrapsAround() {
        TopicInput gamma = topic("Gamma", Set.of());
        topics.add(gamma);
        for (int i = 1; i <= 6; i++) {
            preferences.add(new PreferenceInput("s" + i, List.of(alpha.id())));
        }
        groupSizes.put(alpha.id(), Integer.MAX_VALUE);
        groupSizes.put(beta.id(), Integer.MAX_VALUE);
        groupSizes.put(gamma.id(), 8);

        CompilationException ex = assertCompilationError("INVALID_GROUP_SIZE");
        assertThat((List<UUID>) ex.getProperties().get("topicIds"))
                .containsExactlyInAnyOrder(alpha.id(), beta.id(), gamma.id());
    }

    @Test
    void sizeForInactiveTopicIsInvalid() {
        TopicInput retired = new TopicInput(UUID.randomUUID(), "Retired", false, true, Set.of());
        topics.add(retired);
        preferences.add(new PreferenceInput("s1", List.of()));
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 0);
        groupSizes.put(retired.id(), 0);

        assertCompilationError("INVALID_GROUP_SIZE");
    }

    @Test
    void noActiveTopics() {
        topics = new ArrayList<>(List.of(new TopicInput(UUID.randomUUID(), "Retired", false, true, Set.of())));
        preferences.add(new PreferenceInput("s1", List.of()));

        assertCompilationError("NO_ACTIVE_TOPICS");
    }

    @Test
    void noStudents() {
        assertCompilationError("NO_STUDENTS");
    }

    @Test
    void rosterStudentsWithoutDataAreReported() {
        preferences.add(new PreferenceInput("s1", List.of()));
        roster = Set.of("s1", "s9", "s3");
        groupSizes.put(alpha.id(), 1);
        groupSizes.put(beta.id(), 0);

        CompiledRequest compiled = compiler.compile(input());

        assertThat(compiled.studentsWithoutData()).containsExactly("s3", "s9");
        assertThat(compiled.request().numStudents()).isEqualTo(1);
    }

    private CompilationException assertCompilationError(String code) {
        CompilationInput input = input();
        Throwable thrown = catchThrowable(() -> compiler.compile(input));
        assertThat(thrown).isInstanceOf(CompilationException.class);
        CompilationException ex = (CompilationException) thrown;
        assertThat(ex.getCode()).isEqualTo(code);
        return ex;
    }

    private CompilationInput input() {
        return new CompilationInput(periodId, topics, constraints, preferences, answers, exclusions, roster,
                groupSizes, rankingPercentage, maxTimeSeconds);
    }

    private static TopicInput topic(String title, Set<UUID> constraintIds) {
        return new TopicInput(UUID.randomUUID(), title, true, true, constraintIds);
    }
}
