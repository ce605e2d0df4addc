package com.topicmatch.backend.modules.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.topicmatch.backend.modules.constraint.domain.CriterionType;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;
import com.topicmatch.backend.modules.preference.domain.Question;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.CallbackSignatureVerifier;
import com.topicmatch.backend.modules.trigger.infrastructure.solver.SolverSubmission;
import com.topicmatch.backend.support.AbstractPostgresIntegrationTest;
import com.topicmatch.backend.support.FakeSolverClient;
import com.topicmatch.backend.support.TestPeriodFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class AssignmentFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final List<String> STUDENTS = List.of("s1", "s2", "s3", "s4");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestPeriodFactory testPeriodFactory;

    @Autowired
    private FakeSolverClient fakeSolverClient;

    @Autowired
    private CallbackSignatureVerifier signatureVerifier;

    private UUID periodId;
    private Topic alpha;
    private Topic beta;
    private Question gpaQuestion;

    @BeforeEach
    void setUp() {
        fakeSolverClient.reset();
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        SelectionPeriod period = testPeriodFactory.createPeriod("Capstone", now.minusDays(14), now.minusDays(1));
        periodId = period.getId();
        alpha = testPeriodFactory.createTopic(period, "Alpha");
        beta = testPeriodFactory.createTopic(period, "Beta");
        testPeriodFactory.createConstraint(period, "gpa", CriterionType.MINIMIZE, 0.5);
        gpaQuestion = testPeriodFactory.createScaleQuestion(period, "How strong is your GPA?", 4, "gpa");
    }

    @Test
    @DisplayName("preferences, assign-now and a signed callback produce the current batch")
    void endToEndAssignment() throws Exception {
        submitAllStudents();

        JsonNode accepted = assignNow();
        UUID jobId = UUID.fromString(accepted.get("jobId").asText());
        assertThat(accepted.get("numStudents").asInt()).isEqualTo(4);
        assertThat(accepted.get("numGroups").asInt()).isEqualTo(2);

        SolverSubmission submission = fakeSolverClient.lastSubmission();
        assertThat(submission.deferredId()).isEqualTo(jobId);
        assertThat(submission.input()).containsEntry("num_students", 4).doesNotContainKey("ranking_percentage");

        String batchId = complete(jobId, List.of(0, 1, 0, 1));

        mockMvc.perform(get("/periods/{periodId}/assignments", periodId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value(batchId))
                .andExpect(jsonPath("$.groups.length()").value(2))
                .andExpect(jsonPath("$.groups[0].title").value("Alpha"))
                .andExpect(jsonPath("$.groups[0].students.length()").value(2));

        mockMvc.perform(get("/deferred-assignments/{jobId}/status", jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.materializationStatus").value("MATERIALIZED"))
                .andExpect(jsonPath("$.batchId").value(batchId));

        mockMvc.perform(get("/periods/{periodId}/assignments/students/{studentId}", periodId, "s1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.topicTitle").value("Alpha"))
                .andExpect(jsonPath("$.originalRank").value(1))
                .andExpect(jsonPath("$.wasTopChoice").value(true));
    }

    @Test
    @DisplayName("a re-run produces a new current batch and keeps the old rows")
    void rerunCreatesNewBatch() throws Exception {
        submitAllStudents();
        UUID firstJob = UUID.fromString(assignNow().get("jobId").asText());
        String firstBatch = complete(firstJob, List.of(0, 0, 1, 1));

        JsonNode second = assignNow();
        UUID secondJob = UUID.fromString(second.get("jobId").asText());
        String secondBatch = complete(secondJob, List.of(1, 1, 0, 0));

        assertThat(secondBatch).isNotEqualTo(firstBatch);
        mockMvc.perform(get("/periods/{periodId}/assignments", periodId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchId").value(secondBatch));
        Integer oldRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM assignment WHERE batch_id = ?", Integer.class, firstBatch);
        assertThat(oldRows).isEqualTo(4);

        mockMvc.perform(get("/periods/{periodId}/assignment-batches", periodId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    @DisplayName("a second assign-now abandons the pending job; its late callback is ignored")
    void supersededJobIgnoresLateCallback() throws Exception {
        submitAllStudents();
        UUID firstJob = UUID.fromString(assignNow().get("jobId").asText());
        JsonNode second = assignNow();
        assertThat(second.get("supersededJobId").asText()).isEqualTo(firstJob.toString());

        Map<String, Object> data = result(List.of(0, 1, 0, 1));
        mockMvc.perform(post("/deferred-assignments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callbackBody(firstJob, data, signatureVerifier.sign(data))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("IGNORED"));

        mockMvc.perform(get("/deferred-assignments/{jobId}/status", firstJob))
                .andExpect(jsonPath("$.status").value("ABANDONED"));
        mockMvc.perform(get("/periods/{periodId}/assignments", periodId))
                .andExpect(status().isNoContent());
    }

    @Test
    void callbackWithWrongHashIsRejected() throws Exception {
        submitAllStudents();
        UUID jobId = UUID.fromString(assignNow().get("jobId").asText());

        mockMvc.perform(post("/deferred-assignments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callbackBody(jobId, result(List.of(0, 1, 0, 1)), "deadbeef")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("CALLBACK_HASH_MISMATCH"));

        mockMvc.perform(get("/deferred-assignments/{jobId}/status", jobId))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void failedSubmissionIsReportedAsBadGateway() throws Exception {
        submitAllStudents();
        fakeSolverClient.failNext();

        MvcResult result = mockMvc.perform(post("/periods/{periodId}/assign-now", periodId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andReturn();

        String jobId = objectMapper.readTree(result.getResponse().getContentAsString()).get("jobId").asText();
        mockMvc.perform(get("/deferred-assignments/{jobId}/status", jobId))
                .andExpect(jsonPath("$.status").value("FAILED"));
    }

    @Test
    void incompleteQuestionnaireBlocksAssignNow() throws Exception {
        savePreference("s1", List.of(alpha.getId(), beta.getId()));

        mockMvc.perform(post("/periods/{periodId}/assign-now", periodId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("QUESTIONNAIRE_INCOMPLETE"));

        mockMvc.perform(get("/periods/{periodId}/incomplete-students", periodId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].studentId").value("s1"))
                .andExpect(jsonPath("$[0].requiredCount").value(1));
        assertThat(fakeSolverClient.submissions()).isEmpty();
    }

    private void submitAllStudents() throws Exception {
        for (int i = 0; i < STUDENTS.size(); i++) {
            String studentId = STUDENTS.get(i);
            List<UUID> order = i % 2 == 0 ? List.of(alpha.getId(), beta.getId()) : List.of(beta.getId(), alpha.getId());
            savePreference(studentId, order);
            mockMvc.perform(put("/periods/{periodId}/answers/{studentId}", periodId, studentId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(Map.of("answers",
                                    List.of(Map.of("questionId", gpaQuestion.getId(), "value", i + 1))))))
                    .andExpect(status().isOk());
        }
    }

    private void savePreference(String studentId, List<UUID> order) throws Exception {
        mockMvc.perform(put("/periods/{periodId}/preferences/{studentId}", periodId, studentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("topicOrder", order))))
                .andExpect(status().isOk());
    }

    private JsonNode assignNow() throws Exception {
        MvcResult result = mockMvc.perform(post("/periods/{periodId}/assign-now", periodId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String complete(UUID jobId, List<Integer> groups) throws Exception {
        Map<String, Object> data = result(groups);
        MvcResult result = mockMvc.perform(post("/deferred-assignments/callback")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(callbackBody(jobId, data, signatureVerifier.sign(data))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("COMPLETED"))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("batchId").asText();
    }

    private String callbackBody(UUID jobId, Map<String, Object> data, String hash) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("deferredId", jobId);
        body.put("evaluationId", "eval-" + jobId);
        body.put("data", data);
        body.put("hash", hash);
        return objectMapper.writeValueAsString(body);
    }

    private static Map<String, Object> result(List<Integer> groups) {
        List<Map<String, Object>> assignments = new ArrayList<>();
        for (int student = 0; student < groups.size(); student++) {
            assignments.add(Map.of("student_id", student, "group_id", groups.get(student)));
        }
        return Map.of("assignments", assignments);
    }
}
