package com.topicmatch.backend.modules.assignment.application;

import static org.springframework.http.HttpStatus.CONFLICT;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.assignment.domain.Assignment;
import com.topicmatch.backend.modules.assignment.infrastructure.persistence.AssignmentRepository;
import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.domain.DeferredAssignmentJob;
import com.topicmatch.backend.modules.job.domain.DeferredJobStatus;
import com.topicmatch.backend.modules.job.domain.MaterializationStatus;
import com.topicmatch.backend.modules.job.infrastructure.persistence.DeferredAssignmentJobRepository;
import com.topicmatch.backend.modules.preference.domain.Preference;
import com.topicmatch.backend.modules.preference.infrastructure.persistence.PreferenceRepository;
import com.topicmatch.backend.modules.topic.domain.Topic;
import com.topicmatch.backend.modules.topic.infrastructure.persistence.TopicRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a completed job's result as a new batch. The whole result is validated before the first row is
 * written; the batch and the job's materialization record commit together.
 */
@Service
@Transactional
public class AssignmentMaterializer {

    private static final Logger log = LoggerFactory.getLogger(AssignmentMaterializer.class);

    private final DeferredAssignmentJobRepository jobRepository;
    private final AssignmentRepository assignmentRepository;
    private final TopicRepository topicRepository;
    private final PreferenceRepository preferenceRepository;
    private final Clock clock;

    public AssignmentMaterializer(
            DeferredAssignmentJobRepository jobRepository,
            AssignmentRepository assignmentRepository,
            TopicRepository topicRepository,
            PreferenceRepository preferenceRepository,
            Clock clock
    ) {
        this.jobRepository = jobRepository;
        this.assignmentRepository = assignmentRepository;
        this.topicRepository = topicRepository;
        this.preferenceRepository = preferenceRepository;
        this.clock = clock;
    }

    /**
     * @return id of the new batch, or of the existing one when the job was already materialized
     */
    public String materialize(UUID jobId) {
        DeferredAssignmentJob job = jobRepository.findByIdForUpdate(jobId)
                .orElseThrow(() -> DeferredAssignmentJobService.jobNotFound(jobId));
        if (job.getStatus() != DeferredJobStatus.COMPLETED) {
            throw new ProblemException(CONFLICT, "JOB_NOT_COMPLETED",
                    "Job %s is %s and has no result to materialize".formatted(jobId, job.getStatus()));
        }
        if (job.getMaterializationStatus() == MaterializationStatus.MATERIALIZED) {
            return job.getBatchId();
        }
        boolean latest = jobRepository.findFirstByPeriodIdOrderByCreatedAtDesc(job.getPeriodId())
                .map(candidate -> candidate.getId().equals(jobId))
                .orElse(false);
        if (!latest) {
            throw new ProblemException(CONFLICT, "JOB_NOT_CURRENT",
                    "Job %s was superseded by a newer job of period %s".formatted(jobId, job.getPeriodId()));
        }

        List<String> studentIds = job.getStudentIds();
        List<UUID> topicIds = job.getTopicIds();
        Map<Integer, Integer> groupByStudent = parseAssignments(job.getResultData(), studentIds.size(), topicIds.size());

        Map<UUID, Topic> topics = topicRepository.findAllById(topicIds).stream()
                .collect(Collectors.toMap(Topic::getId, Function.identity()));
        List<UUID> missingTopics = topicIds.stream().filter(topicId -> !topics.containsKey(topicId)).toList();
        if (!missingTopics.isEmpty()) {
            throw new MaterializationException("RESULT_UNKNOWN_GROUP", "Result references topics that no longer exist")
                    .with("topicIds", missingTopics);
        }
        Map<String, Preference> preferences = new HashMap<>();
        preferenceRepository.findByPeriodId(job.getPeriodId())
                .forEach(preference -> preferences.put(preference.getStudentId(), preference));

        OffsetDateTime now = OffsetDateTime.now(clock);
        String batchId = "batch_" + job.getPeriodId() + "_" + now.toInstant().toEpochMilli();

        List<Assignment> rows = new ArrayList<>(groupByStudent.size());
        groupByStudent.forEach((studentIndex, groupIndex) -> {
            String studentId = studentIds.get(studentIndex);
            UUID topicId = topicIds.get(groupIndex);
            Preference preference = preferences.get(studentId);
            Integer rank = preference == null ? null : preference.rankOf(topicId);
            rows.add(new Assignment(job.getPeriodId(), batchId, studentId, topics.get(topicId), now, rank));
        });
        assignmentRepository.saveAll(rows);

        job.markMaterialized(batchId, now);
        jobRepository.save(job);
        log.info("Materialized job {} into batch {} ({} assignments)", jobId, batchId, rows.size());
        return batchId;
    }

    /**
     * Reads {@code {"assignments": [{"student_id"|"student": i, "group_id"|"group": g}]}} into student index to
     * group index, checking every index and that each student appears exactly once.
     */
    static Map<Integer, Integer> parseAssignments(Map<String, Object> resultData, int studentCount, int groupCount) {
        if (resultData == null || !(resultData.get("assignments") instanceof List<?> entries)) {
            throw new MaterializationException("RESULT_MALFORMED", "Result has no assignments list");
        }
        Map<Integer, Integer> groupByStudent = new LinkedHashMap<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> fields)) {
                throw new MaterializationException("RESULT_MALFORMED", "Assignment entry is not an object: " + entry);
            }
            long student = readIndex(fields, "student_id", "student");
            long group = readIndex(fields, "group_id", "group");
            if (student < 0 || student >= studentCount) {
                throw new MaterializationException("RESULT_UNKNOWN_STUDENT",
                        "Student index %d is outside 0..%d".formatted(student, studentCount - 1))
                        .with("studentIndex", student);
            }
            if (group < 0 || group >= groupCount) {
                throw new MaterializationException("RESULT_UNKNOWN_GROUP",
                        "Group index %d is outside 0..%d".formatted(group, groupCount - 1))
                        .with("groupIndex", group);
            }
            if (groupByStudent.putIfAbsent((int) student, (int) group) != null) {
                throw new MaterializationException("RESULT_DUPLICATE_STUDENT",
                        "Student index %d is assigned more than once".formatted(student))
                        .with("studentIndex", student);
            }
        }
        if (groupByStudent.size() != studentCount) {
            List<Integer> missing = new ArrayList<>();
            for (int i = 0; i < studentCount; i++) {
                if (!groupByStudent.containsKey(i)) {
                    missing.add(i);
                }
            }
            throw new MaterializationException("RESULT_INCOMPLETE",
                    "%d of %d students have no group".formatted(missing.size(), studentCount))
                    .with("studentIndices", missing);
        }
        return groupByStudent;
    }

    private static long readIndex(Map<?, ?> fields, String primaryKey, String fallbackKey) {
        Object value = fields.containsKey(primaryKey) ? fields.get(primaryKey) : fields.get(fallbackKey);
        if (value instanceof Number number) {
            double raw = number.doubleValue();
            if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                return number.longValue();
            }
            // BigInteger, BigDecimal and floating values saturate at the long range
            if (raw == Math.rint(raw)) {
                return (long) raw;
            }
        }
        throw new MaterializationException("RESULT_MALFORMED",
                "Assignment entry needs an integer '%s' or '%s' but has %s".formatted(primaryKey, fallbackKey, value));
    }
}
