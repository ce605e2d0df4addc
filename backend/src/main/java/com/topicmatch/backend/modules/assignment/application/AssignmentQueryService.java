package com.topicmatch.backend.modules.assignment.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import com.topicmatch.backend.modules.assignment.domain.Assignment;
import com.topicmatch.backend.modules.assignment.domain.AssignmentBatchView;
import com.topicmatch.backend.modules.assignment.infrastructure.persistence.AssignmentRepository;
import com.topicmatch.backend.modules.assignment.presentation.dto.BatchStatsResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.BatchSummaryResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.CurrentBatchResponse;
import com.topicmatch.backend.modules.assignment.presentation.dto.StudentAssignmentResponse;
import com.topicmatch.backend.modules.topic.domain.Topic;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the assignment batches. Only the current (most recently assigned) batch is exposed,
 * except for the batch listing.
 */
@Service
@Transactional(readOnly = true)
public class AssignmentQueryService {

    private final AssignmentRepository assignmentRepository;

    public AssignmentQueryService(AssignmentRepository assignmentRepository) {
        this.assignmentRepository = assignmentRepository;
    }

    public Optional<String> currentBatchId(UUID periodId) {
        return assignmentRepository.findFirstByPeriodIdOrderByAssignedAtDescBatchIdDesc(periodId)
                .map(Assignment::getBatchId);
    }

    public Optional<CurrentBatchResponse> currentBatch(UUID periodId) {
        return currentBatchId(periodId).map(batchId -> {
            List<Assignment> rows = assignmentRepository.findByBatchIdWithTopic(batchId);
            Map<UUID, Topic> topics = new LinkedHashMap<>();
            Map<UUID, List<CurrentBatchResponse.AssignedStudent>> studentsByTopic = new LinkedHashMap<>();
            rows.stream()
                    .sorted(Comparator.comparing((Assignment row) -> row.getTopic().getTitle())
                            .thenComparing(Assignment::getStudentId))
                    .forEach(row -> {
                        topics.putIfAbsent(row.getTopic().getId(), row.getTopic());
                        studentsByTopic.computeIfAbsent(row.getTopic().getId(), key -> new ArrayList<>())
                                .add(new CurrentBatchResponse.AssignedStudent(row.getStudentId(), row.getOriginalRank()));
                    });
            List<CurrentBatchResponse.TopicGroup> groups = topics.values().stream()
                    .map(topic -> new CurrentBatchResponse.TopicGroup(
                            topic.getId(), topic.getTitle(), List.copyOf(studentsByTopic.get(topic.getId()))))
                    .toList();
            return new CurrentBatchResponse(periodId, batchId, rows.isEmpty() ? null : rows.get(0).getAssignedAt(), groups);
        });
    }

    public Optional<StudentAssignmentResponse> findStudentAssignment(UUID periodId, String studentId) {
        return currentBatchId(periodId)
                .flatMap(batchId -> assignmentRepository.findByBatchIdAndStudentIdWithTopic(batchId, studentId))
                .map(row -> new StudentAssignmentResponse(
                        row.getStudentId(),
                        row.getTopic().getId(),
                        row.getTopic().getTitle(),
                        row.getBatchId(),
                        row.getAssignedAt(),
                        row.getOriginalRank(),
                        row.getOriginalRank() != null,
                        Integer.valueOf(1).equals(row.getOriginalRank())
                ));
    }

    public Optional<BatchStatsResponse> batchStats(UUID periodId) {
        return currentBatchId(periodId).map(batchId -> {
            List<Assignment> rows = assignmentRepository.findByBatchIdWithTopic(batchId);
            Map<Integer, Long> rankDistribution = new TreeMap<>();
            Map<UUID, Long> topicDistribution = new LinkedHashMap<>();
            int matched = 0;
            int topChoices = 0;
            for (Assignment row : rows) {
                Integer rank = row.getOriginalRank();
                if (rank != null) {
                    matched++;
                    if (rank == 1) {
                        topChoices++;
                    }
                    rankDistribution.merge(rank, 1L, Long::sum);
                }
                topicDistribution.merge(row.getTopic().getId(), 1L, Long::sum);
            }
            return new BatchStatsResponse(batchId, rows.size(), matched, topChoices, rows.size() - matched,
                    rankDistribution, topicDistribution);
        });
    }

    public List<BatchSummaryResponse> listBatches(UUID periodId) {
        List<AssignmentBatchView> batches = assignmentRepository.summarizeBatches(periodId);
        String current = currentBatchId(periodId).orElse(null);
        return batches.stream()
                .map(view -> new BatchSummaryResponse(
                        view.getBatchId(),
                        view.getAssignedAt(),
                        view.getAssignmentCount(),
                        view.getBatchId().equals(current)))
                .toList();
    }
}
