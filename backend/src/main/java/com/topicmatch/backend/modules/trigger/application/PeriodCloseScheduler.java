package com.topicmatch.backend.modules.trigger.application;

import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.period.application.SelectionPeriodService;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowRequest;
import com.topicmatch.backend.modules.trigger.presentation.dto.AssignNowResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fires the close trigger once per period. Moving the close date clears the marker, which re-arms it.
 */
@Component
public class PeriodCloseScheduler {

    private static final Logger log = LoggerFactory.getLogger(PeriodCloseScheduler.class);

    private final SelectionPeriodService selectionPeriodService;
    private final AssignmentTriggerService assignmentTriggerService;

    public PeriodCloseScheduler(
            SelectionPeriodService selectionPeriodService,
            AssignmentTriggerService assignmentTriggerService
    ) {
        this.selectionPeriodService = selectionPeriodService;
        this.assignmentTriggerService = assignmentTriggerService;
    }

    @Scheduled(fixedDelayString = "${app.assignment.close-sweep-interval:PT1M}")
    public void triggerClosedPeriods() {
        List<UUID> due = selectionPeriodService.findDueForClose();
        for (UUID periodId : due) {
            triggerOnClose(periodId);
        }
    }

    void triggerOnClose(UUID periodId) {
        if (!selectionPeriodService.markCloseTriggered(periodId)) {
            return;
        }
        try {
            AssignNowResponse response = assignmentTriggerService.assignNow(periodId, AssignNowRequest.defaults());
            if (response.submitted()) {
                log.info("Close trigger submitted job {} for period {}", response.jobId(), periodId);
            } else {
                log.warn("[ALERT][Scheduler] Close trigger for period {} created job {} but submission failed: {}",
                        periodId, response.jobId(), response.error());
            }
        } catch (ProblemException ex) {
            log.warn("[ALERT][Scheduler] Close trigger for period {} rejected: {} ({})",
                    periodId, ex.getCode(), ex.getDetailMessage());
        } catch (RuntimeException ex) {
            log.error("[ALERT][Scheduler] Close trigger for period {} failed", periodId, ex);
        }
    }
}
