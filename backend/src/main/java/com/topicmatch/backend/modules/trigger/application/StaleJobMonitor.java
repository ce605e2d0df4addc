package com.topicmatch.backend.modules.trigger.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import com.topicmatch.backend.modules.job.application.DeferredAssignmentJobService;
import com.topicmatch.backend.modules.job.domain.DeferredAssignmentJob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StaleJobMonitor {

    private static final Logger log = LoggerFactory.getLogger(StaleJobMonitor.class);

    private final DeferredAssignmentJobService jobService;
    private final Clock clock;

    public StaleJobMonitor(DeferredAssignmentJobService jobService, Clock clock) {
        this.jobService = jobService;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.assignment.stale-job-sweep-interval:PT5M}")
    public void sweep() {
        int stale = reportStaleJobs();
        if (stale > 0) {
            log.info("Stale job sweep found {} pending jobs past the threshold", stale);
        }
    }

    int reportStaleJobs() {
        List<DeferredAssignmentJob> stale = jobService.findStalePending();
        OffsetDateTime now = OffsetDateTime.now(clock);
        for (DeferredAssignmentJob job : stale) {
            log.warn("[ALERT][Job] Deferred job {} of period {} pending for {}s without a callback",
                    job.getId(), job.getPeriodId(), Duration.between(job.getCreatedAt(), now).getSeconds());
        }
        return stale.size();
    }
}
