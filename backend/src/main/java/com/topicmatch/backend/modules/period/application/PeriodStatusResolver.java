package com.topicmatch.backend.modules.period.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.topicmatch.backend.modules.assignment.infrastructure.persistence.AssignmentRepository;
import com.topicmatch.backend.modules.period.domain.PeriodStatus;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;

import org.springframework.stereotype.Component;

/**
 * Derives a period's status from its dates and from whether any batch was materialized for it.
 */
@Component
public class PeriodStatusResolver {

    private final AssignmentRepository assignmentRepository;
    private final Clock clock;

    public PeriodStatusResolver(AssignmentRepository assignmentRepository, Clock clock) {
        this.assignmentRepository = assignmentRepository;
        this.clock = clock;
    }

    public PeriodStatus resolve(SelectionPeriod period) {
        if (assignmentRepository.existsByPeriodId(period.getId())) {
            return PeriodStatus.ASSIGNED;
        }
        return resolveByDates(period, OffsetDateTime.now(clock));
    }

    static PeriodStatus resolveByDates(SelectionPeriod period, OffsetDateTime now) {
        if (now.isBefore(period.getOpenDate())) {
            return PeriodStatus.UPCOMING;
        }
        if (!now.isAfter(period.getCloseDate())) {
            return PeriodStatus.OPEN;
        }
        return PeriodStatus.CLOSED;
    }
}
