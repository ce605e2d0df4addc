package com.topicmatch.backend.modules.period.application;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.topicmatch.backend.global.error.ProblemException;
import com.topicmatch.backend.modules.period.domain.SelectionPeriod;
import com.topicmatch.backend.modules.period.infrastructure.persistence.SelectionPeriodRepository;
import com.topicmatch.backend.modules.period.presentation.dto.PeriodResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SelectionPeriodService {

    private static final Logger log = LoggerFactory.getLogger(SelectionPeriodService.class);

    private final SelectionPeriodRepository selectionPeriodRepository;
    private final PeriodStatusResolver periodStatusResolver;
    private final Clock clock;

    public SelectionPeriodService(
            SelectionPeriodRepository selectionPeriodRepository,
            PeriodStatusResolver periodStatusResolver,
            Clock clock
    ) {
        this.selectionPeriodRepository = selectionPeriodRepository;
        this.periodStatusResolver = periodStatusResolver;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public SelectionPeriod getPeriod(UUID periodId) {
        return selectionPeriodRepository.findById(periodId)
                .orElseThrow(() -> periodNotFound(periodId));
    }

    @Transactional(readOnly = true)
    public PeriodResponse describe(UUID periodId) {
        return toResponse(getPeriod(periodId));
    }

    /**
     * Makes the period the single active one; every other active period is deactivated.
     */
    public PeriodResponse activate(UUID periodId) {
        SelectionPeriod period = getPeriod(periodId);
        for (SelectionPeriod other : selectionPeriodRepository.findByActiveTrue()) {
            if (!other.getId().equals(periodId)) {
                other.setActive(false);
                log.info("Deactivated period {} in favour of {}", other.getId(), periodId);
            }
        }
        selectionPeriodRepository.flush();
        period.setActive(true);
        return toResponse(selectionPeriodRepository.save(period));
    }

    /**
     * Moves the close date. The pending close trigger is cancelled and re-armed for the new date.
     */
    public PeriodResponse rescheduleClose(UUID periodId, OffsetDateTime closeDate) {
        SelectionPeriod period = getPeriod(periodId);
        if (!closeDate.isAfter(period.getOpenDate())) {
            throw new ProblemException(BAD_REQUEST, "CLOSE_DATE_BEFORE_OPEN_DATE",
                    "closeDate must be after openDate %s".formatted(period.getOpenDate()));
        }
        period.setCloseDate(closeDate);
        period.setCloseTriggeredAt(null);
        log.info("Rescheduled close of period {} to {}", periodId, closeDate);
        return toResponse(selectionPeriodRepository.save(period));
    }

    /**
     * Active periods whose close date has passed and whose close trigger has not fired yet.
     */
    @Transactional(readOnly = true)
    public List<UUID> findDueForClose() {
        return selectionPeriodRepository
                .findByActiveTrueAndCloseTriggeredAtIsNullAndCloseDateLessThanEqual(OffsetDateTime.now(clock))
                .stream()
                .map(SelectionPeriod::getId)
                .toList();
    }

    /**
     * Records that the close trigger fired. Returns false when another sweep got there first.
     */
    public boolean markCloseTriggered(UUID periodId) {
        SelectionPeriod period = selectionPeriodRepository.findByIdForUpdate(periodId)
                .orElseThrow(() -> periodNotFound(periodId));
        if (period.getCloseTriggeredAt() != null) {
            return false;
        }
        period.setCloseTriggeredAt(OffsetDateTime.now(clock));
        selectionPeriodRepository.save(period);
        return true;
    }

    private PeriodResponse toResponse(SelectionPeriod period) {
        return new PeriodResponse(
                period.getId(),
                period.getTitle(),
                period.getDescription(),
                period.getOpenDate(),
                period.getCloseDate(),
                period.isActive(),
                periodStatusResolver.resolve(period).name()
        );
    }

    public static ProblemException periodNotFound(UUID periodId) {
        return new ProblemException(NOT_FOUND, "PERIOD_NOT_FOUND", "Selection period %s not found".formatted(periodId));
    }
}
