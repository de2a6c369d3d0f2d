package com.maintenance.storage;

import com.maintenance.domain.FailureEvent;
import com.maintenance.exception.ExtractionException;
import com.maintenance.model.FailureHistoryEntry;
import com.maintenance.port.FailureEventReader;
import com.maintenance.repository.FailureHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Failure events from the failure history table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaFailureEventReader implements FailureEventReader {

    private final FailureHistoryRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<FailureEvent> fetch(Instant start, Instant end) {
        try {
            List<FailureEvent> failures = repository.findInTimeRange(start, end).stream()
                .map(this::toFailureEvent)
                .collect(Collectors.toList());
            log.info("Found {} failures in [{}, {})", failures.size(), start, end);
            return failures;
        } catch (DataAccessException e) {
            throw new ExtractionException("Failed to read failure history in [" + start + ", " + end + ")", e);
        }
    }

    private FailureEvent toFailureEvent(FailureHistoryEntry entry) {
        return FailureEvent.builder()
            .machineId(entry.getMachineId())
            .timestamp(entry.getEventTime())
            .failureCode(entry.getFailureCode())
            .measuredValue(entry.getMeasuredValue())
            .build();
    }
}
