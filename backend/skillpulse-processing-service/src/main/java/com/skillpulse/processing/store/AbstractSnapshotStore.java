package com.skillpulse.processing.store;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

abstract class AbstractSnapshotStore implements SnapshotStore {

    protected final Clock clock;

    protected AbstractSnapshotStore(Clock clock) {
        this.clock = clock;
    }

    protected String resolvePeriod(String periodId) {
        String key = periodKey(periodId);
        return key == null ? LocalDate.now(clock).toString() : key;
    }

    // Period ids are stored stripped; every lookup goes through here so saves and loads agree
    protected static String periodKey(String periodId) {
        if (periodId == null || periodId.isBlank()) return null;
        return periodId.strip();
    }

    protected Snapshot newSnapshot(String period, Map<String, Long> counts) {
        String timestamp = OffsetDateTime.now(clock).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return Snapshot.of(period, timestamp, counts);
    }
}
