package com.skillpulse.processing.service;

import com.skillpulse.processing.store.SnapshotStorageException;
import com.skillpulse.processing.store.SnapshotStore;
import com.skillpulse.processing.text.ExtractedSkill;
import com.skillpulse.processing.text.SkillExtractor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulates per-skill document counts from incoming texts, bucketed by the date each text
 * arrived on, and writes them to the {@link SnapshotStore} on a fixed delay.
 *
 * <p>A bucket for a past date is dropped only after its snapshot has been saved. If a save
 * fails the bucket stays and is retried on the next run.
 */
public class SkillStreamProcessor {

    private static final Logger log = LoggerFactory.getLogger(SkillStreamProcessor.class);

    private final SkillExtractor extractor;
    private final SnapshotStore store;
    private final Clock clock;
    private final Counter documentsProcessed;
    private final Counter skillsExtracted;
    private final Counter snapshotsSaved;

    // period id -> counts collected on that date, oldest first
    private final TreeMap<String, PeriodCounts> buckets = new TreeMap<>();

    public SkillStreamProcessor(SkillExtractor extractor, SnapshotStore store, Clock clock, MeterRegistry meterRegistry) {
        this.extractor = extractor;
        this.store = store;
        this.clock = clock;
        this.documentsProcessed = meterRegistry.counter("skillpulse_documents_processed_total");
        this.skillsExtracted = meterRegistry.counter("skillpulse_skills_extracted_total");
        this.snapshotsSaved = meterRegistry.counter("skillpulse_snapshots_saved_total");
    }

    // Call this for each incoming posting text; the text itself is never retained
    public List<ExtractedSkill> handleMessage(String text) {
        List<ExtractedSkill> skills = extractor.extract(text);
        if (skills.isEmpty()) return skills;

        synchronized (this) {
            PeriodCounts bucket = buckets.computeIfAbsent(today(), p -> new PeriodCounts());
            bucket.documents++;
            for (ExtractedSkill s : skills) {
                bucket.counts.merge(s.skill(), 1L, Long::sum);
            }
        }
        documentsProcessed.increment();
        skillsExtracted.increment(skills.size());
        log.debug("Processed document with {} skills", skills.size());
        return skills;
    }

    public synchronized Map<String, Long> currentCounts() {
        PeriodCounts bucket = buckets.get(today());
        return bucket == null ? new TreeMap<>() : new TreeMap<>(bucket.counts);
    }

    public synchronized long documentsInPeriod() {
        PeriodCounts bucket = buckets.get(today());
        return bucket == null ? 0 : bucket.documents;
    }

    public String currentPeriod() {
        return today();
    }

    // Periods collected but not yet closed by a successful save, oldest first
    public synchronized List<String> pendingPeriods() {
        return new ArrayList<>(buckets.keySet());
    }

    /**
     * Saves every bucket under the period it was collected in, oldest first. Buckets for past
     * dates are released once saved; today's keeps accumulating.
     *
     * @return the periods written, oldest first
     * @throws SnapshotStorageException naming the period whose save failed; that bucket and all
     *                                  later ones are kept
     */
    public List<String> snapshot() {
        Instant start = Instant.now(clock);
        Map<String, Map<String, Long>> pending = new TreeMap<>();
        synchronized (this) {
            buckets.forEach((period, bucket) -> pending.put(period, new TreeMap<>(bucket.counts)));
        }

        List<String> saved = new ArrayList<>();
        try {
            for (Map.Entry<String, Map<String, Long>> e : pending.entrySet()) {
                String period = e.getKey();
                if (e.getValue().isEmpty()) continue;
                try {
                    saved.add(store.save(period, e.getValue()));
                } catch (RuntimeException ex) {
                    throw new SnapshotStorageException("Failed to persist skill counts for period " + period, ex);
                }
                snapshotsSaved.increment();
                release(period, e.getValue());
            }
        } finally {
            long ms = Duration.between(start, Instant.now(clock)).toMillis();
            log.info("[snapshot] periods={} saved={} finished in {} ms", pending.keySet(), saved, ms);
        }
        return saved;
    }

    @Scheduled(fixedDelayString = "${skillpulse.snapshots.interval-ms:3600000}",
               initialDelayString = "${skillpulse.snapshots.interval-ms:3600000}")
    void scheduledSnapshot() {
        try {
            snapshot();
        } catch (SnapshotStorageException e) {
            log.error("[snapshot] {}; counts kept for the next run", e.getMessage(), e);
        }
    }

    // Drops a past bucket unless it gained counts after the copy that was saved
    private synchronized void release(String period, Map<String, Long> savedCounts) {
        if (period.equals(today())) return;
        PeriodCounts bucket = buckets.get(period);
        if (bucket != null && bucket.counts.equals(savedCounts)) buckets.remove(period);
    }

    private String today() {
        return LocalDate.now(clock).toString();
    }

    private static final class PeriodCounts {
        final Map<String, Long> counts = new HashMap<>();
        long documents;
    }
}
