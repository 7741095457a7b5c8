package com.skillpulse.processing.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed store of per-period skill count snapshots. Saving a period that already exists
 * replaces it; there is no log of earlier versions.
 */
public interface SnapshotStore {

    /**
     * Persists {@code counts} under {@code periodId}, or under today's ISO date when the id is
     * null or blank.
     *
     * @return the period id actually used
     */
    String save(String periodId, Map<String, Long> counts);

    Optional<Snapshot> load(String periodId);

    /** All known period ids, most recent (lexicographically greatest) first. */
    List<String> listPeriods();

    /**
     * Removes every period whose id sorts strictly before {@code cutoff}, or all periods when
     * the cutoff is null or blank.
     *
     * @return number of periods removed
     */
    int clearBefore(String cutoff);
}
