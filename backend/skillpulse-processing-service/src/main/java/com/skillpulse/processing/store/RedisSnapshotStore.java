package com.skillpulse.processing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot history in a single Redis hash: one field per period id, each holding the snapshot
 * as JSON. Saves touch only their own field.
 */
public class RedisSnapshotStore extends AbstractSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(RedisSnapshotStore.class);

    private final StringRedisTemplate redis;
    private final String hashKey;
    private final ObjectMapper mapper;

    public RedisSnapshotStore(StringRedisTemplate redis, String hashKey, ObjectMapper mapper, Clock clock) {
        super(clock);
        this.redis = redis;
        this.hashKey = hashKey;
        this.mapper = mapper;
    }

    @Override
    public String save(String periodId, Map<String, Long> counts) {
        String period = resolvePeriod(periodId);
        Snapshot snapshot = newSnapshot(period, counts);
        String json;
        try {
            json = mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new SnapshotStorageException("Failed to serialize snapshot " + period, e);
        }
        try {
            redis.opsForHash().put(hashKey, period, json);
        } catch (DataAccessException e) {
            throw new SnapshotStorageException("Failed to write snapshot " + period + " to " + hashKey, e);
        }
        log.info("Saved snapshot period={} skills={} total={} key={}", period, snapshot.uniqueSkills(), snapshot.totalOccurrences(), hashKey);
        return period;
    }

    @Override
    public Optional<Snapshot> load(String periodId) {
        String key = periodKey(periodId);
        if (key == null) return Optional.empty();
        Object raw;
        try {
            raw = redis.opsForHash().get(hashKey, key);
        } catch (DataAccessException e) {
            throw new SnapshotStorageException("Failed to read snapshot " + key + " from " + hashKey, e);
        }
        return Optional.ofNullable(parse(key, raw));
    }

    @Override
    public List<String> listPeriods() {
        Map<Object, Object> entries = entries();
        List<String> periods = new ArrayList<>(entries.size());
        entries.forEach((field, value) -> {
            if (parse(String.valueOf(field), value) != null) periods.add(String.valueOf(field));
        });
        periods.sort(Comparator.reverseOrder());
        return periods;
    }

    @Override
    public int clearBefore(String cutoffId) {
        String cutoff = periodKey(cutoffId);
        Set<Object> fields;
        try {
            fields = redis.opsForHash().keys(hashKey);
        } catch (DataAccessException e) {
            throw new SnapshotStorageException("Failed to list snapshots in " + hashKey, e);
        }
        boolean all = cutoff == null;
        Object[] doomed = fields == null ? new Object[0] : fields.stream()
            .filter(f -> all || String.valueOf(f).compareTo(cutoff) < 0)
            .toArray();
        if (doomed.length == 0) return 0;

        Long removed;
        try {
            removed = redis.opsForHash().delete(hashKey, doomed);
        } catch (DataAccessException e) {
            throw new SnapshotStorageException("Failed to clear snapshots in " + hashKey, e);
        }
        int count = removed == null ? doomed.length : removed.intValue();
        log.info("Cleared {} snapshot period(s) before {} key={}", count, all ? "<all>" : cutoff, hashKey);
        return count;
    }

    private Map<Object, Object> entries() {
        try {
            Map<Object, Object> entries = redis.opsForHash().entries(hashKey);
            return entries == null ? Map.of() : entries;
        } catch (DataAccessException e) {
            throw new SnapshotStorageException("Failed to read snapshots from " + hashKey, e);
        }
    }

    private Snapshot parse(String period, Object raw) {
        if (raw == null) return null;
        try {
            return mapper.readValue(raw.toString(), Snapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed snapshot period={} key={}: {}", period, hashKey, e.getOriginalMessage());
            return null;
        }
    }
}
