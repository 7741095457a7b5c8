package com.skillpulse.processing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps the whole snapshot history in a single JSON file, keyed by period id.
 *
 * <p>Every save and clear re-reads the full file and replaces it through a temp file and an
 * atomic move, so a crash mid-write leaves the previous history intact. Two writers racing on
 * the same file can lose an update (the last write wins); callers that need strict consistency
 * must serialize writes themselves.
 *
 * <p>A missing file is an empty history. A file that is not valid JSON is logged and also read
 * as an empty history, so the next save replaces it. Any other I/O failure surfaces as
 * {@link SnapshotStorageException}.
 */
public class FileSnapshotStore extends AbstractSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);
    private static final TypeReference<TreeMap<String, Snapshot>> HISTORY = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;

    public FileSnapshotStore(Path file, ObjectMapper mapper, Clock clock) {
        super(clock);
        this.file = file;
        this.mapper = mapper;
    }

    public Path file() {
        return file;
    }

    @Override
    public String save(String periodId, Map<String, Long> counts) {
        String period = resolvePeriod(periodId);
        Snapshot snapshot = newSnapshot(period, counts);

        TreeMap<String, Snapshot> history = readHistory();
        history.put(period, snapshot);
        writeHistory(history);

        log.info("Saved snapshot period={} skills={} total={}", period, snapshot.uniqueSkills(), snapshot.totalOccurrences());
        return period;
    }

    @Override
    public Optional<Snapshot> load(String periodId) {
        String key = periodKey(periodId);
        if (key == null) return Optional.empty();
        return Optional.ofNullable(readHistory().get(key));
    }

    @Override
    public List<String> listPeriods() {
        return readHistory().keySet().stream()
            .sorted(Comparator.reverseOrder())
            .toList();
    }

    @Override
    public int clearBefore(String cutoffId) {
        String cutoff = periodKey(cutoffId);
        TreeMap<String, Snapshot> history = readHistory();
        int removed;
        if (cutoff == null) {
            removed = history.size();
            history.clear();
        } else {
            var older = history.headMap(cutoff, false);
            removed = older.size();
            older.clear();
        }
        writeHistory(history);
        log.info("Cleared {} snapshot period(s) before {}", removed, cutoff == null ? "<all>" : cutoff);
        return removed;
    }

    TreeMap<String, Snapshot> readHistory() {
        if (Files.notExists(file)) return new TreeMap<>();
        try (InputStream in = Files.newInputStream(file)) {
            TreeMap<String, Snapshot> history = mapper.readValue(in, HISTORY);
            if (history == null) return new TreeMap<>();
            history.values().removeIf(Objects::isNull);
            return history;
        } catch (JsonProcessingException e) {
            log.warn("Snapshot file {} is malformed, treating history as empty: {}", file, e.getOriginalMessage());
            return new TreeMap<>();
        } catch (NoSuchFileException e) {
            return new TreeMap<>();
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to read snapshot history from " + file, e);
        }
    }

    // Writes a sibling temp file and moves it over the history so readers never see a partial file
    private void writeHistory(TreeMap<String, Snapshot> history) {
        Path target = file.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            if (dir != null) Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, history);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SnapshotStorageException("Failed to write snapshot history to " + file, e);
        } finally {
            // no-op once the move succeeded
            deleteQuietly(tmp);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
