package com.skillpulse.processing.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSnapshotStoreTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private Path file;
    private FileSnapshotStore store;

    @BeforeEach
    void setUp() {
        file = dir.resolve("trends").resolve("historical_data.json");
        store = new FileSnapshotStore(file, new ObjectMapper(), CLOCK);
    }

    // ==================== Save and load ====================

    @Nested
    class SaveAndLoad {

        @Test
        void shouldRoundTripCounts() {
            store.save("2024-01-01", Map.of("Python", 10L, "Java", 5L));

            Snapshot snapshot = store.load("2024-01-01").orElseThrow();

            assertThat(snapshot.period()).isEqualTo("2024-01-01");
            assertThat(snapshot.counts()).containsExactly(Map.entry("Java", 5L), Map.entry("Python", 10L));
            assertThat(snapshot.totalOccurrences()).isEqualTo(15);
            assertThat(snapshot.uniqueSkills()).isEqualTo(2);
            assertThat(snapshot.timestamp()).startsWith("2024-01-15T10:00");
        }

        @Test
        void shouldDefaultPeriodToToday() {
            String period = store.save(null, Map.of("Python", 1L));

            assertThat(period).isEqualTo("2024-01-15");
            assertThat(store.load("2024-01-15")).isPresent();
        }

        @Test
        void shouldTreatBlankPeriodAsToday() {
            assertThat(store.save("  ", Map.of("Python", 1L))).isEqualTo("2024-01-15");
        }

        @Test
        void shouldOverwriteSamePeriod() {
            store.save("2024-01-01", Map.of("Python", 10L));
            store.save("2024-01-01", Map.of("Rust", 2L));

            assertThat(store.load("2024-01-01").orElseThrow().counts()).containsOnlyKeys("Rust");
            assertThat(store.listPeriods()).containsExactly("2024-01-01");
        }

        @Test
        void shouldCreateParentDirectories() {
            store.save("2024-01-01", Map.of("Python", 1L));

            assertThat(file).exists();
        }

        @Test
        void shouldReturnEmptyForUnknownPeriod() {
            store.save("2024-01-01", Map.of("Python", 1L));

            assertThat(store.load("2023-12-31")).isEmpty();
            assertThat(store.load(null)).isEmpty();
        }

        @Test
        void shouldLoadPeriodSavedWithSurroundingWhitespace() {
            String period = store.save(" 2024-01-15 ", Map.of("Python", 2L));

            assertThat(period).isEqualTo("2024-01-15");
            assertThat(store.load(" 2024-01-15 ")).isPresent();
            assertThat(store.load("2024-01-15")).isPresent();
            assertThat(store.load("  ")).isEmpty();
        }

        @Test
        void shouldLeaveNoTempFilesBehind() throws Exception {
            store.save("2024-01-01", Map.of("Python", 1L));
            store.save("2024-01-02", Map.of("Java", 1L));

            try (var files = Files.list(file.getParent())) {
                assertThat(files).containsExactly(file);
            }
        }

        @Test
        void shouldSurviveNewInstanceOnSameFile() {
            store.save("2024-01-01", Map.of("Python", 3L));

            FileSnapshotStore reopened = new FileSnapshotStore(file, new ObjectMapper(), CLOCK);

            assertThat(reopened.load("2024-01-01").orElseThrow().counts()).containsEntry("Python", 3L);
        }
    }

    // ==================== Periods ====================

    @Nested
    class Periods {

        @Test
        void shouldListPeriodsNewestFirst() {
            store.save("2024-01-01", Map.of("Python", 1L));
            store.save("2024-01-14", Map.of("Python", 2L));
            store.save("2024-01-09", Map.of("Python", 3L));

            assertThat(store.listPeriods()).containsExactly("2024-01-14", "2024-01-09", "2024-01-01");
        }

        @Test
        void shouldClearPeriodsBeforeCutoff() {
            store.save("2024-01-01", Map.of("Python", 1L));
            store.save("2024-01-09", Map.of("Python", 2L));
            store.save("2024-01-10", Map.of("Python", 3L));
            store.save("2024-01-14", Map.of("Python", 4L));

            int removed = store.clearBefore("2024-01-10");

            assertThat(removed).isEqualTo(2);
            assertThat(store.listPeriods()).containsExactly("2024-01-14", "2024-01-10");
        }

        @Test
        void shouldClearEverythingWithoutCutoff() {
            store.save("2024-01-01", Map.of("Python", 1L));
            store.save("2024-01-09", Map.of("Python", 2L));

            assertThat(store.clearBefore(null)).isEqualTo(2);
            assertThat(store.listPeriods()).isEmpty();
        }
    }

    // ==================== Damaged storage ====================

    @Nested
    class DamagedStorage {

        @Test
        void shouldTreatMissingFileAsEmptyHistory() {
            assertThat(store.listPeriods()).isEmpty();
            assertThat(store.load("2024-01-01")).isEmpty();
        }

        @Test
        void shouldTreatMalformedFileAsEmptyHistory() throws Exception {
            Files.createDirectories(file.getParent());
            Files.writeString(file, "{ not json");

            assertThat(store.listPeriods()).isEmpty();

            store.save("2024-01-01", Map.of("Python", 1L));
            assertThat(store.listPeriods()).containsExactly("2024-01-01");
        }

        @Test
        void shouldKeepPreviousHistoryWhenWriteFails() throws Exception {
            store.save("2024-01-01", Map.of("Python", 1L));
            String before = Files.readString(file);
            ObjectMapper failing = new ObjectMapper() {
                @Override
                public ObjectWriter writerWithDefaultPrettyPrinter() {
                    throw new IllegalStateException("serializer unavailable");
                }
            };
            FileSnapshotStore broken = new FileSnapshotStore(file, failing, CLOCK);

            assertThatThrownBy(() -> broken.save("2024-01-02", Map.of("Java", 1L)))
                .isInstanceOf(IllegalStateException.class);
            assertThat(Files.readString(file)).isEqualTo(before);
            assertThat(store.listPeriods()).containsExactly("2024-01-01");
            try (var files = Files.list(file.getParent())) {
                assertThat(files).containsExactly(file);
            }
        }

        @Test
        void shouldFailWhenFileCannotBeRead() throws Exception {
            Files.createDirectories(file);

            assertThatThrownBy(() -> store.listPeriods())
                .isInstanceOf(SnapshotStorageException.class);
        }
    }
}
