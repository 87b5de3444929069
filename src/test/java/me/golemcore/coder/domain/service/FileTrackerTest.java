package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.FileChange;
import me.golemcore.coder.domain.model.FileChangeOperation;
import me.golemcore.coder.domain.model.RollbackPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileTrackerTest {

    @TempDir
    Path tempDir;

    private FileTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new FileTracker(Clock.fixed(Instant.parse("2026-04-01T12:00:00Z"), ZoneOffset.UTC), 5, 3);
    }

    @Test
    void tracksModificationOfExistingFile() throws Exception {
        Path file = tempDir.resolve("main.ts");
        Files.writeString(file, "line1\nline2");

        tracker.trackBeforeModify(file.toString());
        Files.writeString(file, "line1\nchanged");
        Optional<FileChange> change = tracker.trackAfterModify(file.toString());

        assertTrue(change.isPresent());
        assertEquals(FileChangeOperation.MODIFY, change.get().getOperation());
        assertEquals("- line2\n+ changed\n", change.get().getDiff());
        assertEquals(2, tracker.getFileHistory(file.toString()).size());
    }

    @Test
    void newFileIsRecordedAsCreate() throws Exception {
        Path file = tempDir.resolve("new.ts");

        tracker.trackBeforeModify(file.toString());
        Files.writeString(file, "content");
        Optional<FileChange> change = tracker.trackAfterModify(file.toString());

        assertEquals(FileChangeOperation.CREATE, change.orElseThrow().getOperation());
    }

    @Test
    void unchangedOrUntrackedFileYieldsNoChange() throws Exception {
        Path file = tempDir.resolve("same.ts");
        Files.writeString(file, "same");

        tracker.trackBeforeModify(file.toString());

        assertTrue(tracker.trackAfterModify(file.toString()).isEmpty());
        assertTrue(tracker.trackAfterModify(tempDir.resolve("other.ts").toString()).isEmpty());
    }

    @Test
    void rollbackPointRevertsCreatesAndModifications() throws Exception {
        Path existing = tempDir.resolve("a.ts");
        Path created = tempDir.resolve("b.ts");
        Files.writeString(existing, "before");

        tracker.trackBeforeModify(existing.toString());
        tracker.trackBeforeModify(created.toString());
        Files.writeString(existing, "after");
        Files.writeString(created, "fresh");
        List<FileChange> changes = List.of(
                tracker.trackAfterModify(existing.toString()).orElseThrow(),
                tracker.trackAfterModify(created.toString()).orElseThrow());
        RollbackPoint point = tracker.createRollbackPoint("After iteration 1", changes);

        List<String> failed = tracker.rollbackTo(point.getId());

        assertTrue(failed.isEmpty());
        assertEquals("before", Files.readString(existing));
        assertFalse(Files.exists(created));
    }

    @Test
    void rollbackPointsAndSnapshotsAreBounded() {
        for (int i = 0; i < 8; i++) {
            tracker.createRollbackPoint("point " + i, List.of());
            tracker.createSnapshot("/tmp/x.ts", "v" + i);
        }

        assertEquals(5, tracker.getRollbackPoints().size());
        assertEquals("point 3", tracker.getRollbackPoints().get(0).getDescription());
        assertEquals(3, tracker.getFileHistory("/tmp/x.ts").size());
        assertEquals("v7", tracker.getFileHistory("/tmp/x.ts").get(2).getContent());
    }

    @Test
    void unknownRollbackPointIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> tracker.rollbackTo("rp-missing"));
    }

    @Test
    void summarizesChanges() {
        assertEquals("No file changes", tracker.getChangesSummary());

        tracker.recordChange("/w/a.ts", null, "x");
        tracker.recordChange("/w/b.ts", "x", "y");

        String summary = tracker.getChangesSummary();
        assertTrue(summary.startsWith("Created: 1, Modified: 1, Deleted: 0"));
        assertTrue(summary.contains("  - /w/a.ts"));
        assertTrue(tracker.wasRecentlyModified("/w/a.ts", Duration.ofMinutes(1)));
    }
}
