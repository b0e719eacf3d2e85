package probe.log;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActivityLogTest {

    @TempDir
    Path tempDir;

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @Test
    void testEntriesAreTimestampedAndAppended() throws IOException {
        ActivityLog log = ActivityLog.inDirectory(tempDir.resolve("logs"), FIXED);

        log.append(LogChannel.INJECTION_TEST, "first");
        log.append(LogChannel.INJECTION_TEST, "second");

        Path file = tempDir.resolve("logs").resolve("injection_tests.log");
        assertEquals(List.of("[2024-03-05 14:07:09] first", "[2024-03-05 14:07:09] second"),
            Files.readAllLines(file));
    }

    @Test
    void testChannelsWriteSeparateFiles() {
        ActivityLog log = ActivityLog.inDirectory(tempDir, FIXED);

        log.append(LogChannel.BRUTE_FORCE, "b");
        log.append(LogChannel.ERROR, "e");

        assertTrue(Files.exists(tempDir.resolve("brute_force.log")));
        assertTrue(Files.exists(tempDir.resolve("errors.log")));
        assertFalse(Files.exists(tempDir.resolve("login.log")));
    }

    @Test
    void testWriteFailureDoesNotPropagate() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        ActivityLog log = ActivityLog.inDirectory(blocker, FIXED);

        assertDoesNotThrow(() -> log.append(LogChannel.INTERCEPT, "lost"));
    }

    @Test
    void testDisabledLogWritesNothing() {
        ActivityLog log = ActivityLog.disabled();

        log.append(LogChannel.LOGIN, "ignored");

        assertFalse(log.isEnabled());
        assertTrue(log.pathOf(LogChannel.LOGIN).isEmpty());
    }
}
