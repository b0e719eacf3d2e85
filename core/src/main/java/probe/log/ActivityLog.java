package probe.log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Timestamped, append-only activity log with one file per {@link LogChannel}.
 *
 * <p>Writing is fire-and-forget: an I/O failure is reported through
 * {@code java.util.logging} and never reaches the caller.
 */
public final class ActivityLog {
    private static final Logger logger = Logger.getLogger(ActivityLog.class.getName());
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path directory;
    private final Clock clock;

    private ActivityLog(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public static ActivityLog inDirectory(Path directory) {
        return inDirectory(directory, Clock.systemDefaultZone());
    }

    public static ActivityLog inDirectory(Path directory, Clock clock) {
        return new ActivityLog(Objects.requireNonNull(directory, "directory cannot be null"), clock);
    }

    /**
     * Log that discards every entry.
     */
    public static ActivityLog disabled() {
        return new ActivityLog(null, Clock.systemDefaultZone());
    }

    public boolean isEnabled() {
        return directory != null;
    }

    public Optional<Path> pathOf(LogChannel channel) {
        return isEnabled() ? Optional.of(directory.resolve(channel.getFileName())) : Optional.empty();
    }

    /**
     * Append one entry. Multi-line text is written as is after the timestamp.
     */
    public synchronized void append(LogChannel channel, String text) {
        if (!isEnabled()) {
            return;
        }
        Path file = directory.resolve(channel.getFileName());
        String line = "[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] " + text + System.lineSeparator();
        try {
            Files.createDirectories(directory);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.warning("Failed to write " + channel + " log entry to " + file + ": " + e.getMessage());
        }
    }
}
