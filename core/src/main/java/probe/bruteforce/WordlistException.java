package probe.bruteforce;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a password wordlist cannot be opened. A run never starts in this case.
 */
public class WordlistException extends IOException {
    private final Path path;

    public WordlistException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public WordlistException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
