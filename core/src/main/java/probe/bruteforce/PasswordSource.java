package probe.bruteforce;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single-pass stream of candidate passwords, read front to back exactly once.
 *
 * <p>File-backed sources are opened eagerly, so a missing or unreadable wordlist fails
 * before any request is issued, and read lazily line by line afterwards. Blank lines
 * in a file are skipped; everything else (including leading '#') is a candidate. Trailing
 * carriage returns are stripped. Files are decoded as UTF-8; byte sequences that are not
 * valid UTF-8 are replaced with U+FFFD so the rest of the list is still tried. In-memory
 * sources yield their values verbatim.
 */
public final class PasswordSource implements Iterator<String>, Closeable {
    private static final Logger logger = Logger.getLogger(PasswordSource.class.getName());

    private final String description;
    private final BufferedReader reader;
    private final Iterator<String> values;
    private String next;
    private boolean exhausted;
    private int consumed;

    private PasswordSource(String description, BufferedReader reader, Iterator<String> values) {
        this.description = description;
        this.reader = reader;
        this.values = values;
    }

    /**
     * Open a wordlist file.
     *
     * @throws WordlistException if the file does not exist or cannot be opened
     */
    public static PasswordSource fromFile(Path path) throws WordlistException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.isRegularFile(path)) {
            throw new WordlistException(path, "Wordlist not found: " + path);
        }
        try {
            BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), lenientUtf8()));
            logger.fine("Opened wordlist " + path);
            return new PasswordSource(path.toString(), reader, null);
        } catch (NoSuchFileException e) {
            throw new WordlistException(path, "Wordlist not found: " + path, e);
        } catch (IOException e) {
            throw new WordlistException(path, "Cannot read wordlist " + path + ": " + e.getMessage(), e);
        }
    }

    // Wordlists mix encodings; undecodable bytes become U+FFFD instead of failing the run
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    /**
     * In-memory source over the given passwords, in order.
     */
    public static PasswordSource of(List<String> passwords) {
        return new PasswordSource("in-memory (" + passwords.size() + ")", null, List.copyOf(passwords).iterator());
    }

    public static PasswordSource of(String... passwords) {
        return of(List.of(passwords));
    }

    /**
     * @throws UncheckedIOException if reading the underlying file fails
     */
    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        next = readNext();
        if (next == null) {
            exhausted = true;
            return false;
        }
        return true;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Password source exhausted: " + description);
        }
        String value = next;
        next = null;
        consumed++;
        return value;
    }

    /**
     * Number of passwords handed out so far.
     */
    public int getConsumed() {
        return consumed;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        next = null;
        if (reader != null) {
            reader.close();
        }
    }

    private String readNext() {
        if (values != null) {
            return values.hasNext() ? values.next() : null;
        }

        try {
            String line;
            while ((line = reader.readLine()) != null) {
                String candidate = stripCarriageReturn(line);
                if (!candidate.isBlank()) {
                    return candidate;
                }
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading wordlist " + description, e);
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    @Override
    public String toString() {
        return "PasswordSource{" + description + ", consumed=" + consumed + "}";
    }
}
