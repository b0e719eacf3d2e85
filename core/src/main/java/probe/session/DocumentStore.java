package probe.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import probe.payload.PayloadLibrary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * JSON documents kept in a state directory, one file per document name.
 *
 * <p>Known documents:
 * <ul>
 *   <li>{@value #SESSION} - {@link SessionDocument} (headers and cookies)</li>
 *   <li>{@value #PAYLOADS} - payload category key to list of payload strings</li>
 *   <li>{@value #HEADERS} - saved custom headers</li>
 * </ul>
 *
 * <p>A missing document loads as the supplied default. A malformed one is logged and also
 * replaced by the default. Writes go through a temporary file and a move.
 */
public final class DocumentStore {
    private static final Logger logger = Logger.getLogger(DocumentStore.class.getName());

    public static final String SESSION = "session";
    public static final String PAYLOADS = "payloads";
    public static final String HEADERS = "headers";

    private static final Pattern NAME_PATTERN = Pattern.compile("[a-z0-9_-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public DocumentStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path pathOf(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid document name: '" + name + "'");
        }
        return directory.resolve(name + ".json");
    }

    public boolean exists(String name) {
        return Files.isRegularFile(pathOf(name));
    }

    public <T> T load(String name, Class<T> type, Supplier<T> defaultValue) {
        return load(name, objectMapper.constructType(type), defaultValue);
    }

    public <T> T load(String name, TypeReference<T> type, Supplier<T> defaultValue) {
        return load(name, objectMapper.constructType(type), defaultValue);
    }

    private <T> T load(String name, JavaType type, Supplier<T> defaultValue) {
        Path path = pathOf(name);
        if (!Files.isRegularFile(path)) {
            return defaultValue.get();
        }
        try {
            T document = objectMapper.readValue(Files.readString(path, StandardCharsets.UTF_8), type);
            return document != null ? document : defaultValue.get();
        } catch (JsonProcessingException e) {
            logger.warning("Malformed document " + path + ", using defaults: " + e.getOriginalMessage());
            return defaultValue.get();
        } catch (IOException e) {
            logger.warning("Cannot read document " + path + ", using defaults: " + e.getMessage());
            return defaultValue.get();
        }
    }

    public void save(String name, Object document) throws IOException {
        Path path = pathOf(name);
        Files.createDirectories(directory);

        Path tempFile = Files.createTempFile(directory, name, ".tmp");
        try {
            Files.writeString(tempFile, objectMapper.writeValueAsString(document), StandardCharsets.UTF_8);
            try {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
        logger.fine("Saved document " + path);
    }

    public boolean delete(String name) throws IOException {
        return Files.deleteIfExists(pathOf(name));
    }

    public SessionDocument loadSession() {
        return load(SESSION, SessionDocument.class, SessionDocument::empty);
    }

    public void saveSession(SessionDocument session) throws IOException {
        save(SESSION, session);
    }

    public Map<String, String> loadHeaders() {
        return load(HEADERS, new TypeReference<LinkedHashMap<String, String>>() {}, LinkedHashMap::new);
    }

    public void saveHeaders(Map<String, String> headers) throws IOException {
        save(HEADERS, headers);
    }

    /**
     * Load the payload library; falls back to the built-in defaults when nothing is stored.
     *
     * @throws IllegalArgumentException if the stored document names an unknown category
     */
    public PayloadLibrary loadPayloads() {
        Map<String, List<String>> document = load(PAYLOADS,
            new TypeReference<LinkedHashMap<String, List<String>>>() {}, () -> null);
        return document != null ? PayloadLibrary.fromDocument(document) : PayloadLibrary.defaults();
    }

    public void savePayloads(PayloadLibrary library) throws IOException {
        save(PAYLOADS, library.toDocument());
    }
}
