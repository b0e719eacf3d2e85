package probe.session;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted session: default headers and cookies carried between invocations.
 */
public record SessionDocument(Map<String, String> headers, List<StoredCookie> cookies) {

    public SessionDocument {
        headers = headers != null ? new LinkedHashMap<>(headers) : new LinkedHashMap<>();
        cookies = cookies != null ? List.copyOf(cookies) : List.of();
    }

    public static SessionDocument empty() {
        return new SessionDocument(null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return headers.isEmpty() && cookies.isEmpty();
    }
}
