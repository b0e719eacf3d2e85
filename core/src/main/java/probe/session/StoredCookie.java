package probe.session;

/**
 * Cookie as persisted in the session document.
 */
public record StoredCookie(String name, String value, String domain, String path, boolean secure) {
}
