package probe.session;

import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Moves session state between a client's cookie jar and a {@link SessionDocument}.
 */
public final class SessionManager {
    private static final Logger logger = Logger.getLogger(SessionManager.class.getName());

    private SessionManager() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Snapshot the cookie jar together with the given session headers.
     */
    public static SessionDocument capture(CookieStore cookieStore, Map<String, String> headers) {
        List<StoredCookie> cookies = new ArrayList<>();
        for (HttpCookie cookie : cookieStore.getCookies()) {
            cookies.add(new StoredCookie(
                cookie.getName(),
                cookie.getValue(),
                cookie.getDomain(),
                cookie.getPath(),
                cookie.getSecure()));
        }
        return new SessionDocument(headers, cookies);
    }

    /**
     * Load stored cookies into the jar. Cookies without a domain cannot be scoped and
     * are skipped.
     *
     * @return number of cookies restored
     */
    public static int restore(SessionDocument session, CookieStore cookieStore) {
        int restored = 0;
        for (StoredCookie stored : session.cookies()) {
            if (stored.name() == null || stored.domain() == null || stored.domain().isBlank()) {
                logger.fine("Skipping stored cookie without name or domain: " + stored);
                continue;
            }

            HttpCookie cookie = new HttpCookie(stored.name(), stored.value() != null ? stored.value() : "");
            cookie.setVersion(0);
            cookie.setDomain(stored.domain());
            cookie.setPath(stored.path() != null ? stored.path() : "/");
            cookie.setSecure(stored.secure());

            cookieStore.add(originOf(stored), cookie);
            restored++;
        }
        return restored;
    }

    private static URI originOf(StoredCookie cookie) {
        String host = cookie.domain().startsWith(".") ? cookie.domain().substring(1) : cookie.domain();
        String scheme = cookie.secure() ? "https" : "http";
        return URI.create(scheme + "://" + host + "/");
    }
}
