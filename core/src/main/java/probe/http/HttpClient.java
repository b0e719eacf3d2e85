package probe.http;

import probe.model.ProbeRequest;
import probe.model.ProbeResponse;

import java.net.CookieStore;

/**
 * HTTP client shared by the probing engines.
 *
 * <p>One instance is owned by the caller and threaded into every engine call, so its
 * cookie jar and default headers span all requests of a run. Implementations must be
 * safe for concurrent use: the injection engine calls {@link #execute(ProbeRequest)}
 * from several worker threads at once.
 *
 * <p>Transport failures (DNS, refused connection, timeout) are reported through
 * {@link ProbeResponse#getError()} rather than thrown.
 */
public interface HttpClient extends AutoCloseable {

    /**
     * Executes the request and returns the response or the transport error.
     *
     * @param request request to execute
     * @return response, never null
     */
    ProbeResponse execute(ProbeRequest request);

    /**
     * Checks whether this client can handle the given URL scheme.
     *
     * @param url URL to check
     * @return true if supported
     */
    boolean supports(String url);

    /**
     * Cookie jar shared across calls. Must tolerate concurrent access.
     *
     * @return the cookie store backing this client
     */
    CookieStore cookieStore();

    /**
     * Closes the client and releases held resources.
     */
    @Override
    void close();
}
