package probe.http;

import probe.model.ProbeRequest;
import probe.model.ProbeResponse;

import javax.net.ssl.*;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP client built on {@link java.net.HttpURLConnection}.
 *
 * <p>Main features:
 * <ul>
 *   <li>GET, POST, PUT, DELETE and HEAD with custom headers and bodies</li>
 *   <li>Configurable timeouts, optional insecure TLS</li>
 *   <li>Redirects (up to 10) followed hop by hop; cookies set on any hop are stored and
 *       sent on the next one. 301/302/303 turn the request into a body-less GET</li>
 *   <li>Per-client cookie jar shared across calls; the jar is lock-guarded so parallel
 *       injection runs do not corrupt it</li>
 *   <li>Error-status bodies are read from the error stream</li>
 * </ul>
 */
public final class StandardHttpClient implements HttpClient {
    private static final Logger logger = Logger.getLogger(StandardHttpClient.class.getName());

    private static final int MAX_REDIRECTS = 10;

    private final HttpClientConfig config;
    private final CookieManager cookieManager;
    private final SSLSocketFactory insecureSocketFactory;

    public StandardHttpClient(HttpClientConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        // InMemoryCookieStore guards every operation with a lock
        this.cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);

        if (!config.isVerifySsl()) {
            logger.warning("SSL verification is disabled - use only for testing!");
            this.insecureSocketFactory = createInsecureSocketFactory();
        } else {
            this.insecureSocketFactory = null;
        }
    }

    @Override
    public ProbeResponse execute(ProbeRequest request) {
        try {
            if (!supports(request.getUrl())) {
                throw new IllegalArgumentException("Unsupported URL scheme: " + request.getUrl());
            }
            // Requests that must not touch the shared jar still keep cookies across their own redirects
            CookieManager cookies = request.isPersistCookies()
                ? cookieManager
                : new CookieManager(null, CookiePolicy.ACCEPT_ALL);

            URI uri = URI.create(request.getUrl());
            String method = request.getMethod().name();
            boolean sendBody = request.hasBody();

            for (int redirects = 0; ; redirects++) {
                HttpURLConnection connection = (HttpURLConnection) uri.toURL().openConnection();
                try {
                    configureConnection(connection, request);
                    connection.setRequestMethod(method);
                    writeHeaders(connection, request, uri, cookies, sendBody);
                    if (sendBody) {
                        writeBody(connection, request);
                    }

                    int statusCode = connection.getResponseCode();
                    cookies.put(uri, connection.getHeaderFields());

                    String location = connection.getHeaderField("Location");
                    if (config.isFollowRedirects() && isRedirect(statusCode) && location != null) {
                        if (redirects >= MAX_REDIRECTS) {
                            throw new IOException("Too many redirects (" + MAX_REDIRECTS + ") starting at " +
                                request.getUrl());
                        }
                        URI target = uri.resolve(location.trim());
                        if (!supports(target.toString())) {
                            throw new IOException("Redirect to unsupported URL: " + target);
                        }
                        logger.fine("Following " + statusCode + " redirect " + uri + " -> " + target);
                        if (statusCode == 303 || ((statusCode == 301 || statusCode == 302) && !"HEAD".equals(method))) {
                            method = "GET";
                            sendBody = false;
                        }
                        uri = target;
                        continue;
                    }

                    byte[] body = readResponseBody(connection, statusCode);
                    Map<String, List<String>> headers = new LinkedHashMap<>(connection.getHeaderFields());
                    headers.remove(null); // status line

                    return ProbeResponse.builder()
                        .statusCode(statusCode)
                        .headers(headers)
                        .body(new String(body, StandardCharsets.UTF_8))
                        .bodyLength(body.length)
                        .build();
                } finally {
                    connection.disconnect();
                }
            }

        } catch (IOException | IllegalArgumentException e) {
            String errorMsg = "Request failed: " + request.getMethod() + " " + request.getUrl();
            if (e.getMessage() != null) {
                errorMsg += " - " + e.getMessage();
            }
            logger.log(Level.FINE, errorMsg, e);

            return ProbeResponse.builder()
                .statusCode(0)
                .error(e)
                .build();
        }
    }

    private void writeHeaders(HttpURLConnection connection, ProbeRequest request, URI uri,
                              CookieManager cookies, boolean sendBody) throws IOException {
        if (config.getUserAgent() != null) {
            connection.setRequestProperty("User-Agent", config.getUserAgent());
        }
        config.getDefaultHeaders().forEach(connection::setRequestProperty);
        applyCookies(connection, uri, cookies);
        // Request headers override defaults and stored cookies
        request.getHeaders().forEach((name, value) -> {
            if (sendBody || !"Content-Type".equalsIgnoreCase(name)) {
                connection.setRequestProperty(name, value);
            }
        });
        if (sendBody && request.getBodyContentType() != null && !hasHeader(request, "Content-Type")) {
            connection.setRequestProperty("Content-Type", request.getBodyContentType());
        }
    }

    private static void writeBody(HttpURLConnection connection, ProbeRequest request) throws IOException {
        connection.setDoOutput(true);
        try (OutputStream os = connection.getOutputStream()) {
            os.write(request.getBody().getBytes(StandardCharsets.UTF_8));
            os.flush();
        }
    }

    private static boolean isRedirect(int statusCode) {
        return statusCode == 301 || statusCode == 302 || statusCode == 303
            || statusCode == 307 || statusCode == 308;
    }

    @Override
    public boolean supports(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    @Override
    public CookieStore cookieStore() {
        return cookieManager.getCookieStore();
    }

    @Override
    public void close() {
        // HttpURLConnection doesn't maintain persistent connections that need cleanup
    }

    private void configureConnection(HttpURLConnection connection, ProbeRequest request) {
        connection.setConnectTimeout((int) config.getConnectTimeout().toMillis());
        connection.setReadTimeout((int) config.getReadTimeout().toMillis());
        // Redirects are followed in execute() so every hop goes through the cookie jar
        connection.setInstanceFollowRedirects(false);
        connection.setUseCaches(false);

        if (request.getTimeoutMs() > 0) {
            connection.setConnectTimeout(request.getTimeoutMs());
            connection.setReadTimeout(request.getTimeoutMs());
        }

        if (insecureSocketFactory != null && connection instanceof HttpsURLConnection) {
            HttpsURLConnection https = (HttpsURLConnection) connection;
            https.setSSLSocketFactory(insecureSocketFactory);
            https.setHostnameVerifier((hostname, session) -> true);
        }
    }

    /**
     * Send the jar's cookies plus, for requests that do not write to the jar, the cookies
     * picked up on earlier hops of the same request.
     */
    private void applyCookies(HttpURLConnection connection, URI uri, CookieManager hopCookies) throws IOException {
        List<String> values = new ArrayList<>(cookieManager.get(uri, Collections.emptyMap())
            .getOrDefault("Cookie", List.of()));
        if (hopCookies != cookieManager) {
            values.addAll(hopCookies.get(uri, Collections.emptyMap()).getOrDefault("Cookie", List.of()));
        }
        if (!values.isEmpty()) {
            connection.setRequestProperty("Cookie", String.join("; ", values));
        }
    }

    private static boolean hasHeader(ProbeRequest request, String name) {
        return request.getHeaders().keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static byte[] readResponseBody(HttpURLConnection connection, int statusCode) throws IOException {
        try (InputStream inputStream = statusCode >= 400
            ? connection.getErrorStream()
            : connection.getInputStream()) {

            if (inputStream == null) {
                return new byte[0];
            }

            return inputStream.readAllBytes();
        }
    }

    /**
     * Build an SSL socket factory accepting all certificates (INSECURE).
     * Must only be used for testing.
     */
    private static SSLSocketFactory createInsecureSocketFactory() {
        try {
            TrustManager[] trustAllCerts = new TrustManager[]{
                new X509TrustManager() {
                    @Override
                    public void checkClientTrusted(X509Certificate[] chain, String authType) {
                        // Accept all
                    }

                    @Override
                    public void checkServerTrusted(X509Certificate[] chain, String authType) {
                        // Accept all
                    }

                    @Override
                    public X509Certificate[] getAcceptedIssuers() {
                        return new X509Certificate[0];
                    }
                }
            };

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAllCerts, new SecureRandom());
            return sslContext.getSocketFactory();

        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to configure insecure SSL", e);
        }
    }
}
