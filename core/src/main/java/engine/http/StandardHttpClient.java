package engine.http;

import engine.model.ProbeRequest;
import engine.model.ProbeResponse;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.*;
import java.util.logging.Logger;

/**
 * Стандартная реализация HTTP клиента на базе {@code java.net.http.HttpClient} с поддержкой SSL/TLS.
 *
 * <p>Основные возможности:
 * <ul>
 *   <li>Переиспользование соединений между запросами</li>
 *   <li>Ручное следование редиректам с ограничением числа переходов</li>
 *   <li>HTTP прокси</li>
 *   <li>Отключаемая проверка сертификатов для тестовых стендов</li>
 * </ul>
 */
public final class StandardHttpClient implements HttpClient {
    private static final Logger logger = Logger.getLogger(StandardHttpClient.class.getName());

    // Headers java.net.http refuses to set explicitly
    private static final Set<String> RESTRICTED_HEADERS = Set.of(
        "connection", "content-length", "expect", "host", "upgrade"
    );

    private final HttpClientConfig config;
    private final java.net.http.HttpClient client;

    public StandardHttpClient(HttpClientConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");

        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
            .version(java.net.http.HttpClient.Version.HTTP_1_1)
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(java.net.http.HttpClient.Redirect.NEVER);

        config.getProxy().ifPresent(proxy -> builder.proxy(proxySelector(proxy)));

        if (!config.isVerifySsl()) {
            logger.warning("SSL verification is disabled - use only for testing!");
            builder.sslContext(insecureSslContext());
        }

        this.client = builder.build();
    }

    @Override
    public ProbeResponse execute(ProbeRequest request) throws IOException {
        long start = System.nanoTime();

        URI uri = toUri(request.getUrl());
        String method = request.getMethod();
        String body = request.getBody();
        int redirects = 0;

        while (true) {
            HttpResponse<byte[]> response = send(buildRequest(uri, method, body, request));
            int status = response.statusCode();

            Optional<String> location = response.headers().firstValue("Location");
            if (!config.isFollowRedirects() || !isRedirect(status) || location.isEmpty()) {
                return toProbeResponse(response, Duration.ofNanos(System.nanoTime() - start));
            }

            if (redirects >= config.getMaxRedirects()) {
                logger.fine("Redirect limit " + config.getMaxRedirects() + " reached for " + request.getUrl());
                return toProbeResponse(response, Duration.ofNanos(System.nanoTime() - start));
            }

            redirects++;
            uri = uri.resolve(location.get());
            if (status == 303 || ((status == 301 || status == 302) && !"GET".equals(method) && !"HEAD".equals(method))) {
                method = "GET";
                body = null;
            }
            logger.fine("Following redirect " + redirects + " to " + uri);
        }
    }

    @Override
    public boolean supports(String url) {
        return url != null && (url.startsWith("http://") || url.startsWith("https://"));
    }

    @Override
    public void close() {
        // java.net.http.HttpClient on JDK 17 releases its connections when garbage collected
    }

    private HttpResponse<byte[]> send(HttpRequest httpRequest) throws IOException {
        try {
            return client.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException(
                "Request interrupted: " + httpRequest.method() + " " + httpRequest.uri());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private HttpRequest buildRequest(URI uri, String method, String body, ProbeRequest request) {
        HttpRequest.BodyPublisher publisher = body != null && !body.isEmpty()
            ? HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)
            : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(request.getTimeoutMs() > 0 ? Duration.ofMillis(request.getTimeoutMs()) : config.getReadTimeout())
            .method(method, publisher);

        Map<String, String> headers = new LinkedHashMap<>(config.getDefaultHeaders());
        // Request headers override defaults
        headers.putAll(request.getHeaders());
        headers.forEach((name, value) -> {
            if (RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                logger.fine("Skipping restricted header: " + name);
            } else {
                builder.setHeader(name, value);
            }
        });

        return builder.build();
    }

    private static ProbeResponse toProbeResponse(HttpResponse<byte[]> response, Duration elapsed) {
        ProbeResponse.Builder builder = ProbeResponse.builder()
            .statusCode(response.statusCode())
            .body(response.body() != null ? response.body() : new byte[0])
            .responseTime(elapsed);

        response.headers().map().forEach((name, values) -> {
            if (!name.startsWith(":")) {
                values.forEach(value -> builder.addHeader(name, value));
            }
        });
        return builder.build();
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static URI toUri(String url) throws IOException {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed URL: " + url
                + ". Check for unsubstituted variables or invalid characters.", e);
        }
    }

    private static ProxySelector proxySelector(String proxy) {
        URI uri = URI.create(proxy.contains("://") ? proxy : "http://" + proxy);
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid proxy URL: " + proxy);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : 8080;
        return ProxySelector.of(new InetSocketAddress(uri.getHost(), port));
    }

    /**
     * Настроить SSL контекст для принятия всех сертификатов (НЕБЕЗОПАСНО).
     * Должно использоваться только для целей тестирования.
     */
    private static SSLContext insecureSslContext() {
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

        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAllCerts, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to configure insecure SSL", e);
        }
    }
}
