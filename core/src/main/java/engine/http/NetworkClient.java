package engine.http;

import engine.ScanException;
import engine.config.EngineConfig;
import engine.model.ProbeRequest;
import engine.model.ProbeResponse;
import engine.session.SessionManager;
import util.TargetParser;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongUnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP клиент движка: повторы с экспоненциальной задержкой, ограничение частоты,
 * stealth-задержки и автоматическая подстановка cookies и JWT из {@link SessionManager}.
 *
 * <p>Потокобезопасен; один экземпляр используется всеми шаблонами сканирования.
 */
public final class NetworkClient implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(NetworkClient.class.getName());

    static final Duration STEALTH_BASE_DELAY = Duration.ofMillis(500);
    static final String DEFAULT_JWT = "default";

    private final HttpClient httpClient;
    private final SessionManager sessionManager;
    private final EngineConfig.NetworkSettings network;
    private final EngineConfig.ExecutionSettings execution;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final LongUnaryOperator jitter;

    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();

    public NetworkClient(HttpClient httpClient, EngineConfig config, SessionManager sessionManager) {
        this(httpClient, config, sessionManager, Sleeper.system(),
            bound -> ThreadLocalRandom.current().nextLong(bound + 1));
    }

    NetworkClient(HttpClient httpClient, EngineConfig config, SessionManager sessionManager,
                  Sleeper sleeper, LongUnaryOperator jitter) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager cannot be null");
        this.network = config.getNetwork();
        this.execution = config.getExecution();
        this.sleeper = sleeper;
        this.jitter = jitter;
        this.rateLimiter = network.getRateLimit()
            .filter(rate -> rate > 0)
            .map(RateLimiter::new)
            .orElse(null);
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    public ProbeResponse get(String url) throws ScanException {
        return get(url, Collections.emptyMap());
    }

    public ProbeResponse get(String url, Map<String, String> headers) throws ScanException {
        return execute(ProbeRequest.builder().url(url).method("GET").headers(headers).build());
    }

    public ProbeResponse post(String url, String body) throws ScanException {
        return post(url, body, Collections.emptyMap());
    }

    public ProbeResponse post(String url, String body, Map<String, String> headers) throws ScanException {
        return execute(ProbeRequest.builder().url(url).method("POST").headers(headers).body(body).build());
    }

    /**
     * Выполняет запрос с повторами.
     *
     * <p>Ответы 5xx и транспортные ошибки повторяются до {@code maxRetries} раз с задержкой
     * {@code retryDelay * 2^(attempt-1)}. Если повторы исчерпаны, возвращается последний
     * 5xx ответ, а транспортная ошибка выбрасывается как {@link ScanException} типа NETWORK.
     *
     * @throws ScanException при исчерпании повторов или прерывании потока
     */
    public ProbeResponse execute(ProbeRequest request) throws ScanException {
        String url = request.getUrl();
        String domain = TargetParser.extractDomain(url);
        int maxRetries = Math.max(0, execution.getMaxRetries());
        int attempt = 0;

        while (true) {
            logger.fine(request.getMethod() + " " + url + " (attempt " + (attempt + 1) + ")");

            try {
                if (execution.isStealthMode()) {
                    Duration delay = STEALTH_BASE_DELAY.plusMillis(jitter.applyAsLong(STEALTH_BASE_DELAY.toMillis() / 2));
                    logger.fine("Stealth mode: delaying request by " + delay.toMillis() + "ms");
                    sleeper.sleep(delay);
                }
                if (rateLimiter != null) {
                    rateLimiter.acquire();
                }

                ProbeResponse response;
                try {
                    requestCount.incrementAndGet();
                    response = httpClient.execute(withSessionHeaders(request, domain));
                } catch (IOException e) {
                    if (attempt < maxRetries) {
                        logger.warning("Request failed for " + url + ": " + e.getMessage() + ", retrying...");
                        attempt++;
                        backoff(url, attempt);
                        continue;
                    }
                    throw new ScanException(ScanException.ErrorType.NETWORK,
                        request.getMethod() + " request failed: " + describe(e), e);
                }

                bytesReceived.addAndGet(response.getBodyLength());

                if (response.isServerError() && attempt < maxRetries) {
                    logger.warning("Server error " + response.getStatusCode() + " for " + url + ", retrying...");
                    attempt++;
                    backoff(url, attempt);
                    continue;
                }

                processResponseCookies(domain, isHttps(url), response);
                return response;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ScanException(ScanException.ErrorType.EXECUTION,
                    "Interrupted while requesting " + url, e);
            }
        }
    }

    /**
     * @return число отправленных HTTP запросов, включая повторы
     */
    public long getRequestCount() {
        return requestCount.get();
    }

    /**
     * @return суммарный размер полученных тел ответов в байтах
     */
    public long getBytesReceived() {
        return bytesReceived.get();
    }

    /**
     * Учитывает трафик, выполненный в обход HTTP (raw TCP).
     */
    public void recordRawExchange(long bytes) {
        requestCount.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    @Override
    public void close() {
        httpClient.close();
    }

    private void backoff(String url, int attempt) throws InterruptedException {
        Duration delay = execution.getRetryDelay().multipliedBy(1L << (attempt - 1));
        logger.fine("Retrying " + url + " after " + delay.toMillis() + "ms (attempt " + (attempt + 1) + ")");
        sleeper.sleep(delay);
    }

    private ProbeRequest withSessionHeaders(ProbeRequest request, String domain) {
        Map<String, String> headers = new LinkedHashMap<>(request.getHeaders());
        putIfAbsent(headers, "User-Agent", network.getUserAgent());
        sessionManager.getCookieHeader(domain).ifPresent(cookie -> putIfAbsent(headers, "Cookie", cookie));
        sessionManager.getJwtHeader(DEFAULT_JWT).ifPresent(jwt -> putIfAbsent(headers, "Authorization", jwt));

        return request.toBuilder()
            .headers(headers)
            .timeoutMs((int) network.getTimeout().toMillis())
            .build();
    }

    // Caller headers take precedence, compared case-insensitively
    private static void putIfAbsent(Map<String, String> headers, String name, String value) {
        boolean present = headers.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(name));
        if (!present) {
            headers.put(name, value);
        }
    }

    private void processResponseCookies(String domain, boolean overHttps, ProbeResponse response) {
        for (String setCookie : response.getHeaderValues("Set-Cookie")) {
            try {
                sessionManager.parseSetCookie(domain, setCookie, overHttps);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to parse cookie from " + domain, e);
            }
        }
    }

    private static boolean isHttps(String url) {
        return url.regionMatches(true, 0, "https://", 0, "https://".length());
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
