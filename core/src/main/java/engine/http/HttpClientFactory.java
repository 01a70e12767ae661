package engine.http;

import engine.config.EngineConfig;

import java.util.logging.Logger;

/**
 * Фабрика HTTP клиентов для сетевого уровня движка.
 */
public final class HttpClientFactory {
    private static final Logger logger = Logger.getLogger(HttpClientFactory.class.getName());

    private HttpClientFactory() {
        // Prevent instantiation
    }

    /**
     * Создать HTTP клиент на основе предоставленной конфигурации.
     *
     * @param config конфигурация HTTP клиента
     * @return экземпляр HTTP клиента
     * @throws IllegalArgumentException если адрес прокси некорректен
     */
    public static HttpClient createClient(HttpClientConfig config) {
        logger.fine("Creating HTTP client: followRedirects=" + config.isFollowRedirects()
            + ", maxRedirects=" + config.getMaxRedirects()
            + config.getProxy().map(p -> ", proxy=" + p).orElse(""));
        return new StandardHttpClient(config);
    }

    /**
     * Создать HTTP клиент по сетевой секции конфигурации движка.
     */
    public static HttpClient createClient(EngineConfig.NetworkSettings network) {
        return createClient(HttpClientConfig.from(network));
    }

    /**
     * Создать стандартный HTTP клиент с конфигурацией по умолчанию.
     *
     * @return стандартный HTTP клиент
     */
    public static HttpClient createDefaultClient() {
        return createClient(HttpClientConfig.builder().build());
    }
}
