package engine.http;

import engine.config.EngineConfig;

import java.time.Duration;
import java.util.*;

/**
 * Configuration for HTTP clients.
 */
public final class HttpClientConfig {
    private final Duration connectTimeout;
    private final Duration readTimeout;
    private final boolean followRedirects;
    private final int maxRedirects;
    private final boolean verifySsl;
    private final String proxy;
    private final Map<String, String> defaultHeaders;

    private HttpClientConfig(Builder builder) {
        this.connectTimeout = builder.connectTimeout != null
            ? builder.connectTimeout
            : Duration.ofSeconds(10);
        this.readTimeout = builder.readTimeout != null
            ? builder.readTimeout
            : Duration.ofSeconds(10);
        this.followRedirects = builder.followRedirects;
        this.maxRedirects = Math.max(0, builder.maxRedirects);
        this.verifySsl = builder.verifySsl;
        this.proxy = builder.proxy;
        this.defaultHeaders = builder.defaultHeaders != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders))
            : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Строит конфигурацию клиента из сетевой секции конфигурации движка.
     */
    public static HttpClientConfig from(EngineConfig.NetworkSettings network) {
        Builder builder = builder()
            .connectTimeout(network.getTimeout())
            .readTimeout(network.getTimeout())
            .followRedirects(network.isFollowRedirects())
            .maxRedirects(network.getMaxRedirects())
            .verifySsl(network.isVerifyTls());
        network.getProxy().ifPresent(builder::proxy);
        return builder.build();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public boolean isFollowRedirects() {
        return followRedirects;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public boolean isVerifySsl() {
        return verifySsl;
    }

    public Optional<String> getProxy() {
        return Optional.ofNullable(proxy);
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public static class Builder {
        private Duration connectTimeout;
        private Duration readTimeout;
        private boolean followRedirects = true;
        private int maxRedirects = 5;
        private boolean verifySsl = true;
        private String proxy;
        private Map<String, String> defaultHeaders;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public Builder verifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder defaultHeaders(Map<String, String> defaultHeaders) {
            this.defaultHeaders = defaultHeaders;
            return this;
        }

        public Builder addDefaultHeader(String key, String value) {
            if (this.defaultHeaders == null) {
                this.defaultHeaders = new LinkedHashMap<>();
            }
            this.defaultHeaders.put(key, value);
            return this;
        }

        public HttpClientConfig build() {
            return new HttpClientConfig(this);
        }
    }
}
