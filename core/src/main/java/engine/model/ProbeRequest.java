package engine.model;

import java.util.*;

/**
 * HTTP запрос, отправляемый шаблоном или шагом потока.
 */
public final class ProbeRequest {
    private final String url;
    private final String method;
    private final Map<String, String> headers;
    private final String body;
    private final int timeoutMs;

    private ProbeRequest(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url cannot be null");
        this.method = Objects.requireNonNull(builder.method, "method cannot be null").toUpperCase(Locale.ROOT);
        this.headers = builder.headers != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers))
            : Collections.emptyMap();
        this.body = builder.body;
        this.timeoutMs = builder.timeoutMs > 0 ? builder.timeoutMs : 10000; // Default 10s
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public boolean hasBody() {
        return body != null && !body.isEmpty();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .url(url)
            .method(method)
            .body(body)
            .timeoutMs(timeoutMs);
        headers.forEach(builder::addHeader);
        return builder;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }

    public static class Builder {
        private String url;
        private String method = "GET";
        private Map<String, String> headers;
        private String body;
        private int timeoutMs;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers != null ? new LinkedHashMap<>(headers) : null;
            return this;
        }

        public Builder addHeader(String key, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(key, value);
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder timeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public ProbeRequest build() {
            return new ProbeRequest(this);
        }
    }
}
