package model;

import java.time.Instant;
import java.util.*;

/**
 * Доказательства находки: захваченный запрос, ответ, совпавшие шаблоны и структурированные данные.
 */
public final class Evidence {
    private final String request;
    private final String response;
    private final List<String> matchedPatterns;
    private final Map<String, Object> data;
    private final Instant timestamp;

    private Evidence(Builder builder) {
        this.request = builder.request;
        this.response = builder.response;
        this.matchedPatterns = builder.matchedPatterns != null
            ? List.copyOf(builder.matchedPatterns)
            : Collections.emptyList();
        this.data = builder.data != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.data))
            : Collections.emptyMap();
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Evidence empty() {
        return builder().build();
    }

    public Optional<String> getRequest() {
        return Optional.ofNullable(request);
    }

    public Optional<String> getResponse() {
        return Optional.ofNullable(response);
    }

    public List<String> getMatchedPatterns() {
        return matchedPatterns;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public static class Builder {
        private String request;
        private String response;
        private List<String> matchedPatterns;
        private Map<String, Object> data;
        private Instant timestamp;

        public Builder request(String request) {
            this.request = request;
            return this;
        }

        public Builder response(String response) {
            this.response = response;
            return this;
        }

        public Builder addMatch(String pattern) {
            if (this.matchedPatterns == null) {
                this.matchedPatterns = new ArrayList<>();
            }
            this.matchedPatterns.add(pattern);
            return this;
        }

        public Builder addData(String key, Object value) {
            if (this.data == null) {
                this.data = new LinkedHashMap<>();
            }
            this.data.put(key, value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Evidence build() {
            return new Evidence(this);
        }
    }
}
