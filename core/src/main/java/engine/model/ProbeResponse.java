package engine.model;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

/**
 * Захваченный ответ, по которому работают матчеры.
 * Формируется как HTTP клиентом, так и клиентом сырых сокетов (псевдо-ответ со статусом 200).
 */
public final class ProbeResponse {
    private final int statusCode;
    private final List<Header> headers;
    private final byte[] body;
    private final Duration responseTime;

    private ProbeResponse(Builder builder) {
        this.statusCode = builder.statusCode;
        this.headers = builder.headers != null ? List.copyOf(builder.headers) : Collections.emptyList();
        this.body = builder.body != null ? builder.body.clone() : new byte[0];
        this.responseTime = builder.responseTime != null ? builder.responseTime : Duration.ZERO;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public List<Header> getHeaders() {
        return headers;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public int getBodyLength() {
        return body.length;
    }

    /**
     * Тело ответа как строка UTF-8 (некорректные последовательности заменяются).
     */
    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public Duration getResponseTime() {
        return responseTime;
    }

    public Optional<String> getHeader(String name) {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                return Optional.of(header.value());
            }
        }
        return Optional.empty();
    }

    public List<String> getHeaderValues(String name) {
        List<String> values = new ArrayList<>();
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(name)) {
                values.add(header.value());
            }
        }
        return values;
    }

    /**
     * Заголовки в виде строк {@code "Name: value"}, разделенных переводом строки.
     */
    public String headersAsString() {
        StringBuilder sb = new StringBuilder();
        for (Header header : headers) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(header.name()).append(": ").append(header.value());
        }
        return sb.toString();
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    @Override
    public String toString() {
        return "ProbeResponse{statusCode=" + statusCode +
               ", responseTime=" + responseTime.toMillis() + "ms" +
               ", bodyLength=" + body.length + "}";
    }

    public record Header(String name, String value) {
        public Header {
            Objects.requireNonNull(name, "name cannot be null");
            value = value != null ? value : "";
        }
    }

    public static class Builder {
        private int statusCode;
        private List<Header> headers;
        private byte[] body;
        private Duration responseTime;

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder headers(List<Header> headers) {
            this.headers = headers != null ? new ArrayList<>(headers) : null;
            return this;
        }

        public Builder addHeader(String name, String value) {
            if (this.headers == null) {
                this.headers = new ArrayList<>();
            }
            this.headers.add(new Header(name, value));
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder body(String body) {
            this.body = body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
            return this;
        }

        public Builder responseTime(Duration responseTime) {
            this.responseTime = responseTime;
            return this;
        }

        public ProbeResponse build() {
            return new ProbeResponse(this);
        }
    }
}
