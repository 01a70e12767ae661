package engine.flow;

import java.util.*;

/**
 * Шаг потока. Вариант определяется полем {@code action} в шаблоне.
 */
public abstract class FlowStep {

    public enum Kind {
        HTTP_REQUEST("http_request"),
        SET_VARIABLE("set_variable"),
        EXTRACT("extract"),
        CHECK("check"),
        WAIT("wait");

        private final String action;

        Kind(String action) {
            this.action = action;
        }

        public String getAction() {
            return action;
        }

        public static Optional<Kind> fromAction(String action) {
            for (Kind kind : values()) {
                if (kind.action.equals(action)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    private final Kind kind;

    private FlowStep(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind.getAction();
    }

    public static final class HttpRequest extends FlowStep {
        private final String method;
        private final String path;
        private final Map<String, String> headers;
        private final String body;
        private final String store;

        public HttpRequest(String method, String path, Map<String, String> headers, String body, String store) {
            super(Kind.HTTP_REQUEST);
            this.method = Objects.requireNonNull(method, "method cannot be null");
            this.path = Objects.requireNonNull(path, "path cannot be null");
            this.headers = headers != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(headers))
                : Collections.emptyMap();
            this.body = body;
            this.store = store;
        }

        public String getMethod() {
            return method;
        }

        public String getPath() {
            return path;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public Optional<String> getBody() {
            return Optional.ofNullable(body);
        }

        public Optional<String> getStore() {
            return Optional.ofNullable(store);
        }
    }

    public static final class SetVariable extends FlowStep {
        private final String name;
        private final String value;

        public SetVariable(String name, String value) {
            super(Kind.SET_VARIABLE);
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.value = Objects.requireNonNull(value, "value cannot be null");
        }

        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }
    }

    public static final class Extract extends FlowStep {
        private final String from;
        private final String pattern;
        private final String store;

        public Extract(String from, String pattern, String store) {
            super(Kind.EXTRACT);
            this.from = Objects.requireNonNull(from, "from cannot be null");
            this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
            this.store = Objects.requireNonNull(store, "store cannot be null");
        }

        public String getFrom() {
            return from;
        }

        public String getPattern() {
            return pattern;
        }

        public String getStore() {
            return store;
        }
    }

    public static final class Check extends FlowStep {
        private final String condition;
        private final String message;

        public Check(String condition, String message) {
            super(Kind.CHECK);
            this.condition = Objects.requireNonNull(condition, "condition cannot be null");
            this.message = message;
        }

        public String getCondition() {
            return condition;
        }

        public Optional<String> getMessage() {
            return Optional.ofNullable(message);
        }
    }

    public static final class Wait extends FlowStep {
        private final long durationMs;

        public Wait(long durationMs) {
            super(Kind.WAIT);
            if (durationMs < 0) {
                throw new IllegalArgumentException("durationMs cannot be negative: " + durationMs);
            }
            this.durationMs = durationMs;
        }

        public long getDurationMs() {
            return durationMs;
        }
    }
}
