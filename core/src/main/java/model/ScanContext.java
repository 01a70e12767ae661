package model;

import java.time.Duration;
import java.util.*;

/**
 * Политика выполнения сканирования: режимы, повторы, таймауты, порты и пользовательские переменные.
 * Создается один раз на задание и разделяется всеми параллельными выполнениями только для чтения.
 */
public final class ScanContext {
    private static final List<Integer> DEFAULT_PORTS = List.of(80, 443);

    private final String scanId;
    private final boolean aggressiveMode;
    private final boolean stealthMode;
    private final boolean passiveMode;
    private final boolean safeMode;
    private final int maxRetries;
    private final Duration timeout;
    private final Integer rateLimit;
    private final List<Integer> additionalPorts;
    private final List<Integer> overridePorts;
    private final Map<String, String> variables;

    private ScanContext(Builder builder) {
        this.scanId = builder.scanId != null ? builder.scanId : UUID.randomUUID().toString();
        this.aggressiveMode = builder.aggressiveMode;
        this.stealthMode = builder.stealthMode;
        this.passiveMode = builder.passiveMode;
        this.safeMode = builder.safeMode;
        this.maxRetries = builder.maxRetries;
        this.timeout = builder.timeout != null ? builder.timeout : Duration.ofSeconds(30);
        this.rateLimit = builder.rateLimit;
        this.additionalPorts = builder.additionalPorts != null
            ? List.copyOf(builder.additionalPorts)
            : Collections.emptyList();
        this.overridePorts = builder.overridePorts != null ? List.copyOf(builder.overridePorts) : null;
        this.variables = builder.variables != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables))
            : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ScanContext defaults() {
        return builder().build();
    }

    public String getScanId() {
        return scanId;
    }

    public boolean isAggressiveMode() {
        return aggressiveMode;
    }

    public boolean isStealthMode() {
        return stealthMode;
    }

    public boolean isPassiveMode() {
        return passiveMode;
    }

    public boolean isSafeMode() {
        return safeMode;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Optional<Integer> getRateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    public List<Integer> getAdditionalPorts() {
        return additionalPorts;
    }

    public Optional<List<Integer>> getOverridePorts() {
        return Optional.ofNullable(overridePorts);
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    /**
     * Порты для сканирования: переопределенные порты, если заданы,
     * иначе 80 и 443 вместе с дополнительными портами.
     */
    public List<Integer> portsToScan() {
        if (overridePorts != null) {
            return overridePorts;
        }
        TreeSet<Integer> ports = new TreeSet<>(DEFAULT_PORTS);
        ports.addAll(additionalPorts);
        return List.copyOf(ports);
    }

    public static class Builder {
        private String scanId;
        private boolean aggressiveMode;
        private boolean stealthMode;
        private boolean passiveMode;
        private boolean safeMode;
        private int maxRetries = 1;
        private Duration timeout;
        private Integer rateLimit;
        private List<Integer> additionalPorts;
        private List<Integer> overridePorts;
        private Map<String, String> variables;

        public Builder scanId(String scanId) {
            this.scanId = scanId;
            return this;
        }

        public Builder aggressiveMode(boolean aggressiveMode) {
            this.aggressiveMode = aggressiveMode;
            return this;
        }

        public Builder stealthMode(boolean stealthMode) {
            this.stealthMode = stealthMode;
            return this;
        }

        public Builder passiveMode(boolean passiveMode) {
            this.passiveMode = passiveMode;
            return this;
        }

        public Builder safeMode(boolean safeMode) {
            this.safeMode = safeMode;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder rateLimit(Integer rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder additionalPorts(List<Integer> additionalPorts) {
            this.additionalPorts = additionalPorts;
            return this;
        }

        public Builder overridePorts(List<Integer> overridePorts) {
            this.overridePorts = overridePorts;
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables = variables;
            return this;
        }

        public Builder addVariable(String key, String value) {
            if (this.variables == null) {
                this.variables = new LinkedHashMap<>();
            }
            this.variables.put(key, value);
            return this;
        }

        public ScanContext build() {
            return new ScanContext(this);
        }
    }
}
