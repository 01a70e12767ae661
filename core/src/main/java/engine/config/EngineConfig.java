package engine.config;

import engine.ScanException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.*;

/**
 * Конфигурация движка сканирования: сеть, выполнение, шаблоны и ограничения ресурсов.
 *
 * <p>Значения по умолчанию соответствуют {@link #defaults()}. Конструирование не проверяет
 * корректность значений: проверка выполняется в {@link #validate()} перед запуском сканирования.
 */
public final class EngineConfig {
    private final NetworkSettings network;
    private final ExecutionSettings execution;
    private final TemplateSettings templates;
    private final SandboxSettings sandbox;

    private EngineConfig(Builder builder) {
        this.network = builder.network != null ? builder.network : NetworkSettings.builder().build();
        this.execution = builder.execution != null ? builder.execution : ExecutionSettings.builder().build();
        this.templates = builder.templates != null ? builder.templates : TemplateSettings.builder().build();
        this.sandbox = builder.sandbox != null ? builder.sandbox : SandboxSettings.builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public NetworkSettings getNetwork() {
        return network;
    }

    public ExecutionSettings getExecution() {
        return execution;
    }

    public TemplateSettings getTemplates() {
        return templates;
    }

    public SandboxSettings getSandbox() {
        return sandbox;
    }

    /**
     * Проверяет значения, без которых сканирование невозможно.
     *
     * @throws ScanException с типом CONFIG при некорректном значении
     */
    public void validate() throws ScanException {
        if (execution.getThreads() <= 0) {
            throw new ScanException(ScanException.ErrorType.CONFIG, "Thread count must be greater than 0");
        }
        if (execution.getParallelTargets() <= 0) {
            throw new ScanException(ScanException.ErrorType.CONFIG, "Parallel targets must be greater than 0");
        }
        if (network.getTimeout().isZero() || network.getTimeout().isNegative()) {
            throw new ScanException(ScanException.ErrorType.CONFIG, "Timeout must be greater than 0");
        }
    }

    public Builder toBuilder() {
        return new Builder()
            .network(network)
            .execution(execution)
            .templates(templates)
            .sandbox(sandbox);
    }

    public static class Builder {
        private NetworkSettings network;
        private ExecutionSettings execution;
        private TemplateSettings templates;
        private SandboxSettings sandbox;

        public Builder network(NetworkSettings network) {
            this.network = network;
            return this;
        }

        public Builder execution(ExecutionSettings execution) {
            this.execution = execution;
            return this;
        }

        public Builder templates(TemplateSettings templates) {
            this.templates = templates;
            return this;
        }

        public Builder sandbox(SandboxSettings sandbox) {
            this.sandbox = sandbox;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    /**
     * Сетевые настройки HTTP и raw-socket клиентов.
     */
    public static final class NetworkSettings {
        public static final String DEFAULT_USER_AGENT = "template-scan-engine/1.0";

        private final Duration timeout;
        private final String userAgent;
        private final boolean followRedirects;
        private final int maxRedirects;
        private final int connectionPoolSize;
        private final Integer rateLimit;
        private final String proxy;
        private final boolean verifyTls;

        private NetworkSettings(Builder builder) {
            this.timeout = builder.timeout;
            this.userAgent = builder.userAgent;
            this.followRedirects = builder.followRedirects;
            this.maxRedirects = builder.maxRedirects;
            this.connectionPoolSize = builder.connectionPoolSize;
            this.rateLimit = builder.rateLimit;
            this.proxy = builder.proxy;
            this.verifyTls = builder.verifyTls;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Builder toBuilder() {
            return new Builder()
                .timeout(timeout)
                .userAgent(userAgent)
                .followRedirects(followRedirects)
                .maxRedirects(maxRedirects)
                .connectionPoolSize(connectionPoolSize)
                .rateLimit(rateLimit)
                .proxy(proxy)
                .verifyTls(verifyTls);
        }

        public Duration getTimeout() {
            return timeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public boolean isFollowRedirects() {
            return followRedirects;
        }

        public int getMaxRedirects() {
            return maxRedirects;
        }

        public int getConnectionPoolSize() {
            return connectionPoolSize;
        }

        /**
         * @return лимит запросов в секунду; пусто или 0 означает отсутствие ограничения
         */
        public Optional<Integer> getRateLimit() {
            return Optional.ofNullable(rateLimit);
        }

        public Optional<String> getProxy() {
            return Optional.ofNullable(proxy);
        }

        public boolean isVerifyTls() {
            return verifyTls;
        }

        public static class Builder {
            private Duration timeout = Duration.ofSeconds(10);
            private String userAgent = DEFAULT_USER_AGENT;
            private boolean followRedirects = true;
            private int maxRedirects = 5;
            private int connectionPoolSize = 100;
            private Integer rateLimit = 100;
            private String proxy;
            private boolean verifyTls = true;

            public Builder timeout(Duration timeout) {
                this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
                return this;
            }

            public Builder userAgent(String userAgent) {
                this.userAgent = Objects.requireNonNull(userAgent, "userAgent cannot be null");
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

            public Builder connectionPoolSize(int connectionPoolSize) {
                this.connectionPoolSize = connectionPoolSize;
                return this;
            }

            public Builder rateLimit(Integer rateLimit) {
                this.rateLimit = rateLimit;
                return this;
            }

            public Builder proxy(String proxy) {
                this.proxy = proxy;
                return this;
            }

            public Builder verifyTls(boolean verifyTls) {
                this.verifyTls = verifyTls;
                return this;
            }

            public NetworkSettings build() {
                return new NetworkSettings(this);
            }
        }
    }

    /**
     * Параметры параллелизма, повторов и режимов сканирования.
     */
    public static final class ExecutionSettings {
        private final int threads;
        private final int parallelTargets;
        private final int parallelTemplates;
        private final int maxRetries;
        private final Duration retryDelay;
        private final boolean aggressiveMode;
        private final boolean stealthMode;
        private final boolean passiveMode;
        private final boolean safeMode;

        private ExecutionSettings(Builder builder) {
            this.threads = builder.threads;
            this.parallelTargets = builder.parallelTargets;
            this.parallelTemplates = builder.parallelTemplates;
            this.maxRetries = builder.maxRetries;
            this.retryDelay = builder.retryDelay;
            this.aggressiveMode = builder.aggressiveMode;
            this.stealthMode = builder.stealthMode;
            this.passiveMode = builder.passiveMode;
            this.safeMode = builder.safeMode;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Builder toBuilder() {
            return new Builder()
                .threads(threads)
                .parallelTargets(parallelTargets)
                .parallelTemplates(parallelTemplates)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .aggressiveMode(aggressiveMode)
                .stealthMode(stealthMode)
                .passiveMode(passiveMode)
                .safeMode(safeMode);
        }

        public int getThreads() {
            return threads;
        }

        public int getParallelTargets() {
            return parallelTargets;
        }

        public int getParallelTemplates() {
            return parallelTemplates;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public Duration getRetryDelay() {
            return retryDelay;
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

        public static class Builder {
            private int threads = Runtime.getRuntime().availableProcessors();
            private int parallelTargets = 50;
            private int parallelTemplates = 10;
            private int maxRetries = 1;
            private Duration retryDelay = Duration.ofSeconds(1);
            private boolean aggressiveMode;
            private boolean stealthMode;
            private boolean passiveMode;
            private boolean safeMode;

            public Builder threads(int threads) {
                this.threads = threads;
                return this;
            }

            public Builder parallelTargets(int parallelTargets) {
                this.parallelTargets = parallelTargets;
                return this;
            }

            public Builder parallelTemplates(int parallelTemplates) {
                this.parallelTemplates = parallelTemplates;
                return this;
            }

            public Builder maxRetries(int maxRetries) {
                this.maxRetries = maxRetries;
                return this;
            }

            public Builder retryDelay(Duration retryDelay) {
                this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay cannot be null");
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

            public ExecutionSettings build() {
                return new ExecutionSettings(this);
            }
        }
    }

    /**
     * Каталоги шаблонов и таймаут выполнения одного шаблона.
     */
    public static final class TemplateSettings {
        private final List<Path> directories;
        private final Duration timeout;

        private TemplateSettings(Builder builder) {
            this.directories = builder.directories != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.directories))
                : Collections.emptyList();
            this.timeout = builder.timeout;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Builder toBuilder() {
            return new Builder()
                .directories(new ArrayList<>(directories))
                .timeout(timeout);
        }

        public List<Path> getDirectories() {
            return directories;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public static class Builder {
            private List<Path> directories;
            private Duration timeout = Duration.ofSeconds(30);

            public Builder directories(List<Path> directories) {
                this.directories = directories;
                return this;
            }

            public Builder addDirectory(Path directory) {
                if (this.directories == null) {
                    this.directories = new ArrayList<>();
                }
                this.directories.add(directory);
                return this;
            }

            public Builder timeout(Duration timeout) {
                this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
                return this;
            }

            public TemplateSettings build() {
                return new TemplateSettings(this);
            }
        }
    }

    /**
     * Ограничения ресурсов для выполнения шаблонов.
     */
    public static final class SandboxSettings {
        private final boolean enabled;
        private final int memoryLimitMb;
        private final int cpuLimitPercent;

        private SandboxSettings(Builder builder) {
            this.enabled = builder.enabled;
            this.memoryLimitMb = builder.memoryLimitMb;
            this.cpuLimitPercent = builder.cpuLimitPercent;
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean isEnabled() {
            return enabled;
        }

        public int getMemoryLimitMb() {
            return memoryLimitMb;
        }

        public int getCpuLimitPercent() {
            return cpuLimitPercent;
        }

        public static class Builder {
            private boolean enabled = true;
            private int memoryLimitMb = 512;
            private int cpuLimitPercent = 80;

            public Builder enabled(boolean enabled) {
                this.enabled = enabled;
                return this;
            }

            public Builder memoryLimitMb(int memoryLimitMb) {
                this.memoryLimitMb = memoryLimitMb;
                return this;
            }

            public Builder cpuLimitPercent(int cpuLimitPercent) {
                this.cpuLimitPercent = cpuLimitPercent;
                return this;
            }

            public SandboxSettings build() {
                return new SandboxSettings(this);
            }
        }
    }
}
