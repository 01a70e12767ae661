package engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import engine.ScanException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Загружает {@link EngineConfig} из YAML или JSON файла.
 *
 * <p>Формат определяется расширением ({@code .yaml}, {@code .yml}, {@code .json}).
 * Отсутствующие поля получают значения по умолчанию, неизвестные секции игнорируются.
 */
public final class ConfigLoader {
    private static final Logger logger = Logger.getLogger(ConfigLoader.class.getName());

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> KNOWN_SECTIONS = Set.of("network", "execution", "templates", "sandbox");

    private ConfigLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Загружает конфигурацию из файла.
     *
     * @throws ScanException с типом CONFIG, если файл не читается, формат не поддерживается
     *                       или содержимое некорректно
     */
    public static EngineConfig load(Path file) throws ScanException {
        Objects.requireNonNull(file, "file cannot be null");

        ObjectMapper mapper = mapperFor(file);
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (IOException e) {
            throw new ScanException(ScanException.ErrorType.CONFIG,
                "Failed to read config file " + file + ": " + e.getMessage(), e);
        }

        EngineConfig config = fromTree(root);
        logger.fine("Loaded engine configuration from " + file);
        return config;
    }

    /**
     * Строит конфигурацию из уже разобранного дерева.
     */
    public static EngineConfig fromTree(JsonNode root) throws ScanException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return EngineConfig.defaults();
        }
        if (!root.isObject()) {
            throw new ScanException(ScanException.ErrorType.CONFIG, "Config root must be a mapping");
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_SECTIONS.contains(name)) {
                logger.fine("Ignoring unknown config section: " + name);
            }
        }

        try {
            return EngineConfig.builder()
                .network(parseNetwork(root.path("network")))
                .execution(parseExecution(root.path("execution")))
                .templates(parseTemplates(root.path("templates")))
                .sandbox(parseSandbox(root.path("sandbox")))
                .build();
        } catch (IllegalArgumentException e) {
            throw new ScanException(ScanException.ErrorType.CONFIG, "Invalid config value: " + e.getMessage(), e);
        }
    }

    private static ObjectMapper mapperFor(Path file) throws ScanException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML_MAPPER;
        }
        if (name.endsWith(".json")) {
            return JSON_MAPPER;
        }
        throw new ScanException(ScanException.ErrorType.CONFIG, "Unsupported config file format: " + file);
    }

    private static EngineConfig.NetworkSettings parseNetwork(JsonNode node) {
        EngineConfig.NetworkSettings.Builder builder = EngineConfig.NetworkSettings.builder();
        if (node.has("timeout_secs")) {
            builder.timeout(Duration.ofSeconds(node.get("timeout_secs").asLong()));
        }
        if (node.hasNonNull("user_agent")) {
            builder.userAgent(node.get("user_agent").asText());
        }
        if (node.has("follow_redirects")) {
            builder.followRedirects(node.get("follow_redirects").asBoolean());
        }
        if (node.has("max_redirects")) {
            builder.maxRedirects(node.get("max_redirects").asInt());
        }
        if (node.has("connection_pool_size")) {
            builder.connectionPoolSize(node.get("connection_pool_size").asInt());
        }
        if (node.has("rate_limit")) {
            JsonNode rate = node.get("rate_limit");
            builder.rateLimit(rate.isNull() ? null : rate.asInt());
        }
        if (node.hasNonNull("proxy")) {
            builder.proxy(node.get("proxy").asText());
        }
        if (node.has("verify_tls")) {
            builder.verifyTls(node.get("verify_tls").asBoolean());
        }
        return builder.build();
    }

    private static EngineConfig.ExecutionSettings parseExecution(JsonNode node) {
        EngineConfig.ExecutionSettings.Builder builder = EngineConfig.ExecutionSettings.builder();
        if (node.has("threads")) {
            builder.threads(node.get("threads").asInt());
        }
        if (node.has("parallel_targets")) {
            builder.parallelTargets(node.get("parallel_targets").asInt());
        }
        if (node.has("parallel_templates")) {
            builder.parallelTemplates(node.get("parallel_templates").asInt());
        }
        if (node.has("max_retries")) {
            builder.maxRetries(node.get("max_retries").asInt());
        }
        if (node.has("retry_delay_secs")) {
            builder.retryDelay(Duration.ofSeconds(node.get("retry_delay_secs").asLong()));
        }
        return builder
            .aggressiveMode(node.path("aggressive_mode").asBoolean(false))
            .stealthMode(node.path("stealth_mode").asBoolean(false))
            .passiveMode(node.path("passive_mode").asBoolean(false))
            .safeMode(node.path("safe_mode").asBoolean(false))
            .build();
    }

    private static EngineConfig.TemplateSettings parseTemplates(JsonNode node) {
        EngineConfig.TemplateSettings.Builder builder = EngineConfig.TemplateSettings.builder();
        for (JsonNode dir : node.path("directories")) {
            builder.addDirectory(Paths.get(dir.asText()));
        }
        if (node.has("timeout_secs")) {
            builder.timeout(Duration.ofSeconds(node.get("timeout_secs").asLong()));
        }
        return builder.build();
    }

    private static EngineConfig.SandboxSettings parseSandbox(JsonNode node) {
        EngineConfig.SandboxSettings.Builder builder = EngineConfig.SandboxSettings.builder();
        if (node.has("enabled")) {
            builder.enabled(node.get("enabled").asBoolean());
        }
        if (node.has("memory_limit_mb")) {
            builder.memoryLimitMb(node.get("memory_limit_mb").asInt());
        }
        if (node.has("cpu_limit_percent")) {
            builder.cpuLimitPercent(node.get("cpu_limit_percent").asInt());
        }
        return builder.build();
    }
}
