package engine.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import engine.ScanException;
import engine.flow.FlowExecutor;
import engine.flow.FlowParser;
import engine.http.NetworkClient;
import engine.http.RawSocketClient;
import engine.matcher.MatcherException;
import engine.matcher.MatcherParser;
import engine.matcher.MatcherType;
import model.Severity;
import model.TemplateMetadata;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Движок YAML шаблонов.
 *
 * <p>Метаданные задаются полями верхнего уровня ({@code id}, {@code name}, {@code author},
 * {@code severity}, ...). Проверки описываются секциями {@code http}, {@code network}
 * и {@code flows}; матчеры секции перекрывают матчеры уровня шаблона.
 *
 * <pre>
 * id: exposed-git
 * name: Exposed .git directory
 * severity: medium
 * http:
 *   - method: GET
 *     path: ["/.git/HEAD"]
 *     matchers:
 *       - type: word
 *         words: ["ref: refs/"]
 * </pre>
 */
public final class YamlTemplateEngine implements TemplateEngine {
    private static final Logger logger = Logger.getLogger(YamlTemplateEngine.class.getName());

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final List<String> EXTENSIONS = List.of("yaml", "yml");

    private final NetworkClient networkClient;
    private final RawSocketClient rawSocketClient;
    private final FlowExecutor flowExecutor;

    public YamlTemplateEngine(NetworkClient networkClient) {
        this(networkClient, new RawSocketClient(), new FlowExecutor(networkClient));
    }

    public YamlTemplateEngine(NetworkClient networkClient, RawSocketClient rawSocketClient, FlowExecutor flowExecutor) {
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient cannot be null");
        this.rawSocketClient = Objects.requireNonNull(rawSocketClient, "rawSocketClient cannot be null");
        this.flowExecutor = Objects.requireNonNull(flowExecutor, "flowExecutor cannot be null");
    }

    @Override
    public String getName() {
        return "yaml";
    }

    @Override
    public List<String> getSupportedExtensions() {
        return EXTENSIONS;
    }

    @Override
    public Template loadTemplate(Path path) throws ScanException {
        logger.fine("Loading YAML template: " + path);

        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new ScanException(ScanException.ErrorType.TEMPLATE,
                "Failed to read template " + path + ": " + e.getMessage(), e);
        }
        return parse(root, path);
    }

    /**
     * Строит шаблон из уже разобранного дерева YAML/JSON.
     *
     * @param root корневой узел шаблона
     * @param source путь к файлу шаблона или null
     * @throws ScanException типа TEMPLATE_VALIDATION при структурных ошибках
     */
    public Template parse(JsonNode root, Path source) throws ScanException {
        if (root == null || !root.isObject()) {
            throw invalid(source, "template root must be a mapping");
        }

        TemplateMetadata metadata = parseMetadata(root, source);
        String where = metadata.getId();

        try {
            List<YamlTemplate.HttpRequestSpec> http = root.has("http")
                ? parseHttpRequests(root.get("http"), where)
                : null;
            List<YamlTemplate.NetworkRequestSpec> network = root.has("network")
                ? parseNetworkRequests(root.get("network"), where)
                : null;

            return new YamlTemplate(
                metadata,
                http,
                network,
                root.has("matchers") ? MatcherParser.parseList(root.get("matchers")) : null,
                MatcherParser.parseCondition(root.get("matchers-condition"), null),
                root.has("flows") ? FlowParser.parseList(root.get("flows")) : null,
                networkClient,
                rawSocketClient,
                flowExecutor);
        } catch (MatcherException e) {
            throw invalid(source, "template " + where + ": " + e.getMessage());
        }
    }

    private static TemplateMetadata parseMetadata(JsonNode root, Path source) throws ScanException {
        String id = text(root, "id");
        if (id == null || id.isBlank()) {
            throw invalid(source, "template is missing 'id'");
        }

        TemplateMetadata.Builder builder = TemplateMetadata.builder()
            .id(id)
            .name(text(root, "name"))
            .description(text(root, "description"))
            .cveIds(stringList(root.get("cve_ids")))
            .cweIds(stringList(root.get("cwe_ids")))
            .tags(stringList(root.get("tags")))
            .language(text(root, "language"))
            .version(text(root, "version"))
            .filePath(source);

        JsonNode author = root.get("author");
        if (author != null && author.isObject()) {
            builder.author(new TemplateMetadata.Author(
                author.path("name").asText("unknown"), text(author, "email"), text(author, "github")));
        } else if (author != null && !author.isNull()) {
            builder.author(author.asText());
        }

        String severity = text(root, "severity");
        if (severity != null) {
            try {
                builder.severity(Severity.fromName(severity));
            } catch (IllegalArgumentException e) {
                throw invalid(source, e.getMessage());
            }
        }

        JsonNode cvss = root.get("cvss_score");
        if (cvss != null && cvss.isNumber()) {
            builder.cvssScore(cvss.asDouble());
        }
        JsonNode confidence = root.get("confidence");
        if (confidence != null && confidence.canConvertToInt()) {
            builder.confidence(confidence.asInt());
        }
        return builder.build();
    }

    private static List<YamlTemplate.HttpRequestSpec> parseHttpRequests(JsonNode node, String where)
            throws ScanException, MatcherException {
        if (!node.isArray()) {
            throw invalid(null, "template " + where + ": 'http' must be a list");
        }
        List<YamlTemplate.HttpRequestSpec> specs = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode path = item.get("path");
            List<String> paths = path == null || path.isNull()
                ? List.of("/")
                : path.isArray() ? stringList(path) : List.of(path.asText());

            specs.add(new YamlTemplate.HttpRequestSpec(
                item.path("method").asText("GET"),
                paths,
                stringMap(item.get("headers")),
                text(item, "body"),
                item.has("matchers") ? MatcherParser.parseList(item.get("matchers")) : null,
                MatcherParser.parseCondition(item.get("matchers-condition"), null)));
        }
        return specs;
    }

    private static List<YamlTemplate.NetworkRequestSpec> parseNetworkRequests(JsonNode node, String where)
            throws ScanException, MatcherException {
        if (!node.isArray()) {
            throw invalid(null, "template " + where + ": 'network' must be a list");
        }
        List<YamlTemplate.NetworkRequestSpec> specs = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode port = item.get("port");
            if (port == null || !port.canConvertToInt() || port.asInt() < 1 || port.asInt() > 65535) {
                throw invalid(null, "template " + where + ": network request needs a valid 'port'");
            }
            specs.add(new YamlTemplate.NetworkRequestSpec(
                item.path("protocol").asText("tcp"),
                port.asInt(),
                stringList(item.get("payloads")),
                item.has("matchers") ? MatcherParser.parseList(item.get("matchers")) : null,
                MatcherParser.parseCondition(item.get("matchers-condition"), null)));
        }
        return specs;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            return List.of(node.asText());
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue().asText()));
        return values;
    }

    private static ScanException invalid(Path source, String reason) {
        String prefix = source != null ? source + ": " : "";
        return new ScanException(ScanException.ErrorType.TEMPLATE_VALIDATION, prefix + reason);
    }
}
