package cli;

import engine.ScanEngine;
import engine.ScanException;
import engine.ScanJob;
import engine.config.ConfigLoader;
import engine.config.EngineConfig;
import engine.template.Template;
import engine.template.TemplateFilter;
import model.ScanResults;
import model.Severity;
import model.Target;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import util.TargetParser;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Главная точка входа CLI движка сканирования по шаблонам.
 *
 * <p>Примеры использования:
 * <pre>
 * # Сканирование одной цели шаблонами из каталога
 * template-scan -t ./templates https://example.com
 *
 * # Несколько целей, только критичные и высокие шаблоны, JSON отчет в файл
 * template-scan -t ./templates -s critical,high -f json -o report.json 10.0.0.5:8080 example.org
 *
 * # Конфигурация из файла и stealth режим
 * template-scan -c engine.yaml --stealth example.com
 * </pre>
 *
 * <p>Коды возврата: 0 - находок уровня critical/high нет, 3 - такие находки есть,
 * 1 - ошибка входных данных или конфигурации, 99 - непредвиденная ошибка.
 */
@Command(
    name = "template-scan",
    description = "Сканирование целей на уязвимости по декларативным шаблонам",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT"
)
public class TemplateScanCli implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(TemplateScanCli.class.getName());

    @Parameters(
        arity = "1..*",
        description = "Targets: URL (https://host:8443), host:port or host"
    )
    private List<String> targets;

    @Option(
        names = {"-t", "--templates"},
        description = "Template directory (repeatable, earlier directories win on duplicate ids)"
    )
    private List<Path> templateDirs = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Engine configuration file (YAML or JSON)"
    )
    private Path configFile;

    @Option(
        names = {"--id"},
        split = ",",
        description = "Only run templates with these ids"
    )
    private List<String> templateIds = new ArrayList<>();

    @Option(
        names = {"--exclude-id"},
        split = ",",
        description = "Skip templates whose id contains any of these values"
    )
    private List<String> excludeIds = new ArrayList<>();

    @Option(
        names = {"--tags"},
        split = ",",
        description = "Only run templates having at least one of these tags"
    )
    private List<String> tags = new ArrayList<>();

    @Option(
        names = {"-s", "--severity"},
        split = ",",
        description = "Only run templates of these severities: info, low, medium, high, critical"
    )
    private List<String> severities = new ArrayList<>();

    @Option(
        names = {"--threads"},
        description = "Worker threads for template execution"
    )
    private Integer threads;

    @Option(
        names = {"--parallel-targets"},
        description = "Maximum number of targets scanned concurrently"
    )
    private Integer parallelTargets;

    @Option(
        names = {"--parallel-templates"},
        description = "Maximum number of templates run concurrently per target"
    )
    private Integer parallelTemplates;

    @Option(
        names = {"--timeout"},
        description = "Network timeout, e.g. 10s or 500ms"
    )
    private String timeout;

    @Option(
        names = {"--template-timeout"},
        description = "Timeout of a single template execution, e.g. 30s"
    )
    private String templateTimeout;

    @Option(
        names = {"--rate-limit"},
        description = "Maximum requests per second (0 disables the limit)"
    )
    private Integer rateLimit;

    @Option(
        names = {"--retries"},
        description = "Retries for failed requests"
    )
    private Integer retries;

    @Option(
        names = {"--proxy"},
        description = "HTTP proxy URL, e.g. http://127.0.0.1:8080"
    )
    private String proxy;

    @Option(
        names = {"--no-verify-ssl"},
        description = "Disable TLS certificate verification (for testing only!)"
    )
    private boolean noVerifySsl;

    @Option(
        names = {"--stealth"},
        description = "Add a random delay before each request"
    )
    private boolean stealth;

    @Option(
        names = {"--safe"},
        description = "Safe mode flag passed to templates"
    )
    private boolean safe;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: console, json (default: console)"
    )
    private String format;

    @Option(
        names = {"-o", "--output"},
        description = "Output file for the report (optional, defaults to stdout)"
    )
    private String outputFile;

    @Option(
        names = {"-nc", "--no-color"},
        description = "Disable colored output"
    )
    private boolean noColor;

    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose;

    private PrintWriter out = new PrintWriter(System.out, true);

    @Override
    public Integer call() {
        if (verbose) {
            Logger.getLogger("").setLevel(Level.FINE);
            Logger.getLogger("engine").setLevel(Level.FINE);
        }

        List<Target> parsedTargets = new ArrayList<>();
        try {
            for (String target : targets) {
                parsedTargets.add(TargetParser.parseTarget(target));
            }
        } catch (IllegalArgumentException e) {
            out.println("ERROR: " + e.getMessage());
            return 1;
        }

        EngineConfig config;
        TemplateFilter filter;
        try {
            config = buildConfig();
            filter = buildFilter();
        } catch (ScanException | IllegalArgumentException e) {
            out.println("ERROR: " + e.getMessage());
            return 1;
        }

        if (config.getTemplates().getDirectories().isEmpty()) {
            out.println("ERROR: No template directories. Use --templates or the 'templates' config section.");
            return 1;
        }

        try (ScanEngine engine = new ScanEngine(config)) {
            if (verbose) {
                engine.addListener(new ConsoleProgressListener(out));
            }
            engine.getListeners().discover();

            List<Template> templates = engine.loadTemplates();
            ScanJob job = engine.createScanJob(parsedTargets, templates).filterTemplates(filter);
            if (job.getTemplates().isEmpty()) {
                out.println("ERROR: No templates match the given filters.");
                return 1;
            }
            if (verbose) {
                out.println("Scanning " + job.getTargets().size() + " targets with "
                    + job.getTemplates().size() + " templates");
            }

            ScanResults results = engine.executeScan(job);
            writeReport(results);
            return results.hasCriticalOrHigh() ? 3 : 0;
        } catch (ScanException e) {
            out.println("ERROR: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Unexpected error", e);
            out.println("ERROR: Unexpected error occurred: " + e.getMessage());
            if (verbose) {
                e.printStackTrace(out);
            }
            return 99;
        }
    }

    EngineConfig buildConfig() throws ScanException {
        EngineConfig base = configFile != null ? ConfigLoader.load(configFile) : EngineConfig.defaults();

        EngineConfig.NetworkSettings.Builder network = base.getNetwork().toBuilder();
        if (timeout != null) {
            network.timeout(TargetParser.parseDuration(timeout));
        }
        if (rateLimit != null) {
            network.rateLimit(rateLimit > 0 ? rateLimit : null);
        }
        if (proxy != null) {
            network.proxy(proxy);
        }
        if (noVerifySsl) {
            network.verifyTls(false);
        }

        EngineConfig.ExecutionSettings.Builder execution = base.getExecution().toBuilder();
        if (threads != null) {
            execution.threads(threads);
        }
        if (parallelTargets != null) {
            execution.parallelTargets(parallelTargets);
        }
        if (parallelTemplates != null) {
            execution.parallelTemplates(parallelTemplates);
        }
        if (retries != null) {
            execution.maxRetries(retries);
        }
        if (stealth) {
            execution.stealthMode(true);
        }
        if (safe) {
            execution.safeMode(true);
        }

        EngineConfig.TemplateSettings.Builder templateSettings = base.getTemplates().toBuilder();
        if (!templateDirs.isEmpty()) {
            templateSettings.directories(new ArrayList<>(templateDirs));
        }
        if (templateTimeout != null) {
            Duration parsed = TargetParser.parseDuration(templateTimeout);
            templateSettings.timeout(parsed);
        }

        EngineConfig config = base.toBuilder()
            .network(network.build())
            .execution(execution.build())
            .templates(templateSettings.build())
            .build();
        config.validate();
        return config;
    }

    TemplateFilter buildFilter() {
        List<Severity> parsedSeverities = new ArrayList<>();
        for (String severity : severities) {
            parsedSeverities.add(Severity.fromName(severity));
        }
        return TemplateFilter.builder()
            .ids(templateIds)
            .excludeIds(excludeIds)
            .tags(tags)
            .severities(parsedSeverities)
            .build();
    }

    private void writeReport(ScanResults results) throws IOException {
        boolean json = format != null && format.equalsIgnoreCase("json");

        if (outputFile != null) {
            try (PrintWriter fileWriter = new PrintWriter(new FileWriter(outputFile))) {
                if (json) {
                    new JsonResultWriter().write(results, fileWriter);
                } else {
                    new ResultFormatter(fileWriter, false).printResults(results);
                }
            }
            out.println("Report written to: " + outputFile);
        } else if (json) {
            new JsonResultWriter().write(results, out);
        } else {
            new ResultFormatter(out, !noColor).printResults(results);
        }
    }

    void setOut(PrintWriter out) {
        this.out = out;
    }

    private static void configureLogging() {
        try (InputStream config = TemplateScanCli.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("WARNING: Failed to load logging configuration: " + e.getMessage());
        }
    }

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new TemplateScanCli()).execute(args);
        System.exit(exitCode);
    }
}
