package engine;

import engine.config.EngineConfig;
import engine.execution.Executor;
import engine.execution.PrioritizedTemplate;
import engine.execution.ResourceManager;
import engine.execution.Scheduler;
import engine.http.HttpClientFactory;
import engine.http.NetworkClient;
import engine.session.SessionManager;
import engine.template.Template;
import engine.template.TemplateEngine;
import engine.template.TemplateLoader;
import engine.template.YamlTemplateEngine;
import model.Finding;
import model.ScanContext;
import model.ScanResults;
import model.Target;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Точка входа движка сканирования.
 *
 * <p>Связывает конфигурацию, сетевой клиент, загрузку шаблонов, планировщик и исполнитель:
 * <ol>
 *   <li>{@link #loadTemplates()} загружает шаблоны из настроенных каталогов</li>
 *   <li>{@link #createScanJob(List, List)} создает задание с контекстом из конфигурации</li>
 *   <li>{@link #executeScan(ScanJob)} выполняет задание и собирает {@link ScanResults}</li>
 * </ol>
 */
public final class ScanEngine implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ScanEngine.class.getName());

    private final EngineConfig config;
    private final NetworkClient networkClient;
    private final TemplateLoader templateLoader;
    private final Scheduler scheduler = new Scheduler();
    private final Executor executor;
    private final ResourceManager resourceManager;
    private final ScanListenerRegistry listeners = new ScanListenerRegistry();

    /**
     * Создает движок со стандартным HTTP клиентом и YAML движком шаблонов.
     *
     * @throws ScanException типа CONFIG при некорректной конфигурации
     */
    public ScanEngine(EngineConfig config) throws ScanException {
        this(validated(config), new NetworkClient(
            HttpClientFactory.createClient(config.getNetwork()), config, new SessionManager()));
    }

    public ScanEngine(EngineConfig config, NetworkClient networkClient) throws ScanException {
        this(validated(config), networkClient, List.of(new YamlTemplateEngine(networkClient)));
    }

    public ScanEngine(EngineConfig config, NetworkClient networkClient, List<TemplateEngine> engines)
            throws ScanException {
        this.config = validated(config);
        this.networkClient = Objects.requireNonNull(networkClient, "networkClient cannot be null");
        this.templateLoader = new TemplateLoader(engines);
        this.executor = new Executor(config);
        this.resourceManager = ResourceManager.from(config);
        logger.info("Scan engine initialized: threads=" + config.getExecution().getThreads()
            + ", parallelTargets=" + config.getExecution().getParallelTargets()
            + ", parallelTemplates=" + config.getExecution().getParallelTemplates());
    }

    private static EngineConfig validated(EngineConfig config) throws ScanException {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        return config;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public NetworkClient getNetworkClient() {
        return networkClient;
    }

    public TemplateLoader getTemplateLoader() {
        return templateLoader;
    }

    public ResourceManager getResourceManager() {
        return resourceManager;
    }

    public ScanListenerRegistry getListeners() {
        return listeners;
    }

    public void addListener(ScanListener listener) {
        listeners.register(listener);
    }

    /**
     * Загружает шаблоны из каталогов конфигурации. Отсутствующие каталоги пропускаются;
     * при повторе идентификатора остается шаблон из более раннего каталога.
     */
    public List<Template> loadTemplates() throws ScanException {
        List<Path> existing = new ArrayList<>();
        for (Path directory : config.getTemplates().getDirectories()) {
            if (Files.isDirectory(directory)) {
                existing.add(directory);
            } else {
                logger.fine("Template directory does not exist: " + directory);
            }
        }

        List<Template> templates = templateLoader.loadFromDirectories(existing);
        if (templates.isEmpty()) {
            logger.warning("No templates found in " + config.getTemplates().getDirectories());
        }
        return templates;
    }

    /**
     * Создает задание с новым идентификатором и режимами из конфигурации.
     */
    public ScanJob createScanJob(List<Target> targets, List<Template> templates) {
        EngineConfig.ExecutionSettings execution = config.getExecution();
        ScanContext context = ScanContext.builder()
            .scanId(UUID.randomUUID().toString())
            .aggressiveMode(execution.isAggressiveMode())
            .stealthMode(execution.isStealthMode())
            .passiveMode(execution.isPassiveMode())
            .safeMode(execution.isSafeMode())
            .maxRetries(execution.getMaxRetries())
            .timeout(config.getNetwork().getTimeout())
            .rateLimit(config.getNetwork().getRateLimit().orElse(null))
            .build();
        return new ScanJob(targets, templates, context);
    }

    /**
     * Выполняет задание: шаблоны запускаются в порядке приоритета планировщика,
     * ошибки отдельных пар (шаблон, цель) попадают в результаты и не прерывают сканирование.
     */
    public ScanResults executeScan(ScanJob job) {
        logger.info("Starting scan " + job.getId() + " with " + job.getTargets().size() + " targets and "
            + job.getTemplates().size() + " templates");

        ScanResults results = new ScanResults(job.getId());
        listeners.onScanStart(job);

        List<Template> ordered = scheduledOrder(job);
        Executor.ExecutionResult execution = executor.execute(job.getTargets(), ordered, job.getContext(), listeners);

        for (Finding finding : execution.findings()) {
            results.addFinding(finding);
        }
        execution.errors().forEach(results::addError);
        results.complete(job.getTargets().size(), job.getTemplates().size(),
            networkClient.getRequestCount(), networkClient.getBytesReceived());

        logger.info("Scan " + job.getId() + " completed. Found " + results.getFindings().size() + " findings, "
            + results.getErrors().size() + " errors");
        listeners.onScanComplete(results);
        return results;
    }

    private List<Template> scheduledOrder(ScanJob job) {
        Map<String, Deque<Template>> byId = new HashMap<>();
        for (Template template : job.getTemplates()) {
            byId.computeIfAbsent(template.getId(), id -> new ArrayDeque<>()).add(template);
        }

        List<PrioritizedTemplate> queue;
        synchronized (scheduler) {
            scheduler.scheduleJob(job);
            queue = scheduler.drain();
        }

        List<Template> ordered = new ArrayList<>(job.getTemplates().size());
        for (PrioritizedTemplate entry : queue) {
            Deque<Template> candidates = byId.get(entry.templateId());
            if (candidates != null && !candidates.isEmpty()) {
                ordered.add(candidates.poll());
            }
        }
        return ordered;
    }

    @Override
    public void close() {
        executor.close();
        networkClient.close();
    }
}
