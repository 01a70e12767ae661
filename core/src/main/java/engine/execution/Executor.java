package engine.execution;

import engine.ScanException;
import engine.ScanListener;
import engine.config.EngineConfig;
import engine.template.Template;
import model.Finding;
import model.ScanContext;
import model.Target;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Выполняет шаблоны против целей с ограничением параллелизма.
 *
 * <p>Не более {@code parallelTargets} целей обрабатываются одновременно; для каждой цели
 * не более {@code parallelTemplates} шаблонов выполняются одновременно. Каждое выполнение
 * шаблона ограничено таймаутом; по его истечении задача прерывается, а для пары
 * (шаблон, цель) фиксируется ошибка TIMEOUT. Ошибка одной пары не влияет на остальные.
 */
public final class Executor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Executor.class.getName());

    private final int parallelTargets;
    private final int parallelTemplates;
    private final Duration templateTimeout;
    private final ExecutorService targetPool;
    private final ExecutorService supervisorPool;
    private final ExecutorService workerPool;

    public Executor(EngineConfig config) {
        this(config.getExecution().getParallelTargets(),
            config.getExecution().getParallelTemplates(),
            config.getExecution().getThreads(),
            config.getTemplates().getTimeout());
    }

    public Executor(int parallelTargets, int parallelTemplates, int workerThreads, Duration templateTimeout) {
        if (parallelTargets <= 0 || parallelTemplates <= 0) {
            throw new IllegalArgumentException("Parallelism must be positive: targets=" + parallelTargets
                + ", templates=" + parallelTemplates);
        }
        this.parallelTargets = parallelTargets;
        this.parallelTemplates = parallelTemplates;
        this.templateTimeout = Objects.requireNonNull(templateTimeout, "templateTimeout cannot be null");

        this.targetPool = Executors.newFixedThreadPool(parallelTargets, namedThreads("scan-target"));
        this.supervisorPool = Executors.newCachedThreadPool(namedThreads("scan-supervisor"));
        // Core threads stay warm; the semaphores bound the total
        this.workerPool = new ThreadPoolExecutor(Math.max(1, workerThreads), Integer.MAX_VALUE,
            60L, TimeUnit.SECONDS, new SynchronousQueue<>(), namedThreads("scan-worker"));
    }

    /**
     * Выполняет все шаблоны против всех целей.
     *
     * @param targets цели
     * @param templates шаблоны в порядке выполнения
     * @param context контекст сканирования
     * @param listener получает каждую находку и ошибку
     * @return находки и ошибки выполнения
     */
    public ExecutionResult execute(List<Target> targets, List<Template> templates,
                                   ScanContext context, ScanListener listener) {
        logger.info("Executing " + templates.size() + " templates against " + targets.size() + " targets");

        List<Finding> findings = new ArrayList<>();
        List<String> errors = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger executed = new AtomicInteger();
        Semaphore targetPermits = new Semaphore(parallelTargets);
        List<Future<?>> targetFutures = new ArrayList<>();

        try {
            for (Target target : targets) {
                targetPermits.acquire();
                try {
                    targetFutures.add(targetPool.submit(() -> {
                        try {
                            List<Finding> targetFindings =
                                executeTemplatesForTarget(target, templates, context, listener, errors, executed);
                            if (!targetFindings.isEmpty()) {
                                logger.info("Found " + targetFindings.size() + " findings for target "
                                    + target.getAddress());
                                synchronized (findings) {
                                    findings.addAll(targetFindings);
                                }
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            logger.warning("Target " + target.getAddress() + " interrupted");
                        } finally {
                            targetPermits.release();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    targetPermits.release();
                    throw e;
                }
            }
            awaitAll(targetFutures);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            targetFutures.forEach(f -> f.cancel(true));
            errors.add("Scan interrupted");
            logger.warning("Scan execution interrupted");
        }

        synchronized (findings) {
            return new ExecutionResult(List.copyOf(findings), List.copyOf(errors), executed.get());
        }
    }

    private List<Finding> executeTemplatesForTarget(Target target, List<Template> templates, ScanContext context,
                                                    ScanListener listener, List<String> errors,
                                                    AtomicInteger executed) throws InterruptedException {
        logger.fine("Processing target: " + target.getAddress());

        Semaphore templatePermits = new Semaphore(parallelTemplates);
        List<Future<List<Finding>>> futures = new ArrayList<>();
        List<Finding> targetFindings = new ArrayList<>();

        try {
            for (Template template : templates) {
                templatePermits.acquire();
                try {
                    futures.add(supervisorPool.submit(() -> {
                        try {
                            return runTemplate(template, target, context, listener, errors, executed);
                        } finally {
                            templatePermits.release();
                        }
                    }));
                } catch (RejectedExecutionException e) {
                    templatePermits.release();
                    throw e;
                }
            }

            for (Future<List<Finding>> future : futures) {
                try {
                    targetFindings.addAll(future.get());
                } catch (ExecutionException e) {
                    // runTemplate reports its own failures; anything here is a bug
                    logger.log(Level.SEVERE, "Unexpected failure supervising template for " + target, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }
        return targetFindings;
    }

    private List<Finding> runTemplate(Template template, Target target, ScanContext context,
                                      ScanListener listener, List<String> errors, AtomicInteger executed) {
        String templateId = template.getId();
        logger.fine("Executing template " + templateId + " against target " + target.getAddress());

        Future<List<Finding>> work = workerPool.submit(() -> template.execute(target, context));
        try {
            List<Finding> result = work.get(templateTimeout.toMillis(), TimeUnit.MILLISECONDS);
            executed.incrementAndGet();
            if (!result.isEmpty()) {
                logger.info("Template " + templateId + " found " + result.size() + " findings for "
                    + target.getAddress());
                result.forEach(listener::onFinding);
            }
            return result;
        } catch (TimeoutException e) {
            work.cancel(true);
            fail(templateId, target, new ScanException(ScanException.ErrorType.TIMEOUT,
                "Template " + templateId + " exceeded " + templateTimeout.toSeconds() + "s", e), listener, errors);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ScanException error = cause instanceof ScanException
                ? (ScanException) cause
                : new ScanException(ScanException.ErrorType.TEMPLATE_EXECUTION,
                    "Template " + templateId + " failed: " + cause, cause);
            fail(templateId, target, error, listener, errors);
        } catch (InterruptedException e) {
            work.cancel(true);
            Thread.currentThread().interrupt();
            fail(templateId, target, new ScanException(ScanException.ErrorType.EXECUTION,
                "Template " + templateId + " interrupted", e), listener, errors);
        }
        return Collections.emptyList();
    }

    private static void fail(String templateId, Target target, ScanException error,
                             ScanListener listener, List<String> errors) {
        logger.warning("Template " + templateId + " failed for target " + target.getAddress() + ": "
            + error.getMessage());
        errors.add(templateId + " @ " + target.getAddress() + ": " + error.getMessage());
        try {
            listener.onError(templateId, target, error);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Scan listener failed handling error", e);
        }
    }

    private static void awaitAll(List<Future<?>> futures) throws InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Target task failed", e.getCause());
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Останавливает пулы потоков, прерывая выполняющиеся шаблоны после ожидания.
     */
    @Override
    public void close() {
        for (ExecutorService pool : List.of(targetPool, supervisorPool, workerPool)) {
            pool.shutdown();
        }
        try {
            for (ExecutorService pool : List.of(targetPool, supervisorPool, workerPool)) {
                if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            targetPool.shutdownNow();
            supervisorPool.shutdownNow();
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Итог выполнения: находки, сообщения об ошибках и число успешно выполненных пар.
     */
    public record ExecutionResult(List<Finding> findings, List<String> errors, int executedCount) {
    }
}
