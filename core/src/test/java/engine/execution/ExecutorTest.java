package engine.execution;

import engine.ScanException;
import engine.ScanListener;
import engine.ScanJob;
import engine.template.StubTemplate;
import engine.template.Template;
import model.Finding;
import model.Protocol;
import model.ScanContext;
import model.ScanResults;
import model.Severity;
import model.Target;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutorTest {

    private final List<Target> targets = List.of(
        Target.of("a.example", Protocol.HTTP),
        Target.of("b.example", Protocol.HTTP));

    private Executor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    /**
     * Слушатель, запоминающий находки и ошибки.
     */
    private static class RecordingListener implements ScanListener {
        final List<Finding> findings = new CopyOnWriteArrayList<>();
        final List<ScanException> errors = new CopyOnWriteArrayList<>();

        @Override
        public void onScanStart(ScanJob job) {
        }

        @Override
        public void onFinding(Finding finding) {
            findings.add(finding);
        }

        @Override
        public void onScanComplete(ScanResults results) {
        }

        @Override
        public void onError(String templateId, Target target, ScanException error) {
            errors.add(error);
        }
    }

    @Test
    void testFindingsFromEveryPairAreCollected() {
        executor = new Executor(2, 2, 4, Duration.ofSeconds(5));
        RecordingListener listener = new RecordingListener();
        List<Template> templates = List.of(
            StubTemplate.finding("t1", Severity.HIGH),
            StubTemplate.finding("t2", Severity.LOW),
            StubTemplate.silent("t3", Severity.INFO));

        Executor.ExecutionResult result = executor.execute(targets, templates, ScanContext.defaults(), listener);

        assertEquals(4, result.findings().size());
        assertEquals(6, result.executedCount());
        assertTrue(result.errors().isEmpty());
        assertEquals(4, listener.findings.size());
    }

    @Test
    void testTimeoutIsReportedAsError() {
        executor = new Executor(1, 1, 2, Duration.ofMillis(200));
        RecordingListener listener = new RecordingListener();
        Template slow = StubTemplate.of("slow", Severity.MEDIUM, target -> {
            Thread.sleep(5000);
            return Collections.emptyList();
        });

        Executor.ExecutionResult result = executor.execute(targets.subList(0, 1), List.of(slow),
            ScanContext.defaults(), listener);

        assertTrue(result.findings().isEmpty());
        assertEquals(0, result.executedCount());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("slow @ a.example: TIMEOUT"));
        assertEquals(ScanException.ErrorType.TIMEOUT, listener.errors.get(0).getErrorType());
    }

    @Test
    void testFailureIsolatedToItsPair() {
        executor = new Executor(2, 2, 2, Duration.ofSeconds(5));
        RecordingListener listener = new RecordingListener();
        Template flaky = StubTemplate.of("flaky", Severity.HIGH, target -> {
            if (target.getAddress().startsWith("a.")) {
                throw new ScanException(ScanException.ErrorType.NETWORK, "refused");
            }
            return StubTemplate.finding("flaky", Severity.HIGH).execute(target, ScanContext.defaults());
        });
        Template broken = StubTemplate.of("broken", Severity.LOW, target -> {
            throw new IllegalStateException("bug");
        });

        Executor.ExecutionResult result = executor.execute(targets, List.of(flaky, broken),
            ScanContext.defaults(), listener);

        assertEquals(1, result.findings().size());
        assertEquals("http://b.example", result.findings().get(0).getTarget());
        assertEquals(3, result.errors().size());
        assertTrue(result.errors().contains("flaky @ a.example: NETWORK: refused"));
        assertEquals(2, listener.errors.stream()
            .filter(e -> e.getErrorType() == ScanException.ErrorType.TEMPLATE_EXECUTION).count());
    }

    @Test
    void testListenerFailureDoesNotAbortScan() {
        executor = new Executor(1, 1, 1, Duration.ofSeconds(5));
        ScanListener throwing = new RecordingListener() {
            @Override
            public void onError(String templateId, Target target, ScanException error) {
                throw new IllegalStateException("listener bug");
            }
        };
        Template failing = StubTemplate.of("failing", Severity.LOW, target -> {
            throw new ScanException(ScanException.ErrorType.MATCHER, "bad");
        });

        Executor.ExecutionResult result = executor.execute(targets, List.of(failing),
            ScanContext.defaults(), throwing);

        assertEquals(2, result.errors().size());
    }

    @Test
    void testTemplateConcurrencyIsBoundedPerTarget() {
        executor = new Executor(1, 2, 8, Duration.ofSeconds(5));
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StubTemplate.Body body = target -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(50);
            running.decrementAndGet();
            return Collections.emptyList();
        };
        List<Template> templates = List.of(
            StubTemplate.of("t1", Severity.LOW, body),
            StubTemplate.of("t2", Severity.LOW, body),
            StubTemplate.of("t3", Severity.LOW, body),
            StubTemplate.of("t4", Severity.LOW, body),
            StubTemplate.of("t5", Severity.LOW, body));

        Executor.ExecutionResult result = executor.execute(targets.subList(0, 1), templates,
            ScanContext.defaults(), ScanListener.noOp());

        assertEquals(5, result.executedCount());
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    void testTargetsRunInParallel() throws Exception {
        executor = new Executor(2, 1, 2, Duration.ofSeconds(5));
        CountDownLatch bothStarted = new CountDownLatch(2);
        Template rendezvous = StubTemplate.of("rendezvous", Severity.INFO, target -> {
            bothStarted.countDown();
            if (!bothStarted.await(2, TimeUnit.SECONDS)) {
                throw new ScanException(ScanException.ErrorType.EXECUTION, "targets did not overlap");
            }
            return Collections.emptyList();
        });

        Executor.ExecutionResult result = executor.execute(targets, List.of(rendezvous),
            ScanContext.defaults(), ScanListener.noOp());

        assertTrue(result.errors().isEmpty(), String.valueOf(result.errors()));
        assertEquals(2, result.executedCount());
    }

    @Test
    void testInvalidParallelismRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Executor(0, 1, 1, Duration.ofSeconds(1)));
    }
}
