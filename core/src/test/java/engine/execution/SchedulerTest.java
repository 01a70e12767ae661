package engine.execution;

import engine.ScanJob;
import engine.template.StubTemplate;
import model.Protocol;
import model.ScanContext;
import model.Severity;
import model.Target;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private static List<String> ids(List<PrioritizedTemplate> templates) {
        return templates.stream().map(PrioritizedTemplate::templateId).collect(Collectors.toList());
    }

    @Test
    void testCriticalTemplatesRunFirst() {
        Scheduler scheduler = new Scheduler();
        ScanJob job = new ScanJob(List.of(Target.of("example.com", Protocol.HTTPS)), List.of(
            StubTemplate.silent("low", Severity.LOW),
            StubTemplate.silent("critical", Severity.CRITICAL),
            StubTemplate.silent("medium", Severity.MEDIUM)
        ), ScanContext.defaults());

        scheduler.scheduleJob(job);

        assertEquals(3, scheduler.pendingCount());
        assertEquals(List.of("critical", "medium", "low"), ids(scheduler.drain()));
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void testEqualPriorityKeepsInsertionOrder() {
        Scheduler scheduler = new Scheduler();
        scheduler.schedule(new PrioritizedTemplate("a", 500, 2, 1000));
        scheduler.schedule(new PrioritizedTemplate("b", 500, 2, 1000));
        scheduler.schedule(new PrioritizedTemplate("top", 1000, 4, 1000));
        scheduler.schedule(new PrioritizedTemplate("c", 500, 2, 1000));

        assertEquals("top", scheduler.nextTemplate().orElseThrow().templateId());
        assertEquals(List.of("a", "b", "c"), ids(scheduler.drain()));
        assertTrue(scheduler.nextTemplate().isEmpty());
    }

    @Test
    void testPriorityBySeverity() {
        assertEquals(1000, PrioritizedTemplate.priorityFor(Severity.CRITICAL));
        assertEquals(750, PrioritizedTemplate.priorityFor(Severity.HIGH));
        assertEquals(500, PrioritizedTemplate.priorityFor(Severity.MEDIUM));
        assertEquals(250, PrioritizedTemplate.priorityFor(Severity.LOW));
        assertEquals(100, PrioritizedTemplate.priorityFor(Severity.INFO));

        PrioritizedTemplate high = PrioritizedTemplate.of(StubTemplate.silent("h", Severity.HIGH));
        assertEquals(3, high.severityScore());
        assertEquals(PrioritizedTemplate.DEFAULT_ESTIMATED_TIME_MS, high.estimatedTimeMs());
    }

    @Test
    void testClear() {
        Scheduler scheduler = new Scheduler();
        scheduler.schedule(new PrioritizedTemplate("a", 100, 0, 1000));

        scheduler.clear();

        assertEquals(0, scheduler.pendingCount());
    }
}
