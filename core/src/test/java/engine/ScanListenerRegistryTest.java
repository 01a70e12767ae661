package engine;

import model.Finding;
import model.Protocol;
import model.ScanContext;
import model.ScanResults;
import model.Severity;
import model.Target;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanListenerRegistryTest {

    @TempDir
    Path dir;

    private static Finding finding(String templateId) {
        return Finding.builder().target("http://a.example").templateId(templateId).severity(Severity.LOW).build();
    }

    @Test
    void testDispatchToAllListeners() {
        ScanListenerRegistry registry = new ScanListenerRegistry();
        RecordingScanListener first = new RecordingScanListener();
        RecordingScanListener second = new RecordingScanListener();
        registry.register(first);
        registry.register(second);

        registry.onScanStart(new ScanJob(List.of(Target.of("a.example", Protocol.HTTP)), List.of(),
            ScanContext.builder().scanId("scan-1").build()));
        registry.onFinding(finding("exposed-git"));
        registry.onError("broken", Target.of("a.example", Protocol.HTTP),
            new ScanException(ScanException.ErrorType.TIMEOUT, "slow"));
        registry.onScanComplete(new ScanResults("scan-1"));

        List<String> expected = List.of("start:1", "finding:exposed-git", "error:broken:TIMEOUT", "complete:scan-1");
        assertEquals(expected, first.getEvents());
        assertEquals(expected, second.getEvents());
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        ScanListenerRegistry registry = new ScanListenerRegistry();
        RecordingScanListener failing = new RecordingScanListener() {
            @Override
            public void onFinding(Finding finding) {
                throw new IllegalStateException("listener bug");
            }
        };
        RecordingScanListener healthy = new RecordingScanListener();
        registry.register(failing);
        registry.register(healthy);

        assertDoesNotThrow(() -> registry.onFinding(finding("x")));
        assertEquals(List.of("finding:x"), healthy.getEvents());
    }

    @Test
    void testRegisterAndUnregister() {
        ScanListenerRegistry registry = new ScanListenerRegistry();
        RecordingScanListener listener = new RecordingScanListener();

        assertThrows(IllegalArgumentException.class, () -> registry.register(null));

        registry.register(listener);
        assertEquals(List.of(listener), registry.getListeners());

        registry.unregister(listener);
        registry.onFinding(finding("x"));
        assertTrue(registry.getListeners().isEmpty());
        assertTrue(listener.getEvents().isEmpty());
    }

    @Test
    void testDiscoverFromServiceFile() throws Exception {
        Path services = dir.resolve("META-INF/services");
        Files.createDirectories(services);
        Files.writeString(services.resolve(ScanListener.class.getName()),
            "# test listeners\n" + RecordingScanListener.class.getName() + "\n");

        ScanListenerRegistry registry = new ScanListenerRegistry();
        try (URLClassLoader loader = new URLClassLoader(new URL[]{dir.toUri().toURL()},
                ScanListenerRegistryTest.class.getClassLoader())) {
            assertEquals(1, registry.discover(loader));
        }

        assertEquals(1, registry.getListeners().size());
        assertTrue(registry.getListeners().get(0) instanceof RecordingScanListener);
    }

    @Test
    void testNoOpListener() {
        ScanListener listener = ScanListener.noOp();

        assertDoesNotThrow(() -> listener.onFinding(finding("x")));
        assertDoesNotThrow(() -> listener.onScanComplete(new ScanResults("scan-1")));
    }
}
