package model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ScanResultsTest {

    private static Finding finding(Severity severity) {
        return Finding.builder().target("https://example.com").templateId("t-" + severity).severity(severity).build();
    }

    @Test
    void testStatisticsOnComplete() {
        ScanResults results = new ScanResults("scan-1", Instant.now().minusSeconds(2));
        results.addFinding(finding(Severity.CRITICAL));
        results.addFinding(finding(Severity.HIGH));
        results.addFinding(finding(Severity.HIGH));
        results.addError("t @ example.com: TIMEOUT: slow");

        assertTrue(results.getCompletedAt().isEmpty());
        assertEquals(ScanStatistics.empty(), results.getStatistics());

        results.complete(2, 4, 12, 2048);

        ScanStatistics stats = results.getStatistics();
        assertEquals(2, stats.targetsScanned());
        assertEquals(4, stats.templatesExecuted());
        assertEquals(1, stats.findingCount(Severity.CRITICAL));
        assertEquals(2, stats.findingCount(Severity.HIGH));
        assertEquals(0, stats.findingCount(Severity.INFO));
        assertEquals(12, stats.networkRequests());
        assertEquals(2048, stats.dataTransferred());
        assertEquals(3.0 / 8.0, stats.successRate(), 1e-9);
        assertTrue(stats.duration().getSeconds() >= 2);
        assertTrue(results.getCompletedAt().isPresent());
        assertEquals(1, results.getErrors().size());
    }

    @Test
    void testSeverityViews() {
        ScanResults results = new ScanResults("scan-2");
        results.addFinding(finding(Severity.LOW));
        assertFalse(results.hasCriticalOrHigh());

        results.addFinding(finding(Severity.CRITICAL));
        assertTrue(results.hasCriticalOrHigh());
        assertEquals(1, results.criticalFindings().size());
        assertTrue(results.highFindings().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> results.getFindings().clear());
    }

    @Test
    void testZeroWorkUnits() {
        ScanResults results = new ScanResults("scan-3");
        results.complete(0, 5, 0, 0);

        assertEquals(0.0, results.getStatistics().successRate());
    }

    @Test
    void testFindingDefaults() {
        Finding finding = Finding.builder().target("t").templateId("id").severity(Severity.INFO).confidence(250).build();

        assertEquals("id", finding.getTitle());
        assertEquals(100, finding.getConfidence());
        assertNotNull(finding.getId());
        assertThrows(NullPointerException.class, () -> Finding.builder().templateId("id").severity(Severity.INFO).build());
    }

    @Test
    void testSeverityParsing() {
        assertEquals(Severity.HIGH, Severity.fromName("High"));
        assertEquals(Severity.INFO, Severity.fromName("informational"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromName("urgent"));
        assertThrows(IllegalArgumentException.class, () -> Severity.fromName(" "));
    }
}
