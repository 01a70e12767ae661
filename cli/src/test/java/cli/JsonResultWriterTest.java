package cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import model.Evidence;
import model.Finding;
import model.ScanResults;
import model.Severity;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonResultWriterTest {

    private static ScanResults results() {
        ScanResults results = new ScanResults("scan-42", Instant.parse("2026-01-01T10:00:00Z"));
        results.addFinding(Finding.builder()
            .target("https://example.com")
            .templateId("exposed-git")
            .severity(Severity.HIGH)
            .title("Exposed .git directory")
            .addCve("CVE-2024-0001")
            .cvssScore(7.5)
            .remediation("Block access to /.git")
            .evidence(Evidence.builder()
                .request("GET https://example.com/.git/config")
                .response("[core]")
                .addMatch("[core]")
                .addData("status_code", 200)
                .build())
            .build());
        results.addError("slow @ example.com: TIMEOUT: exceeded");
        results.complete(1, 2, 3, 64);
        return results;
    }

    @Test
    void testToMap() {
        Map<String, Object> json = new JsonResultWriter().toMap(results());

        assertEquals("scan-42", json.get("scanId"));
        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), json.get("startedAt"));
        assertTrue(json.containsKey("completedAt"));
        assertEquals(List.of("slow @ example.com: TIMEOUT: exceeded"), json.get("errors"));
    }

    @Test
    void testWriteJson() throws Exception {
        StringWriter output = new StringWriter();
        new JsonResultWriter().write(results(), new PrintWriter(output));

        JsonNode root = new ObjectMapper().readTree(output.toString());
        assertEquals("2026-01-01T10:00:00Z", root.path("startedAt").asText());

        JsonNode finding = root.path("findings").get(0);
        assertEquals("high", finding.path("severity").asText());
        assertEquals("Exposed .git directory", finding.path("title").asText());
        assertEquals("CVE-2024-0001", finding.path("cveIds").get(0).asText());
        assertEquals(7.5, finding.path("cvssScore").asDouble());
        assertEquals("Block access to /.git", finding.path("remediation").asText());
        assertFalse(finding.has("cweIds"));
        assertEquals("[core]", finding.path("evidence").path("matchedPatterns").get(0).asText());
        assertEquals(200, finding.path("evidence").path("data").path("status_code").asInt());

        JsonNode statistics = root.path("statistics");
        assertEquals(1, statistics.path("findingsBySeverity").path("high").asInt());
        assertEquals(0, statistics.path("findingsBySeverity").path("info").asInt());
        assertEquals(3, statistics.path("networkRequests").asInt());
        assertEquals(0.5, statistics.path("successRate").asDouble(), 1e-9);
    }
}
