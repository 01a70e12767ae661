package cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import model.Evidence;
import model.Finding;
import model.ScanResults;
import model.ScanStatistics;
import model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.*;

/**
 * Запись результатов сканирования в JSON для программной обработки (CI/CD, агрегация).
 *
 * <p>Временные метки пишутся в ISO-8601, длительности в миллисекундах.
 */
public final class JsonResultWriter {

    private final ObjectMapper objectMapper;

    public JsonResultWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Пишет отчет в переданный writer, не закрывая его.
     */
    public void write(ScanResults results, PrintWriter writer) throws IOException {
        writer.println(objectMapper.writeValueAsString(toMap(results)));
        writer.flush();
    }

    Map<String, Object> toMap(ScanResults results) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("scanId", results.getScanId());
        json.put("startedAt", results.getStartedAt());
        results.getCompletedAt().ifPresent(completed -> json.put("completedAt", completed));

        List<Map<String, Object>> findings = new ArrayList<>();
        for (Finding finding : results.getFindings()) {
            findings.add(findingToMap(finding));
        }
        json.put("findings", findings);
        json.put("errors", results.getErrors());
        json.put("statistics", statisticsToMap(results.getStatistics()));
        return json;
    }

    private Map<String, Object> findingToMap(Finding finding) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", finding.getId());
        json.put("target", finding.getTarget());
        json.put("templateId", finding.getTemplateId());
        json.put("severity", finding.getSeverity().toString());
        json.put("confidence", finding.getConfidence());
        json.put("title", finding.getTitle());
        json.put("description", finding.getDescription());
        if (!finding.getCveIds().isEmpty()) {
            json.put("cveIds", finding.getCveIds());
        }
        if (!finding.getCweIds().isEmpty()) {
            json.put("cweIds", finding.getCweIds());
        }
        finding.getCvssScore().ifPresent(score -> json.put("cvssScore", score));
        finding.getRemediation().ifPresent(remediation -> json.put("remediation", remediation));
        if (!finding.getReferences().isEmpty()) {
            json.put("references", finding.getReferences());
        }
        if (!finding.getTags().isEmpty()) {
            json.put("tags", finding.getTags());
        }
        json.put("evidence", evidenceToMap(finding.getEvidence()));
        json.put("timestamp", finding.getTimestamp());
        return json;
    }

    private Map<String, Object> evidenceToMap(Evidence evidence) {
        Map<String, Object> json = new LinkedHashMap<>();
        evidence.getRequest().ifPresent(request -> json.put("request", request));
        evidence.getResponse().ifPresent(response -> json.put("response", response));
        json.put("matchedPatterns", evidence.getMatchedPatterns());
        json.put("data", evidence.getData());
        json.put("timestamp", evidence.getTimestamp());
        return json;
    }

    private Map<String, Object> statisticsToMap(ScanStatistics statistics) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("targetsScanned", statistics.targetsScanned());
        json.put("templatesExecuted", statistics.templatesExecuted());

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.toString(), statistics.findingCount(severity));
        }
        json.put("findingsBySeverity", bySeverity);
        json.put("networkRequests", statistics.networkRequests());
        json.put("dataTransferred", statistics.dataTransferred());
        json.put("durationMs", statistics.duration().toMillis());
        json.put("successRate", statistics.successRate());
        return json;
    }
}
