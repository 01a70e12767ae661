package cli;

import model.Evidence;
import model.Finding;
import model.ScanResults;
import model.ScanStatistics;
import model.Severity;
import util.StringUtils;

import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Форматтер результатов сканирования для консольного вывода.
 * Группирует находки по критичности (от critical к info) и печатает итоговую статистику.
 * Цвета ANSI опциональны.
 */
public final class ResultFormatter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_GRAY = "\u001B[90m";
    private static final String ANSI_BOLD = "\u001B[1m";

    private static final int MAX_RESPONSE_PREVIEW = 200;

    private final PrintWriter out;
    private final boolean useColors;

    public ResultFormatter(PrintWriter out, boolean useColors) {
        this.out = out;
        this.useColors = useColors;
    }

    public ResultFormatter(PrintWriter out) {
        this(out, true);
    }

    /**
     * Печатает заголовок, находки, ошибки и статистику сканирования.
     */
    public void printResults(ScanResults results) {
        printHeader("Template Scan Results");
        out.println("Scan ID: " + results.getScanId());
        out.println();

        List<Finding> findings = results.getFindings();
        if (findings.isEmpty()) {
            printSuccess("No findings.");
        } else {
            printSection("Findings");
            printSummary(findings);
            out.println();
            printDetailedFindings(findings);
        }

        if (!results.getErrors().isEmpty()) {
            printSection("Errors (" + results.getErrors().size() + ")");
            for (String error : results.getErrors()) {
                out.println(colorize("  [ERROR] ", ANSI_RED) + error);
            }
            out.println();
        }

        printStatistics(results.getStatistics());
        out.flush();
    }

    private void printHeader(String title) {
        out.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        out.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        out.println(colorize(ANSI_BOLD + "=".repeat(60), ANSI_BLUE));
        out.println();
    }

    private void printSection(String title) {
        out.println(colorize(ANSI_BOLD + title, ANSI_BLUE));
        out.println(colorize("-".repeat(60), ANSI_BLUE));
    }

    private void printSuccess(String message) {
        out.println(colorize("✓ ", ANSI_GREEN) + message);
        out.println();
    }

    private void printSummary(List<Finding> findings) {
        Map<Severity, Long> countsBySeverity = findings.stream()
            .collect(Collectors.groupingBy(Finding::getSeverity, Collectors.counting()));

        out.println("Total findings: " + colorize(String.valueOf(findings.size()), ANSI_BOLD));
        out.println();

        for (Severity severity : bySeverityDescending()) {
            long count = countsBySeverity.getOrDefault(severity, 0L);
            if (count > 0) {
                out.println("  " + colorize(getSeverityIcon(severity) + " " + severity.getDisplayName() + ": " + count,
                    getSeverityColor(severity)));
            }
        }
    }

    private void printDetailedFindings(List<Finding> findings) {
        Map<Severity, List<Finding>> groupedBySeverity = findings.stream()
            .collect(Collectors.groupingBy(Finding::getSeverity));

        for (Severity severity : bySeverityDescending()) {
            List<Finding> severityFindings = groupedBySeverity.get(severity);
            if (severityFindings == null || severityFindings.isEmpty()) {
                continue;
            }

            out.println();
            out.println(colorize(ANSI_BOLD + "[" + severity.getDisplayName().toUpperCase() + "]",
                getSeverityColor(severity)));
            out.println();

            for (Finding finding : severityFindings) {
                printFinding(finding);
            }
        }
    }

    private void printFinding(Finding finding) {
        out.println(colorize(getSeverityIcon(finding.getSeverity()) + " " + finding.getTitle(),
            getSeverityColor(finding.getSeverity())));
        out.println("  Target: " + colorize(finding.getTarget(), ANSI_BOLD));
        out.println("  Template: " + finding.getTemplateId() + " (confidence " + finding.getConfidence() + "%)");

        if (!finding.getDescription().isEmpty()) {
            out.println("  Details: " + finding.getDescription());
        }
        if (!finding.getCveIds().isEmpty()) {
            out.println("  CVE: " + String.join(", ", finding.getCveIds()));
        }

        Evidence evidence = finding.getEvidence();
        if (!evidence.getMatchedPatterns().isEmpty()) {
            out.println("  Matched: " + String.join(", ", evidence.getMatchedPatterns()));
        }
        evidence.getRequest().ifPresent(request ->
            out.println("  Request: " + request.lines().findFirst().orElse("")));
        evidence.getResponse().filter(response -> !response.isBlank()).ifPresent(response ->
            out.println("  Response: " + preview(response)));

        finding.getRemediation().ifPresent(remediation ->
            out.println("  " + colorize("Recommendation:", ANSI_GREEN) + " " + remediation));
        out.println("  " + colorize("ID: " + finding.getId(), ANSI_GRAY));
        out.println();
    }

    private void printStatistics(ScanStatistics statistics) {
        printSection("Statistics");
        out.println("  Targets scanned:    " + statistics.targetsScanned());
        out.println("  Templates executed: " + statistics.templatesExecuted());
        out.println("  Network requests:   " + statistics.networkRequests());
        out.println("  Data received:      " + statistics.dataTransferred() + " bytes");
        out.println("  Duration:           " + statistics.duration().toMillis() + " ms");
        out.println(String.format("  Success rate:       %.2f%%", statistics.successRate() * 100));
        out.println();
    }

    private static String preview(String response) {
        return StringUtils.truncate(response.replaceAll("\\s+", " ").trim(), MAX_RESPONSE_PREVIEW);
    }

    private static Severity[] bySeverityDescending() {
        return new Severity[]{Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW, Severity.INFO};
    }

    private String getSeverityIcon(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "🔴";
            case HIGH -> "🟠";
            case MEDIUM -> "🟡";
            case LOW -> "🔵";
            case INFO -> "ℹ️";
        };
    }

    private String getSeverityColor(Severity severity) {
        return switch (severity) {
            case CRITICAL, HIGH -> ANSI_RED;
            case MEDIUM -> ANSI_YELLOW;
            case LOW -> ANSI_BLUE;
            case INFO -> ANSI_GRAY;
        };
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }
}
