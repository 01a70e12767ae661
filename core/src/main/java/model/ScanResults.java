package model;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Результаты одного задания сканирования: находки, ошибки и итоговая статистика.
 * Находки добавляются до вызова {@link #complete}, после чего статистика фиксируется.
 */
public final class ScanResults {
    private final String scanId;
    private final Instant startedAt;
    private final List<Finding> findings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<Severity, Integer> findingsBySeverity = new EnumMap<>(Severity.class);
    private Instant completedAt;
    private ScanStatistics statistics = ScanStatistics.empty();

    public ScanResults(String scanId) {
        this(scanId, Instant.now());
    }

    public ScanResults(String scanId, Instant startedAt) {
        this.scanId = Objects.requireNonNull(scanId, "scanId cannot be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt cannot be null");
    }

    public void addFinding(Finding finding) {
        findingsBySeverity.merge(finding.getSeverity(), 1, Integer::sum);
        findings.add(finding);
    }

    public void addError(String error) {
        errors.add(error);
    }

    /**
     * Фиксирует время завершения и рассчитывает статистику.
     *
     * @param targetsScanned количество целей
     * @param templatesExecuted количество шаблонов
     * @param networkRequests число отправленных сетевых запросов
     * @param dataTransferred объем полученных данных в байтах
     */
    public void complete(int targetsScanned, int templatesExecuted, long networkRequests, long dataTransferred) {
        this.completedAt = Instant.now();
        long workUnits = (long) targetsScanned * templatesExecuted;
        double successRate = workUnits > 0 ? (double) findings.size() / workUnits : 0.0;
        this.statistics = new ScanStatistics(
            targetsScanned,
            templatesExecuted,
            findingsBySeverity,
            networkRequests,
            dataTransferred,
            Duration.between(startedAt, completedAt),
            successRate
        );
    }

    public String getScanId() {
        return scanId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public ScanStatistics getStatistics() {
        return statistics;
    }

    public List<Finding> criticalFindings() {
        return findingsOf(Severity.CRITICAL);
    }

    public List<Finding> highFindings() {
        return findingsOf(Severity.HIGH);
    }

    public boolean hasCriticalOrHigh() {
        return findings.stream().anyMatch(f -> f.getSeverity().isCriticalOrHigh());
    }

    private List<Finding> findingsOf(Severity severity) {
        List<Finding> result = new ArrayList<>();
        for (Finding finding : findings) {
            if (finding.getSeverity() == severity) {
                result.add(finding);
            }
        }
        return result;
    }
}
