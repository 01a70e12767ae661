package model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Статистика завершенного сканирования.
 */
public record ScanStatistics(
    int targetsScanned,
    int templatesExecuted,
    Map<Severity, Integer> findingsBySeverity,
    long networkRequests,
    long dataTransferred,
    Duration duration,
    double successRate
) {
    public ScanStatistics {
        findingsBySeverity = findingsBySeverity != null && !findingsBySeverity.isEmpty()
            ? Collections.unmodifiableMap(new EnumMap<>(findingsBySeverity))
            : Collections.emptyMap();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, Collections.emptyMap(), 0, 0, Duration.ZERO, 0.0);
    }

    public int findingCount(Severity severity) {
        return findingsBySeverity.getOrDefault(severity, 0);
    }
}
