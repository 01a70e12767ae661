package engine.execution;

import engine.template.Template;
import model.Severity;

import java.util.Comparator;

/**
 * Шаблон в очереди планировщика. Приоритет определяется критичностью шаблона.
 */
public record PrioritizedTemplate(String templateId, int priority, int severityScore, long estimatedTimeMs)
        implements Comparable<PrioritizedTemplate> {

    public static final long DEFAULT_ESTIMATED_TIME_MS = 1000;

    private static final Comparator<PrioritizedTemplate> ORDER =
        Comparator.comparingInt(PrioritizedTemplate::priority);

    public static PrioritizedTemplate of(Template template) {
        Severity severity = template.getMetadata().getSeverity();
        return new PrioritizedTemplate(template.getId(), priorityFor(severity), severity.getScore(),
            DEFAULT_ESTIMATED_TIME_MS);
    }

    static int priorityFor(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 1000;
            case HIGH -> 750;
            case MEDIUM -> 500;
            case LOW -> 250;
            case INFO -> 100;
        };
    }

    /**
     * Сравнение только по приоритету: больший приоритет больше.
     */
    @Override
    public int compareTo(PrioritizedTemplate other) {
        return ORDER.compare(this, other);
    }
}
