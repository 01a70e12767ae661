package engine.execution;

import engine.ScanJob;
import engine.template.Template;

import java.util.*;
import java.util.logging.Logger;

/**
 * Очередь шаблонов с приоритетом по критичности: критичные проверки выполняются первыми.
 * Шаблоны с равным приоритетом выдаются в порядке постановки.
 *
 * <p>Потокобезопасен.
 */
public final class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long sequence;

    public synchronized void scheduleJob(ScanJob job) {
        logger.fine("Scheduling job " + job.getId() + " with " + job.getTemplates().size() + " templates");
        for (Template template : job.getTemplates()) {
            schedule(PrioritizedTemplate.of(template));
        }
    }

    public synchronized void schedule(PrioritizedTemplate template) {
        queue.add(new Entry(template, sequence++));
    }

    /**
     * @return шаблон с наибольшим приоритетом или пусто, если очередь пуста
     */
    public synchronized Optional<PrioritizedTemplate> nextTemplate() {
        Entry entry = queue.poll();
        return entry != null ? Optional.of(entry.template()) : Optional.empty();
    }

    /**
     * Извлекает все шаблоны в порядке выполнения.
     */
    public synchronized List<PrioritizedTemplate> drain() {
        List<PrioritizedTemplate> ordered = new ArrayList<>(queue.size());
        Entry entry;
        while ((entry = queue.poll()) != null) {
            ordered.add(entry.template());
        }
        return ordered;
    }

    public synchronized int pendingCount() {
        return queue.size();
    }

    public synchronized void clear() {
        queue.clear();
    }

    private record Entry(PrioritizedTemplate template, long sequence) implements Comparable<Entry> {
        @Override
        public int compareTo(Entry other) {
            int byPriority = other.template.compareTo(template);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
