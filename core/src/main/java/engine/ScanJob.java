package engine;

import engine.template.Template;
import engine.template.TemplateFilter;
import model.ScanContext;
import model.Target;

import java.time.Instant;
import java.util.*;

/**
 * Единица работы сканирования: цели, шаблоны и контекст.
 */
public final class ScanJob {
    private final String id;
    private final List<Target> targets;
    private final List<Template> templates;
    private final ScanContext context;
    private final Instant createdAt;

    public ScanJob(List<Target> targets, List<Template> templates, ScanContext context) {
        this.id = context.getScanId();
        this.targets = List.copyOf(Objects.requireNonNull(targets, "targets cannot be null"));
        this.templates = List.copyOf(Objects.requireNonNull(templates, "templates cannot be null"));
        this.context = context;
        this.createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public List<Target> getTargets() {
        return targets;
    }

    public List<Template> getTemplates() {
        return templates;
    }

    public ScanContext getContext() {
        return context;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return число пар (цель, шаблон)
     */
    public int totalWorkUnits() {
        return targets.size() * templates.size();
    }

    /**
     * Возвращает задание только с шаблонами, прошедшими фильтр.
     */
    public ScanJob filterTemplates(TemplateFilter filter) {
        List<Template> kept = new ArrayList<>();
        for (Template template : templates) {
            if (filter.matches(template.getMetadata())) {
                kept.add(template);
            }
        }
        return new ScanJob(targets, kept, context);
    }

    @Override
    public String toString() {
        return "ScanJob{" + id + ", targets=" + targets.size() + ", templates=" + templates.size() + "}";
    }
}
