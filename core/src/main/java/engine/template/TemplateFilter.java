package engine.template;

import model.Severity;
import model.TemplateMetadata;

import java.nio.file.Path;
import java.util.*;

/**
 * Отбор шаблонов по идентификаторам, тегам, критичности и языку.
 *
 * <p>Пустой критерий не ограничивает выборку. Идентификатор совпадает без учета регистра,
 * по окончанию пути файла или по имени файла без расширения. Исключение срабатывает
 * по подстроке идентификатора или пути.
 */
public final class TemplateFilter {
    private final Set<String> ids;
    private final Set<String> tags;
    private final Set<Severity> severities;
    private final Set<String> languages;
    private final Set<String> excludeIds;

    private TemplateFilter(Builder builder) {
        this.ids = copy(builder.ids);
        this.tags = copy(builder.tags);
        this.severities = builder.severities.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.severities));
        this.languages = copy(builder.languages);
        this.excludeIds = copy(builder.excludeIds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TemplateFilter all() {
        return builder().build();
    }

    public boolean matches(TemplateMetadata metadata) {
        String path = metadata.getFilePath().map(p -> p.toString().replace('\\', '/')).orElse("");

        if (!ids.isEmpty() && ids.stream().noneMatch(id -> matchesId(id, metadata, path))) {
            return false;
        }

        for (String exclude : excludeIds) {
            if (metadata.getId().contains(exclude) || exclude.contains(metadata.getId())
                || (!path.isEmpty() && path.contains(exclude))) {
                return false;
            }
        }

        if (!tags.isEmpty() && metadata.getTags().stream().noneMatch(tags::contains)) {
            return false;
        }

        if (!severities.isEmpty() && !severities.contains(metadata.getSeverity())) {
            return false;
        }

        return languages.isEmpty() || languages.contains(metadata.getLanguage().toLowerCase(Locale.ROOT));
    }

    private static boolean matchesId(String filterId, TemplateMetadata metadata, String path) {
        if (metadata.getId().equalsIgnoreCase(filterId)) {
            return true;
        }
        if (path.isEmpty()) {
            return false;
        }
        if (path.endsWith(filterId.replace('\\', '/'))) {
            return true;
        }
        Path fileName = metadata.getFilePath().map(Path::getFileName).orElse(null);
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem.equalsIgnoreCase(filterId);
    }

    private static Set<String> copy(Set<String> values) {
        return values.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    public static class Builder {
        private final Set<String> ids = new LinkedHashSet<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<Severity> severities = new LinkedHashSet<>();
        private final Set<String> languages = new LinkedHashSet<>();
        private final Set<String> excludeIds = new LinkedHashSet<>();

        public Builder ids(Collection<String> ids) {
            this.ids.addAll(ids);
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.addAll(tags);
            return this;
        }

        public Builder severities(Collection<Severity> severities) {
            this.severities.addAll(severities);
            return this;
        }

        public Builder languages(Collection<String> languages) {
            languages.forEach(language -> this.languages.add(language.toLowerCase(Locale.ROOT)));
            return this;
        }

        public Builder excludeIds(Collection<String> excludeIds) {
            this.excludeIds.addAll(excludeIds);
            return this;
        }

        public TemplateFilter build() {
            return new TemplateFilter(this);
        }
    }
}
