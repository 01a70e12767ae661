package model;

import java.nio.file.Path;
import java.util.*;

/**
 * Метаданные шаблона: идентификатор, автор, критичность, ссылки на CVE/CWE и прочее.
 */
public final class TemplateMetadata {
    private final String id;
    private final String name;
    private final Author author;
    private final Severity severity;
    private final String description;
    private final List<String> cveIds;
    private final List<String> cweIds;
    private final Double cvssScore;
    private final List<String> tags;
    private final String language;
    private final Path filePath;
    private final String version;
    private final Integer confidence;

    private TemplateMetadata(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id cannot be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.author = builder.author != null ? builder.author : new Author("unknown", null, null);
        this.severity = builder.severity != null ? builder.severity : Severity.INFO;
        this.description = builder.description != null ? builder.description : "";
        this.cveIds = builder.cveIds != null ? List.copyOf(builder.cveIds) : Collections.emptyList();
        this.cweIds = builder.cweIds != null ? List.copyOf(builder.cweIds) : Collections.emptyList();
        this.cvssScore = builder.cvssScore;
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : Collections.emptyList();
        this.language = builder.language != null ? builder.language : "yaml";
        this.filePath = builder.filePath;
        this.version = builder.version != null ? builder.version : "1.0";
        this.confidence = builder.confidence;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Author getAuthor() {
        return author;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getCveIds() {
        return cveIds;
    }

    public List<String> getCweIds() {
        return cweIds;
    }

    public Optional<Double> getCvssScore() {
        return Optional.ofNullable(cvssScore);
    }

    public List<String> getTags() {
        return tags;
    }

    public String getLanguage() {
        return language;
    }

    public Optional<Path> getFilePath() {
        return Optional.ofNullable(filePath);
    }

    public String getVersion() {
        return version;
    }

    public Optional<Integer> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    /**
     * Автор шаблона.
     */
    public record Author(String name, String email, String github) {
        public Author {
            Objects.requireNonNull(name, "name cannot be null");
        }
    }

    public static class Builder {
        private String id;
        private String name;
        private Author author;
        private Severity severity;
        private String description;
        private List<String> cveIds;
        private List<String> cweIds;
        private Double cvssScore;
        private List<String> tags;
        private String language;
        private Path filePath;
        private String version;
        private Integer confidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder author(Author author) {
            this.author = author;
            return this;
        }

        public Builder author(String authorName) {
            this.author = new Author(authorName, null, null);
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder cveIds(List<String> cveIds) {
            this.cveIds = cveIds;
            return this;
        }

        public Builder cweIds(List<String> cweIds) {
            this.cweIds = cweIds;
            return this;
        }

        public Builder cvssScore(Double cvssScore) {
            this.cvssScore = cvssScore;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder filePath(Path filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder confidence(Integer confidence) {
            this.confidence = confidence;
            return this;
        }

        public TemplateMetadata build() {
            return new TemplateMetadata(this);
        }
    }
}
