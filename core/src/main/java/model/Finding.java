package model;

import java.time.Instant;
import java.util.*;

/**
 * Находка: положительное срабатывание шаблона против цели вместе с доказательствами.
 * Создается только после успешной проверки матчеров; после создания не изменяется.
 */
public final class Finding {
    public static final int DEFAULT_CONFIDENCE = 90;

    private final String id;
    private final String target;
    private final String templateId;
    private final Severity severity;
    private final int confidence;
    private final String title;
    private final String description;
    private final Evidence evidence;
    private final List<String> cveIds;
    private final List<String> cweIds;
    private final Double cvssScore;
    private final String remediation;
    private final List<String> references;
    private final List<String> tags;
    private final Instant timestamp;

    private Finding(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.target = Objects.requireNonNull(builder.target, "target cannot be null");
        this.templateId = Objects.requireNonNull(builder.templateId, "templateId cannot be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity cannot be null");
        this.confidence = Math.max(0, Math.min(100, builder.confidence));
        this.title = builder.title != null ? builder.title : builder.templateId;
        this.description = builder.description != null ? builder.description : "";
        this.evidence = builder.evidence != null ? builder.evidence : Evidence.empty();
        this.cveIds = builder.cveIds != null ? List.copyOf(builder.cveIds) : Collections.emptyList();
        this.cweIds = builder.cweIds != null ? List.copyOf(builder.cweIds) : Collections.emptyList();
        this.cvssScore = builder.cvssScore;
        this.remediation = builder.remediation;
        this.references = builder.references != null ? List.copyOf(builder.references) : Collections.emptyList();
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : Collections.emptyList();
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getTarget() {
        return target;
    }

    public String getTemplateId() {
        return templateId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public int getConfidence() {
        return confidence;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Evidence getEvidence() {
        return evidence;
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

    public Optional<String> getRemediation() {
        return Optional.ofNullable(remediation);
    }

    public List<String> getReferences() {
        return references;
    }

    public List<String> getTags() {
        return tags;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Finding{" + severity + " " + templateId + " @ " + target + "}";
    }

    public static class Builder {
        private String id;
        private String target;
        private String templateId;
        private Severity severity;
        private int confidence = DEFAULT_CONFIDENCE;
        private String title;
        private String description;
        private Evidence evidence;
        private List<String> cveIds;
        private List<String> cweIds;
        private Double cvssScore;
        private String remediation;
        private List<String> references;
        private List<String> tags;
        private Instant timestamp;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * Уверенность 0-100; значения выше 100 обрезаются.
         */
        public Builder confidence(int confidence) {
            this.confidence = Math.min(confidence, 100);
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(Evidence evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder cveIds(List<String> cveIds) {
            this.cveIds = cveIds != null ? new ArrayList<>(cveIds) : null;
            return this;
        }

        public Builder addCve(String cveId) {
            if (this.cveIds == null) {
                this.cveIds = new ArrayList<>();
            }
            this.cveIds.add(cveId);
            return this;
        }

        public Builder cweIds(List<String> cweIds) {
            this.cweIds = cweIds != null ? new ArrayList<>(cweIds) : null;
            return this;
        }

        public Builder addCwe(String cweId) {
            if (this.cweIds == null) {
                this.cweIds = new ArrayList<>();
            }
            this.cweIds.add(cweId);
            return this;
        }

        public Builder cvssScore(Double cvssScore) {
            this.cvssScore = cvssScore;
            return this;
        }

        public Builder remediation(String remediation) {
            this.remediation = remediation;
            return this;
        }

        public Builder references(List<String> references) {
            this.references = references;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }
}
