package engine.flow;

import java.util.*;

/**
 * Именованная последовательность шагов с необязательным условием выполнения.
 */
public final class Flow {
    private final String name;
    private final List<FlowStep> steps;
    private final List<String> dependsOn;
    private final String condition;
    private final boolean optional;
    private final String description;

    private Flow(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.steps = builder.steps != null
            ? Collections.unmodifiableList(new ArrayList<>(builder.steps))
            : Collections.emptyList();
        this.dependsOn = builder.dependsOn != null
            ? Collections.unmodifiableList(new ArrayList<>(builder.dependsOn))
            : Collections.emptyList();
        this.condition = builder.condition;
        this.optional = builder.optional;
        this.description = builder.description;
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    public String getName() {
        return name;
    }

    public List<FlowStep> getSteps() {
        return steps;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public Optional<String> getCondition() {
        return Optional.ofNullable(condition);
    }

    public boolean isOptional() {
        return optional;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    @Override
    public String toString() {
        return "Flow{" + name + ", steps=" + steps.size() + (optional ? ", optional" : "") + "}";
    }

    public static class Builder {
        private String name;
        private List<FlowStep> steps;
        private List<String> dependsOn;
        private String condition;
        private boolean optional;
        private String description;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder steps(List<FlowStep> steps) {
            this.steps = steps;
            return this;
        }

        public Builder addStep(FlowStep step) {
            if (this.steps == null) {
                this.steps = new ArrayList<>();
            }
            this.steps.add(step);
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Flow build() {
            return new Flow(this);
        }
    }
}
