package engine.flow;

import com.fasterxml.jackson.databind.JsonNode;
import engine.ScanException;

import java.util.*;

/**
 * Построение потоков из секции {@code flows} шаблона.
 */
public final class FlowParser {

    private FlowParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static List<Flow> parseList(JsonNode node) throws ScanException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw invalid("'flows' must be a list");
        }
        List<Flow> flows = new ArrayList<>();
        for (JsonNode item : node) {
            flows.add(parseFlow(item));
        }
        return flows;
    }

    public static Flow parseFlow(JsonNode node) throws ScanException {
        String name = required(node, "name", "flow");
        Flow.Builder builder = Flow.builder(name)
            .dependsOn(stringList(node.get("depends_on")))
            .condition(text(node, "condition"))
            .optional(node.path("optional").asBoolean(false))
            .description(text(node, "description"));

        JsonNode steps = node.get("steps");
        if (steps == null || !steps.isArray()) {
            throw invalid("Flow '" + name + "' must have a 'steps' list");
        }
        for (JsonNode step : steps) {
            builder.addStep(parseStep(step, name));
        }
        return builder.build();
    }

    static FlowStep parseStep(JsonNode node, String flowName) throws ScanException {
        String action = required(node, "action", "step of flow '" + flowName + "'");
        FlowStep.Kind kind = FlowStep.Kind.fromAction(action.toLowerCase(Locale.ROOT))
            .orElseThrow(() -> invalid("Unknown flow action '" + action + "' in flow '" + flowName + "'"));

        String where = action + " step of flow '" + flowName + "'";
        return switch (kind) {
            case HTTP_REQUEST -> new FlowStep.HttpRequest(
                required(node, "method", where),
                required(node, "path", where),
                stringMap(node.get("headers")),
                text(node, "body"),
                text(node, "store"));
            case SET_VARIABLE -> new FlowStep.SetVariable(required(node, "name", where), required(node, "value", where));
            case EXTRACT -> new FlowStep.Extract(
                required(node, "from", where),
                required(node, "pattern", where),
                required(node, "store", where));
            case CHECK -> new FlowStep.Check(required(node, "condition", where), text(node, "message"));
            case WAIT -> {
                JsonNode duration = node.get("duration_ms");
                if (duration == null || !duration.canConvertToLong() || duration.asLong() < 0) {
                    throw invalid("'duration_ms' of " + where + " must be a non-negative number");
                }
                yield new FlowStep.Wait(duration.asLong());
            }
        };
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String required(JsonNode node, String field, String where) throws ScanException {
        String value = text(node, field);
        if (value == null) {
            throw invalid("Missing '" + field + "' in " + where);
        }
        return value;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> result.add(item.asText()));
        } else {
            result.add(node.asText());
        }
        return result;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> result = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> result.put(entry.getKey(), entry.getValue().asText()));
        }
        return result;
    }

    private static ScanException invalid(String message) {
        return new ScanException(ScanException.ErrorType.TEMPLATE_VALIDATION, message);
    }
}
