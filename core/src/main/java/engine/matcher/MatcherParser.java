package engine.matcher;

import com.fasterxml.jackson.databind.JsonNode;
import util.TargetParser;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Построение матчеров из узлов шаблона (YAML/JSON).
 *
 * <p>Вариант выбирается по полю {@code type} в нижнем регистре. Поле {@code time} матчера
 * времени принимает число миллисекунд, строку длительности ({@code "2s"}) или объект
 * {@code {secs, nanos}}.
 */
public final class MatcherParser {

    private MatcherParser() {
        // Utility class
    }

    public static List<MatcherType> parseList(JsonNode node) throws MatcherException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Collections.emptyList();
        }
        if (!node.isArray()) {
            throw new MatcherException("'matchers' must be a list");
        }
        List<MatcherType> matchers = new ArrayList<>();
        for (JsonNode item : node) {
            matchers.add(parse(item));
        }
        return matchers;
    }

    public static MatcherType parse(JsonNode node) throws MatcherException {
        String type = text(node, "type");
        if (type == null) {
            throw new MatcherException("Matcher is missing 'type'");
        }

        switch (type.toLowerCase(Locale.ROOT)) {
            case "status":
                return new MatcherType.Status(intList(node, "status"));
            case "word":
                return new MatcherType.Word(
                    requiredStringList(node, "words"),
                    parseCondition(node.get("condition"), MatcherType.MatchCondition.OR),
                    parseEnum(MatcherType.ResponsePart.class, text(node, "part"), MatcherType.ResponsePart.BODY));
            case "regex":
                JsonNode group = node.get("group");
                return new MatcherType.Regex(
                    requiredStringList(node, "regex"),
                    group != null && !group.isNull() ? group.asInt() : null);
            case "binary":
                return new MatcherType.Binary(requiredStringList(node, "binary"));
            case "time":
                return new MatcherType.Time(
                    requiredEnum(MatcherType.TimeCondition.class, text(node, "condition"), "condition"),
                    parseDuration(node.get("time")));
            case "size":
                return new MatcherType.Size(
                    requiredEnum(MatcherType.SizeCondition.class, text(node, "condition"), "condition"),
                    requiredLong(node, "size"));
            case "hash":
                return new MatcherType.Hash(
                    requiredEnum(MatcherType.HashAlgorithm.class, text(node, "algorithm"), "algorithm"),
                    required(node, "hash"));
            case "tls":
                return new MatcherType.Tls(
                    stringList(node, "versions"),
                    stringList(node, "ciphers"),
                    stringList(node, "vulnerabilities"));
            case "dns":
                return new MatcherType.Dns(required(node, "record_type"), text(node, "pattern"), text(node, "value"));
            case "diff":
                try {
                    return new MatcherType.Diff(required(node, "baseline"), (int) requiredLong(node, "threshold"));
                } catch (IllegalArgumentException e) {
                    throw new MatcherException(e.getMessage(), e);
                }
            case "custom":
                return new MatcherType.Custom(required(node, "language"), required(node, "code"));
            default:
                throw new MatcherException("Unknown matcher type: " + type);
        }
    }

    /**
     * Разбирает условие {@code and}/{@code or}; отсутствующее значение заменяется значением по умолчанию.
     */
    public static MatcherType.MatchCondition parseCondition(JsonNode node, MatcherType.MatchCondition defaultValue)
            throws MatcherException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaultValue;
        }
        return parseEnum(MatcherType.MatchCondition.class, node.asText(), defaultValue);
    }

    private static Duration parseDuration(JsonNode node) throws MatcherException {
        if (node == null || node.isNull()) {
            throw new MatcherException("Time matcher is missing 'time'");
        }
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        if (node.isObject()) {
            return Duration.ofSeconds(node.path("secs").asLong(), node.path("nanos").asLong());
        }
        try {
            return TargetParser.parseDuration(node.asText());
        } catch (IllegalArgumentException e) {
            throw new MatcherException("Invalid time threshold: " + node.asText(), e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue)
            throws MatcherException {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MatcherException("Invalid " + type.getSimpleName() + ": " + value, e);
        }
    }

    private static <E extends Enum<E>> E requiredEnum(Class<E> type, String value, String field)
            throws MatcherException {
        if (value == null) {
            throw new MatcherException("Matcher is missing '" + field + "'");
        }
        return parseEnum(type, value, null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static String required(JsonNode node, String field) throws MatcherException {
        String value = text(node, field);
        if (value == null) {
            throw new MatcherException("Matcher is missing '" + field + "'");
        }
        return value;
    }

    private static long requiredLong(JsonNode node, String field) throws MatcherException {
        JsonNode value = node.get(field);
        if (value == null || !value.canConvertToLong()) {
            throw new MatcherException("Matcher field '" + field + "' must be a number");
        }
        return value.asLong();
    }

    private static List<String> stringList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(item -> result.add(item.asText()));
        } else {
            result.add(value.asText());
        }
        return result;
    }

    private static List<String> requiredStringList(JsonNode node, String field) throws MatcherException {
        if (node.get(field) == null) {
            throw new MatcherException("Matcher is missing '" + field + "'");
        }
        return stringList(node, field);
    }

    private static List<Integer> intList(JsonNode node, String field) throws MatcherException {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new MatcherException("Matcher is missing '" + field + "'");
        }
        List<Integer> result = new ArrayList<>();
        if (value.isArray()) {
            for (JsonNode item : value) {
                if (!item.canConvertToInt()) {
                    throw new MatcherException("Status code must be a number: " + item.asText());
                }
                result.add(item.asInt());
            }
        } else if (value.canConvertToInt()) {
            result.add(value.asInt());
        } else {
            throw new MatcherException("Status code must be a number: " + value.asText());
        }
        return result;
    }
}
