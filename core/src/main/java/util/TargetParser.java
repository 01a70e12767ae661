package util;

import model.Protocol;
import model.Target;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Разбор пользовательского ввода: цели, диапазоны портов, длительности, домены.
 */
public final class TargetParser {
    private static final Logger logger = Logger.getLogger(TargetParser.class.getName());

    private TargetParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Разбирает цель в одном из форматов: URL ({@code https://host:8443}), {@code host:port} или {@code host}.
     *
     * <p>Для URL протокол берется из схемы. Для {@code host:port} протокол выбирается по порту
     * (80, 8000, 8080 - HTTP, иначе HTTPS). Голый хост считается HTTPS целью.
     *
     * @param value строка цели
     * @return цель сканирования
     * @throws IllegalArgumentException если строка пустая или порт некорректен
     */
    public static Target parseTarget(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Target cannot be empty");
        }
        String trimmed = value.trim();

        if (trimmed.contains("://")) {
            try {
                URI uri = new URI(trimmed);
                if (uri.getHost() == null) {
                    throw new IllegalArgumentException("No host in URL: " + trimmed);
                }
                Protocol protocol = Protocol.fromName(uri.getScheme());
                Target.Builder builder = Target.builder().address(uri.getHost()).protocol(protocol);
                if (uri.getPort() > 0) {
                    builder.port(uri.getPort());
                }
                return builder.build();
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid URL: " + trimmed, e);
            }
        }

        int colon = trimmed.lastIndexOf(':');
        if (colon > 0 && trimmed.indexOf(':') == colon) {
            String host = trimmed.substring(0, colon);
            int port = parsePort(trimmed.substring(colon + 1));
            Protocol protocol = (port == 80 || port == 8000 || port == 8080) ? Protocol.HTTP : Protocol.HTTPS;
            return Target.of(host, port, protocol);
        }

        return Target.of(trimmed, Protocol.HTTPS);
    }

    /**
     * Разбирает порт или диапазон портов ({@code "8000-8010"}).
     */
    public static List<Integer> parsePortRange(String range) {
        if (range == null || range.isBlank()) {
            throw new IllegalArgumentException("Port range cannot be empty");
        }
        String trimmed = range.trim();
        int dash = trimmed.indexOf('-');
        if (dash < 0) {
            return List.of(parsePort(trimmed));
        }

        int start = parsePort(trimmed.substring(0, dash));
        int end = parsePort(trimmed.substring(dash + 1));
        if (start > end) {
            throw new IllegalArgumentException("Invalid port range: " + start + " > " + end);
        }

        List<Integer> ports = new ArrayList<>(end - start + 1);
        for (int port = start; port <= end; port++) {
            ports.add(port);
        }
        return ports;
    }

    /**
     * Разбирает длительность вида {@code 500ms}, {@code 30s}, {@code 5m}, {@code 1h}.
     * Число без единицы измерения трактуется как секунды.
     */
    public static Duration parseDuration(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Empty duration");
        }
        String trimmed = value.trim().toLowerCase(Locale.ROOT);

        String number;
        String unit;
        if (trimmed.endsWith("ms")) {
            number = trimmed.substring(0, trimmed.length() - 2);
            unit = "ms";
        } else if (trimmed.endsWith("s") || trimmed.endsWith("m") || trimmed.endsWith("h")) {
            number = trimmed.substring(0, trimmed.length() - 1);
            unit = trimmed.substring(trimmed.length() - 1);
        } else {
            number = trimmed;
            unit = "s";
        }

        long amount;
        try {
            amount = Long.parseLong(number.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration value: " + value, e);
        }

        switch (unit) {
            case "ms":
                return Duration.ofMillis(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "s":
            default:
                return Duration.ofSeconds(amount);
        }
    }

    /**
     * Извлекает имя хоста из URL или строки {@code host:port}.
     */
    public static String extractDomain(String input) {
        if (input == null) {
            return "";
        }
        if (input.contains("://")) {
            try {
                String host = new URI(input).getHost();
                if (host != null) {
                    return host;
                }
            } catch (URISyntaxException e) {
                logger.fine("Not a valid URL, parsing as host: " + input);
            }
        }

        int colon = input.lastIndexOf(':');
        if (colon > 0) {
            String suffix = input.substring(colon + 1);
            if (!suffix.isEmpty() && suffix.chars().allMatch(Character::isDigit)) {
                return input.substring(0, colon);
            }
        }
        return input;
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid port number: " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port number: " + value, e);
        }
    }
}
