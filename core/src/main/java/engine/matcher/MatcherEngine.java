package engine.matcher;

import engine.model.ProbeResponse;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Вычисление матчеров против захваченного ответа.
 *
 * <p>Все методы чистые: результат зависит только от матчера и ответа.
 * Ошибки возникают только при дефектах шаблона (некорректный regex или hex, неподдерживаемый
 * алгоритм хеширования, пользовательский матчер) и не подавляются.
 *
 * <p>Матчеры TLS и DNS работают по принципу "best effort": они анализируют только данные,
 * уже присутствующие в ответе, и всегда пишут предупреждение в лог.
 */
public final class MatcherEngine {
    private static final Logger logger = Logger.getLogger(MatcherEngine.class.getName());

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private MatcherEngine() {
        // Utility class
    }

    /**
     * Проверяет один матчер против ответа.
     *
     * @param matcher правило сопоставления
     * @param response захваченный ответ
     * @return true если правило выполнено
     * @throws MatcherException если шаблон матчера некорректен
     */
    public static boolean evaluate(MatcherType matcher, ProbeResponse response) throws MatcherException {
        Objects.requireNonNull(matcher, "matcher cannot be null");
        Objects.requireNonNull(response, "response cannot be null");

        switch (matcher.getKind()) {
            case STATUS:
                return ((MatcherType.Status) matcher).getCodes().contains(response.getStatusCode());
            case WORD:
                return evaluateWord((MatcherType.Word) matcher, response);
            case REGEX:
                return evaluateRegex((MatcherType.Regex) matcher, response);
            case BINARY:
                return evaluateBinary((MatcherType.Binary) matcher, response);
            case TIME:
                return evaluateTime((MatcherType.Time) matcher, response);
            case SIZE:
                return evaluateSize((MatcherType.Size) matcher, response);
            case HASH:
                return evaluateHash((MatcherType.Hash) matcher, response);
            case TLS:
                return evaluateTls((MatcherType.Tls) matcher, response);
            case DNS:
                return evaluateDns((MatcherType.Dns) matcher, response);
            case DIFF:
                return evaluateDiff((MatcherType.Diff) matcher, response);
            case CUSTOM:
                MatcherType.Custom custom = (MatcherType.Custom) matcher;
                throw new MatcherException("Custom matchers (" + custom.getLanguage()
                    + ") require template engine support and are not evaluated by the core");
            default:
                throw new MatcherException("Unsupported matcher kind: " + matcher.getKind());
        }
    }

    /**
     * Объединяет результаты набора матчеров по условию AND/OR.
     * Пустой набор всегда дает false: шаблон без матчеров не может породить находку.
     */
    public static boolean matchAll(List<? extends MatcherType> matchers, ProbeResponse response,
                                   MatcherType.MatchCondition condition) throws MatcherException {
        if (matchers == null || matchers.isEmpty()) {
            return false;
        }

        // Every matcher is evaluated so that authoring errors surface regardless of condition
        List<Boolean> results = new ArrayList<>(matchers.size());
        for (MatcherType matcher : matchers) {
            results.add(evaluate(matcher, response));
        }

        if (condition == MatcherType.MatchCondition.AND) {
            return !results.contains(Boolean.FALSE);
        }
        return results.contains(Boolean.TRUE);
    }

    /**
     * Позиционная посимвольная схожесть строк в процентах (0-100).
     * Две пустые строки считаются идентичными, одна пустая - полностью различной.
     */
    public static int similarity(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 100;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }

        int[] left = a.codePoints().toArray();
        int[] right = b.codePoints().toArray();
        int maxLen = Math.max(left.length, right.length);
        int minLen = Math.min(left.length, right.length);

        int matches = 0;
        for (int i = 0; i < minLen; i++) {
            if (left[i] == right[i]) {
                matches++;
            }
        }
        return (int) ((double) matches / maxLen * 100.0);
    }

    static byte[] decodeHex(String pattern) throws MatcherException {
        String hex = pattern.startsWith("0x") || pattern.startsWith("0X") ? pattern.substring(2) : pattern;
        if (hex.isEmpty()) {
            throw new MatcherException("Invalid hex pattern: empty pattern");
        }
        if (hex.length() % 2 != 0) {
            throw new MatcherException("Invalid hex pattern: odd length in '" + pattern + "'");
        }

        byte[] bytes = new byte[hex.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int high = Character.digit(hex.charAt(i * 2), 16);
            int low = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new MatcherException("Invalid hex pattern: non-hex character in '" + pattern + "'");
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return bytes;
    }

    static Pattern compile(String regex) throws MatcherException {
        Pattern cached = PATTERN_CACHE.get(regex);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern compiled = Pattern.compile(regex);
            PATTERN_CACHE.putIfAbsent(regex, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            throw new MatcherException("Invalid regex: " + e.getMessage(), e);
        }
    }

    private static boolean evaluateWord(MatcherType.Word matcher, ProbeResponse response) {
        String content;
        switch (matcher.getPart()) {
            case HEADER:
                content = response.headersAsString();
                break;
            case ALL:
                content = response.headersAsString() + "\n\n" + response.getBodyAsString();
                break;
            case BODY:
            default:
                content = response.getBodyAsString();
                break;
        }

        if (matcher.getCondition() == MatcherType.MatchCondition.AND) {
            return matcher.getWords().stream().allMatch(content::contains);
        }
        return matcher.getWords().stream().anyMatch(content::contains);
    }

    private static boolean evaluateRegex(MatcherType.Regex matcher, ProbeResponse response) throws MatcherException {
        String content = response.getBodyAsString();
        Optional<Integer> group = matcher.getGroup();

        for (String regex : matcher.getPatterns()) {
            Matcher m = compile(regex).matcher(content);
            if (!m.find()) {
                continue;
            }
            if (group.isEmpty()) {
                return true;
            }
            int index = group.get();
            if (index <= m.groupCount() && m.group(index) != null) {
                return true;
            }
        }
        return false;
    }

    private static boolean evaluateBinary(MatcherType.Binary matcher, ProbeResponse response) throws MatcherException {
        byte[] body = response.getBody();
        for (String pattern : matcher.getHexPatterns()) {
            if (indexOf(body, decodeHex(pattern)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean evaluateTime(MatcherType.Time matcher, ProbeResponse response) {
        int cmp = response.getResponseTime().compareTo(matcher.getThreshold());
        return matcher.getCondition() == MatcherType.TimeCondition.GREATER ? cmp > 0 : cmp < 0;
    }

    private static boolean evaluateSize(MatcherType.Size matcher, ProbeResponse response) {
        long bodySize = response.getBodyLength();
        switch (matcher.getCondition()) {
            case GREATER:
                return bodySize > matcher.getSize();
            case LESS:
                return bodySize < matcher.getSize();
            case EQUAL:
            default:
                return bodySize == matcher.getSize();
        }
    }

    private static boolean evaluateHash(MatcherType.Hash matcher, ProbeResponse response) throws MatcherException {
        String jdkName = matcher.getAlgorithm().getJdkName()
            .orElseThrow(() -> new MatcherException(
                "Hash algorithm " + matcher.getAlgorithm() + " is not available"));
        try {
            byte[] digest = MessageDigest.getInstance(jdkName).digest(response.getBody());
            return toHex(digest).equalsIgnoreCase(matcher.getDigest().trim());
        } catch (NoSuchAlgorithmException e) {
            throw new MatcherException("Hash algorithm " + jdkName + " is not available", e);
        }
    }

    private static boolean evaluateTls(MatcherType.Tls matcher, ProbeResponse response) {
        String headers = response.headersAsString().toLowerCase(Locale.ROOT);
        boolean matched = false;

        for (String version : matcher.getVersions()) {
            if (headers.contains("tls " + version.toLowerCase(Locale.ROOT))) {
                matched = true;
                break;
            }
        }

        for (String cipher : matcher.getCiphers()) {
            if (headers.contains(cipher.toLowerCase(Locale.ROOT))) {
                matched = true;
                break;
            }
        }

        for (String vulnerability : matcher.getVulnerabilities()) {
            if (vulnerability.equalsIgnoreCase("heartbleed") && headers.contains("heartbeat")) {
                matched = true;
            }
        }

        logger.warning("TLS matcher inspects response headers only; accurate detection requires connection metadata");
        return matched;
    }

    private static boolean evaluateDns(MatcherType.Dns matcher, ProbeResponse response) throws MatcherException {
        String body = response.getBodyAsString();
        boolean matched = body.contains(matcher.getRecordType());

        Optional<String> pattern = matcher.getPattern();
        if (pattern.isPresent()) {
            matched = matched && compile(pattern.get()).matcher(body).find();
        }

        Optional<String> value = matcher.getValue();
        if (value.isPresent()) {
            matched = matched && body.contains(value.get());
        }

        logger.warning("DNS matcher inspects the captured body only; accurate detection requires a DNS protocol handler");
        return matched;
    }

    private static boolean evaluateDiff(MatcherType.Diff matcher, ProbeResponse response) {
        int similarity = similarity(response.getBodyAsString(), matcher.getBaseline());
        return 100 - similarity >= matcher.getThreshold();
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
