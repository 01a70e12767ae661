package engine.matcher;

import java.time.Duration;
import java.util.*;

/**
 * Декларативное правило сопоставления ответа.
 *
 * <p>Закрытое семейство вариантов, различаемых по {@link Kind}. Каждый вариант неизменяем
 * и создается из данных шаблона через {@link MatcherParser} или фабричные методы.
 * Вариант {@link Custom} хранит код на стороннем языке и ядром не вычисляется.
 */
public abstract class MatcherType {

    public enum Kind {
        STATUS, WORD, REGEX, BINARY, TIME, SIZE, HASH, TLS, DNS, DIFF, CUSTOM
    }

    public enum MatchCondition {
        AND, OR
    }

    public enum ResponsePart {
        BODY, HEADER, ALL
    }

    public enum TimeCondition {
        GREATER, LESS
    }

    public enum SizeCondition {
        GREATER, LESS, EQUAL
    }

    public enum HashAlgorithm {
        MD5("MD5"),
        SHA1("SHA-1"),
        SHA256("SHA-256"),
        SHA512("SHA-512"),
        BLAKE3(null);

        private final String jdkName;

        HashAlgorithm(String jdkName) {
            this.jdkName = jdkName;
        }

        public Optional<String> getJdkName() {
            return Optional.ofNullable(jdkName);
        }
    }

    private final Kind kind;

    private MatcherType(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static Status status(Integer... codes) {
        return new Status(Arrays.asList(codes));
    }

    public static Word words(MatchCondition condition, ResponsePart part, String... words) {
        return new Word(Arrays.asList(words), condition, part);
    }

    public static Regex regex(String... patterns) {
        return new Regex(Arrays.asList(patterns), null);
    }

    public static final class Status extends MatcherType {
        private final List<Integer> codes;

        public Status(List<Integer> codes) {
            super(Kind.STATUS);
            this.codes = List.copyOf(Objects.requireNonNull(codes, "codes cannot be null"));
        }

        public List<Integer> getCodes() {
            return codes;
        }
    }

    public static final class Word extends MatcherType {
        private final List<String> words;
        private final MatchCondition condition;
        private final ResponsePart part;

        public Word(List<String> words, MatchCondition condition, ResponsePart part) {
            super(Kind.WORD);
            this.words = List.copyOf(Objects.requireNonNull(words, "words cannot be null"));
            this.condition = condition != null ? condition : MatchCondition.OR;
            this.part = part != null ? part : ResponsePart.BODY;
        }

        public List<String> getWords() {
            return words;
        }

        public MatchCondition getCondition() {
            return condition;
        }

        public ResponsePart getPart() {
            return part;
        }
    }

    public static final class Regex extends MatcherType {
        private final List<String> patterns;
        private final Integer group;

        public Regex(List<String> patterns, Integer group) {
            super(Kind.REGEX);
            this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns cannot be null"));
            this.group = group;
        }

        public List<String> getPatterns() {
            return patterns;
        }

        public Optional<Integer> getGroup() {
            return Optional.ofNullable(group);
        }
    }

    public static final class Binary extends MatcherType {
        private final List<String> hexPatterns;

        public Binary(List<String> hexPatterns) {
            super(Kind.BINARY);
            this.hexPatterns = List.copyOf(Objects.requireNonNull(hexPatterns, "hexPatterns cannot be null"));
        }

        public List<String> getHexPatterns() {
            return hexPatterns;
        }
    }

    public static final class Time extends MatcherType {
        private final TimeCondition condition;
        private final Duration threshold;

        public Time(TimeCondition condition, Duration threshold) {
            super(Kind.TIME);
            this.condition = Objects.requireNonNull(condition, "condition cannot be null");
            this.threshold = Objects.requireNonNull(threshold, "threshold cannot be null");
        }

        public TimeCondition getCondition() {
            return condition;
        }

        public Duration getThreshold() {
            return threshold;
        }
    }

    public static final class Size extends MatcherType {
        private final SizeCondition condition;
        private final long size;

        public Size(SizeCondition condition, long size) {
            super(Kind.SIZE);
            this.condition = Objects.requireNonNull(condition, "condition cannot be null");
            this.size = size;
        }

        public SizeCondition getCondition() {
            return condition;
        }

        public long getSize() {
            return size;
        }
    }

    public static final class Hash extends MatcherType {
        private final HashAlgorithm algorithm;
        private final String digest;

        public Hash(HashAlgorithm algorithm, String digest) {
            super(Kind.HASH);
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null");
            this.digest = Objects.requireNonNull(digest, "digest cannot be null");
        }

        public HashAlgorithm getAlgorithm() {
            return algorithm;
        }

        public String getDigest() {
            return digest;
        }
    }

    public static final class Tls extends MatcherType {
        private final List<String> versions;
        private final List<String> ciphers;
        private final List<String> vulnerabilities;

        public Tls(List<String> versions, List<String> ciphers, List<String> vulnerabilities) {
            super(Kind.TLS);
            this.versions = versions != null ? List.copyOf(versions) : Collections.emptyList();
            this.ciphers = ciphers != null ? List.copyOf(ciphers) : Collections.emptyList();
            this.vulnerabilities = vulnerabilities != null ? List.copyOf(vulnerabilities) : Collections.emptyList();
        }

        public List<String> getVersions() {
            return versions;
        }

        public List<String> getCiphers() {
            return ciphers;
        }

        public List<String> getVulnerabilities() {
            return vulnerabilities;
        }
    }

    public static final class Dns extends MatcherType {
        private final String recordType;
        private final String pattern;
        private final String value;

        public Dns(String recordType, String pattern, String value) {
            super(Kind.DNS);
            this.recordType = Objects.requireNonNull(recordType, "recordType cannot be null");
            this.pattern = pattern;
            this.value = value;
        }

        public String getRecordType() {
            return recordType;
        }

        public Optional<String> getPattern() {
            return Optional.ofNullable(pattern);
        }

        public Optional<String> getValue() {
            return Optional.ofNullable(value);
        }
    }

    public static final class Diff extends MatcherType {
        private final String baseline;
        private final int threshold;

        public Diff(String baseline, int threshold) {
            super(Kind.DIFF);
            this.baseline = Objects.requireNonNull(baseline, "baseline cannot be null");
            if (threshold < 0 || threshold > 100) {
                throw new IllegalArgumentException("Diff threshold must be within 0..100: " + threshold);
            }
            this.threshold = threshold;
        }

        public String getBaseline() {
            return baseline;
        }

        public int getThreshold() {
            return threshold;
        }
    }

    public static final class Custom extends MatcherType {
        private final String language;
        private final String code;

        public Custom(String language, String code) {
            super(Kind.CUSTOM);
            this.language = Objects.requireNonNull(language, "language cannot be null");
            this.code = Objects.requireNonNull(code, "code cannot be null");
        }

        public String getLanguage() {
            return language;
        }

        public String getCode() {
            return code;
        }
    }
}
