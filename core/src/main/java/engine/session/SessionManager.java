package engine.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import util.StringUtils;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Хранилище состояния сессии на время сканирования: cookies по доменам,
 * именованные JWT токены и переменные шаблонов.
 *
 * <p>Потокобезопасен. Изменения cookies одного домена выполняются под блокировкой
 * записи этого домена в {@link ConcurrentHashMap#compute}; списки cookies неизменяемы
 * и заменяются целиком, поэтому чтение не блокируется.
 */
public final class SessionManager {
    private static final Logger logger = Logger.getLogger(SessionManager.class.getName());

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_BITS = 128;

    private final Map<String, List<Cookie>> cookies = new ConcurrentHashMap<>();
    private final Map<String, JwtToken> jwtTokens = new ConcurrentHashMap<>();
    private final Map<String, String> variables = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();

    public SessionManager() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Сохраняет cookie, заменяя cookie с тем же именем в пределах домена.
     */
    public void storeCookie(Cookie cookie) {
        Objects.requireNonNull(cookie, "cookie cannot be null");
        cookies.compute(cookie.getDomain(), (domain, existing) -> {
            List<Cookie> updated = new ArrayList<>();
            if (existing != null) {
                for (Cookie c : existing) {
                    if (!c.getName().equals(cookie.getName())) {
                        updated.add(c);
                    }
                }
            }
            updated.add(cookie);
            return List.copyOf(updated);
        });
    }

    /**
     * Возвращает неистекшие cookies домена.
     */
    public List<Cookie> getCookies(String domain) {
        List<Cookie> stored = cookies.getOrDefault(domain, Collections.emptyList());
        return stored.stream()
            .filter(c -> !c.isExpired())
            .collect(Collectors.toList());
    }

    /**
     * Формирует значение заголовка Cookie для домена.
     *
     * @return {@code name=value; name2=value2} или пусто, если cookies нет
     */
    public Optional<String> getCookieHeader(String domain) {
        List<Cookie> active = getCookies(domain);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(active.stream()
            .map(Cookie::toHeaderValue)
            .collect(Collectors.joining("; ")));
    }

    /**
     * Разбирает заголовок Set-Cookie и сохраняет cookie для домена.
     * Заголовок без корректной пары {@code name=value} игнорируется.
     */
    public void parseSetCookie(String domain, String headerValue) {
        parseSetCookie(domain, headerValue, false);
    }

    /**
     * Разбирает заголовок Set-Cookie, запоминая, пришел ли ответ по HTTPS.
     * Такая cookie без флага Secure отмечается анализом безопасности.
     */
    public void parseSetCookie(String domain, String headerValue, boolean overHttps) {
        if (headerValue == null || headerValue.isBlank()) {
            return;
        }

        String[] parts = headerValue.split(";");
        String[] nameValue = parts[0].split("=", -1);
        if (nameValue.length != 2) {
            logger.fine("Ignoring Set-Cookie without name=value pair for " + domain);
            return;
        }

        Cookie.Builder builder = Cookie.builder(nameValue[0].trim(), nameValue[1].trim(), domain)
            .receivedOverHttps(overHttps);
        Instant expires = null;
        Instant maxAgeExpiry = null;

        for (int i = 1; i < parts.length; i++) {
            String attribute = parts[i].trim();
            String lower = attribute.toLowerCase(Locale.ROOT);
            if (lower.equals("secure")) {
                builder.secure(true);
            } else if (lower.equals("httponly")) {
                builder.httpOnly(true);
            } else if (lower.startsWith("samesite=")) {
                builder.sameSite(parseSameSite(lower.substring("samesite=".length())));
            } else if (lower.startsWith("path=")) {
                builder.path(attribute.substring("path=".length()).trim());
            } else if (lower.startsWith("expires=")) {
                expires = parseExpires(attribute.substring("expires=".length()).trim());
            } else if (lower.startsWith("max-age=")) {
                maxAgeExpiry = parseMaxAge(lower.substring("max-age=".length()).trim());
            }
        }

        // Max-Age has precedence over Expires
        builder.expires(maxAgeExpiry != null ? maxAgeExpiry : expires);
        storeCookie(builder.build());
    }

    /**
     * Сохраняет JWT под именем. Токен {@code default} подставляется в запросы как Authorization.
     *
     * @throws SessionException если токен некорректен
     */
    public void setJwt(String name, String token) throws SessionException {
        JwtToken jwt = JwtToken.parse(token);
        jwtTokens.put(name, jwt);
        logger.fine("Stored JWT " + name + ": " + StringUtils.maskSensitive(token));
    }

    public Optional<JwtToken> getJwt(String name) {
        return Optional.ofNullable(jwtTokens.get(name));
    }

    /**
     * @return значение заголовка Authorization вида {@code Bearer <token>}
     */
    public Optional<String> getJwtHeader(String name) {
        return getJwt(name).map(JwtToken::toAuthorizationHeader);
    }

    /**
     * Анализирует все сохраненные JWT; в результат попадают только токены с проблемами.
     */
    public Map<String, List<JwtSecurityIssue>> analyzeJwtSecurity() {
        Map<String, List<JwtSecurityIssue>> results = new TreeMap<>();
        jwtTokens.forEach((name, token) -> {
            List<JwtSecurityIssue> issues = token.analyzeSecurity();
            if (!issues.isEmpty()) {
                results.put(name, issues);
            }
        });
        return results;
    }

    /**
     * Анализирует cookies всех доменов; в результат попадают только домены с проблемами.
     */
    public Map<String, List<CookieSecurityIssue>> analyzeCookieSecurity() {
        Map<String, List<CookieSecurityIssue>> results = new TreeMap<>();
        cookies.forEach((domain, list) -> {
            List<CookieSecurityIssue> issues = new ArrayList<>();
            list.forEach(cookie -> issues.addAll(cookie.analyzeSecurity()));
            if (!issues.isEmpty()) {
                results.put(domain, issues);
            }
        });
        return results;
    }

    public void setVariable(String name, String value) {
        variables.put(name, value);
    }

    public Optional<String> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    public Map<String, String> getVariables() {
        return Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    public void clear() {
        cookies.clear();
        jwtTokens.clear();
        variables.clear();
    }

    // ===== Persistence =====

    /**
     * Сохраняет сессию в JSON файл.
     */
    public void saveToFile(Path file) throws SessionException {
        try {
            Files.write(file, toJson());
            logger.fine("Session saved to " + file);
        } catch (IOException e) {
            throw new SessionException("Failed to save session to " + file, e);
        }
    }

    /**
     * Загружает сессию из JSON файла, дополняя текущее состояние.
     */
    public void loadFromFile(Path file) throws SessionException {
        byte[] json;
        try {
            json = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new SessionException("Failed to read session file " + file, e);
        }
        fromJson(json);
        logger.fine("Session loaded from " + file);
    }

    /**
     * Экспортирует сессию, зашифрованную AES-GCM ключом, производным от пароля.
     *
     * @return Base64 от IV и шифртекста
     */
    public String exportEncrypted(String passphrase) throws SessionException {
        byte[] plain = toJson();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphrase), new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] encrypted = cipher.doFinal(plain);

            byte[] output = new byte[iv.length + encrypted.length];
            System.arraycopy(iv, 0, output, 0, iv.length);
            System.arraycopy(encrypted, 0, output, iv.length, encrypted.length);
            return Base64.getEncoder().encodeToString(output);
        } catch (GeneralSecurityException e) {
            throw new SessionException("Failed to encrypt session", e);
        }
    }

    /**
     * Импортирует сессию, экспортированную {@link #exportEncrypted(String)}.
     *
     * @throws SessionException при неверном пароле или поврежденных данных
     */
    public void importEncrypted(String data, String passphrase) throws SessionException {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(data.trim());
        } catch (IllegalArgumentException e) {
            throw new SessionException("Encrypted session is not valid Base64", e);
        }
        if (raw.length <= GCM_IV_LENGTH) {
            throw new SessionException("Encrypted session is too short");
        }

        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphrase),
                new GCMParameterSpec(GCM_TAG_BITS, raw, 0, GCM_IV_LENGTH));
            byte[] plain = cipher.doFinal(raw, GCM_IV_LENGTH, raw.length - GCM_IV_LENGTH);
            fromJson(plain);
        } catch (GeneralSecurityException e) {
            throw new SessionException("Failed to decrypt session: wrong passphrase or corrupted data", e);
        }
    }

    private static SecretKeySpec deriveKey(String passphrase) throws GeneralSecurityException {
        Objects.requireNonNull(passphrase, "passphrase cannot be null");
        byte[] key = MessageDigest.getInstance("SHA-256").digest(passphrase.getBytes(StandardCharsets.UTF_8));
        return new SecretKeySpec(key, "AES");
    }

    private byte[] toJson() throws SessionException {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode cookiesNode = root.putObject("cookies");
        new TreeMap<>(cookies).forEach((domain, list) -> {
            ArrayNode array = cookiesNode.putArray(domain);
            list.forEach(cookie -> array.add(cookieToJson(cookie)));
        });

        ObjectNode jwtNode = root.putObject("jwt_tokens");
        new TreeMap<>(jwtTokens).forEach((name, token) -> jwtNode.put(name, token.getToken()));

        ObjectNode variablesNode = root.putObject("variables");
        new TreeMap<>(variables).forEach(variablesNode::put);

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (IOException e) {
            throw new SessionException("Failed to serialize session", e);
        }
    }

    private ObjectNode cookieToJson(Cookie cookie) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", cookie.getName());
        node.put("value", cookie.getValue());
        node.put("domain", cookie.getDomain());
        node.put("path", cookie.getPath());
        node.put("secure", cookie.isSecure());
        node.put("http_only", cookie.isHttpOnly());
        node.put("received_over_https", cookie.isReceivedOverHttps());
        cookie.getSameSite().ifPresent(s -> node.put("same_site", s.name()));
        cookie.getExpires().ifPresent(e -> node.set("expires", objectMapper.valueToTree(e)));
        return node;
    }

    private void fromJson(byte[] json) throws SessionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new SessionException("Session data is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SessionException("Session data must be a JSON object");
        }

        JsonNode cookiesNode = root.path("cookies");
        Iterator<Map.Entry<String, JsonNode>> domains = cookiesNode.fields();
        while (domains.hasNext()) {
            Map.Entry<String, JsonNode> entry = domains.next();
            for (JsonNode c : entry.getValue()) {
                storeCookie(cookieFromJson(entry.getKey(), c));
            }
        }

        Iterator<Map.Entry<String, JsonNode>> tokens = root.path("jwt_tokens").fields();
        while (tokens.hasNext()) {
            Map.Entry<String, JsonNode> entry = tokens.next();
            setJwt(entry.getKey(), entry.getValue().asText());
        }

        root.path("variables").fields()
            .forEachRemaining(entry -> variables.put(entry.getKey(), entry.getValue().asText()));
    }

    private Cookie cookieFromJson(String domain, JsonNode node) throws SessionException {
        if (!node.hasNonNull("name") || !node.hasNonNull("value")) {
            throw new SessionException("Cookie entry for " + domain + " is missing name or value");
        }
        Cookie.Builder builder = Cookie.builder(node.get("name").asText(), node.get("value").asText(),
                node.path("domain").asText(domain))
            .path(node.path("path").asText("/"))
            .secure(node.path("secure").asBoolean(false))
            .httpOnly(node.path("http_only").asBoolean(false))
            .receivedOverHttps(node.path("received_over_https").asBoolean(false));

        if (node.hasNonNull("same_site")) {
            builder.sameSite(parseSameSite(node.get("same_site").asText()));
        }
        if (node.hasNonNull("expires")) {
            builder.expires(objectMapper.convertValue(node.get("expires"), Instant.class));
        }
        return builder.build();
    }

    private static Cookie.SameSite parseSameSite(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> Cookie.SameSite.STRICT;
            case "lax" -> Cookie.SameSite.LAX;
            case "none" -> Cookie.SameSite.NONE;
            default -> null;
        };
    }

    private static Instant parseExpires(String value) {
        try {
            return DateTimeFormatter.RFC_1123_DATE_TIME.parse(value, Instant::from);
        } catch (DateTimeParseException e) {
            logger.fine("Ignoring unparseable cookie Expires attribute: " + value);
            return null;
        }
    }

    private static Instant parseMaxAge(String value) {
        long seconds;
        try {
            seconds = Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.fine("Ignoring invalid cookie Max-Age attribute: " + value);
            return null;
        }
        try {
            return Instant.now().plusSeconds(seconds);
        } catch (DateTimeException | ArithmeticException e) {
            // Out of the representable range: clamp to the nearest bound
            return seconds > 0 ? Instant.MAX : Instant.EPOCH;
        }
    }
}
