package engine.session;

import java.time.Instant;
import java.util.*;

/**
 * HTTP cookie, сохраненная для домена цели.
 */
public final class Cookie {

    private static final List<String> SESSION_COOKIE_NAMES = List.of(
        "sessionid", "session_id", "sess", "jsessionid",
        "phpsessid", "asp.net_sessionid", "aspsessionid"
    );

    private final String name;
    private final String value;
    private final String domain;
    private final String path;
    private final boolean secure;
    private final boolean httpOnly;
    private final SameSite sameSite;
    private final Instant expires;
    private final boolean receivedOverHttps;

    public enum SameSite {
        STRICT, LAX, NONE
    }

    private Cookie(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name cannot be null");
        this.value = Objects.requireNonNull(builder.value, "value cannot be null");
        this.domain = Objects.requireNonNull(builder.domain, "domain cannot be null");
        this.path = builder.path != null ? builder.path : "/";
        this.secure = builder.secure;
        this.httpOnly = builder.httpOnly;
        this.sameSite = builder.sameSite;
        this.expires = builder.expires;
        this.receivedOverHttps = builder.receivedOverHttps;
    }

    public static Builder builder(String name, String value, String domain) {
        return new Builder().name(name).value(value).domain(domain);
    }

    public static Cookie of(String name, String value, String domain) {
        return builder(name, value, domain).build();
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getDomain() {
        return domain;
    }

    public String getPath() {
        return path;
    }

    public boolean isSecure() {
        return secure;
    }

    public boolean isHttpOnly() {
        return httpOnly;
    }

    public Optional<SameSite> getSameSite() {
        return Optional.ofNullable(sameSite);
    }

    public Optional<Instant> getExpires() {
        return Optional.ofNullable(expires);
    }

    /**
     * Cookie была выставлена ответом, полученным по HTTPS.
     */
    public boolean isReceivedOverHttps() {
        return receivedOverHttps;
    }

    public boolean isExpired() {
        return expires != null && Instant.now().isAfter(expires);
    }

    public String toHeaderValue() {
        return name + "=" + value;
    }

    /**
     * Эвристический анализ флагов безопасности cookie.
     *
     * @return найденные проблемы в порядке: Secure, HttpOnly, слабый идентификатор, SameSite
     */
    public List<CookieSecurityIssue> analyzeSecurity() {
        List<CookieSecurityIssue> issues = new ArrayList<>();

        if (!secure && (receivedOverHttps || domain.startsWith("https://"))) {
            issues.add(new CookieSecurityIssue(CookieSecurityIssue.Type.MISSING_SECURE_FLAG, name, null));
        }

        if (!httpOnly && isSessionCookie()) {
            issues.add(new CookieSecurityIssue(CookieSecurityIssue.Type.MISSING_HTTP_ONLY, name, null));
        }

        if (isSessionCookie() && isWeakSessionId()) {
            issues.add(new CookieSecurityIssue(CookieSecurityIssue.Type.WEAK_SESSION_ID, name, entropy()));
        }

        if (sameSite == null) {
            issues.add(new CookieSecurityIssue(CookieSecurityIssue.Type.MISSING_SAME_SITE, name, null));
        }

        return issues;
    }

    boolean isSessionCookie() {
        String lower = name.toLowerCase(Locale.ROOT);
        return SESSION_COOKIE_NAMES.stream().anyMatch(lower::contains);
    }

    boolean isWeakSessionId() {
        if (value.length() < 16) {
            return true;
        }
        if (value.chars().allMatch(Character::isDigit)) {
            return true;
        }
        return entropy() < 50;
    }

    /**
     * Доля уникальных символов значения, масштабированная к 0-100.
     */
    int entropy() {
        if (value.isEmpty()) {
            return 0;
        }
        long unique = value.chars().distinct().count();
        return (int) ((double) unique / value.length() * 100.0);
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .value(value)
            .domain(domain)
            .path(path)
            .secure(secure)
            .httpOnly(httpOnly)
            .sameSite(sameSite)
            .expires(expires)
            .receivedOverHttps(receivedOverHttps);
    }

    @Override
    public String toString() {
        return "Cookie{" + name + " @ " + domain + path + "}";
    }

    public static class Builder {
        private String name;
        private String value;
        private String domain;
        private String path;
        private boolean secure;
        private boolean httpOnly;
        private SameSite sameSite;
        private Instant expires;
        private boolean receivedOverHttps;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder httpOnly(boolean httpOnly) {
            this.httpOnly = httpOnly;
            return this;
        }

        public Builder sameSite(SameSite sameSite) {
            this.sameSite = sameSite;
            return this;
        }

        public Builder expires(Instant expires) {
            this.expires = expires;
            return this;
        }

        public Builder receivedOverHttps(boolean receivedOverHttps) {
            this.receivedOverHttps = receivedOverHttps;
            return this;
        }

        public Cookie build() {
            return new Cookie(this);
        }
    }
}
