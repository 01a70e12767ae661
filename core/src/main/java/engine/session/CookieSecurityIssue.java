package engine.session;

import java.util.Optional;

/**
 * Проблема безопасности cookie.
 *
 * @param type тип проблемы
 * @param cookieName имя cookie
 * @param entropy оценка энтропии 0-100, только для {@link Type#WEAK_SESSION_ID}
 */
public record CookieSecurityIssue(Type type, String cookieName, Integer entropy) {

    public enum Type {
        MISSING_SECURE_FLAG,
        MISSING_HTTP_ONLY,
        WEAK_SESSION_ID,
        MISSING_SAME_SITE
    }

    public Optional<Integer> entropyScore() {
        return Optional.ofNullable(entropy);
    }
}
