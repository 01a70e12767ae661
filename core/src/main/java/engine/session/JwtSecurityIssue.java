package engine.session;

import model.Severity;

/**
 * Проблема безопасности JWT, найденная статическим анализом заголовка и claims.
 */
public record JwtSecurityIssue(Type type, Severity severity, String subject, String description) {

    public enum Type {
        WEAK_ALGORITHM,
        KEY_CONFUSION,
        MISSING_CLAIM
    }
}
