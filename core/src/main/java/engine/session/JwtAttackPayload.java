package engine.session;

import model.Severity;

/**
 * Поддельный токен для проверки серверной валидации JWT.
 * Не является действительным учетным данным.
 */
public record JwtAttackPayload(String name, String token, String description, Severity severity) {
}
