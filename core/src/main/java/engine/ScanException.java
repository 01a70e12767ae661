package engine;

import java.util.EnumSet;
import java.util.Set;

/**
 * Базовое исключение движка сканирования.
 * Тип ошибки определяет, можно ли повторить операцию и является ли сбой фатальным.
 */
public class ScanException extends Exception {

    private static final Set<ErrorType> RETRYABLE = EnumSet.of(
        ErrorType.NETWORK,
        ErrorType.TARGET_UNREACHABLE,
        ErrorType.TIMEOUT,
        ErrorType.RATE_LIMIT,
        ErrorType.HTTP_REQUEST
    );

    private static final Set<ErrorType> FATAL = EnumSet.of(
        ErrorType.INTERNAL,
        ErrorType.SANDBOX_VIOLATION,
        ErrorType.RESOURCE_LIMIT,
        ErrorType.COORDINATOR
    );

    private final ErrorType errorType;

    public enum ErrorType {
        CONFIG,
        TEMPLATE,
        TEMPLATE_NOT_FOUND,
        TEMPLATE_VALIDATION,
        TEMPLATE_EXECUTION,
        NETWORK,
        HTTP_REQUEST,
        INVALID_TARGET,
        TARGET_UNREACHABLE,
        PARSE,
        IO,
        SCHEDULER,
        RESOURCE_LIMIT,
        TIMEOUT,
        EXECUTION,
        SANDBOX_VIOLATION,
        RATE_LIMIT,
        AUTHENTICATION,
        SERIALIZATION,
        PROTOCOL,
        MATCHER,
        SESSION,
        INTERNAL,
        COORDINATOR
    }

    public ScanException(ErrorType errorType, String message) {
        super(String.format("%s: %s", errorType, message));
        this.errorType = errorType;
    }

    public ScanException(ErrorType errorType, String message, Throwable cause) {
        super(String.format("%s: %s", errorType, message), cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public boolean isRetryable() {
        return RETRYABLE.contains(errorType);
    }

    public boolean isFatal() {
        return FATAL.contains(errorType);
    }
}
