package engine.matcher;

/**
 * Ошибка вычисления или разбора матчера: некорректный regex, hex-шаблон или неподдерживаемый алгоритм.
 * Означает дефект шаблона и не подавляется.
 */
public class MatcherException extends Exception {

    public MatcherException(String message) {
        super(message);
    }

    public MatcherException(String message, Throwable cause) {
        super(message, cause);
    }
}
