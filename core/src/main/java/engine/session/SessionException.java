package engine.session;

/**
 * Ошибка работы с сессионными данными: некорректный JWT, сбой сохранения или загрузки сессии.
 */
public class SessionException extends Exception {

    public SessionException(String message) {
        super(message);
    }

    public SessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
