package engine.http;

import engine.ScanException;
import model.Target;

import java.time.Duration;
import java.util.Objects;

/**
 * Обработчик протокола прикладного уровня для проверок, не описываемых HTTP шаблонами.
 *
 * <p>Реализации должны быть потокобезопасны.
 */
public interface ProtocolHandler {

    /**
     * @return имя протокола в нижнем регистре ("http", "tcp")
     */
    String name();

    int defaultPort();

    /**
     * Проверяет, отвечает ли цель по этому протоколу.
     */
    boolean probe(Target target);

    /**
     * Выполняет обмен данными с целью.
     *
     * @throws ScanException если обмен невозможен по причинам, не связанным с самой целью
     */
    ProtocolResponse execute(ProtocolRequest request) throws ScanException;

    /**
     * Запрос к обработчику протокола.
     */
    record ProtocolRequest(String address, int port, byte[] data, Duration timeout) {
        public ProtocolRequest {
            Objects.requireNonNull(address, "address cannot be null");
            data = data != null ? data.clone() : new byte[0];
            timeout = timeout != null ? timeout : Duration.ofSeconds(10);
        }
    }

    /**
     * Ответ обработчика протокола; {@code success=false} означает, что цель не ответила.
     */
    record ProtocolResponse(byte[] data, Duration responseTime, boolean success) {
        public ProtocolResponse {
            data = data != null ? data.clone() : new byte[0];
        }
    }
}
