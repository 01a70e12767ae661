package engine.http;

import engine.ScanException;

import javax.net.ssl.SSLException;
import java.io.EOFException;
import java.net.ConnectException;
import java.net.ProtocolException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Классификация ошибок соединения.
 *
 * <p>Ошибка уровня соединения означает, что сервер, вероятно, говорит по другой схеме
 * (HTTP вместо HTTPS или наоборот) или недоступен; такие ошибки разрешают попытку
 * другой схемы.
 */
public final class ConnectionErrors {

    private static final List<String> MESSAGE_MARKERS = List.of(
        "refused", "reset", "ssl", "tls", "certificate", "handshake", "protocol",
        "timeout", "timed out", "overflow", "invalid data", "eof", "received no bytes"
    );

    private static final int MAX_CAUSE_DEPTH = 16;

    private ConnectionErrors() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Проверяет ошибку и всю цепочку ее причин.
     *
     * <p>Для {@link ScanException} решает тип ошибки: только NETWORK, TIMEOUT и PROTOCOL
     * могут означать сбой соединения. Текст самого ScanException не анализируется,
     * так как он содержит идентификатор шаблона; проверяются только причины под ним.
     */
    public static boolean isConnectionLevel(Throwable error) {
        if (error instanceof ScanException) {
            return isConnectionLevel((ScanException) error, 0);
        }
        return inspectChain(error, 0);
    }

    private static boolean isConnectionLevel(ScanException error, int depth) {
        ScanException.ErrorType type = error.getErrorType();
        if (type == ScanException.ErrorType.TIMEOUT || type == ScanException.ErrorType.PROTOCOL) {
            return true;
        }
        if (type != ScanException.ErrorType.NETWORK) {
            return false;
        }
        // NETWORK without an underlying cause comes from the transport itself
        return error.getCause() == null || inspectChain(error.getCause(), depth + 1);
    }

    private static boolean inspectChain(Throwable error, int depth) {
        Throwable current = error;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof ScanException) {
                return isConnectionLevel((ScanException) current, depth);
            }
            if (isConnectionType(current) || hasMarker(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isConnectionType(Throwable error) {
        return error instanceof ConnectException
            || error instanceof SocketTimeoutException
            || error instanceof HttpTimeoutException
            || error instanceof SSLException
            || error instanceof EOFException
            || error instanceof ProtocolException
            || (error instanceof SocketException && hasMarker(error.getMessage()));
    }

    private static boolean hasMarker(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return MESSAGE_MARKERS.stream().anyMatch(lower::contains);
    }
}
