package engine.http;

import engine.ScanException;
import engine.model.ProbeResponse;
import model.Target;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * HTTP как {@link ProtocolHandler} поверх {@link NetworkClient}.
 */
public final class HttpProtocolHandler implements ProtocolHandler {
    private static final Logger logger = Logger.getLogger(HttpProtocolHandler.class.getName());

    private final NetworkClient client;

    public HttpProtocolHandler(NetworkClient client) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public int defaultPort() {
        return 80;
    }

    @Override
    public boolean probe(Target target) {
        try {
            client.get(target.url());
            return true;
        } catch (ScanException e) {
            logger.fine("HTTP probe failed for " + target.url() + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Выполняет GET к {@code http://address:port}. Сетевая ошибка дает неуспешный ответ, а не исключение.
     */
    @Override
    public ProtocolResponse execute(ProtocolRequest request) throws ScanException {
        String url = "http://" + request.address() + ":" + request.port();
        long start = System.nanoTime();

        try {
            ProbeResponse response = client.get(url);
            return new ProtocolResponse(response.getBody(), Duration.ofNanos(System.nanoTime() - start), true);
        } catch (ScanException e) {
            if (e.getErrorType() != ScanException.ErrorType.NETWORK) {
                throw e;
            }
            logger.fine("HTTP exchange with " + url + " failed: " + e.getMessage());
            return new ProtocolResponse(new byte[0], Duration.ofNanos(System.nanoTime() - start), false);
        }
    }
}
