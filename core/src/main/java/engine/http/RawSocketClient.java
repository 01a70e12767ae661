package engine.http;

import engine.model.ProbeResponse;
import util.StringUtils;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * TCP клиент для сетевых шаблонов: отправляет payload-ы и собирает ответные байты.
 *
 * <p>Результат оформляется как псевдо-ответ (статус 200, без заголовков, нулевое время),
 * чтобы к нему применялись те же матчеры, что и к HTTP.
 */
public final class RawSocketClient {
    private static final Logger logger = Logger.getLogger(RawSocketClient.class.getName());

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(5);
    static final int READ_BUFFER_SIZE = 8192;

    private final Duration connectTimeout;
    private final Duration readTimeout;

    public RawSocketClient() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    public RawSocketClient(Duration connectTimeout, Duration readTimeout) {
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    /**
     * Подключается к {@code host:port} и по очереди отправляет payload-ы.
     * После каждого payload читается до 8192 байт; EOF, ошибка чтения или таймаут
     * завершают обмен. Ошибка записи пропускает payload.
     *
     * @return псевдо-ответ с накопленными байтами или пусто, если подключиться не удалось
     */
    public Optional<ProbeResponse> exchange(String host, int port, List<String> payloads) {
        String address = host + ":" + port;

        try (Socket socket = new Socket()) {
            try {
                socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
                socket.setSoTimeout((int) readTimeout.toMillis());
            } catch (IOException e) {
                logger.fine("Failed to connect to " + address + ": " + e.getMessage());
                return Optional.empty();
            }

            ByteArrayOutputStream received = new ByteArrayOutputStream();
            OutputStream out = socket.getOutputStream();
            InputStream in = socket.getInputStream();
            byte[] buffer = new byte[READ_BUFFER_SIZE];

            for (String payload : payloads) {
                try {
                    out.write(StringUtils.unescapePayload(payload).getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (IOException e) {
                    logger.fine("Failed to send payload to " + address + ": " + e.getMessage());
                    continue;
                }

                if (!readOnce(in, buffer, received, address)) {
                    break;
                }
            }

            logger.fine("Received " + received.size() + " bytes from " + address);
            return Optional.of(ProbeResponse.builder()
                .statusCode(200)
                .body(received.toByteArray())
                .responseTime(Duration.ZERO)
                .build());
        } catch (IOException e) {
            logger.fine("Socket error for " + address + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    // Returns false when the exchange should stop
    private static boolean readOnce(InputStream in, byte[] buffer, ByteArrayOutputStream received, String address) {
        try {
            int n = in.read(buffer);
            if (n <= 0) {
                logger.fine("Connection closed by " + address);
                return false;
            }
            received.write(buffer, 0, n);
            return true;
        } catch (SocketTimeoutException e) {
            logger.fine("Read timeout from " + address);
            return false;
        } catch (IOException e) {
            logger.fine("Failed to read response from " + address + ": " + e.getMessage());
            return false;
        }
    }
}
