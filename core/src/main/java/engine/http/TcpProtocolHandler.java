package engine.http;

import engine.model.ProbeResponse;
import model.Target;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Сырой TCP как {@link ProtocolHandler} поверх {@link RawSocketClient}.
 */
public final class TcpProtocolHandler implements ProtocolHandler {
    private final RawSocketClient socketClient;
    private final int defaultPort;

    public TcpProtocolHandler(RawSocketClient socketClient, int defaultPort) {
        this.socketClient = socketClient;
        this.defaultPort = defaultPort;
    }

    @Override
    public String name() {
        return "tcp";
    }

    @Override
    public int defaultPort() {
        return defaultPort;
    }

    @Override
    public boolean probe(Target target) {
        int port = target.getPort().orElse(defaultPort);
        return socketClient.exchange(target.getAddress(), port, List.of()).isPresent();
    }

    @Override
    public ProtocolResponse execute(ProtocolRequest request) {
        long start = System.nanoTime();
        List<String> payloads = request.data().length > 0
            ? List.of(new String(request.data(), StandardCharsets.UTF_8))
            : List.of();

        Optional<ProbeResponse> response = socketClient.exchange(request.address(), request.port(), payloads);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        return response
            .map(r -> new ProtocolResponse(r.getBody(), elapsed, true))
            .orElseGet(() -> new ProtocolResponse(new byte[0], elapsed, false));
    }
}
