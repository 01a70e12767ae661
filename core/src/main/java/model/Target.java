package model;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.*;

/**
 * Цель сканирования: адрес, необязательный порт и протокол.
 * Неизменяемый объект; для перебора схем HTTP/HTTPS создаются копии через {@link #withProtocol(Protocol)}.
 */
public final class Target {
    private final String id;
    private final String address;
    private final Integer port;
    private final Protocol protocol;
    private final Map<String, String> metadata;

    private Target(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.address = Objects.requireNonNull(builder.address, "address cannot be null");
        this.port = builder.port;
        this.protocol = Objects.requireNonNull(builder.protocol, "protocol cannot be null");
        this.metadata = builder.metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata))
            : Collections.emptyMap();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Target of(String address, Protocol protocol) {
        return builder().address(address).protocol(protocol).build();
    }

    public static Target of(String address, int port, Protocol protocol) {
        return builder().address(address).port(port).protocol(protocol).build();
    }

    public String getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public Optional<Integer> getPort() {
        return Optional.ofNullable(port);
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Полный URL для HTTP(S) целей или {@code address[:port]} для остальных протоколов.
     */
    public String url() {
        if (protocol.isHttpFamily()) {
            String scheme = protocol.equals(Protocol.HTTPS) ? "https" : "http";
            return port != null
                ? scheme + "://" + address + ":" + port
                : scheme + "://" + address;
        }
        return port != null ? address + ":" + port : address;
    }

    /**
     * Адрес сокета, если адрес цели является IP-литералом.
     */
    public Optional<InetSocketAddress> socketAddress() {
        if (!isIpLiteral(address)) {
            return Optional.empty();
        }
        try {
            InetAddress inet = InetAddress.getByName(address);
            return Optional.of(new InetSocketAddress(inet, port != null ? port : 0));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    public Target withProtocol(Protocol newProtocol) {
        return new Builder(this).protocol(newProtocol).build();
    }

    public Target withPort(int newPort) {
        return new Builder(this).port(newPort).build();
    }

    /**
     * Варианты цели со схемами HTTP и HTTPS.
     * Для не-HTTP протоколов возвращает только саму цель.
     */
    public List<Target> withBothSchemes() {
        if (protocol.isHttpFamily()) {
            return List.of(withProtocol(Protocol.HTTP), withProtocol(Protocol.HTTPS));
        }
        return List.of(this);
    }

    /**
     * Выбор схемы по номеру порта.
     */
    public Protocol inferScheme() {
        if (port == null) {
            return protocol;
        }
        switch (port) {
            case 443:
            case 8443:
                return Protocol.HTTPS;
            case 80:
            case 8080:
            case 8000:
                return Protocol.HTTP;
            default:
                return protocol;
        }
    }

    private static boolean isIpLiteral(String value) {
        if (value.contains(":")) {
            // IPv6 literal
            return value.chars().allMatch(c -> Character.digit(c, 16) >= 0 || c == ':' || c == '.');
        }
        String[] octets = value.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3 || !octet.chars().allMatch(Character::isDigit)) {
                return false;
            }
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Target target = (Target) o;
        return id.equals(target.id) && address.equals(target.address)
            && Objects.equals(port, target.port) && protocol.equals(target.protocol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, address, port, protocol);
    }

    @Override
    public String toString() {
        return url();
    }

    public static class Builder {
        private String id;
        private String address;
        private Integer port;
        private Protocol protocol = Protocol.HTTPS;
        private Map<String, String> metadata;

        public Builder() {
        }

        private Builder(Target source) {
            this.id = source.id;
            this.address = source.address;
            this.port = source.port;
            this.protocol = source.protocol;
            this.metadata = source.metadata.isEmpty() ? null : new LinkedHashMap<>(source.metadata);
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder port(Integer port) {
            if (port != null && (port < 0 || port > 65535)) {
                throw new IllegalArgumentException("Port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder addMetadata(String key, String value) {
            if (this.metadata == null) {
                this.metadata = new LinkedHashMap<>();
            }
            this.metadata.put(key, value);
            return this;
        }

        public Target build() {
            return new Target(this);
        }
    }
}
