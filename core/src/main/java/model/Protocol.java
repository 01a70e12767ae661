package model;

import java.util.*;

/**
 * Сетевой протокол цели или шаблона.
 * Закрытый набор стандартных протоколов плюс произвольный {@link #custom(String)} вариант
 * для шаблонов с нестандартными протоколами.
 */
public final class Protocol {

    public static final Protocol HTTP = new Protocol("http", false);
    public static final Protocol HTTPS = new Protocol("https", false);
    public static final Protocol TCP = new Protocol("tcp", false);
    public static final Protocol UDP = new Protocol("udp", false);
    public static final Protocol DNS = new Protocol("dns", false);
    public static final Protocol SSH = new Protocol("ssh", false);
    public static final Protocol FTP = new Protocol("ftp", false);
    public static final Protocol SMTP = new Protocol("smtp", false);
    public static final Protocol SMB = new Protocol("smb", false);
    public static final Protocol RDP = new Protocol("rdp", false);

    private static final Map<String, Protocol> STANDARD;

    static {
        Map<String, Protocol> standard = new LinkedHashMap<>();
        for (Protocol protocol : List.of(HTTP, HTTPS, TCP, UDP, DNS, SSH, FTP, SMTP, SMB, RDP)) {
            standard.put(protocol.name, protocol);
        }
        STANDARD = Collections.unmodifiableMap(standard);
    }

    private final String name;
    private final boolean custom;

    private Protocol(String name, boolean custom) {
        this.name = name;
        this.custom = custom;
    }

    public static Protocol custom(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return new Protocol(name, true);
    }

    /**
     * Находит протокол по имени без учета регистра.
     * Неизвестные имена превращаются в пользовательский протокол.
     */
    public static Protocol fromName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        Protocol standard = STANDARD.get(normalized);
        return standard != null ? standard : custom(normalized);
    }

    public static Collection<Protocol> standardProtocols() {
        return STANDARD.values();
    }

    public String getName() {
        return name;
    }

    public boolean isCustom() {
        return custom;
    }

    public boolean isHttpFamily() {
        return this.equals(HTTP) || this.equals(HTTPS);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Protocol protocol = (Protocol) o;
        return custom == protocol.custom && name.equals(protocol.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, custom);
    }

    @Override
    public String toString() {
        return name;
    }
}
