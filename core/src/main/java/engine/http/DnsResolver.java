package engine.http;

import engine.ScanException;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Разрешение имен целей через системный резолвер JDK.
 */
public final class DnsResolver {
    private static final Logger logger = Logger.getLogger(DnsResolver.class.getName());

    private final Lookup lookup;

    public DnsResolver() {
        this(InetAddress::getAllByName);
    }

    DnsResolver(Lookup lookup) {
        this.lookup = lookup;
    }

    /**
     * @return все адреса имени в порядке, возвращенном резолвером
     * @throws ScanException типа TARGET_UNREACHABLE, если имя не разрешается
     */
    public List<InetAddress> resolve(String hostname) throws ScanException {
        try {
            List<InetAddress> addresses = Arrays.asList(lookup.apply(hostname));
            logger.fine("Resolved " + hostname + " to " + addresses);
            return addresses;
        } catch (UnknownHostException e) {
            throw new ScanException(ScanException.ErrorType.TARGET_UNREACHABLE,
                "DNS resolution failed for " + hostname + ": " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    interface Lookup {
        InetAddress[] apply(String hostname) throws UnknownHostException;
    }
}
