package uk.gegc.cooksnap.features.scrape.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether an IP address lies in a range that outbound fetches must never reach:
 * private, reserved, loopback, link-local, CGNAT, test-net and benchmarking blocks.
 * <p>
 * Pure and free of I/O. The string overload only accepts IP literals and never resolves names;
 * anything it cannot parse is reported as blocked.
 */
@Slf4j
@Component
public class AddressClassifier {

    private static final Pattern IPV4_LITERAL =
            Pattern.compile("^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$");

    private static final List<Ipv4Block> BLOCKED_IPV4 = List.of(
            Ipv4Block.of("0.0.0.0", 8),        // this network
            Ipv4Block.of("10.0.0.0", 8),       // RFC 1918
            Ipv4Block.of("100.64.0.0", 10),    // CGNAT, RFC 6598
            Ipv4Block.of("127.0.0.0", 8),      // loopback
            Ipv4Block.of("169.254.0.0", 16),   // link-local, cloud metadata
            Ipv4Block.of("172.16.0.0", 12),    // RFC 1918
            Ipv4Block.of("192.0.2.0", 24),     // TEST-NET-1
            Ipv4Block.of("192.168.0.0", 16),   // RFC 1918
            Ipv4Block.of("198.18.0.0", 15),    // benchmarking, RFC 2544
            Ipv4Block.of("198.51.100.0", 24),  // TEST-NET-2
            Ipv4Block.of("203.0.113.0", 24),   // TEST-NET-3
            Ipv4Block.of("240.0.0.0", 4)       // reserved through broadcast
    );

    public boolean isBlocked(InetAddress address) {
        if (address == null) {
            return true;
        }
        return isBlocked(address.getAddress());
    }

    /**
     * Classifies an IP literal such as {@code 10.0.0.1}, {@code ::1} or {@code [fe80::1%eth0]}.
     */
    public boolean isBlocked(String ipLiteral) {
        if (ipLiteral == null || ipLiteral.isBlank()) {
            return true;
        }
        String literal = ipLiteral.trim();
        if (literal.startsWith("[") && literal.endsWith("]")) {
            literal = literal.substring(1, literal.length() - 1);
        }
        if (IPV4_LITERAL.matcher(literal).matches()) {
            return isBlockedIpv4(Ipv4Block.toLong(literal));
        }
        if (!literal.contains(":")) {
            log.debug("Treating non-literal address '{}' as blocked", ipLiteral);
            return true;
        }
        int zone = literal.indexOf('%');
        if (zone >= 0) {
            literal = literal.substring(0, zone);
        }
        try {
            // A literal containing ':' is parsed as IPv6 without any name lookup
            return isBlocked(InetAddress.getByName(literal));
        } catch (UnknownHostException | SecurityException ex) {
            log.debug("Treating malformed address '{}' as blocked", ipLiteral);
            return true;
        }
    }

    private boolean isBlocked(byte[] bytes) {
        if (bytes == null) {
            return true;
        }
        if (bytes.length == 4) {
            return isBlockedIpv4(toUnsignedInt(bytes, 0));
        }
        if (bytes.length == 16) {
            return isBlockedIpv6(bytes);
        }
        return true;
    }

    private boolean isBlockedIpv4(long value) {
        for (Ipv4Block block : BLOCKED_IPV4) {
            if (block.contains(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBlockedIpv6(byte[] bytes) {
        Long embedded = embeddedIpv4(bytes);
        if (embedded != null) {
            return isBlockedIpv4(embedded);
        }

        if (isZero(bytes, 0, 12)) {
            // ::, ::1 and the deprecated IPv4-compatible form ::a.b.c.d
            return true;
        }

        int first = bytes[0] & 0xFF;
        int second = bytes[1] & 0xFF;
        if ((first & 0xFE) == 0xFC) {
            return true; // fc00::/7 unique local
        }
        if (first == 0xFE && (second & 0xC0) == 0x80) {
            return true; // fe80::/10 link-local
        }
        return first == 0xFE && (second & 0xC0) == 0xC0; // fec0::/10 site-local
    }

    /**
     * Returns the IPv4 address carried inside IPv4-mapped, NAT64 well-known prefix
     * or 6to4 IPv6 addresses, or {@code null} when there is none.
     */
    private Long embeddedIpv4(byte[] bytes) {
        boolean mapped = isZero(bytes, 0, 10)
                && (bytes[10] & 0xFF) == 0xFF
                && (bytes[11] & 0xFF) == 0xFF;
        if (mapped) {
            return toUnsignedInt(bytes, 12);
        }
        boolean nat64 = (bytes[0] & 0xFF) == 0x00
                && (bytes[1] & 0xFF) == 0x64
                && (bytes[2] & 0xFF) == 0xFF
                && (bytes[3] & 0xFF) == 0x9B
                && isZero(bytes, 4, 12);
        if (nat64) {
            return toUnsignedInt(bytes, 12);
        }
        boolean sixToFour = (bytes[0] & 0xFF) == 0x20 && (bytes[1] & 0xFF) == 0x02;
        if (sixToFour) {
            return toUnsignedInt(bytes, 2);
        }
        return null;
    }

    private static boolean isZero(byte[] bytes, int fromInclusive, int toExclusive) {
        for (int i = fromInclusive; i < toExclusive; i++) {
            if (bytes[i] != 0) {
                return false;
            }
        }
        return true;
    }

    private static long toUnsignedInt(byte[] bytes, int offset) {
        return ((long) (bytes[offset] & 0xFF) << 24)
                | ((bytes[offset + 1] & 0xFF) << 16)
                | ((bytes[offset + 2] & 0xFF) << 8)
                | (bytes[offset + 3] & 0xFF);
    }

    private record Ipv4Block(long network, long mask) {

        static Ipv4Block of(String network, int prefixLength) {
            long mask = prefixLength == 0 ? 0 : (0xFFFFFFFFL << (32 - prefixLength)) & 0xFFFFFFFFL;
            return new Ipv4Block(toLong(network) & mask, mask);
        }

        boolean contains(long address) {
            return (address & mask) == network;
        }

        static long toLong(String dotted) {
            String[] parts = dotted.split("\\.");
            long value = 0;
            for (String part : parts) {
                value = (value << 8) | Integer.parseInt(part);
            }
            return value;
        }
    }
}
