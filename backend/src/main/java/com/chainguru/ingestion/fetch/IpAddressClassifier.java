package com.chainguru.ingestion.fetch;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies addresses a server must never be tricked into contacting: private, loopback, link-local, reserved,
 * multicast and unspecified ranges. IPv6 outside global unicast (2000::/3) counts as reserved.
 */
public final class IpAddressClassifier {

    private static final Pattern DOTTED_QUAD = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private static final List<Cidr> BLOCKED_V4 = List.of(
            Cidr.parse("0.0.0.0/8"),
            Cidr.parse("10.0.0.0/8"),
            Cidr.parse("100.64.0.0/10"),
            Cidr.parse("127.0.0.0/8"),
            Cidr.parse("169.254.0.0/16"),
            Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.0.0.0/24"),
            Cidr.parse("192.0.2.0/24"),
            Cidr.parse("192.168.0.0/16"),
            Cidr.parse("198.18.0.0/15"),
            Cidr.parse("198.51.100.0/24"),
            Cidr.parse("203.0.113.0/24"),
            Cidr.parse("224.0.0.0/4"),
            Cidr.parse("240.0.0.0/4"));

    private static final Cidr GLOBAL_UNICAST_V6 = Cidr.parse("2000::/3");

    private static final List<Cidr> BLOCKED_V6 = List.of(
            Cidr.parse("2001::/23"),
            Cidr.parse("2001:db8::/32"));

    private IpAddressClassifier() {
    }

    /**
     * True when the address must not be contacted.
     */
    public static boolean isBlocked(InetAddress address) {
        if (address.isAnyLocalAddress()
                || address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            return BLOCKED_V4.stream().anyMatch(c -> c.contains(bytes));
        }
        if (address instanceof Inet6Address v6) {
            Optional<InetAddress> embedded = embeddedIpv4(v6);
            if (embedded.isPresent()) {
                return isBlocked(embedded.get());
            }
            if (!GLOBAL_UNICAST_V6.contains(bytes)) {
                return true;
            }
            return BLOCKED_V6.stream().anyMatch(c -> c.contains(bytes));
        }
        return true;
    }

    /**
     * Parses {@code host} as an IP literal without touching DNS. Accepts dotted-quad IPv4 and IPv6 with or without
     * brackets; anything else (hostnames) yields empty.
     */
    public static Optional<InetAddress> parseLiteral(String host) {
        if (host == null || host.isEmpty()) {
            return Optional.empty();
        }
        String candidate = host;
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        boolean v4 = DOTTED_QUAD.matcher(candidate).matches();
        boolean v6 = candidate.indexOf(':') >= 0;
        if (!v4 && !v6) {
            return Optional.empty();
        }
        if (v4) {
            for (String octet : candidate.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return Optional.empty();
                }
            }
        }
        try {
            // literal input: InetAddress parses it without a lookup
            return Optional.of(InetAddress.getByName(candidate));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    /** IPv4-compatible (::a.b.c.d) and NAT64 (64:ff9b::/96) forms carry an IPv4 address in the low 32 bits. */
    private static Optional<InetAddress> embeddedIpv4(Inet6Address v6) {
        byte[] b = v6.getAddress();
        boolean nat64 = (b[0] & 0xff) == 0x00 && (b[1] & 0xff) == 0x64 && (b[2] & 0xff) == 0xff && (b[3] & 0xff) == 0x9b;
        boolean zeroPrefix = true;
        for (int i = 0; i < 12; i++) {
            if (b[i] != 0) {
                zeroPrefix = false;
                break;
            }
        }
        if (nat64) {
            for (int i = 4; i < 12; i++) {
                if (b[i] != 0) {
                    return Optional.empty();
                }
            }
        } else if (!zeroPrefix) {
            return Optional.empty();
        }
        if (zeroPrefix && b[12] == 0 && b[13] == 0 && b[14] == 0) {
            // :: and ::1 are handled by the JDK checks above
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByAddress(new byte[]{b[12], b[13], b[14], b[15]}));
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }

    private record Cidr(byte[] network, int prefixLength) {

        static Cidr parse(String notation) {
            int slash = notation.indexOf('/');
            try {
                byte[] network = InetAddress.getByName(notation.substring(0, slash)).getAddress();
                return new Cidr(network, Integer.parseInt(notation.substring(slash + 1)));
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("Invalid CIDR " + notation, e);
            }
        }

        boolean contains(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xff << (8 - remainingBits)) & 0xff;
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
