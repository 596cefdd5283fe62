package com.minidisc.common.model;

import java.net.Inet4Address;

/**
 * CIDR 形式的 IPv4 网段，例如 100.64.0.0/10
 */
public final class Ipv4Prefix {

    private final int network;
    private final int mask;
    private final int length;

    private Ipv4Prefix(int network, int length) {
        this.length = length;
        this.mask = length == 0 ? 0 : -1 << (32 - length);
        this.network = network & mask;
    }

    public static Ipv4Prefix parse(String cidr) {
        int slash = cidr.indexOf('/');
        if (slash < 0) {
            throw new IllegalArgumentException("Missing prefix length: " + cidr);
        }
        int length;
        try {
            length = Integer.parseInt(cidr.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed prefix length: " + cidr, e);
        }
        if (length < 0 || length > 32) {
            throw new IllegalArgumentException("Prefix length out of range: " + cidr);
        }
        return new Ipv4Prefix(toInt(AddrPort.parseAddress(cidr.substring(0, slash))), length);
    }

    public boolean contains(Inet4Address address) {
        return (toInt(address) & mask) == network;
    }

    private static int toInt(Inet4Address address) {
        byte[] b = address.getAddress();
        return ((b[0] & 0xff) << 24) | ((b[1] & 0xff) << 16) | ((b[2] & 0xff) << 8) | (b[3] & 0xff);
    }

    @Override
    public String toString() {
        return ((network >>> 24) & 0xff) + "." + ((network >>> 16) & 0xff) + "."
            + ((network >>> 8) & 0xff) + "." + (network & 0xff) + "/" + length;
    }
}
