package com.minidisc.common.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Ipv4PrefixTest {

    @Test
    void testCgnatRange() {
        Ipv4Prefix prefix = Ipv4Prefix.parse("100.64.0.0/10");

        assertTrue(prefix.contains(AddrPort.parseAddress("100.64.0.1")));
        assertTrue(prefix.contains(AddrPort.parseAddress("100.127.255.254")));
        assertFalse(prefix.contains(AddrPort.parseAddress("100.63.255.255")));
        assertFalse(prefix.contains(AddrPort.parseAddress("100.128.0.0")));
        assertFalse(prefix.contains(AddrPort.parseAddress("10.0.0.1")));
    }

    @Test
    void testNormalizesHostBits() {
        Ipv4Prefix prefix = Ipv4Prefix.parse("127.0.0.9/8");

        assertEquals("127.0.0.0/8", prefix.toString());
        assertTrue(prefix.contains(AddrPort.parseAddress("127.1.2.3")));
    }

    @Test
    void testZeroLengthMatchesEverything() {
        assertTrue(Ipv4Prefix.parse("0.0.0.0/0").contains(AddrPort.parseAddress("8.8.8.8")));
    }

    @Test
    void testRejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> Ipv4Prefix.parse("100.64.0.0"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Prefix.parse("100.64.0.0/33"));
        assertThrows(IllegalArgumentException.class, () -> Ipv4Prefix.parse("100.64.0.0/x"));
    }
}
