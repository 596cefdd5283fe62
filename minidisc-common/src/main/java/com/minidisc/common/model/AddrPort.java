/**
 * IPv4地址与端口
 *
 * @date 2026/10/12
 */
package com.minidisc.common.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * 不可变的 IPv4 地址 + 端口
 * 线路格式为 "a.b.c.d:port"，JSON 中只作为字符串出现，不暴露任何字段
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.NONE,
    getterVisibility = JsonAutoDetect.Visibility.NONE,
    isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class AddrPort {

    private final Inet4Address address;
    private final int port;

    @JsonCreator(mode = JsonCreator.Mode.DISABLED)
    public AddrPort(Inet4Address address, int port) {
        if (address == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.address = address;
        this.port = port;
    }

    /**
     * 解析 "a.b.c.d:port" 格式的字符串，不做DNS查询
     *
     * @param value 地址字符串
     * @return 解析结果
     * @throws IllegalArgumentException 格式错误
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AddrPort parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("addrPort must not be null");
        }
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Malformed addrPort: " + value);
        }
        Inet4Address address = parseAddress(value.substring(0, colon));
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed port in addrPort: " + value, e);
        }
        return new AddrPort(address, port);
    }

    /**
     * 解析点分十进制IPv4地址
     *
     * @param dottedQuad 例如 "100.64.0.1"
     * @return IPv4地址
     */
    public static Inet4Address parseAddress(String dottedQuad) {
        String[] parts = dottedQuad.split("\\.", -1);
        if (parts.length != 4) {
            throw new IllegalArgumentException("Not an IPv4 address: " + dottedQuad);
        }
        byte[] octets = new byte[4];
        for (int i = 0; i < 4; i++) {
            String part = parts[i];
            if (part.isEmpty() || part.length() > 3 || !part.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Not an IPv4 address: " + dottedQuad);
            }
            int octet = Integer.parseInt(part);
            if (octet > 255) {
                throw new IllegalArgumentException("Not an IPv4 address: " + dottedQuad);
            }
            octets[i] = (byte) octet;
        }
        try {
            return (Inet4Address) InetAddress.getByAddress(octets);
        } catch (UnknownHostException e) {
            // 仅在字节数组长度非法时发生
            throw new IllegalStateException(e);
        }
    }

    public static AddrPort of(InetSocketAddress socketAddress) {
        InetAddress address = socketAddress.getAddress();
        if (!(address instanceof Inet4Address)) {
            throw new IllegalArgumentException("Not an IPv4 socket address: " + socketAddress);
        }
        return new AddrPort((Inet4Address) address, socketAddress.getPort());
    }

    public Inet4Address getAddress() {
        return address;
    }

    public int getPort() {
        return port;
    }

    public AddrPort withPort(int newPort) {
        return new AddrPort(address, newPort);
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(address, port);
    }

    @JsonValue
    @Override
    public String toString() {
        return address.getHostAddress() + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AddrPort that = (AddrPort) o;
        return port == that.port && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, port);
    }
}
