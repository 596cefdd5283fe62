package com.minidisc.common.source;

import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.TailnetStatus;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.List;

/**
 * 固定地址列表，用于测试和静态部署
 */
public class StaticAddressSource implements AddressSource {

    private final TailnetStatus status;

    public StaticAddressSource(Inet4Address localAddress, List<Inet4Address> peerAddresses) {
        this.status = new TailnetStatus(localAddress, peerAddresses);
    }

    /**
     * 从点分十进制字符串构建
     */
    public static StaticAddressSource of(String localAddress, String... peerAddresses) {
        List<Inet4Address> peers = new ArrayList<>();
        for (String peer : peerAddresses) {
            peers.add(AddrPort.parseAddress(peer));
        }
        return new StaticAddressSource(AddrPort.parseAddress(localAddress), peers);
    }

    @Override
    public TailnetStatus status() {
        return status;
    }
}
