/**
 * 私有网络状态快照
 *
 * @date 2026/10/12
 */
package com.minidisc.common.model;

import lombok.Getter;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 本机地址与在线对端地址
 */
@Getter
public final class TailnetStatus {

    private final Inet4Address localAddress;
    private final List<Inet4Address> peerAddresses;

    public TailnetStatus(Inet4Address localAddress, List<Inet4Address> peerAddresses) {
        if (localAddress == null) {
            throw new IllegalArgumentException("localAddress must not be null");
        }
        this.localAddress = localAddress;
        this.peerAddresses = peerAddresses == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(peerAddresses));
    }

    /**
     * 本机地址在前，其后按来源顺序排列对端地址
     */
    public List<Inet4Address> allAddresses() {
        List<Inet4Address> all = new ArrayList<>(1 + peerAddresses.size());
        all.add(localAddress);
        all.addAll(peerAddresses);
        return all;
    }
}
