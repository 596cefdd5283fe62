/**
 * 本地服务目录
 *
 * @date 2026/10/13
 */
package com.minidisc.core.registry;

import com.minidisc.common.exception.DuplicateServiceException;
import com.minidisc.common.exception.NonLocalDelegateException;
import com.minidisc.common.exception.NonMemberAddressException;
import com.minidisc.common.exception.ServiceNotFoundException;
import com.minidisc.common.logging.RegistryLogger;
import com.minidisc.common.model.AddrPort;
import com.minidisc.common.model.Ipv4Prefix;
import com.minidisc.common.model.Service;

import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 内存服务目录（每个注册表实例独占一份）
 *
 * 保存本进程广播的服务，以及作为 leader 时同主机上已注册的 delegate。
 * 所有读写只在一把互斥锁内完成，任何网络调用都不能持有这把锁。
 */
public class ServiceDirectory {

    private final ReentrantLock lock = new ReentrantLock();

    // 启动时确定，之后网络重新配置也不会改变目录内容
    private final Inet4Address localAddress;
    private final Ipv4Prefix memberNetwork;
    private final RegistryLogger logger;

    // 按地址唯一，保持插入顺序
    private final List<Service> localServices = new ArrayList<>();
    private final Set<AddrPort> delegates = new LinkedHashSet<>();

    public ServiceDirectory(Inet4Address localAddress, Ipv4Prefix memberNetwork, RegistryLogger logger) {
        this.localAddress = localAddress;
        this.memberNetwork = memberNetwork;
        this.logger = logger;
    }

    public Inet4Address getLocalAddress() {
        return localAddress;
    }

    /**
     * 广播本机端口上的服务
     *
     * @param port 服务端口
     * @param name 服务名称
     * @param labels 标签，可为null
     * @throws DuplicateServiceException 该地址已有服务
     */
    public void advertise(int port, String name, Map<String, String> labels) {
        addService(new Service(name, labels, new AddrPort(localAddress, port)));
    }

    /**
     * 代替无法自行运行注册表的远程服务进行广播
     *
     * @param addrPort 远程服务地址，必须位于私有网络地址段
     * @param name 服务名称
     * @param labels 标签，可为null
     * @throws NonMemberAddressException 地址不在私有网络内
     * @throws DuplicateServiceException 该地址已有服务
     */
    public void advertiseRemote(AddrPort addrPort, String name, Map<String, String> labels) {
        if (!memberNetwork.contains(addrPort.getAddress())) {
            throw new NonMemberAddressException("Address " + addrPort + " is outside " + memberNetwork);
        }
        addService(new Service(name, labels, addrPort));
    }

    private void addService(Service service) {
        lock.lock();
        try {
            for (Service existing : localServices) {
                if (existing.getAddrPort().equals(service.getAddrPort())) {
                    throw new DuplicateServiceException("Address " + service.getAddrPort() + " already registered");
                }
            }
            localServices.add(service);
        } finally {
            lock.unlock();
        }
        logger.info("广播新服务: name={}, labels={}, address={}",
            service.getName(), service.getLabels(), service.getAddrPort());
    }

    /**
     * 撤销本机端口上的服务
     *
     * @param port 服务端口
     * @throws ServiceNotFoundException 本机该端口上没有服务
     */
    public void unlist(int port) {
        removeService(new AddrPort(localAddress, port));
    }

    /**
     * 撤销之前通过 advertiseRemote 广播的服务
     *
     * @param addrPort 远程服务地址
     * @throws ServiceNotFoundException 该地址上没有服务
     */
    public void unlistRemote(AddrPort addrPort) {
        removeService(addrPort);
    }

    private void removeService(AddrPort addrPort) {
        boolean removed;
        lock.lock();
        try {
            removed = localServices.removeIf(s -> s.getAddrPort().equals(addrPort));
        } finally {
            lock.unlock();
        }
        if (!removed) {
            throw new ServiceNotFoundException("No service at " + addrPort);
        }
        logger.info("撤销服务: address={}", addrPort);
    }

    /**
     * 本地服务快照（按插入顺序）
     */
    public List<Service> services() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(localServices));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 记录一个同主机的 delegate，重复注册静默成功
     *
     * @param delegate delegate 的监听地址
     * @return 是否为新 delegate
     * @throws NonLocalDelegateException 地址不是本机地址
     */
    public boolean addDelegate(AddrPort delegate) {
        if (!delegate.getAddress().equals(localAddress)) {
            throw new NonLocalDelegateException("Delegate " + delegate + " is not on local address "
                + localAddress.getHostAddress());
        }
        lock.lock();
        try {
            return delegates.add(delegate);
        } finally {
            lock.unlock();
        }
    }

    public boolean removeDelegate(AddrPort delegate) {
        lock.lock();
        try {
            return delegates.remove(delegate);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清除全部 delegate
     *
     * @return 清除的数量
     */
    public int clearDelegates() {
        lock.lock();
        try {
            int count = delegates.size();
            delegates.clear();
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * delegate 快照（按注册顺序）
     */
    public List<AddrPort> delegates() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(delegates));
        } finally {
            lock.unlock();
        }
    }
}
