package com.minidisc.core.election;

/**
 * 注册表节点状态
 */
public enum RegistryState {

    /**
     * 尚未绑定任何端口
     */
    UNBOUND,

    /**
     * 已绑定发现端口，为本主机提供服务
     */
    LEADER,

    /**
     * 已在临时端口上服务，正在向 leader 注册
     */
    DELEGATE_ATTEMPT,

    /**
     * 已注册到 leader，周期性探测 leader 存活
     */
    DELEGATE_SERVING,

    /**
     * 无法绑定任何端口，不再重试
     */
    FAILED,

    /**
     * 已被所有者关闭
     */
    STOPPED;

    public boolean isTerminal() {
        return this == FAILED || this == STOPPED;
    }
}
