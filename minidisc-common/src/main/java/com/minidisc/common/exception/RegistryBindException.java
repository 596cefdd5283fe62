package com.minidisc.common.exception;

/**
 * 发现端口和任意端口都无法绑定，节点无法参与服务发现
 */
public class RegistryBindException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public RegistryBindException(String message) {
        super(message);
    }

    public RegistryBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
