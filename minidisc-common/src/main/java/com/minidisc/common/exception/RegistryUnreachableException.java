package com.minidisc.common.exception;

/**
 * 对端注册表不可达（连接失败或超时），属于预期中的瞬时故障
 */
public class RegistryUnreachableException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public RegistryUnreachableException(String message) {
        super(message);
    }

    public RegistryUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
