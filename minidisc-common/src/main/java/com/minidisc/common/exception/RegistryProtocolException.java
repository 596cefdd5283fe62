package com.minidisc.common.exception;

/**
 * 请求或响应格式错误，通常意味着协议不匹配
 */
public class RegistryProtocolException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public RegistryProtocolException(String message) {
        super(message);
    }

    public RegistryProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
