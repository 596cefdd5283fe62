package com.minidisc.common.exception;

/**
 * 要撤销的服务不存在
 */
public class ServiceNotFoundException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public ServiceNotFoundException(String message) {
        super(message);
    }
}
