package com.minidisc.common.exception;

/**
 * 同一地址已有服务在广播
 */
public class DuplicateServiceException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public DuplicateServiceException(String message) {
        super(message);
    }
}
