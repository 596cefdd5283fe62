package com.minidisc.common.exception;

/**
 * 没有满足名称和标签条件的服务
 */
public class NoMatchingServiceException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public NoMatchingServiceException(String message) {
        super(message);
    }
}
