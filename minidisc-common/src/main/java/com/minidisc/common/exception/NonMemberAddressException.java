package com.minidisc.common.exception;

/**
 * 地址不属于私有网络地址段
 */
public class NonMemberAddressException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public NonMemberAddressException(String message) {
        super(message);
    }
}
