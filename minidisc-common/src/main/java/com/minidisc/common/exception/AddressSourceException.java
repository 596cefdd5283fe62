package com.minidisc.common.exception;

/**
 * 无法获取私有网络的在线地址列表
 */
public class AddressSourceException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public AddressSourceException(String message) {
        super(message);
    }

    public AddressSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
