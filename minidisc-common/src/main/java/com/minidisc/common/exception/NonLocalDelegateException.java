package com.minidisc.common.exception;

/**
 * delegate 地址不是本机地址，leader 只接受同主机的 delegate
 */
public class NonLocalDelegateException extends MinidiscException {

    private static final long serialVersionUID = 1L;

    public NonLocalDelegateException(String message) {
        super(message);
    }
}
