/**
 * Minidisc异常基类
 *
 * @date 2026/10/12
 */
package com.minidisc.common.exception;

/**
 * 服务发现相关异常的公共父类
 */
public class MinidiscException extends RuntimeException {

    /**
     * 序列化版本号
     */
    private static final long serialVersionUID = 1L;

    /**
     * 创建异常
     *
     * @param message 异常消息
     */
    public MinidiscException(String message) {
        super(message);
    }

    /**
     * 创建异常
     *
     * @param message 异常消息
     * @param cause 原因异常
     */
    public MinidiscException(String message, Throwable cause) {
        super(message, cause);
    }
}
