package com.work.token.core.exception;

/**
 * 组件内部的统一异常类型，便于宿主侧捕获或转换为诊断日志。
 */
public class TokenException extends RuntimeException {

    public TokenException(String message) {
        super(message);
    }

    public TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
