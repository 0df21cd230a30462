package com.work.token.core.exception;

/**
 * 安全随机源不可用。该 token 不得产出任何值（绝不能用全零或可预测的缓冲区替代）。
 */
public class CsprngUnavailableException extends TokenException {

    public CsprngUnavailableException(String message) {
        super(message);
    }

    public CsprngUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
