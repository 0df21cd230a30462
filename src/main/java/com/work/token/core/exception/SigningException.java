package com.work.token.core.exception;

/**
 * HMAC 计算失败。调用方应降级为未签名 token，而不是中断整个请求。
 */
public class SigningException extends TokenException {

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
