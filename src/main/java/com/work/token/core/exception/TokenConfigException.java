package com.work.token.core.exception;

/**
 * 加载期配置非法（长度、格式、TTL、字母表等越界），应阻止应用启动。
 */
public class TokenConfigException extends TokenException {

    public TokenConfigException(String message) {
        super(message);
    }

    public TokenConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
