package com.work.token.core.config;

/**
 * 配置取值边界与系统级默认值。
 */
public final class TokenLimits {

    /** 128 bit 熵。 */
    public static final int LENGTH_DEFAULT = 16;
    public static final int LENGTH_MIN = 1;
    public static final int LENGTH_MAX = 1024;

    public static final int TTL_DEFAULT = 0;
    public static final int TTL_MAX_SECONDS = 86_400;

    public static final int EXPIRY_MAX_SECONDS = 31_536_000;

    public static final int GROUPING_MAX = 128;

    public static final int ALPHABET_MIN_SIZE = 2;
    public static final int ALPHABET_MAX_SIZE = 256;

    /** 单个作用域（含继承）最多的 token 数，限制每个请求的工作量。 */
    public static final int MAX_TOKENS = 50;

    public static final TokenFormat FORMAT_DEFAULT = TokenFormat.BASE64;

    private TokenLimits() {
        throw new AssertionError("工具类不允许实例化");
    }
}
