package com.work.token.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * token 输出格式。
 */
public enum TokenFormat {
    /** 标准 base64（带 '=' 填充）。 */
    BASE64,
    /** 小写十六进制，每字节两个字符。 */
    HEX,
    /** URL 安全 base64，无填充。 */
    BASE64URL,
    /** 自定义字母表，按位打包。 */
    CUSTOM;

    /**
     * 大小写不敏感地解析格式名，未知名称返回 empty。
     */
    public static Optional<TokenFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (TokenFormat f : values()) {
            if (f.name().equals(normalized)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }
}
