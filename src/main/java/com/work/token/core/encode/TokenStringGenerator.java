package com.work.token.core.encode;

import com.work.token.core.config.TokenFormat;
import com.work.token.core.exception.CsprngUnavailableException;
import com.work.token.core.random.SecureByteSource;

import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 生成随机字节并按格式编码。
 *
 * <p>随机源失败时 {@link CsprngUnavailableException} 原样向上抛出，
 * 后续的时间戳、签名、缓存都不会发生。</p>
 */
public class TokenStringGenerator {

    private final SecureByteSource byteSource;

    public TokenStringGenerator(SecureByteSource byteSource) {
        this.byteSource = requireNonNull(byteSource, "byteSource");
    }

    public String generate(int length, TokenFormat format, String alphabet, int grouping) {
        byte[] bytes = byteSource.nextBytes(length);
        if (bytes == null || bytes.length != length) {
            throw new CsprngUnavailableException("secure random source returned "
                    + (bytes == null ? "null" : bytes.length + " bytes") + ", expected " + length);
        }
        TokenFormat f = format == null ? TokenFormat.BASE64 : format;
        switch (f) {
            case HEX:
                return TokenEncoders.hex(bytes);
            case BASE64URL:
                return TokenEncoders.base64Url(bytes);
            case CUSTOM:
                return TokenEncoders.customAlphabet(bytes, alphabet, grouping);
            case BASE64:
            default:
                return TokenEncoders.base64(bytes);
        }
    }
}
