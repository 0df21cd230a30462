package com.work.token.core.crypto;

import com.work.token.core.encode.TokenEncoders;

import java.time.Clock;

import static com.work.token.core.support.ValidationUtils.isBlank;
import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 把过期时间（以及可选签名）编码进 token：
 * <ul>
 *     <li>未签名：{@code <expiry>:<payload>}</li>
 *     <li>签名：{@code <expiry>:<payload>:<hex(HMAC-SHA256(key, "<expiry>:<payload>"))>}</li>
 * </ul>
 * 未签名的形式只防猜测，不防伪造；只有配置了签名密钥才具备防篡改能力。
 */
public class MetadataEncoder {

    public static final char DELIMITER = ':';

    private final Clock clock;

    public MetadataEncoder(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
    }

    public String encode(String payload, long expirySeconds, String signingKey) {
        return encode(payload, expirySeconds, signingKey, clock.instant().getEpochSecond());
    }

    /**
     * @param nowEpochSeconds 调用方的时间采样，保证同一个 token 内时间一致
     */
    public String encode(String payload, long expirySeconds, String signingKey, long nowEpochSeconds) {
        String unsigned = unsigned(payload, expirySeconds, nowEpochSeconds);
        if (isBlank(signingKey)) {
            return unsigned;
        }
        byte[] digest = HmacSigner.hmacSha256(signingKey, unsigned);
        return unsigned + DELIMITER + TokenEncoders.hex(digest);
    }

    public String unsigned(String payload, long expirySeconds, long nowEpochSeconds) {
        long expiry = nowEpochSeconds + expirySeconds;
        return Long.toString(expiry) + DELIMITER + (payload == null ? "" : payload);
    }
}
