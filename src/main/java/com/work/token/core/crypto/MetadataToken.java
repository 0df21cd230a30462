package com.work.token.core.crypto;

import java.util.Optional;

/**
 * 解析后的元数据 token 及其校验结论。
 */
public final class MetadataToken {

    private final VerificationResult result;
    private final Long expiresAt;
    private final String payload;

    MetadataToken(VerificationResult result, Long expiresAt, String payload) {
        this.result = result;
        this.expiresAt = expiresAt;
        this.payload = payload;
    }

    public static MetadataToken malformed() {
        return new MetadataToken(VerificationResult.MALFORMED, null, null);
    }

    public VerificationResult getResult() {
        return result;
    }

    /** 过期时刻（unix 秒），格式错误时 empty。 */
    public Optional<Long> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public Optional<String> getPayload() {
        return Optional.ofNullable(payload);
    }

    public boolean isValid() {
        return result == VerificationResult.VALID;
    }
}
