package com.work.token.demo.web.dto;

import com.work.token.core.crypto.MetadataToken;

/**
 * 校验结果：VALID / EXPIRED / BAD_SIGNATURE / MALFORMED / UNKNOWN_TOKEN。
 */
public class VerifyTokenResponse {

    public static final String UNKNOWN_TOKEN = "UNKNOWN_TOKEN";

    private final String result;
    private final Long expiresAt;
    private final String payload;

    private VerifyTokenResponse(String result, Long expiresAt, String payload) {
        this.result = result;
        this.expiresAt = expiresAt;
        this.payload = payload;
    }

    public static VerifyTokenResponse of(MetadataToken token) {
        return new VerifyTokenResponse(token.getResult().name(),
                token.getExpiresAt().orElse(null), token.getPayload().orElse(null));
    }

    public static VerifyTokenResponse unknownToken() {
        return new VerifyTokenResponse(UNKNOWN_TOKEN, null, null);
    }

    public String getResult() {
        return result;
    }

    public Long getExpiresAt() {
        return expiresAt;
    }

    public String getPayload() {
        return payload;
    }
}
