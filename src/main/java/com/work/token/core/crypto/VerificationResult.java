package com.work.token.core.crypto;

/**
 * 元数据 token 校验结论。
 */
public enum VerificationResult {
    VALID,
    EXPIRED,
    BAD_SIGNATURE,
    MALFORMED
}
