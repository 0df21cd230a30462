package com.work.token.core.crypto;

import com.work.token.core.exception.SigningException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

import static com.work.token.core.support.ValidationUtils.requireNonEmpty;
import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * HMAC-SHA256。Mac 实例非线程安全，每次调用新建。
 */
public final class HmacSigner {

    public static final String ALGORITHM = "HmacSHA256";
    public static final int DIGEST_LENGTH = 32;

    private HmacSigner() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * @return 32 字节摘要；相同 (key, message) 结果恒定
     */
    public static byte[] hmacSha256(String key, String message) {
        requireNonEmpty(key, "signing key");
        requireNonNull(message, "message");
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new SigningException("HMAC-SHA256 failed: " + e.getMessage(), e);
        }
    }
}
