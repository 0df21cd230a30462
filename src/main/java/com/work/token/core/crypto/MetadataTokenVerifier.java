package com.work.token.core.crypto;

import com.work.token.core.encode.TokenEncoders;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static com.work.token.core.support.ValidationUtils.isBlank;

/**
 * 校验 {@link MetadataEncoder} 产出的 token。
 *
 * <p>线格式对 ':' 不做转义：过期时间取第一个 ':' 之前，签名取最后一个 ':' 之后（固定 64 位 hex），
 * 中间全部视为 payload。未签名形式下 payload 取第一个 ':' 之后的全部内容；
 * 若 payload 本身以 ":<64 位 hex>" 结尾，未签名与签名两种形式无法区分，只能依赖调用方是否配置密钥。</p>
 */
public class MetadataTokenVerifier {

    private static final int SIGNATURE_HEX_LENGTH = HmacSigner.DIGEST_LENGTH * 2;

    public MetadataToken verify(String token, String signingKey, long nowEpochSeconds) {
        if (token == null) {
            return MetadataToken.malformed();
        }
        int first = token.indexOf(MetadataEncoder.DELIMITER);
        if (first <= 0) {
            return MetadataToken.malformed();
        }
        Long expiry = parseExpiry(token.substring(0, first));
        if (expiry == null) {
            return MetadataToken.malformed();
        }

        boolean signed = !isBlank(signingKey);
        String payload;
        if (signed) {
            int last = token.lastIndexOf(MetadataEncoder.DELIMITER);
            if (last <= first) {
                return MetadataToken.malformed();
            }
            String signature = token.substring(last + 1);
            if (!isLowerHex(signature, SIGNATURE_HEX_LENGTH)) {
                return MetadataToken.malformed();
            }
            payload = token.substring(first + 1, last);
            String expected = TokenEncoders.hex(HmacSigner.hmacSha256(signingKey, token.substring(0, last)));
            if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.US_ASCII),
                    signature.getBytes(StandardCharsets.US_ASCII))) {
                return new MetadataToken(VerificationResult.BAD_SIGNATURE, expiry, payload);
            }
        } else {
            payload = token.substring(first + 1);
        }

        if (nowEpochSeconds >= expiry) {
            return new MetadataToken(VerificationResult.EXPIRED, expiry, payload);
        }
        return new MetadataToken(VerificationResult.VALID, expiry, payload);
    }

    private static Long parseExpiry(String s) {
        if (s.isEmpty() || s.length() > 19) {
            return null;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isLowerHex(String s, int expectedLength) {
        if (s.length() != expectedLength) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
