package com.work.token.core.random;

import com.work.token.core.exception.CsprngUnavailableException;
import com.work.token.core.exception.TokenConfigException;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

import static com.work.token.core.support.ValidationUtils.requireNonNegative;
import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 基于 {@link SecureRandom} 的默认实现。SecureRandom 本身线程安全，可被所有请求共享。
 */
public class SecureRandomByteSource implements SecureByteSource {

    private final SecureRandom random;

    public SecureRandomByteSource() {
        this(new SecureRandom());
    }

    public SecureRandomByteSource(SecureRandom random) {
        this.random = requireNonNull(random, "random");
    }

    /**
     * 使用指定算法（如 NativePRNGNonBlocking、DRBG）；算法为空时使用平台默认。
     */
    public static SecureRandomByteSource forAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.trim().isEmpty()) {
            return new SecureRandomByteSource();
        }
        try {
            return new SecureRandomByteSource(SecureRandom.getInstance(algorithm.trim()));
        } catch (NoSuchAlgorithmException e) {
            throw new TokenConfigException("unsupported SecureRandom algorithm: " + algorithm, e);
        }
    }

    @Override
    public byte[] nextBytes(int count) {
        requireNonNegative(count, "count");
        byte[] bytes = new byte[count];
        try {
            random.nextBytes(bytes);
        } catch (RuntimeException e) {
            // provider 故障（熵源不可读等）：上报失败，不返回未填充的缓冲区
            throw new CsprngUnavailableException("secure random source failed: " + e.getMessage(), e);
        }
        return bytes;
    }
}
