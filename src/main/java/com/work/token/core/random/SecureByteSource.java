package com.work.token.core.random;

import com.work.token.core.exception.CsprngUnavailableException;

/**
 * 密码学安全的随机字节来源。
 *
 * <p>失败时必须抛出 {@link CsprngUnavailableException}，绝不能返回全零或可预测的数据。</p>
 */
@FunctionalInterface
public interface SecureByteSource {

    /**
     * @param count 字节数，>= 0
     * @return 长度恰为 count 的新数组
     */
    byte[] nextBytes(int count);
}
