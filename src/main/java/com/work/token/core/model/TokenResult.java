package com.work.token.core.model;

import java.util.Optional;

/**
 * 单个 token 的生成结果：输出通道标签 + 值或失败原因。
 */
public final class TokenResult {

    private final String name;
    private final String header;
    private final String value;
    private final TokenFailureReason failure;
    private final boolean cached;

    private TokenResult(String name, String header, String value, TokenFailureReason failure, boolean cached) {
        this.name = name;
        this.header = header;
        this.value = value;
        this.failure = failure;
        this.cached = cached;
    }

    public static TokenResult generated(String name, String header, String value) {
        return new TokenResult(name, header, value, null, false);
    }

    public static TokenResult cached(String name, String header, String value) {
        return new TokenResult(name, header, value, null, true);
    }

    public static TokenResult failed(String name, String header, TokenFailureReason reason) {
        return new TokenResult(name, header, null, reason, false);
    }

    /** 环境变量式输出通道名。 */
    public String getName() {
        return name;
    }

    /** header 式输出通道名（可选）。 */
    public Optional<String> getHeader() {
        return Optional.ofNullable(header);
    }

    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<TokenFailureReason> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** 值是否来自 TTL 缓存。 */
    public boolean isCached() {
        return cached;
    }

    @Override
    public String toString() {
        return "TokenResult{name=" + name + ", header=" + header
                + (failure == null ? ", cached=" + cached : ", failure=" + failure) + "}";
    }
}
