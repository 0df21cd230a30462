package com.work.token.core.config;

import com.work.token.core.cache.TokenCacheSlot;

import java.util.Optional;

import static com.work.token.core.support.ValidationUtils.requireNonEmpty;

/**
 * 单个具名 token 的规格。
 *
 * <p>每个可覆盖字段都是“有/无”两态：empty 表示本层未配置、向上继承；
 * 有值（包括 0、false）表示显式配置，必须覆盖父级默认值。</p>
 *
 * <p>除 {@link #getCacheSlot()} 外不可变；缓存槽由该规格独占，被命中同一作用域的所有请求共享。</p>
 */
public final class TokenSpec {

    private final String name;
    private final String header;
    private final Integer length;
    private final TokenFormat format;
    private final Boolean timestamp;
    private final String prefix;
    private final String suffix;
    private final Integer ttlSeconds;
    private final TokenCacheSlot cacheSlot;

    private TokenSpec(Builder b) {
        this.name = requireNonEmpty(b.name, "token name");
        this.header = emptyToNull(b.header);
        this.length = b.length;
        this.format = b.format;
        this.timestamp = b.timestamp;
        this.prefix = b.prefix;
        this.suffix = b.suffix;
        this.ttlSeconds = b.ttlSeconds;
        this.cacheSlot = new TokenCacheSlot();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 复制配置字段，缓存槽重新创建（子作用域不继承父作用域的缓存）。
     */
    public TokenSpec copyWithFreshCache() {
        return new Builder(name)
                .header(header)
                .length(length)
                .format(format)
                .timestamp(timestamp)
                .prefix(prefix)
                .suffix(suffix)
                .ttlSeconds(ttlSeconds)
                .build();
    }

    /** 环境变量式输出通道的名称。 */
    public String getName() {
        return name;
    }

    /** 可选的 header 式输出通道。 */
    public Optional<String> getHeader() {
        return Optional.ofNullable(header);
    }

    public Optional<Integer> getLength() {
        return Optional.ofNullable(length);
    }

    public Optional<TokenFormat> getFormat() {
        return Optional.ofNullable(format);
    }

    public Optional<Boolean> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<String> getPrefix() {
        return Optional.ofNullable(prefix);
    }

    public Optional<String> getSuffix() {
        return Optional.ofNullable(suffix);
    }

    public Optional<Integer> getTtlSeconds() {
        return Optional.ofNullable(ttlSeconds);
    }

    public TokenCacheSlot getCacheSlot() {
        return cacheSlot;
    }

    @Override
    public String toString() {
        return "TokenSpec{name=" + name + ", header=" + header + ", length=" + length
                + ", format=" + format + ", timestamp=" + timestamp + ", ttl=" + ttlSeconds + "}";
    }

    private static String emptyToNull(String s) {
        return (s == null || s.isEmpty()) ? null : s;
    }

    public static final class Builder {

        private final String name;
        private String header;
        private Integer length;
        private TokenFormat format;
        private Boolean timestamp;
        private String prefix;
        private String suffix;
        private Integer ttlSeconds;

        private Builder(String name) {
            this.name = name;
        }

        public Builder header(String header) {
            this.header = header;
            return this;
        }

        public Builder length(Integer length) {
            this.length = length;
            return this;
        }

        public Builder format(TokenFormat format) {
            this.format = format;
            return this;
        }

        public Builder timestamp(Boolean timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = prefix;
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = suffix;
            return this;
        }

        public Builder ttlSeconds(Integer ttlSeconds) {
            this.ttlSeconds = ttlSeconds;
            return this;
        }

        public TokenSpec build() {
            return new TokenSpec(this);
        }
    }
}
