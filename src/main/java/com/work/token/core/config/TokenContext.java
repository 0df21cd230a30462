package com.work.token.core.config;

import com.work.token.core.exception.TokenConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 某个作用域（类似 location/目录嵌套）上已合并的配置：共享默认值 + 有序 token 列表。
 *
 * <p>构造完成后只读，不需要加锁；唯一的可变状态是各 {@link TokenSpec} 内部的缓存槽。</p>
 */
public final class TokenContext {

    private static final Logger log = LoggerFactory.getLogger(TokenContext.class);

    private static final TokenContext EMPTY = builder().build();

    private final Integer length;
    private final TokenFormat format;
    private final Boolean timestamp;
    private final String prefix;
    private final String suffix;
    private final Integer ttlSeconds;
    private final String alphabet;
    private final Integer grouping;
    private final Integer expirySeconds;
    private final Boolean encodeMetadata;
    private final String signingKey;
    private final Pattern urlPattern;
    private final List<TokenSpec> tokens;

    private TokenContext(Builder b) {
        this.length = b.length;
        this.format = b.format;
        this.timestamp = b.timestamp;
        this.prefix = b.prefix;
        this.suffix = b.suffix;
        this.ttlSeconds = b.ttlSeconds;
        this.alphabet = b.alphabet;
        this.grouping = b.grouping;
        this.expirySeconds = b.expirySeconds;
        this.encodeMetadata = b.encodeMetadata;
        this.signingKey = b.signingKey;
        this.urlPattern = b.urlPattern;
        this.tokens = Collections.unmodifiableList(new ArrayList<>(b.tokens));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** 所有字段均未配置、没有 token 的上下文。 */
    public static TokenContext empty() {
        return EMPTY;
    }

    /**
     * 纯函数合并：子级显式配置的字段覆盖父级，未配置的继承父级。
     * token 列表为“父级在前、子级在后”的拼接，总数超过上限的部分被截断。
     * 结果中的 token 规格都是新副本，不与任何一方共享缓存槽。
     */
    public static TokenContext merge(TokenContext parent, TokenContext child) {
        Builder b = builder()
                .length(firstPresent(child.length, parent.length))
                .format(firstPresent(child.format, parent.format))
                .timestamp(firstPresent(child.timestamp, parent.timestamp))
                .prefix(firstPresent(child.prefix, parent.prefix))
                .suffix(firstPresent(child.suffix, parent.suffix))
                .ttlSeconds(firstPresent(child.ttlSeconds, parent.ttlSeconds))
                .alphabet(firstPresent(child.alphabet, parent.alphabet))
                .grouping(firstPresent(child.grouping, parent.grouping))
                .expirySeconds(firstPresent(child.expirySeconds, parent.expirySeconds))
                .encodeMetadata(firstPresent(child.encodeMetadata, parent.encodeMetadata))
                .signingKey(firstPresent(child.signingKey, parent.signingKey))
                .urlPattern(firstPresent(child.urlPattern, parent.urlPattern));

        int total = parent.tokens.size() + child.tokens.size();
        List<TokenSpec> all = new ArrayList<>(total);
        all.addAll(parent.tokens);
        all.addAll(child.tokens);
        if (total > TokenLimits.MAX_TOKENS) {
            log.warn("merged token list truncated total={} max={} dropped={}",
                    total, TokenLimits.MAX_TOKENS, all.subList(TokenLimits.MAX_TOKENS, total));
        }
        for (TokenSpec spec : all.subList(0, Math.min(total, TokenLimits.MAX_TOKENS))) {
            b.addToken(spec.copyWithFreshCache());
        }
        return b.build();
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

    public Optional<String> getAlphabet() {
        return Optional.ofNullable(alphabet);
    }

    public Optional<Integer> getGrouping() {
        return Optional.ofNullable(grouping);
    }

    public Optional<Integer> getExpirySeconds() {
        return Optional.ofNullable(expirySeconds);
    }

    public Optional<Boolean> getEncodeMetadata() {
        return Optional.ofNullable(encodeMetadata);
    }

    public Optional<String> getSigningKey() {
        return Optional.ofNullable(signingKey);
    }

    /** URL/主体过滤：配置后只有匹配的请求才生成 token。 */
    public Optional<Pattern> getUrlPattern() {
        return Optional.ofNullable(urlPattern);
    }

    public List<TokenSpec> getTokens() {
        return tokens;
    }

    /** 按名称查找 token 规格（名称区分大小写）。 */
    public Optional<TokenSpec> findToken(String name) {
        for (TokenSpec spec : tokens) {
            if (spec.getName().equals(name)) {
                return Optional.of(spec);
            }
        }
        return Optional.empty();
    }

    private static <T> T firstPresent(T child, T parent) {
        return child != null ? child : parent;
    }

    public static final class Builder {

        private Integer length;
        private TokenFormat format;
        private Boolean timestamp;
        private String prefix;
        private String suffix;
        private Integer ttlSeconds;
        private String alphabet;
        private Integer grouping;
        private Integer expirySeconds;
        private Boolean encodeMetadata;
        private String signingKey;
        private Pattern urlPattern;
        private final List<TokenSpec> tokens = new ArrayList<>();

        private Builder() {
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

        public Builder alphabet(String alphabet) {
            this.alphabet = alphabet;
            return this;
        }

        public Builder grouping(Integer grouping) {
            this.grouping = grouping;
            return this;
        }

        public Builder expirySeconds(Integer expirySeconds) {
            this.expirySeconds = expirySeconds;
            return this;
        }

        public Builder encodeMetadata(Boolean encodeMetadata) {
            this.encodeMetadata = encodeMetadata;
            return this;
        }

        public Builder signingKey(String signingKey) {
            this.signingKey = signingKey;
            return this;
        }

        public Builder urlPattern(Pattern urlPattern) {
            this.urlPattern = urlPattern;
            return this;
        }

        /**
         * 追加一个 token 规格；超过 {@link TokenLimits#MAX_TOKENS} 时拒绝。
         */
        public Builder addToken(TokenSpec spec) {
            if (spec == null) {
                throw new TokenConfigException("token spec 不能为null");
            }
            if (tokens.size() >= TokenLimits.MAX_TOKENS) {
                throw new TokenConfigException("maximum number of tokens (" + TokenLimits.MAX_TOKENS
                        + ") exceeded, rejected: " + spec.getName());
            }
            tokens.add(spec);
            return this;
        }

        public TokenContext build() {
            return new TokenContext(this);
        }
    }
}
