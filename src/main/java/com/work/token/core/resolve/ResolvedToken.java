package com.work.token.core.resolve;

import com.work.token.core.config.TokenFormat;
import com.work.token.core.config.TokenSpec;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 某个 token 规格在某个上下文中的生效参数（所有字段均已确定、已做越界保护）。
 */
public final class ResolvedToken {

    private final TokenSpec spec;
    private final int length;
    private final TokenFormat format;
    private final boolean timestamp;
    private final String prefix;
    private final String suffix;
    private final int ttlSeconds;
    private final String alphabet;
    private final int grouping;
    private final boolean encodeMetadata;
    private final int expirySeconds;
    private final String signingKey;
    private final List<ResolutionWarning> warnings;

    ResolvedToken(TokenSpec spec, int length, TokenFormat format, boolean timestamp,
                  String prefix, String suffix, int ttlSeconds, String alphabet, int grouping,
                  boolean encodeMetadata, int expirySeconds, String signingKey,
                  List<ResolutionWarning> warnings) {
        this.spec = spec;
        this.length = length;
        this.format = format;
        this.timestamp = timestamp;
        this.prefix = prefix;
        this.suffix = suffix;
        this.ttlSeconds = ttlSeconds;
        this.alphabet = alphabet;
        this.grouping = grouping;
        this.encodeMetadata = encodeMetadata;
        this.expirySeconds = expirySeconds;
        this.signingKey = signingKey;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public TokenSpec getSpec() {
        return spec;
    }

    public String getName() {
        return spec.getName();
    }

    public Optional<String> getHeader() {
        return spec.getHeader();
    }

    public int getLength() {
        return length;
    }

    public TokenFormat getFormat() {
        return format;
    }

    public boolean isTimestamp() {
        return timestamp;
    }

    /** 生效前缀，未配置时为空串。 */
    public String getPrefix() {
        return prefix;
    }

    /** 生效后缀，未配置时为空串。 */
    public String getSuffix() {
        return suffix;
    }

    public int getTtlSeconds() {
        return ttlSeconds;
    }

    public boolean isCacheEnabled() {
        return ttlSeconds > 0;
    }

    /** 仅 CUSTOM 格式有值。 */
    public String getAlphabet() {
        return alphabet;
    }

    public int getGrouping() {
        return grouping;
    }

    /** 是否需要编码元数据（已开启且过期时间 > 0）。 */
    public boolean isEncodeMetadata() {
        return encodeMetadata;
    }

    public int getExpirySeconds() {
        return expirySeconds;
    }

    public Optional<String> getSigningKey() {
        return Optional.ofNullable(signingKey);
    }

    public List<ResolutionWarning> getWarnings() {
        return warnings;
    }
}
