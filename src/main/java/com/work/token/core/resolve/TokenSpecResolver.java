package com.work.token.core.resolve;

import com.work.token.core.config.TokenConfigValidator;
import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenFormat;
import com.work.token.core.config.TokenLimits;
import com.work.token.core.config.TokenSpec;

import java.util.ArrayList;
import java.util.List;

import static com.work.token.core.support.ValidationUtils.inRange;
import static com.work.token.core.support.ValidationUtils.isBlank;
import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 计算 token 规格的生效参数：规格自身的值 > 上下文默认值 > 系统默认值。
 *
 * <p>加载期校验之外再做一次越界保护（防止以编程方式构造的非法配置）：
 * 越界值被钳制或降级，并以 {@link ResolutionWarning} 上报，从不中断生成。</p>
 */
public class TokenSpecResolver {

    public ResolvedToken resolve(TokenSpec spec, TokenContext context) {
        requireNonNull(spec, "spec");
        requireNonNull(context, "context");
        List<ResolutionWarning> warnings = new ArrayList<>(2);

        int length = spec.getLength().orElse(context.getLength().orElse(TokenLimits.LENGTH_DEFAULT));
        if (!inRange(length, TokenLimits.LENGTH_MIN, TokenLimits.LENGTH_MAX)) {
            warnings.add(ResolutionWarning.LENGTH_OUT_OF_RANGE);
            length = TokenLimits.LENGTH_DEFAULT;
        }

        TokenFormat format = spec.getFormat().orElse(context.getFormat().orElse(TokenLimits.FORMAT_DEFAULT));
        boolean timestamp = spec.getTimestamp().orElse(context.getTimestamp().orElse(Boolean.FALSE));
        String prefix = spec.getPrefix().orElse(context.getPrefix().orElse(""));
        String suffix = spec.getSuffix().orElse(context.getSuffix().orElse(""));

        int ttl = spec.getTtlSeconds().orElse(context.getTtlSeconds().orElse(TokenLimits.TTL_DEFAULT));
        if (ttl < 0) {
            warnings.add(ResolutionWarning.TTL_NEGATIVE);
            ttl = 0;
        } else if (ttl > TokenLimits.TTL_MAX_SECONDS) {
            warnings.add(ResolutionWarning.TTL_CLAMPED);
            ttl = TokenLimits.TTL_MAX_SECONDS;
        }

        String alphabet = null;
        int grouping = 0;
        if (format == TokenFormat.CUSTOM) {
            alphabet = context.getAlphabet().orElse(null);
            if (alphabet == null || alphabet.isEmpty()) {
                warnings.add(ResolutionWarning.ALPHABET_MISSING);
                format = TokenFormat.BASE64;
                alphabet = null;
            } else if (TokenConfigValidator.describeAlphabetProblem(alphabet) != null) {
                warnings.add(ResolutionWarning.ALPHABET_INVALID);
                format = TokenFormat.BASE64;
                alphabet = null;
            } else {
                grouping = context.getGrouping().orElse(0);
                if (!inRange(grouping, 0, TokenLimits.GROUPING_MAX)) {
                    warnings.add(ResolutionWarning.GROUPING_CLAMPED);
                    grouping = Math.max(0, Math.min(grouping, TokenLimits.GROUPING_MAX));
                }
            }
        }

        boolean metadataRequested = context.getEncodeMetadata().orElse(Boolean.FALSE);
        int expiry = context.getExpirySeconds().orElse(0);
        if (!inRange(expiry, 0, TokenLimits.EXPIRY_MAX_SECONDS)) {
            warnings.add(ResolutionWarning.EXPIRY_CLAMPED);
            expiry = Math.max(0, Math.min(expiry, TokenLimits.EXPIRY_MAX_SECONDS));
        }
        String signingKey = context.getSigningKey().filter(k -> !isBlank(k)).orElse(null);
        boolean encodeMetadata = false;
        if (metadataRequested) {
            if (expiry <= 0) {
                warnings.add(ResolutionWarning.METADATA_WITHOUT_EXPIRY);
            } else {
                encodeMetadata = true;
                if (signingKey == null) {
                    warnings.add(ResolutionWarning.SIGNING_KEY_MISSING);
                }
                if (ttl > expiry) {
                    warnings.add(ResolutionWarning.TTL_EXCEEDS_EXPIRY);
                }
            }
        }

        return new ResolvedToken(spec, length, format, timestamp, prefix, suffix, ttl,
                alphabet, grouping, encodeMetadata, expiry, signingKey, warnings);
    }
}
