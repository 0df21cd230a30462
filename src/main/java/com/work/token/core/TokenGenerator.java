package com.work.token.core;

import com.work.token.core.cache.TokenCacheSlot;
import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.crypto.MetadataEncoder;
import com.work.token.core.encode.TokenStringGenerator;
import com.work.token.core.exception.CsprngUnavailableException;
import com.work.token.core.exception.SigningException;
import com.work.token.core.model.TokenFailureReason;
import com.work.token.core.model.TokenResult;
import com.work.token.core.resolve.ResolutionWarning;
import com.work.token.core.resolve.ResolvedToken;
import com.work.token.core.resolve.TokenSpecResolver;
import com.work.token.core.support.metrics.TokenMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 单个 token 的完整生成流水线：
 * 解析生效参数 → 读缓存 → [未命中] 随机字节 + 编码 → 时间戳 → 元数据/签名 → 前后缀 → 写缓存。
 *
 * <p>同一个 token 只采样一次时间：时间戳前缀、元数据过期时间、缓存写入时刻共用这一采样。</p>
 */
public class TokenGenerator {

    private static final Logger log = LoggerFactory.getLogger(TokenGenerator.class);

    private final TokenSpecResolver resolver;
    private final TokenStringGenerator stringGenerator;
    private final MetadataEncoder metadataEncoder;
    private final Clock clock;
    private final TokenMetrics metrics;
    private final Duration cacheLockTimeout;

    public TokenGenerator(TokenSpecResolver resolver,
                          TokenStringGenerator stringGenerator,
                          MetadataEncoder metadataEncoder,
                          Clock clock,
                          TokenMetrics metrics,
                          Duration cacheLockTimeout) {
        this.resolver = requireNonNull(resolver, "resolver");
        this.stringGenerator = requireNonNull(stringGenerator, "stringGenerator");
        this.metadataEncoder = requireNonNull(metadataEncoder, "metadataEncoder");
        this.clock = requireNonNull(clock, "clock");
        this.metrics = requireNonNull(metrics, "metrics");
        this.cacheLockTimeout = requireNonNull(cacheLockTimeout, "cacheLockTimeout");
    }

    /**
     * 生成（或从缓存取出）一个 token。
     * 随机源失败时返回失败结果，不抛出；其余可降级的问题只记录告警。
     */
    public TokenResult generate(TokenSpec spec, TokenContext context) {
        ResolvedToken token = resolver.resolve(spec, context);
        String name = token.getName();
        String header = token.getHeader().orElse(null);
        for (ResolutionWarning w : token.getWarnings()) {
            log.warn("token config degraded name={} warning={}", name, w);
            metrics.resolutionWarning(w.code());
        }

        Instant now = clock.instant();
        TokenCacheSlot slot = spec.getCacheSlot();
        if (token.isCacheEnabled()) {
            TokenCacheSlot.Read read = slot.read(now, token.getTtlSeconds(), cacheLockTimeout);
            metrics.cacheLookup(read.getOutcome().name().toLowerCase(Locale.ROOT));
            if (read.isHit() && read.getValue().isPresent()) {
                return TokenResult.cached(name, header, read.getValue().get());
            }
            if (read.getOutcome() == TokenCacheSlot.Outcome.LOCK_FAILED) {
                log.warn("token cache unavailable, generating without cache name={}", name);
            }
        }

        String payload;
        try {
            payload = stringGenerator.generate(token.getLength(), token.getFormat(),
                    token.getAlphabet(), token.getGrouping());
        } catch (CsprngUnavailableException e) {
            log.error("CSPRNG unavailable, token not emitted name={}", name, e);
            metrics.generation("csprng_unavailable");
            return TokenResult.failed(name, header, TokenFailureReason.CSPRNG_UNAVAILABLE);
        }

        long epochSeconds = now.getEpochSecond();
        if (token.isTimestamp()) {
            payload = epochSeconds + "-" + payload;
        }
        if (token.isEncodeMetadata()) {
            payload = encodeMetadata(token, payload, epochSeconds);
        }

        String value = token.getPrefix() + payload + token.getSuffix();

        if (token.isCacheEnabled() && !slot.write(value, now, cacheLockTimeout)) {
            log.debug("token cache write skipped, lock unavailable name={}", name);
        }
        metrics.generation("ok");
        return TokenResult.generated(name, header, value);
    }

    private String encodeMetadata(ResolvedToken token, String payload, long epochSeconds) {
        String key = token.getSigningKey().orElse(null);
        if (key == null) {
            metrics.signing("unsigned");
            return metadataEncoder.unsigned(payload, token.getExpirySeconds(), epochSeconds);
        }
        try {
            String signed = metadataEncoder.encode(payload, token.getExpirySeconds(), key, epochSeconds);
            metrics.signing("signed");
            return signed;
        } catch (SigningException | IllegalArgumentException e) {
            // 密钥不可用与签名失败同样处理：降级为未签名 token
            log.warn("token signing failed, emitting unsigned token name={} err={}", token.getName(), e.toString());
            metrics.signing("failed");
            return metadataEncoder.unsigned(payload, token.getExpirySeconds(), epochSeconds);
        }
    }
}
