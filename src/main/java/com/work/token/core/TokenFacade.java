package com.work.token.core;

import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.model.TokenFailureReason;
import com.work.token.core.model.TokenResult;
import com.work.token.core.support.metrics.TokenMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 门面层：对宿主暴露“为一个工作单元生成全部 token”的唯一入口。
 * <p>按配置顺序逐个生成；任一 token 失败只影响它自己，不会让整批失败。</p>
 */
public class TokenFacade {

    private static final Logger log = LoggerFactory.getLogger(TokenFacade.class);

    private final TokenGenerator generator;
    private final TokenMetrics metrics;

    public TokenFacade(TokenGenerator generator, TokenMetrics metrics) {
        this.generator = requireNonNull(generator, "generator");
        this.metrics = requireNonNull(metrics, "metrics");
    }

    /**
     * 为一个工作单元生成生效上下文中的全部 token。
     *
     * @param context 已合并的生效上下文
     * @param subject 用于 URL 过滤的主体（通常是请求路径）；为 null 时按空串匹配
     * @return 与 token 列表同序的结果；被 URL 过滤跳过时返回空列表
     */
    public List<TokenResult> resolveAndGenerate(TokenContext context, String subject) {
        requireNonNull(context, "context");
        Optional<Pattern> filter = context.getUrlPattern();
        String s = subject == null ? "" : subject;
        if (filter.isPresent() && !filter.get().matcher(s).find()) {
            log.debug("token generation skipped, subject does not match filter subject={} pattern={}",
                    s, filter.get().pattern());
            return Collections.emptyList();
        }

        List<TokenSpec> specs = context.getTokens();
        List<TokenResult> results = new ArrayList<>(specs.size());
        for (TokenSpec spec : specs) {
            results.add(generateOne(spec, context));
        }
        return results;
    }

    private TokenResult generateOne(TokenSpec spec, TokenContext context) {
        try {
            return generator.generate(spec, context);
        } catch (RuntimeException e) {
            log.error("token generation failed name={}", spec.getName(), e);
            metrics.generation("error");
            return TokenResult.failed(spec.getName(), spec.getHeader().orElse(null), TokenFailureReason.INTERNAL_ERROR);
        }
    }
}
