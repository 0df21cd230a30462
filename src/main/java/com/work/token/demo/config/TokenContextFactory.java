package com.work.token.demo.config;

import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.exception.TokenConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.work.token.core.config.TokenConfigValidator.checkAlphabet;
import static com.work.token.core.config.TokenConfigValidator.checkExpiry;
import static com.work.token.core.config.TokenConfigValidator.checkGrouping;
import static com.work.token.core.config.TokenConfigValidator.checkLength;
import static com.work.token.core.config.TokenConfigValidator.checkSigningKey;
import static com.work.token.core.config.TokenConfigValidator.checkTtl;
import static com.work.token.core.config.TokenConfigValidator.compileUrlPattern;
import static com.work.token.core.config.TokenConfigValidator.parseFormat;

/**
 * 把 {@link TokenProperties} 转换为只读的 {@link TokenContext} 树，并在加载期做全部校验。
 *
 * <p>每个作用域的生效上下文 = merge(父级生效上下文, 本层配置)，只在启动时计算一次。</p>
 */
public class TokenContextFactory {

    private static final Logger log = LoggerFactory.getLogger(TokenContextFactory.class);

    public ScopeRegistry build(TokenProperties properties) {
        ScopeProperties root = properties.getRoot() == null ? new ScopeProperties() : properties.getRoot();
        TokenContext rootContext = toContext(root, "root");

        List<ScopeRegistry.Scope> scopes = new ArrayList<>();
        Set<String> seenPaths = new HashSet<>();
        for (ScopeProperties child : root.getScopes()) {
            collect(child, "/", rootContext, scopes, seenPaths);
        }
        log.info("token scopes loaded rootTokens={} scopes={}", rootContext.getTokens().size(), seenPaths);
        return new ScopeRegistry(rootContext, scopes, properties.getScopeCacheSize());
    }

    private void collect(ScopeProperties scope, String parentPath, TokenContext parentEffective,
                         List<ScopeRegistry.Scope> out, Set<String> seenPaths) {
        String path = normalizePath(scope.getPath());
        if (!isWithin(path, parentPath)) {
            throw new TokenConfigException("scope " + path + " is not nested under " + parentPath);
        }
        if (!seenPaths.add(path)) {
            throw new TokenConfigException("duplicate scope path: " + path);
        }
        TokenContext effective = TokenContext.merge(parentEffective, toContext(scope, "scope " + path));
        out.add(new ScopeRegistry.Scope(path, effective));
        for (ScopeProperties child : scope.getScopes()) {
            collect(child, path, effective, out, seenPaths);
        }
    }

    /**
     * 只转换本层配置（不含继承），未配置字段保持 empty。
     */
    TokenContext toContext(ScopeProperties p, String where) {
        TokenContext.Builder b = TokenContext.builder()
                .length(checkLength(p.getLength(), where))
                .format(parseFormat(p.getFormat(), where))
                .timestamp(p.getTimestamp())
                .prefix(p.getPrefix())
                .suffix(p.getSuffix())
                .ttlSeconds(checkTtl(p.getTtl(), where))
                .alphabet(checkAlphabet(p.getAlphabet(), where))
                .grouping(checkGrouping(p.getGrouping(), where))
                .expirySeconds(checkExpiry(p.getExpiry(), where))
                .encodeMetadata(p.getEncodeMetadata())
                .signingKey(checkSigningKey(p.getSigningKey(), where))
                .urlPattern(compileUrlPattern(p.getOnlyFor(), where));
        if (p.getTokens() != null) {
            for (TokenSpecProperties t : p.getTokens()) {
                b.addToken(toSpec(t, where));
            }
        }
        return b.build();
    }

    private TokenSpec toSpec(TokenSpecProperties t, String where) {
        if (t.getName() == null || t.getName().trim().isEmpty()) {
            throw new TokenConfigException(where + ": token name is required");
        }
        String name = t.getName().trim();
        String w = where + " token " + name;
        return TokenSpec.builder(name)
                .header(t.getHeader())
                .length(checkLength(t.getLength(), w))
                .format(parseFormat(t.getFormat(), w))
                .timestamp(t.getTimestamp())
                .prefix(t.getPrefix())
                .suffix(t.getSuffix())
                .ttlSeconds(checkTtl(t.getTtl(), w))
                .build();
    }

    static String normalizePath(String path) {
        if (path == null || path.trim().isEmpty() || !path.trim().startsWith("/")) {
            throw new TokenConfigException("scope path must be an absolute URL path, got '" + path + "'");
        }
        String p = path.trim();
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    private static boolean isWithin(String path, String parentPath) {
        return "/".equals(parentPath) || path.equals(parentPath) || path.startsWith(parentPath + "/");
    }
}
