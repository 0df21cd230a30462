package com.work.token.demo.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.work.token.core.config.TokenContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.work.token.core.support.ValidationUtils.requireNonNull;

/**
 * 作用域注册表：请求路径 -> 最深匹配作用域的生效上下文。
 *
 * <p>上下文在加载期一次性构建，之后只读；Caffeine 只缓存“路径查找结果”这一引用，
 * 淘汰不会影响各上下文内部的 token 缓存槽。</p>
 */
public class ScopeRegistry {

    /**
     * 路径前缀及其生效上下文。
     */
    public static final class Scope {
        private final String path;
        private final TokenContext context;

        public Scope(String path, TokenContext context) {
            this.path = requireNonNull(path, "path");
            this.context = requireNonNull(context, "context");
        }

        public String getPath() {
            return path;
        }

        public TokenContext getContext() {
            return context;
        }

        boolean matches(String requestPath) {
            if ("/".equals(path) || path.equals(requestPath)) {
                return true;
            }
            return requestPath.startsWith(path) && requestPath.charAt(path.length()) == '/';
        }
    }

    private final TokenContext rootContext;
    private final List<Scope> scopes;
    private final Cache<String, TokenContext> lookups;

    public ScopeRegistry(TokenContext rootContext, List<Scope> scopes, int lookupCacheSize) {
        this.rootContext = requireNonNull(rootContext, "rootContext");
        List<Scope> sorted = new ArrayList<>(requireNonNull(scopes, "scopes"));
        // 最长路径优先，保证第一个命中即最深作用域
        sorted.sort(Comparator.comparingInt((Scope s) -> s.getPath().length()).reversed());
        this.scopes = Collections.unmodifiableList(sorted);
        this.lookups = Caffeine.newBuilder()
                .maximumSize(Math.max(1, lookupCacheSize))
                .build();
    }

    /**
     * 返回请求路径对应的生效上下文；没有作用域匹配时返回根上下文。
     */
    public TokenContext resolve(String requestPath) {
        String p = (requestPath == null || requestPath.isEmpty()) ? "/" : requestPath;
        return lookups.get(p, this::findDeepest);
    }

    public TokenContext getRootContext() {
        return rootContext;
    }

    public List<Scope> getScopes() {
        return scopes;
    }

    private TokenContext findDeepest(String requestPath) {
        for (Scope s : scopes) {
            if (s.matches(requestPath)) {
                return s.getContext();
            }
        }
        return rootContext;
    }
}
