package com.work.token.demo.web;

import com.work.token.core.TokenFacade;
import com.work.token.core.config.TokenContext;
import com.work.token.core.model.TokenResult;
import com.work.token.demo.config.ScopeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;

/**
 * 每个请求进入时按作用域生成 token：
 * - 以 token 名作为 request attribute（环境变量式输出）
 * - 声明了 header 的 token 同时写入同名响应头
 * - 失败的 token 直接省略（诊断日志已在 core 中输出）
 *
 * <p>OncePerRequestFilter 保证 forward/include 等内部分派不会重复生成。</p>
 */
@Component
public class TokenInjectionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TokenInjectionFilter.class);

    /** 本次请求全部结果（含失败项）的 request attribute 名。 */
    public static final String RESULTS_ATTRIBUTE = TokenInjectionFilter.class.getName() + ".RESULTS";

    private final ScopeRegistry scopeRegistry;
    private final TokenFacade tokenFacade;

    public TokenInjectionFilter(ScopeRegistry scopeRegistry, TokenFacade tokenFacade) {
        this.scopeRegistry = scopeRegistry;
        this.tokenFacade = tokenFacade;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = pathWithinApplication(request);
        TokenContext context = scopeRegistry.resolve(path);
        List<TokenResult> results = tokenFacade.resolveAndGenerate(context, path);

        int emitted = 0;
        for (TokenResult r : results) {
            if (!r.isSuccess() || !r.getValue().isPresent()) {
                continue;
            }
            String value = r.getValue().get();
            request.setAttribute(r.getName(), value);
            if (r.getHeader().isPresent()) {
                response.setHeader(r.getHeader().get(), value);
            }
            emitted++;
        }
        request.setAttribute(RESULTS_ATTRIBUTE, results);
        if (emitted < results.size()) {
            log.warn("tokens omitted for request path={} emitted={} configured={}", path, emitted, results.size());
        }
        filterChain.doFilter(request, response);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri == null) {
            return "/";
        }
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
