package com.work.token.demo.service;

import com.work.token.core.config.TokenContext;
import com.work.token.core.config.TokenSpec;
import com.work.token.core.crypto.MetadataToken;
import com.work.token.core.crypto.MetadataTokenVerifier;
import com.work.token.core.resolve.ResolvedToken;
import com.work.token.core.resolve.TokenSpecResolver;
import com.work.token.demo.config.ScopeRegistry;
import com.work.token.demo.web.dto.VerifyTokenResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * 校验此前签发的元数据 token：定位作用域与 token 规格，剥离生效前后缀，再校验过期时间与签名。
 */
@Service
public class TokenVerificationService {

    private static final Logger log = LoggerFactory.getLogger(TokenVerificationService.class);

    private final ScopeRegistry scopeRegistry;
    private final TokenSpecResolver resolver;
    private final MetadataTokenVerifier verifier;
    private final Clock clock;

    public TokenVerificationService(ScopeRegistry scopeRegistry,
                                    TokenSpecResolver resolver,
                                    MetadataTokenVerifier verifier,
                                    Clock clock) {
        this.scopeRegistry = scopeRegistry;
        this.resolver = resolver;
        this.verifier = verifier;
        this.clock = clock;
    }

    public VerifyTokenResponse verify(String path, String name, String token) {
        TokenContext context = scopeRegistry.resolve(path);
        Optional<TokenSpec> spec = context.findToken(name);
        if (!spec.isPresent()) {
            return VerifyTokenResponse.unknownToken();
        }
        ResolvedToken resolved = resolver.resolve(spec.get(), context);
        if (!resolved.isEncodeMetadata()) {
            // 该 token 不携带元数据，无从校验
            return VerifyTokenResponse.unknownToken();
        }

        String prefix = resolved.getPrefix();
        String suffix = resolved.getSuffix();
        if (!token.startsWith(prefix) || !token.endsWith(suffix)
                || token.length() < prefix.length() + suffix.length()) {
            return VerifyTokenResponse.of(MetadataToken.malformed());
        }
        String core = token.substring(prefix.length(), token.length() - suffix.length());
        MetadataToken parsed = verifier.verify(core, resolved.getSigningKey().orElse(null),
                clock.instant().getEpochSecond());
        log.debug("token verified path={} name={} result={}", path, name, parsed.getResult());
        return VerifyTokenResponse.of(parsed);
    }
}
