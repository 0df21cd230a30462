package com.work.token.demo.config;

import com.work.token.core.TokenFacade;
import com.work.token.core.TokenGenerator;
import com.work.token.core.crypto.MetadataEncoder;
import com.work.token.core.crypto.MetadataTokenVerifier;
import com.work.token.core.encode.TokenStringGenerator;
import com.work.token.core.random.SecureByteSource;
import com.work.token.core.random.SecureRandomByteSource;
import com.work.token.core.resolve.TokenSpecResolver;
import com.work.token.core.support.metrics.NoopTokenMetrics;
import com.work.token.core.support.metrics.TokenMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * core 包本身不依赖 Spring，只在这里完成组装。
 */
@Configuration
@EnableConfigurationProperties(TokenProperties.class)
public class TokenComponentConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock tokenClock() {
        return Clock.systemUTC();
    }

    /**
     * 随机源（业务方可替换为 HSM 等实现）
     */
    @Bean
    @ConditionalOnMissingBean(SecureByteSource.class)
    public SecureByteSource secureByteSource(TokenProperties properties) {
        return SecureRandomByteSource.forAlgorithm(properties.getRandomAlgorithm());
    }

    @Bean
    @ConditionalOnMissingBean(TokenMetrics.class)
    public TokenMetrics tokenMetrics() {
        return new NoopTokenMetrics();
    }

    @Bean
    public ScopeRegistry scopeRegistry(TokenProperties properties) {
        return new TokenContextFactory().build(properties);
    }

    @Bean
    public MetadataEncoder metadataEncoder(Clock clock) {
        return new MetadataEncoder(clock);
    }

    @Bean
    public MetadataTokenVerifier metadataTokenVerifier() {
        return new MetadataTokenVerifier();
    }

    @Bean
    public TokenSpecResolver tokenSpecResolver() {
        return new TokenSpecResolver();
    }

    @Bean
    public TokenGenerator tokenGenerator(TokenSpecResolver resolver,
                                         SecureByteSource byteSource,
                                         MetadataEncoder metadataEncoder,
                                         Clock clock,
                                         TokenMetrics metrics,
                                         TokenProperties properties) {
        return new TokenGenerator(resolver, new TokenStringGenerator(byteSource),
                metadataEncoder, clock, metrics, properties.getCacheLockTimeout());
    }

    @Bean
    public TokenFacade tokenFacade(TokenGenerator generator, TokenMetrics metrics) {
        return new TokenFacade(generator, metrics);
    }
}
