package com.work.token.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于 demo/宿主包，用于从 application.yml 读取配置。
 * 再由 {@link TokenContextFactory} 转换为 core 包所需的 {@link com.work.token.core.config.TokenContext} 树。
 */
@ConfigurationProperties(prefix = "token")
public class TokenProperties {

    /**
     * SecureRandom 算法名，为空使用平台默认
     */
    private String randomAlgorithm;

    /**
     * 获取缓存槽锁的最长等待，超时即按未命中处理
     */
    private Duration cacheLockTimeout = Duration.ofMillis(50);

    /**
     * 请求路径 -> 生效上下文 的查找缓存容量
     */
    private int scopeCacheSize = 1024;

    private ScopeProperties root = new ScopeProperties();

    public String getRandomAlgorithm() {
        return randomAlgorithm;
    }

    public void setRandomAlgorithm(String randomAlgorithm) {
        this.randomAlgorithm = randomAlgorithm;
    }

    public Duration getCacheLockTimeout() {
        return cacheLockTimeout;
    }

    public void setCacheLockTimeout(Duration cacheLockTimeout) {
        this.cacheLockTimeout = cacheLockTimeout;
    }

    public int getScopeCacheSize() {
        return scopeCacheSize;
    }

    public void setScopeCacheSize(int scopeCacheSize) {
        this.scopeCacheSize = scopeCacheSize;
    }

    public ScopeProperties getRoot() {
        return root;
    }

    public void setRoot(ScopeProperties root) {
        this.root = root;
    }
}
