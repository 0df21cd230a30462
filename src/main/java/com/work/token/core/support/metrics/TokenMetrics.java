package com.work.token.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 设计目标：
 * - 核心路径只调用接口，不绑定具体 metrics 实现
 * - 业务/平台可通过自定义 Bean 接入 Micrometer 等实现
 */
public interface TokenMetrics {

    /**
     * @param result ok / csprng_unavailable / error
     */
    default void generation(String result) {
    }

    /**
     * @param result hit / miss / lock_failed / clock_skew
     */
    default void cacheLookup(String result) {
    }

    default void resolutionWarning(String code) {
    }

    /**
     * @param result signed / unsigned / failed
     */
    default void signing(String result) {
    }
}
