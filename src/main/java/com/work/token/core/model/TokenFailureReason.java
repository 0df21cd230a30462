package com.work.token.core.model;

/**
 * 导致某个 token 没有产出值的原因。
 */
public enum TokenFailureReason {
    /** 安全随机源不可用：致命，必须上报，不能被掩盖。 */
    CSPRNG_UNAVAILABLE,
    /** 生成过程中的意外异常，仅影响该 token。 */
    INTERNAL_ERROR
}
