package com.work.token.core.resolve;

import java.util.Locale;

/**
 * 解析期发现的非致命问题：字段被钳制或降级到安全默认值，生成继续进行。
 */
public enum ResolutionWarning {
    /** 长度越界，重置为系统默认长度。 */
    LENGTH_OUT_OF_RANGE,
    /** TTL 为负，关闭缓存。 */
    TTL_NEGATIVE,
    /** TTL 超过上限，钳制到上限。 */
    TTL_CLAMPED,
    /** 分组大小越界，钳制到 [0, 上限]。 */
    GROUPING_CLAMPED,
    /** custom 格式但未配置字母表，降级为 base64。 */
    ALPHABET_MISSING,
    /** 字母表非法（长度或重复字符），降级为 base64。 */
    ALPHABET_INVALID,
    /** 过期时间越界，钳制到 [0, 上限]。 */
    EXPIRY_CLAMPED,
    /** 开启了元数据编码但过期时间为 0，不编码元数据。 */
    METADATA_WITHOUT_EXPIRY,
    /** 开启了元数据编码但没有签名密钥，输出未签名 token。 */
    SIGNING_KEY_MISSING,
    /** TTL 长于元数据过期时间，缓存可能返回内嵌过期时间已过的 token。 */
    TTL_EXCEEDS_EXPIRY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
