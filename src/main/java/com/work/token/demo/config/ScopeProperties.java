package com.work.token.demo.config;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个配置作用域（类似 location 嵌套）。所有标量字段为 null 表示“本层未配置”。
 * 子作用域显式配置的字段覆盖父级，token 列表在父级之后追加。
 */
public class ScopeProperties {

    /**
     * 作用域的 URL 路径前缀（绝对路径），根作用域忽略该字段。
     */
    private String path;

    private Integer length;
    private String format;
    private Boolean timestamp;
    private String prefix;
    private String suffix;
    private Integer ttl;

    /**
     * custom 格式使用的字母表，2~256 个互不重复的字符。
     */
    private String alphabet;

    /**
     * custom 格式每 N 个字符插入一个 '-'，0 表示不分组。
     */
    private Integer grouping;

    /**
     * 元数据中的有效期（秒），需配合 encodeMetadata 使用。
     */
    private Integer expiry;

    private Boolean encodeMetadata;
    private String signingKey;

    /**
     * 只为匹配该正则的请求路径生成 token。
     */
    private String onlyFor;

    private List<TokenSpecProperties> tokens = new ArrayList<>();

    private List<ScopeProperties> scopes = new ArrayList<>();

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Integer getLength() {
        return length;
    }

    public void setLength(Integer length) {
        this.length = length;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public Boolean getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Boolean timestamp) {
        this.timestamp = timestamp;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public Integer getTtl() {
        return ttl;
    }

    public void setTtl(Integer ttl) {
        this.ttl = ttl;
    }

    public String getAlphabet() {
        return alphabet;
    }

    public void setAlphabet(String alphabet) {
        this.alphabet = alphabet;
    }

    public Integer getGrouping() {
        return grouping;
    }

    public void setGrouping(Integer grouping) {
        this.grouping = grouping;
    }

    public Integer getExpiry() {
        return expiry;
    }

    public void setExpiry(Integer expiry) {
        this.expiry = expiry;
    }

    public Boolean getEncodeMetadata() {
        return encodeMetadata;
    }

    public void setEncodeMetadata(Boolean encodeMetadata) {
        this.encodeMetadata = encodeMetadata;
    }

    public String getSigningKey() {
        return signingKey;
    }

    public void setSigningKey(String signingKey) {
        this.signingKey = signingKey;
    }

    public String getOnlyFor() {
        return onlyFor;
    }

    public void setOnlyFor(String onlyFor) {
        this.onlyFor = onlyFor;
    }

    public List<TokenSpecProperties> getTokens() {
        return tokens;
    }

    public void setTokens(List<TokenSpecProperties> tokens) {
        this.tokens = tokens;
    }

    public List<ScopeProperties> getScopes() {
        return scopes;
    }

    public void setScopes(List<ScopeProperties> scopes) {
        this.scopes = scopes;
    }
}
