package com.work.token.demo.web.dto;

import com.work.token.core.model.TokenResult;

/**
 * 本次请求生成的单个 token 的对外视图。
 */
public class TokenView {

    private final String name;
    private final String header;
    private final String value;
    private final boolean cached;

    private TokenView(String name, String header, String value, boolean cached) {
        this.name = name;
        this.header = header;
        this.value = value;
        this.cached = cached;
    }

    public static TokenView from(TokenResult result) {
        return new TokenView(result.getName(), result.getHeader().orElse(null),
                result.getValue().orElse(null), result.isCached());
    }

    public String getName() {
        return name;
    }

    public String getHeader() {
        return header;
    }

    public String getValue() {
        return value;
    }

    public boolean isCached() {
        return cached;
    }
}
