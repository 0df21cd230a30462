package com.work.token.demo.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 校验请求：token 在哪个路径、以哪个名称签发。
 */
public class VerifyTokenRequest {

    /** 签发 token 时的请求路径，用于定位作用域。 */
    @NotBlank(message = "path 不能为空")
    private String path;

    @NotBlank(message = "name 不能为空")
    private String name;

    @NotBlank(message = "token 不能为空")
    private String token;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }
}
