package com.work.token.demo.config;

/**
 * 单个 token 的声明，对应 application.yml 中 scope 下的 tokens 列表项。
 * 未填写的字段保持 null，表示继承作用域默认值。
 */
public class TokenSpecProperties {

    /** 输出名（环境变量式），必填。 */
    private String name;

    /** 额外输出的 header 名。 */
    private String header;

    private Integer length;
    private String format;
    private Boolean timestamp;
    private String prefix;
    private String suffix;
    private Integer ttl;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getHeader() {
        return header;
    }

    public void setHeader(String header) {
        this.header = header;
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
}
