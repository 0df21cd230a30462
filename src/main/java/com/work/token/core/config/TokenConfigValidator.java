package com.work.token.core.config;

import com.work.token.core.exception.TokenConfigException;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.work.token.core.support.ValidationUtils.inRange;
import static com.work.token.core.support.ValidationUtils.isBlank;

/**
 * 加载期配置校验：越界即抛出 {@link TokenConfigException}，阻止应用以错误配置启动。
 * <p>null 表示“未配置”，直接放行并原样返回。</p>
 */
public final class TokenConfigValidator {

    private TokenConfigValidator() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static Integer checkLength(Integer length, String where) {
        if (length != null && !inRange(length, TokenLimits.LENGTH_MIN, TokenLimits.LENGTH_MAX)) {
            throw new TokenConfigException(where + ": length must be between "
                    + TokenLimits.LENGTH_MIN + " and " + TokenLimits.LENGTH_MAX + ", got " + length);
        }
        return length;
    }

    public static Integer checkTtl(Integer ttl, String where) {
        if (ttl != null && !inRange(ttl, 0, TokenLimits.TTL_MAX_SECONDS)) {
            throw new TokenConfigException(where + ": ttl must be between 0 and "
                    + TokenLimits.TTL_MAX_SECONDS + " seconds (24 hours), got " + ttl);
        }
        return ttl;
    }

    public static Integer checkGrouping(Integer grouping, String where) {
        if (grouping != null && !inRange(grouping, 0, TokenLimits.GROUPING_MAX)) {
            throw new TokenConfigException(where + ": grouping must be between 0 and "
                    + TokenLimits.GROUPING_MAX + " (0 = no grouping), got " + grouping);
        }
        return grouping;
    }

    public static Integer checkExpiry(Integer expiry, String where) {
        if (expiry != null && !inRange(expiry, 0, TokenLimits.EXPIRY_MAX_SECONDS)) {
            throw new TokenConfigException(where + ": expiry must be between 0 and "
                    + TokenLimits.EXPIRY_MAX_SECONDS + " seconds (1 year), got " + expiry);
        }
        return expiry;
    }

    public static TokenFormat parseFormat(String format, String where) {
        if (format == null) {
            return null;
        }
        return TokenFormat.fromName(format).orElseThrow(() -> new TokenConfigException(where
                + ": invalid format '" + format + "' (must be base64, hex, base64url, or custom)"));
    }

    public static String checkAlphabet(String alphabet, String where) {
        if (alphabet == null) {
            return null;
        }
        String problem = describeAlphabetProblem(alphabet);
        if (problem != null) {
            throw new TokenConfigException(where + ": " + problem);
        }
        return alphabet;
    }

    public static String checkSigningKey(String key, String where) {
        if (key != null && isBlank(key)) {
            throw new TokenConfigException(where + ": signing key cannot be empty or blank");
        }
        return key;
    }

    public static Pattern compileUrlPattern(String regex, String where) {
        if (regex == null) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new TokenConfigException(where + ": invalid regex pattern '" + regex + "'", e);
        }
    }

    /**
     * 返回字母表的问题描述；合法时返回 null。解析期与生成期共用同一套规则。
     */
    public static String describeAlphabetProblem(String alphabet) {
        if (alphabet == null || alphabet.isEmpty()) {
            return "alphabet cannot be empty";
        }
        int len = alphabet.length();
        if (len < TokenLimits.ALPHABET_MIN_SIZE) {
            return "alphabet must contain at least " + TokenLimits.ALPHABET_MIN_SIZE + " characters";
        }
        if (len > TokenLimits.ALPHABET_MAX_SIZE) {
            return "alphabet too long (max " + TokenLimits.ALPHABET_MAX_SIZE + " characters)";
        }
        Set<Character> seen = new HashSet<>();
        for (int i = 0; i < len; i++) {
            char c = alphabet.charAt(i);
            if (Character.isSurrogate(c)) {
                return "alphabet must contain only BMP characters, found surrogate at position " + i;
            }
            if (!seen.add(c)) {
                return "duplicate character '" + c + "' at position " + i;
            }
        }
        return null;
    }
}
