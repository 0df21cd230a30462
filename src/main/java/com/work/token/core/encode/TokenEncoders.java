package com.work.token.core.encode;

import java.util.Base64;

/**
 * 随机字节的文本编码：hex、base64、base64url 以及自定义字母表。
 *
 * <p>全部为纯函数，无共享状态，空输入返回空串。</p>
 */
public final class TokenEncoders {

    /** 自定义字母表分组使用的分隔符。 */
    public static final char GROUP_SEPARATOR = '-';

    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    private TokenEncoders() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 每字节两个小写十六进制字符。
     */
    public static String hex(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        char[] out = new char[data.length * 2];
        for (int i = 0; i < data.length; i++) {
            int b = data[i] & 0xFF;
            out[i * 2] = HEX_CHARS[b >>> 4];
            out[i * 2 + 1] = HEX_CHARS[b & 0x0F];
        }
        return new String(out);
    }

    /**
     * 标准 base64，保留 '=' 填充。
     */
    public static String base64(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(data);
    }

    /**
     * URL 安全 base64：'+' 换成 '-'，'/' 换成 '_'，去掉 '=' 填充。
     */
    public static String base64Url(byte[] data) {
        if (data == null || data.length == 0) {
            return "";
        }
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    /**
     * 把字节流视为大端位流，每次取 ceil(log2(K)) 位作为字母表下标（K 为字母表长度）。
     *
     * <p>最后不足一个符号的剩余位左移补齐后再输出一个符号，不丢弃熵。
     * K 不是 2 的幂时，超出字母表范围的下标被跳过（拒绝采样，避免取模偏差）。
     * grouping > 0 时每 grouping 个符号插入一个 '-'，但末尾绝不出现分隔符。</p>
     *
     * <p>前置条件：字母表已由调用方校验（2~256 个互不重复的 BMP 字符，不含代理项）。
     * 未提供字母表或长度小于 2 时退化为 hex。</p>
     */
    public static String customAlphabet(byte[] data, String alphabet, int grouping) {
        if (alphabet == null || alphabet.length() < 2) {
            return hex(data);
        }
        if (data == null || data.length == 0) {
            return "";
        }
        int k = alphabet.length();
        int bitsPerSymbol = bitsPerSymbol(k);
        int mask = (1 << bitsPerSymbol) - 1;
        int group = Math.max(0, grouping);

        // 最坏情况：每个位组都输出一个符号，再加上 flush 符号与分隔符
        int maxSymbols = (data.length * 8 + bitsPerSymbol - 1) / bitsPerSymbol;
        int capacity = maxSymbols + (group > 0 ? maxSymbols / group : 0);
        StringBuilder out = new StringBuilder(capacity);

        int buffer = 0;
        int bitsAvailable = 0;
        int emitted = 0;
        for (byte b : data) {
            buffer = ((buffer << 8) | (b & 0xFF)) & 0xFFFF;
            bitsAvailable += 8;
            while (bitsAvailable >= bitsPerSymbol) {
                bitsAvailable -= bitsPerSymbol;
                int index = (buffer >>> bitsAvailable) & mask;
                emitted = append(out, alphabet, index, group, emitted);
            }
        }
        if (bitsAvailable > 0) {
            int index = (buffer << (bitsPerSymbol - bitsAvailable)) & mask;
            append(out, alphabet, index, group, emitted);
        }
        return out.toString();
    }

    /**
     * ceil(log2(k))，k >= 2。
     */
    static int bitsPerSymbol(int k) {
        int bits = 0;
        while ((1 << bits) < k) {
            bits++;
        }
        return bits;
    }

    private static int append(StringBuilder out, String alphabet, int index, int group, int emitted) {
        if (index >= alphabet.length()) {
            return emitted;
        }
        if (group > 0 && emitted > 0 && emitted % group == 0) {
            out.append(GROUP_SEPARATOR);
        }
        out.append(alphabet.charAt(index));
        return emitted + 1;
    }
}
