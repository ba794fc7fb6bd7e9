package com.psrlang.compiler.emitter;

/**
 * JS/TS 字符串转义与反转义工具
 *
 * <p>escape 逐字符处理，反斜杠总是最先被转义，因此不会出现二次转义；
 * 对任意字符串 s 满足 {@code unescape(escape(s, q)).equals(s)}。</p>
 */
public final class StringEscapes {

    private StringEscapes() {}

    /**
     * 反转义单个转义字符（反斜杠后面的字符）。
     * <p>十六进制转义和行续接由调用者处理。</p>
     *
     * @return 对应的实际字符，未识别的转义返回 -1
     */
    public static int unescapeChar(char c) {
        switch (c) {
            case 'n':  return '\n';
            case 'r':  return '\r';
            case 't':  return '\t';
            case 'b':  return '\b';
            case 'f':  return '\f';
            case 'v':  return '\u000B';
            case '0':  return '\0';
            case '\\': return '\\';
            case '\'': return '\'';
            case '"':  return '"';
            case '`':  return '`';
            case '$':  return '$';
            default:   return -1;
        }
    }

    /** 转义字符串内容（不含外层引号） */
    public static String escape(String s, char quote) {
        return escape(s, quote, false);
    }

    /**
     * 转义字符串内容
     *
     * @param quote     外层引号（' " 或 `），只转义该种引号
     * @param asciiOnly 为 true 时非 ASCII 字符也转义为 \\u 形式
     */
    public static String escape(String s, char quote, boolean asciiOnly) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                case '\u000B': sb.append("\\v"); break;
                case '\u2028': sb.append("\\u2028"); break;
                case '\u2029': sb.append("\\u2029"); break;
                case '\'':
                case '"':
                case '`':
                    if (c == quote) sb.append('\\');
                    sb.append(c);
                    break;
                case '$':
                    // 模板字符串中 ${ 需要转义
                    if (quote == '`' && i + 1 < s.length() && s.charAt(i + 1) == '{') {
                        sb.append("\\$");
                    } else {
                        sb.append(c);
                    }
                    break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else if (asciiOnly && c > 0x7E) {
                        if (Character.isHighSurrogate(c) && i + 1 < s.length()
                                && Character.isLowSurrogate(s.charAt(i + 1))) {
                            int cp = Character.toCodePoint(c, s.charAt(i + 1));
                            sb.append("\\u{").append(Integer.toHexString(cp)).append('}');
                            i++;
                        } else {
                            sb.append(String.format("\\u%04x", (int) c));
                        }
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    /** 转义并加上引号 */
    public static String quote(String s, char quote) {
        return quote + escape(s, quote) + quote;
    }

    /** 使用单引号的字符串字面量（发射器默认风格） */
    public static String singleQuoted(String s) {
        return quote(s, '\'');
    }

    /**
     * 反转义字符串内容（不含外层引号）
     *
     * @throws IllegalArgumentException 十六进制转义不完整时
     */
    public static String unescape(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= s.length()) {
                throw new IllegalArgumentException("Dangling backslash at end of string");
            }
            char e = s.charAt(i++);
            switch (e) {
                case 'x': {
                    sb.append((char) parseHex(s, i, 2));
                    i += 2;
                    break;
                }
                case 'u': {
                    if (i < s.length() && s.charAt(i) == '{') {
                        int close = s.indexOf('}', i);
                        if (close < 0) {
                            throw new IllegalArgumentException("Unterminated \\u{ escape");
                        }
                        sb.appendCodePoint(parseHex(s, i + 1, close - i - 1));
                        i = close + 1;
                    } else {
                        sb.append((char) parseHex(s, i, 4));
                        i += 4;
                    }
                    break;
                }
                case '\r':
                    // 行续接
                    if (i < s.length() && s.charAt(i) == '\n') i++;
                    break;
                case '\n':
                case '\u2028':
                case '\u2029':
                    break;
                default: {
                    int r = unescapeChar(e);
                    sb.append(r >= 0 ? (char) r : e);
                }
            }
        }
        return sb.toString();
    }

    private static int parseHex(String s, int from, int len) {
        if (len <= 0 || from + len > s.length()) {
            throw new IllegalArgumentException("Incomplete hex escape");
        }
        try {
            return Integer.parseInt(s.substring(from, from + len), 16);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid hex escape: " + s.substring(from, from + len), ex);
        }
    }
}
