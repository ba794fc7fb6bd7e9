package com.psrlang.compiler.parser;

import java.util.HashMap;
import java.util.Map;

/**
 * JSX 文本和属性字符串中的 HTML 实体解码
 */
public final class HtmlEntities {

    private static final Map<String, String> NAMED = new HashMap<String, String>();

    static {
        NAMED.put("amp", "&");
        NAMED.put("lt", "<");
        NAMED.put("gt", ">");
        NAMED.put("quot", "\"");
        NAMED.put("apos", "'");
        NAMED.put("nbsp", "\u00A0");
        NAMED.put("copy", "\u00A9");
        NAMED.put("reg", "\u00AE");
        NAMED.put("trade", "\u2122");
        NAMED.put("hellip", "\u2026");
        NAMED.put("mdash", "\u2014");
        NAMED.put("ndash", "\u2013");
        NAMED.put("laquo", "\u00AB");
        NAMED.put("raquo", "\u00BB");
        NAMED.put("lsquo", "\u2018");
        NAMED.put("rsquo", "\u2019");
        NAMED.put("ldquo", "\u201C");
        NAMED.put("rdquo", "\u201D");
        NAMED.put("bull", "\u2022");
        NAMED.put("middot", "\u00B7");
        NAMED.put("times", "\u00D7");
        NAMED.put("divide", "\u00F7");
        NAMED.put("euro", "\u20AC");
        NAMED.put("pound", "\u00A3");
        NAMED.put("yen", "\u00A5");
        NAMED.put("cent", "\u00A2");
        NAMED.put("deg", "\u00B0");
        NAMED.put("plusmn", "\u00B1");
        NAMED.put("para", "\u00B6");
        NAMED.put("sect", "\u00A7");
        NAMED.put("larr", "\u2190");
        NAMED.put("uarr", "\u2191");
        NAMED.put("rarr", "\u2192");
        NAMED.put("darr", "\u2193");
        NAMED.put("harr", "\u2194");
        NAMED.put("hearts", "\u2665");
        NAMED.put("spades", "\u2660");
        NAMED.put("clubs", "\u2663");
        NAMED.put("diams", "\u2666");
        NAMED.put("check", "\u2713");
        NAMED.put("ensp", "\u2002");
        NAMED.put("emsp", "\u2003");
        NAMED.put("thinsp", "\u2009");
        NAMED.put("zwj", "\u200D");
        NAMED.put("zwnj", "\u200C");
    }

    private HtmlEntities() {
    }

    /**
     * 解码命名实体、十进制 {@code &#65;} 和十六进制 {@code &#x41;} 引用，无法识别的实体原样保留
     */
    public static String decode(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '&') {
                sb.append(c);
                i++;
                continue;
            }
            int semi = text.indexOf(';', i + 1);
            // 实体名最长不超过 10 个字符
            if (semi < 0 || semi - i > 11) {
                sb.append(c);
                i++;
                continue;
            }
            String decoded = decodeEntity(text.substring(i + 1, semi));
            if (decoded == null) {
                sb.append(c);
                i++;
            } else {
                sb.append(decoded);
                i = semi + 1;
            }
        }
        return sb.toString();
    }

    private static String decodeEntity(String body) {
        if (body.isEmpty()) return null;
        if (body.charAt(0) != '#') {
            return NAMED.get(body);
        }
        try {
            int codePoint;
            if (body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')) {
                if (body.length() == 2) return null;
                codePoint = Integer.parseInt(body.substring(2), 16);
            } else {
                if (body.length() == 1) return null;
                codePoint = Integer.parseInt(body.substring(1), 10);
            }
            if (!Character.isValidCodePoint(codePoint)) return null;
            return new String(Character.toChars(codePoint));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
