package com.psrlang.compiler.emitter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StringEscapes 测试
 */
class StringEscapesTest {

    private static final String EMOJI = new String(Character.toChars(0x1F600));

    @Test
    @DisplayName("只转义外层使用的引号")
    void testQuotes() {
        assertThat(StringEscapes.escape("a'b\"c", '\'')).isEqualTo("a\\'b\"c");
        assertThat(StringEscapes.escape("a'b\"c", '"')).isEqualTo("a'b\\\"c");
        assertThat(StringEscapes.singleQuoted("it's")).isEqualTo("'it\\'s'");
    }

    @Test
    @DisplayName("控制字符与反斜杠")
    void testControlCharacters() {
        assertThat(StringEscapes.escape("line\nnext\ttab\\", '"')).isEqualTo("line\\nnext\\ttab\\\\");
        assertThat(StringEscapes.escape(String.valueOf((char) 1), '\'')).isEqualTo("\\x01");
    }

    @Test
    @DisplayName("模板字符串中的插值起始和反引号")
    void testTemplate() {
        assertThat(StringEscapes.escape("${x} $y `q`", '`')).isEqualTo("\\${x} $y \\`q\\`");
    }

    @Test
    @DisplayName("仅 ASCII 输出")
    void testAsciiOnly() {
        assertThat(StringEscapes.escape("café", '\'', true)).isEqualTo("caf\\u00e9");
        assertThat(StringEscapes.escape(EMOJI, '\'', true)).isEqualTo("\\u{1f600}");
        assertThat(StringEscapes.escape("café", '\'')).isEqualTo("café");
    }

    @Test
    @DisplayName("转义后再反转义得到原串")
    void testRoundTrip() {
        List<String> samples = Arrays.asList("plain", "it's \"quoted\"", "a\\b\nc\r\td",
                "${not} `interpolated`", " " + EMOJI + "\u0000");
        for (String s : samples) {
            for (char quote : new char[]{'\'', '"', '`'}) {
                assertThat(StringEscapes.unescape(StringEscapes.escape(s, quote))).isEqualTo(s);
            }
        }
    }

    @Test
    @DisplayName("反转义十六进制、码点和行续接")
    void testUnescape() {
        assertThat(StringEscapes.unescape("\\x41\\u0042\\u{1F600}")).isEqualTo("AB" + EMOJI);
        assertThat(StringEscapes.unescape("a\\\nb")).isEqualTo("ab");
        assertThat(StringEscapes.unescape("\\q")).isEqualTo("q");
        assertThat(StringEscapes.unescape("no escapes")).isEqualTo("no escapes");
    }

    @Test
    @DisplayName("不完整的转义")
    void testUnescapeErrors() {
        assertThatThrownBy(() -> StringEscapes.unescape("abc\\"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Dangling backslash at end of string");
        assertThatThrownBy(() -> StringEscapes.unescape("\\x4"))
                .hasMessage("Incomplete hex escape");
        assertThatThrownBy(() -> StringEscapes.unescape("\\xZZ"))
                .hasMessage("Invalid hex escape: ZZ");
        assertThatThrownBy(() -> StringEscapes.unescape("\\u{41"))
                .hasMessage("Unterminated \\u{ escape");
    }
}
