package com.psrlang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lexer 单元测试
 */
class LexerTest {

    // ============ 辅助方法 ============

    private List<Token> lex(String source) {
        return new Lexer(source).scanTokens();
    }

    private Lexer lexer(String source, LexerMode mode) {
        return new Lexer(source, "test.psr", LexerOptions.defaults().setMode(mode));
    }

    /**
     * 提取 token 类型序列（去掉末尾 EOF）
     */
    private List<TokenType> types(String source) {
        List<TokenType> result = new ArrayList<TokenType>();
        for (Token token : lex(source)) {
            if (token.getType() != TokenType.EOF) {
                result.add(token.getType());
            }
        }
        return result;
    }

    private Token first(String source) {
        return lex(source).get(0);
    }

    // ============ 基础 ============

    @Nested
    @DisplayName("基础 Token")
    class BasicTokenTests {

        @Test
        @DisplayName("空输入只产生 EOF")
        void testEmpty() {
            List<Token> tokens = lex("");
            assertThat(tokens).hasSize(1);
            assertThat(tokens.get(0).getType()).isEqualTo(TokenType.EOF);
        }

        @Test
        @DisplayName("关键词与上下文关键词")
        void testKeywords() {
            assertThat(types("component const let function"))
                    .containsExactly(TokenType.KW_COMPONENT, TokenType.KW_CONST,
                            TokenType.KW_LET, TokenType.KW_FUNCTION);
            assertThat(TokenType.KW_COMPONENT.isContextualKeyword()).isTrue();
            assertThat(TokenType.KW_RETURN.isContextualKeyword()).isFalse();
        }

        @Test
        @DisplayName("属性访问之后的关键词视为标识符")
        void testKeywordAfterDot() {
            assertThat(types("obj.default"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER);
            assertThat(types("a?.new"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.QUESTION_DOT, TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("复合运算符")
        void testCompoundOperators() {
            assertThat(types("a ??= b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.NULLISH_ASSIGN, TokenType.IDENTIFIER);
            assertThat(types("a === b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.EQ_STRICT, TokenType.IDENTIFIER);
            assertThat(types("a ** b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.STAR_STAR, TokenType.IDENTIFIER);
            assertThat(types("(x) => x"))
                    .containsExactly(TokenType.LPAREN, TokenType.IDENTIFIER, TokenType.RPAREN,
                            TokenType.ARROW, TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("私有名称")
        void testPrivateName() {
            Token token = first("#count");
            assertThat(token.getType()).isEqualTo(TokenType.PRIVATE_NAME);
            assertThat(token.getLexeme()).isEqualTo("#count");
        }

        @Test
        @DisplayName("行列号与换行标记")
        void testPosition() {
            List<Token> tokens = lex("let a\n  = 1");
            Token assign = tokens.get(2);
            assertThat(assign.getType()).isEqualTo(TokenType.ASSIGN);
            assertThat(assign.getLine()).isEqualTo(2);
            assertThat(assign.getColumn()).isEqualTo(3);
            assertThat(assign.isNewlineBefore()).isTrue();
            assertThat(tokens.get(1).isNewlineBefore()).isFalse();
        }

        @Test
        @DisplayName("注释被跳过")
        void testComments() {
            assertThat(types("a // line\n/* block\n */ b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.IDENTIFIER);
        }
    }

    // ============ 字面量 ============

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("十进制、十六进制与分隔符")
        void testNumbers() {
            assertThat(first("42").getLiteral()).isEqualTo(42.0);
            assertThat(first("0x1F").getLiteral()).isEqualTo(31.0);
            assertThat(first("1_000").getLiteral()).isEqualTo(1000.0);
            assertThat(first(".5").getLiteral()).isEqualTo(0.5);
            assertThat(first("1e3").getLiteral()).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("BigInt 字面量")
        void testBigInt() {
            Token token = first("10n");
            assertThat(token.getType()).isEqualTo(TokenType.BIGINT_LITERAL);
            assertThat(token.getLiteral()).isEqualTo(BigInteger.TEN);
        }

        @Test
        @DisplayName("字符串转义被解码")
        void testStringEscapes() {
            assertThat(first("'a\\nb'").getLiteral()).isEqualTo("a\nb");
            assertThat(first("\"\\x41\"").getLiteral()).isEqualTo("A");
            assertThat(first("'it\\'s'").getLiteral()).isEqualTo("it's");
        }

        @Test
        @DisplayName("模板字符串拆分为头、中、尾")
        void testTemplate() {
            List<Token> tokens = lex("`a${b}c${d}e`");
            assertThat(tokens.get(0).getType()).isEqualTo(TokenType.TEMPLATE_HEAD);
            assertThat(tokens.get(0).getLiteral()).isEqualTo("a");
            assertThat(tokens.get(1).getType()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(tokens.get(2).getType()).isEqualTo(TokenType.TEMPLATE_MIDDLE);
            assertThat(tokens.get(2).getLiteral()).isEqualTo("c");
            assertThat(tokens.get(4).getType()).isEqualTo(TokenType.TEMPLATE_TAIL);
            assertThat(tokens.get(4).getLiteral()).isEqualTo("e");
        }

        @Test
        @DisplayName("插值内部的对象字面量不会提前结束插值")
        void testTemplateNestedBraces() {
            assertThat(types("`${ {a: 1}.a }`")).containsExactly(
                    TokenType.TEMPLATE_HEAD, TokenType.LBRACE, TokenType.IDENTIFIER, TokenType.COLON,
                    TokenType.NUMBER_LITERAL, TokenType.RBRACE, TokenType.DOT, TokenType.IDENTIFIER,
                    TokenType.TEMPLATE_TAIL);
        }

        @Test
        @DisplayName("表达式位置的 '/' 是正则")
        void testRegex() {
            List<Token> tokens = lex("x = /ab+c/g;");
            assertThat(tokens.get(2).getType()).isEqualTo(TokenType.REGEX_LITERAL);
            assertThat(tokens.get(2).getLiteral()).isEqualTo("ab+c");
            assertThat(tokens.get(2).getLexeme()).isEqualTo("/ab+c/g");
        }

        @Test
        @DisplayName("操作数之后的 '/' 是除号")
        void testDivision() {
            assertThat(types("a / b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.SLASH, TokenType.IDENTIFIER);
        }
    }

    // ============ 尖括号消歧 ============

    @Nested
    @DisplayName("尖括号消歧")
    class AngleBracketTests {

        @Test
        @DisplayName("泛型调用中的联合类型")
        void testGenericCall() {
            assertThat(types("createSignal<IUser | null>(null)")).containsExactly(
                    TokenType.IDENTIFIER, TokenType.GENERIC_OPEN, TokenType.IDENTIFIER, TokenType.PIPE,
                    TokenType.KW_NULL, TokenType.GENERIC_CLOSE, TokenType.LPAREN, TokenType.KW_NULL,
                    TokenType.RPAREN);
        }

        @Test
        @DisplayName("嵌套泛型的 '>>' 拆成两个闭合")
        void testNestedGenericClose() {
            assertThat(types("let x: Promise<Array<T>> = y;")).containsExactly(
                    TokenType.KW_LET, TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER,
                    TokenType.GENERIC_OPEN, TokenType.IDENTIFIER, TokenType.GENERIC_OPEN,
                    TokenType.IDENTIFIER, TokenType.GENERIC_CLOSE, TokenType.GENERIC_CLOSE,
                    TokenType.ASSIGN, TokenType.IDENTIFIER, TokenType.SEMICOLON);
        }

        @Test
        @DisplayName("比较运算符")
        void testComparison() {
            assertThat(types("a < b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.LT, TokenType.IDENTIFIER);
            assertThat(types("a >= b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.GE, TokenType.IDENTIFIER);
            assertThat(types("a <= b"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.LE, TokenType.IDENTIFIER);
        }

        @Test
        @DisplayName("泛型之外的移位运算最长匹配")
        void testShift() {
            assertThat(types("a >> b")).containsExactly(TokenType.IDENTIFIER, TokenType.SHR, TokenType.IDENTIFIER);
            assertThat(types("a >>> b")).containsExactly(TokenType.IDENTIFIER, TokenType.USHR, TokenType.IDENTIFIER);
            assertThat(types("a >>= 1"))
                    .containsExactly(TokenType.IDENTIFIER, TokenType.SHR_ASSIGN, TokenType.NUMBER_LITERAL);
        }

        @Test
        @DisplayName("泛型箭头函数 <T,>")
        void testGenericArrow() {
            assertThat(types("<T,>(x: T) => x").get(0)).isEqualTo(TokenType.GENERIC_OPEN);
        }

        @Test
        @DisplayName("return 之后的 '<' 开始 JSX")
        void testJsxAfterReturn() {
            assertThat(types("return <div>Hi</div>;")).containsExactly(
                    TokenType.KW_RETURN, TokenType.JSX_OPEN, TokenType.IDENTIFIER, TokenType.JSX_TAG_END,
                    TokenType.JSX_TEXT, TokenType.JSX_CLOSE_OPEN, TokenType.IDENTIFIER,
                    TokenType.JSX_TAG_END, TokenType.SEMICOLON);
        }
    }

    // ============ JSX ============

    @Nested
    @DisplayName("JSX")
    class JsxTests {

        @Test
        @DisplayName("属性字符串与自闭合")
        void testAttributeString() {
            List<Token> tokens = lex("<a href=\"/home\" />");
            assertThat(tokens.get(0).getType()).isEqualTo(TokenType.JSX_OPEN);
            assertThat(tokens.get(2).getLexeme()).isEqualTo("href");
            assertThat(tokens.get(3).getType()).isEqualTo(TokenType.ASSIGN);
            assertThat(tokens.get(4).getType()).isEqualTo(TokenType.JSX_ATTR_STRING);
            assertThat(tokens.get(4).getLiteral()).isEqualTo("/home");
            assertThat(tokens.get(5).getType()).isEqualTo(TokenType.JSX_SELF_CLOSE);
        }

        @Test
        @DisplayName("带连字符的属性名")
        void testHyphenatedAttribute() {
            List<Token> tokens = lex("<div data-id=\"1\"/>");
            assertThat(tokens.get(2).getType()).isEqualTo(TokenType.IDENTIFIER);
            assertThat(tokens.get(2).getLexeme()).isEqualTo("data-id");
        }

        @Test
        @DisplayName("子节点中的表达式容器")
        void testExpressionChild() {
            assertThat(types("<p>n: {count()}!</p>")).containsExactly(
                    TokenType.JSX_OPEN, TokenType.IDENTIFIER, TokenType.JSX_TAG_END,
                    TokenType.JSX_TEXT, TokenType.LBRACE, TokenType.IDENTIFIER, TokenType.LPAREN,
                    TokenType.RPAREN, TokenType.RBRACE, TokenType.JSX_TEXT,
                    TokenType.JSX_CLOSE_OPEN, TokenType.IDENTIFIER, TokenType.JSX_TAG_END);
        }

        @Test
        @DisplayName("属性中的箭头函数")
        void testHandlerAttribute() {
            assertThat(types("<button onClick={() => go()} />")).containsExactly(
                    TokenType.JSX_OPEN, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.ASSIGN,
                    TokenType.LBRACE, TokenType.LPAREN, TokenType.RPAREN, TokenType.ARROW,
                    TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.RPAREN, TokenType.RBRACE,
                    TokenType.JSX_SELF_CLOSE);
        }

        @Test
        @DisplayName("JSX 文本保留原始内容")
        void testRawText() {
            List<Token> tokens = lex("<p>a &amp; b</p>");
            assertThat(tokens.get(3).getType()).isEqualTo(TokenType.JSX_TEXT);
            assertThat(tokens.get(3).getLexeme()).isEqualTo("a &amp; b");
        }
    }

    // ============ 错误处理 ============

    @Nested
    @DisplayName("错误处理")
    class ErrorTests {

        @Test
        @DisplayName("严格模式遇到非法字符抛出异常")
        void testStrictThrows() {
            assertThatThrownBy(() -> lexer("let a = #;", LexerMode.STRICT).scanTokens())
                    .isInstanceOf(LexerException.class)
                    .hasMessage("[test.psr:1:9] Lexer error: Unexpected character: #");
        }

        @Test
        @DisplayName("严格模式下未闭合字符串")
        void testUnterminatedString() {
            assertThatThrownBy(() -> lexer("'abc", LexerMode.STRICT).scanTokens())
                    .isInstanceOf(LexerException.class)
                    .hasMessageContaining("Unterminated string literal");
        }

        @Test
        @DisplayName("收集模式记录错误并继续")
        void testCollectMode() {
            Lexer lexer = lexer("let a = #;", LexerMode.COLLECT);
            List<Token> tokens = lexer.scanTokens();

            assertThat(lexer.hasErrors()).isTrue();
            assertThat(lexer.getErrors()).hasSize(1);
            LexError error = lexer.getErrors().get(0);
            assertThat(error.getMessage()).isEqualTo("Unexpected character: #");
            assertThat(error.getLine()).isEqualTo(1);
            assertThat(error.getColumn()).isEqualTo(9);
            assertThat(tokens.get(3).getType()).isEqualTo(TokenType.ERROR);
            assertThat(tokens.get(4).getType()).isEqualTo(TokenType.SEMICOLON);
        }

        @Test
        @DisplayName("RESILIENT 模式跳过出错行的剩余部分")
        void testResilientMode() {
            Lexer lexer = lexer("let s = \"abc\nlet b = 1;", LexerMode.RESILIENT);
            List<Token> tokens = lexer.scanTokens();

            assertThat(lexer.getErrors()).extracting("message")
                    .containsExactly("Unterminated string literal");
            Token second = null;
            for (Token token : tokens) {
                if (token.is(TokenType.KW_LET) && token.getLine() == 2) {
                    second = token;
                }
            }
            assertThat(second).isNotNull();
            assertThat(tokens.get(tokens.size() - 2).getType()).isEqualTo(TokenType.SEMICOLON);
        }

        @Test
        @DisplayName("错误数超过上限时放弃")
        void testTooManyErrors() {
            Lexer lexer = new Lexer("# # # #", "test.psr",
                    LexerOptions.defaults().setMode(LexerMode.COLLECT).setMaxErrors(2));
            assertThatThrownBy(lexer::scanTokens)
                    .isInstanceOf(LexerException.class)
                    .hasMessageContaining("Too many lexical errors");
        }
    }
}
