package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.Literal;
import com.psrlang.compiler.ast.expr.Literal.LiteralKind;
import com.psrlang.compiler.ast.expr.SpreadElement;
import com.psrlang.compiler.ast.jsx.*;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * JSX 解析：元素、片段、属性和子节点
 *
 * <p>标签内部的 token（名称、属性字符串、'>'、'/>'）由词法器在 JSX 模式下产生，
 * 花括号内部回到普通表达式模式。</p>
 */
class JsxParser {

    private final Parser p;

    JsxParser(Parser parser) {
        this.p = parser;
    }

    /**
     * 当前为 JSX_OPEN 时解析一个元素或片段
     */
    Expression parseElementOrFragment() {
        p.enterNesting();
        try {
            return parseElement();
        } finally {
            p.exitNesting();
        }
    }

    private Expression parseElement() {
        Token start = p.expect(JSX_OPEN, "Expected '<'");
        if (p.match(JSX_TAG_END)) {
            List<Expression> children = parseChildren();
            expectClosing(start, null);
            return new JsxFragment(p.locationFrom(start), children);
        }

        String tagName = parseTagName();
        List<AstNode> attributes = parseAttributes();
        if (p.match(JSX_SELF_CLOSE)) {
            return new JsxElement(p.locationFrom(start), tagName, Collections.<TypeNode>emptyList(),
                    attributes, Collections.<Expression>emptyList(), true);
        }
        p.expect(JSX_TAG_END, "Expected '>' or '/>' in JSX tag");
        List<Expression> children = parseChildren();
        expectClosing(start, tagName);
        return new JsxElement(p.locationFrom(start), tagName, Collections.<TypeNode>emptyList(),
                attributes, children, false);
    }

    /** div、my-element、Foo.Bar、svg:rect */
    private String parseTagName() {
        StringBuilder name = new StringBuilder(p.expect(IDENTIFIER, "Expected JSX tag name").getLexeme());
        if (p.check(COLON)) {
            p.advance();
            name.append(':').append(p.expect(IDENTIFIER, "Expected JSX namespaced name").getLexeme());
            return name.toString();
        }
        while (p.match(DOT)) {
            name.append('.').append(p.expect(IDENTIFIER, "Expected JSX member name").getLexeme());
        }
        return name.toString();
    }

    private List<AstNode> parseAttributes() {
        List<AstNode> attributes = new ArrayList<AstNode>();
        while (!p.checkAny(JSX_TAG_END, JSX_SELF_CLOSE)) {
            if (p.isAtEnd()) {
                throw new ParseException("Unterminated JSX element", p.current);
            }
            Token start = p.current;
            if (p.check(LBRACE)) {
                p.advance();
                p.expect(ELLIPSIS, "Expected '...' in JSX spread attribute");
                Expression argument = p.parseAssignment();
                p.expect(RBRACE, "Expected '}' after JSX spread attribute");
                attributes.add(new JsxSpreadAttribute(p.locationFrom(start), argument));
                continue;
            }
            String name = p.expect(IDENTIFIER, "Expected JSX attribute name").getLexeme();
            if (p.match(COLON)) {
                name = name + ":" + p.expect(IDENTIFIER, "Expected JSX namespaced attribute name").getLexeme();
            }
            AstNode value = null;
            if (p.match(ASSIGN)) {
                value = parseAttributeValue();
            }
            attributes.add(new JsxAttribute(p.locationFrom(start), name, value));
        }
        return attributes;
    }

    private AstNode parseAttributeValue() {
        Token start = p.current;
        if (p.check(JSX_ATTR_STRING)) {
            p.advance();
            String raw = (String) start.getLiteral();
            return new Literal(p.locationOf(start), LiteralKind.STRING, HtmlEntities.decode(raw), start.getLexeme());
        }
        if (p.check(LBRACE)) {
            return parseExpressionContainer();
        }
        if (p.check(JSX_OPEN)) {
            return parseElementOrFragment();
        }
        throw new ParseException("Expected JSX attribute value", p.current, "string, '{' or element");
    }

    /**
     * {expr} 或空的 {}（仅含注释时同样为空）
     */
    private JsxExpressionContainer parseExpressionContainer() {
        Token start = p.expect(LBRACE, "Expected '{'");
        Expression expression = null;
        if (!p.check(RBRACE)) {
            expression = p.parseExpression();
        }
        p.expect(RBRACE, "Expected '}' after JSX expression");
        return new JsxExpressionContainer(p.locationFrom(start), expression);
    }

    // ============ 子节点 ============

    private List<Expression> parseChildren() {
        List<Expression> children = new ArrayList<Expression>();
        while (!p.check(JSX_CLOSE_OPEN)) {
            Token start = p.current;
            switch (p.current.getType()) {
                case EOF:
                    throw new ParseException("Unterminated JSX element", p.current);
                case JSX_TEXT: {
                    p.advance();
                    String raw = start.getLexeme();
                    String cleaned = cleanText(raw);
                    if (!cleaned.isEmpty()) {
                        children.add(new JsxText(p.locationOf(start), raw, HtmlEntities.decode(cleaned)));
                    }
                    break;
                }
                case JSX_OPEN:
                    children.add(parseElementOrFragment());
                    break;
                case LBRACE: {
                    if (p.checkAhead(1, ELLIPSIS)) {
                        p.advance();
                        Token spreadStart = p.advance();
                        Expression argument = p.parseAssignment();
                        p.expect(RBRACE, "Expected '}' after JSX spread child");
                        Expression spread = new SpreadElement(p.locationFrom(spreadStart), argument);
                        children.add(new JsxExpressionContainer(p.locationFrom(start), spread));
                        break;
                    }
                    JsxExpressionContainer container = parseExpressionContainer();
                    if (!container.isEmpty()) {
                        children.add(container);
                    }
                    break;
                }
                default:
                    throw new ParseException("Unexpected token in JSX children", p.current);
            }
        }
        return children;
    }

    /**
     * 闭合标签 &lt;/name&gt;，名称必须与开始标签一致（片段为 null）
     */
    private void expectClosing(Token open, String tagName) {
        Token closeStart = p.expect(JSX_CLOSE_OPEN, "Expected JSX closing tag");
        String closingName = p.check(IDENTIFIER) ? parseTagName() : null;
        boolean matches = tagName == null ? closingName == null : tagName.equals(closingName);
        if (!matches) {
            String expected = tagName == null ? "</>" : "</" + tagName + ">";
            throw new ParseException("Expected corresponding JSX closing tag for <"
                    + (tagName == null ? "" : tagName) + ">", closeStart, expected);
        }
        p.expect(JSX_TAG_END, "Expected '>' after JSX closing tag");
    }

    /**
     * JSX 文本空白规则：逐行去掉首尾空白（首行保留行首、末行保留行尾），
     * 丢弃空行，剩余行以单个空格连接
     */
    static String cleanText(String raw) {
        String[] lines = raw.split("\r\n|\n|\r", -1);
        if (lines.length == 1) {
            return raw;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) {
                line = trimLeading(line);
            }
            if (i < lines.length - 1) {
                line = trimTrailing(line);
            }
            if (line.isEmpty()) continue;
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(line);
        }
        return sb.toString();
    }

    private static boolean isJsxWhitespace(char c) {
        return c == ' ' || c == '\t';
    }

    private static String trimLeading(String s) {
        int i = 0;
        while (i < s.length() && isJsxWhitespace(s.charAt(i))) i++;
        return s.substring(i);
    }

    private static String trimTrailing(String s) {
        int i = s.length();
        while (i > 0 && isJsxWhitespace(s.charAt(i - 1))) i--;
        return s.substring(0, i);
    }
}
