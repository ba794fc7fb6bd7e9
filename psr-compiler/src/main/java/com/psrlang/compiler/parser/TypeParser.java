package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.type.*;
import com.psrlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * 类型解析器
 *
 * <p>类型不参与检查，只需要正确地确定其边界并保留文本；
 * 常见形态构造为具体节点，映射类型等复杂形态保存为 {@link RawTypeNode}。</p>
 */
class TypeParser {

    private final Parser p;

    TypeParser(Parser parser) {
        this.p = parser;
    }

    // ============ 类型 ============

    /**
     * 解析完整类型（含条件类型）
     */
    TypeNode parseType() {
        p.enterNesting();
        try {
            return parseTypeInner();
        } finally {
            p.exitNesting();
        }
    }

    private TypeNode parseTypeInner() {
        Token start = p.current;
        if (isFunctionTypeStart()) {
            return parseFunctionType();
        }
        TypeNode checkType = parseUnion();
        if (p.check(KW_EXTENDS) && !p.current.isNewlineBefore()) {
            p.advance();
            TypeNode extendsType = parseUnion();
            p.expect(QUESTION, "Expected '?' in conditional type");
            TypeNode trueType = parseType();
            p.expect(COLON, "Expected ':' in conditional type");
            TypeNode falseType = parseType();
            return new ConditionalTypeNode(p.locationFrom(start), p.textFrom(start),
                    checkType, extendsType, trueType, falseType);
        }
        return checkType;
    }

    /**
     * 返回类型位置：额外支持类型谓词 {@code x is T} 与 {@code asserts x [is T]}
     */
    TypeNode parseReturnType() {
        Token start = p.current;
        boolean asserts = false;
        if (p.checkWord("asserts") && (p.peek(1).getType().isIdentifierLike() || p.checkAhead(1, KW_THIS))
                && !p.peek(1).isNewlineBefore()) {
            p.advance();
            asserts = true;
        }
        if ((p.isIdentifierToken() || p.check(KW_THIS))
                && (asserts || isWord(p.peek(1), "is"))) {
            String name = p.advance().getLexeme();
            TypeNode type = null;
            if (p.checkWord("is") && !p.current.isNewlineBefore()) {
                p.advance();
                type = parseType();
            }
            return new TypePredicateNode(p.locationFrom(start), p.textFrom(start), name, type, asserts);
        }
        return parseType();
    }

    private static boolean isWord(Token token, String word) {
        return token.is(IDENTIFIER) && word.equals(token.getLexeme()) && !token.isNewlineBefore();
    }

    private TypeNode parseUnion() {
        Token start = p.current;
        p.match(PIPE);
        TypeNode first = parseIntersection();
        if (!p.check(PIPE)) {
            return first;
        }
        List<TypeNode> types = new ArrayList<TypeNode>();
        types.add(first);
        while (p.match(PIPE)) {
            types.add(parseIntersection());
        }
        return new UnionType(p.locationFrom(start), p.textFrom(start), types);
    }

    private TypeNode parseIntersection() {
        Token start = p.current;
        p.match(AMP);
        TypeNode first = parseTypeOperator();
        if (!p.check(AMP)) {
            return first;
        }
        List<TypeNode> types = new ArrayList<TypeNode>();
        types.add(first);
        while (p.match(AMP)) {
            types.add(parseTypeOperator());
        }
        return new IntersectionType(p.locationFrom(start), p.textFrom(start), types);
    }

    private TypeNode parseTypeOperator() {
        Token start = p.current;
        if (p.check(KW_KEYOF) || p.check(KW_READONLY) || p.checkWord("unique")) {
            String operator = p.advance().getLexeme();
            TypeNode operand = parseTypeOperator();
            return new TypeOperatorNode(p.locationFrom(start), p.textFrom(start), operator, operand);
        }
        if (p.checkWord("infer")) {
            p.advance();
            p.expectIdentifier("Expected type name after 'infer'");
            if (p.check(KW_EXTENDS) && !p.checkAhead(1, QUESTION)) {
                int mark = p.mark();
                p.advance();
                parseTypeOperator();
                if (p.check(QUESTION)) {
                    // infer U extends X ? ... 中的 extends 属于外层条件类型
                    p.reset(mark);
                }
            }
            return new RawTypeNode(p.locationFrom(start), p.textFrom(start));
        }
        return parsePostfix();
    }

    private TypeNode parsePostfix() {
        Token start = p.current;
        TypeNode type = parsePrimary();
        while (p.check(LBRACKET) && !p.current.isNewlineBefore()) {
            p.advance();
            if (p.match(RBRACKET)) {
                type = new ArrayType(p.locationFrom(start), p.textFrom(start), type);
            } else {
                TypeNode index = parseType();
                p.expect(RBRACKET, "Expected ']' in indexed access type");
                type = new IndexedAccessType(p.locationFrom(start), p.textFrom(start), type, index);
            }
        }
        return type;
    }

    private TypeNode parsePrimary() {
        Token start = p.current;
        switch (p.current.getType()) {
            case STRING_LITERAL:
            case NUMBER_LITERAL:
            case BIGINT_LITERAL:
            case KW_TRUE:
            case KW_FALSE:
            case TEMPLATE_STRING:
                p.advance();
                return new LiteralTypeNode(p.locationOf(start), p.textFrom(start));
            case MINUS:
                p.advance();
                if (!p.checkAny(NUMBER_LITERAL, BIGINT_LITERAL)) {
                    throw new ParseException("Expected number after '-' in type", p.current, "NUMBER_LITERAL");
                }
                p.advance();
                return new LiteralTypeNode(p.locationFrom(start), p.textFrom(start));
            case TEMPLATE_HEAD:
                return parseTemplateLiteralType();
            case KW_VOID:
            case KW_NULL:
            case KW_THIS:
                p.advance();
                return new TypeReference(p.locationOf(start), start.getLexeme(), start.getLexeme(),
                        Collections.<TypeNode>emptyList());
            case KW_TYPEOF:
                return parseTypeQuery();
            case KW_IMPORT:
                return parseImportType();
            case LBRACE:
                return parseObjectOrMappedType();
            case LBRACKET:
                return parseTuple();
            case LPAREN: {
                p.advance();
                TypeNode inner = parseType();
                p.expect(RPAREN, "Expected ')' after parenthesized type");
                return new ParenthesizedType(p.locationFrom(start), p.textFrom(start), inner);
            }
            default:
                break;
        }
        if (p.isIdentifierToken() || p.current.getType().isKeyword()) {
            return parseTypeReference();
        }
        throw new ParseException("Expected type", p.current, "type");
    }

    private TypeNode parseTypeReference() {
        Token start = p.current;
        StringBuilder name = new StringBuilder(p.advance().getLexeme());
        while (p.check(DOT) && !p.checkAhead(1, DOT)) {
            p.advance();
            name.append('.').append(p.expectPropertyName());
        }
        List<TypeNode> typeArgs = Collections.emptyList();
        if (p.check(GENERIC_OPEN)) {
            typeArgs = parseTypeArgs();
        }
        return new TypeReference(p.locationFrom(start), p.textFrom(start), name.toString(), typeArgs);
    }

    /** typeof x.y 或 typeof import('x') */
    private TypeNode parseTypeQuery() {
        Token start = p.current;
        p.advance();
        if (p.check(KW_IMPORT)) {
            parseImportType();
        } else {
            p.expectPropertyName();
            while (p.match(DOT)) {
                p.expectPropertyName();
            }
            if (p.check(GENERIC_OPEN)) {
                parseTypeArgs();
            }
        }
        return new RawTypeNode(p.locationFrom(start), p.textFrom(start));
    }

    /** import('module').Name<Args> */
    private TypeNode parseImportType() {
        Token start = p.current;
        p.advance();
        p.expect(LPAREN, "Expected '(' after 'import' in type");
        p.expect(STRING_LITERAL, "Expected module path");
        p.expect(RPAREN, "Expected ')'");
        while (p.match(DOT)) {
            p.expectPropertyName();
        }
        if (p.check(GENERIC_OPEN)) {
            parseTypeArgs();
        }
        return new RawTypeNode(p.locationFrom(start), p.textFrom(start));
    }

    private TypeNode parseTemplateLiteralType() {
        Token start = p.current;
        p.advance();
        while (true) {
            parseType();
            if (p.match(TEMPLATE_TAIL)) break;
            p.expect(TEMPLATE_MIDDLE, "Expected template continuation in type");
        }
        return new RawTypeNode(p.locationFrom(start), p.textFrom(start));
    }

    /**
     * 对象类型字面量或映射类型；成员不逐一建模
     */
    TypeNode parseObjectOrMappedType() {
        Token start = p.current;
        boolean mapped = isMappedTypeStart();
        p.skipBalanced();
        if (mapped) {
            return new RawTypeNode(p.locationFrom(start), p.textFrom(start));
        }
        return new ObjectTypeNode(p.locationFrom(start), p.textFrom(start));
    }

    /** 接口体 */
    ObjectTypeNode parseObjectType() {
        Token start = p.current;
        if (!p.check(LBRACE)) {
            throw new ParseException("Expected '{'", p.current, "LBRACE");
        }
        p.skipBalanced();
        return new ObjectTypeNode(p.locationFrom(start), p.textFrom(start));
    }

    private boolean isMappedTypeStart() {
        int i = 1;
        Token t = p.peek(i);
        if (t.isOneOf(PLUS, MINUS)) {
            t = p.peek(++i);
        }
        if (t.is(KW_READONLY)) {
            t = p.peek(++i);
        }
        return t.is(LBRACKET) && p.peek(i + 1).getType().isIdentifierLike() && p.peek(i + 2).is(KW_IN);
    }

    private TypeNode parseTuple() {
        Token start = p.current;
        p.advance();
        List<TypeNode> elements = new ArrayList<TypeNode>();
        while (!p.check(RBRACKET) && !p.isAtEnd()) {
            p.match(ELLIPSIS);
            // 具名元素：[name: T] / [name?: T]
            if (p.isIdentifierToken()
                    && (p.checkAhead(1, COLON) || (p.checkAhead(1, QUESTION) && p.checkAhead(2, COLON)))) {
                p.advance();
                p.match(QUESTION);
                p.advance();
            }
            elements.add(parseType());
            p.match(QUESTION);
            if (!p.match(COMMA)) break;
        }
        p.expect(RBRACKET, "Expected ']' after tuple type");
        return new TupleType(p.locationFrom(start), p.textFrom(start), elements);
    }

    // ============ 函数类型 ============

    private boolean isFunctionTypeStart() {
        if (p.check(KW_NEW) || (p.check(KW_ABSTRACT) && p.checkAhead(1, KW_NEW))) {
            return true;
        }
        if (p.check(GENERIC_OPEN)) {
            return true;
        }
        if (!p.check(LPAREN)) {
            return false;
        }
        int close = p.matchingCloseOffset();
        return close > 0 && p.peek(close + 1).is(ARROW);
    }

    /**
     * (a: A, b?: B) => R、new (...) => R、&lt;T&gt;(x: T) => T
     */
    private TypeNode parseFunctionType() {
        Token start = p.current;
        p.match(KW_ABSTRACT);
        p.match(KW_NEW);
        if (p.check(GENERIC_OPEN)) {
            parseTypeParams();
        }
        if (!p.check(LPAREN)) {
            throw new ParseException("Expected '(' in function type", p.current, "LPAREN");
        }
        p.skipBalanced();
        p.expect(ARROW, "Expected '=>' in function type");
        TypeNode returnType = parseReturnType();
        return new FunctionTypeNode(p.locationFrom(start), p.textFrom(start), returnType);
    }

    // ============ 类型参数与实参 ============

    /**
     * 类型实参：&lt;A, B&gt;
     */
    List<TypeNode> parseTypeArgs() {
        p.expect(GENERIC_OPEN, "Expected '<'");
        List<TypeNode> args = new ArrayList<TypeNode>();
        while (!p.check(GENERIC_CLOSE) && !p.isAtEnd()) {
            args.add(parseType());
            if (!p.match(COMMA)) break;
        }
        p.expect(GENERIC_CLOSE, "Expected '>' after type arguments");
        return args;
    }

    /**
     * 类型参数声明：&lt;T, U extends X = Y&gt;
     */
    TypeParams parseTypeParams() {
        Token start = p.current;
        p.expect(GENERIC_OPEN, "Expected '<'");
        List<TypeParameter> params = new ArrayList<TypeParameter>();
        while (!p.check(GENERIC_CLOSE) && !p.isAtEnd()) {
            Token paramStart = p.current;
            // const / in / out 修饰
            while ((p.check(KW_CONST) || p.check(KW_IN) || p.checkWord("out"))
                    && p.peek(1).getType().isIdentifierLike()) {
                p.advance();
            }
            String name = p.expectIdentifier("Expected type parameter name");
            TypeNode constraint = null;
            TypeNode defaultType = null;
            if (p.match(KW_EXTENDS)) {
                constraint = parseType();
            }
            if (p.match(ASSIGN)) {
                defaultType = parseType();
            }
            params.add(new TypeParameter(p.locationFrom(paramStart), name, constraint, defaultType));
            if (!p.match(COMMA)) break;
        }
        p.expect(GENERIC_CLOSE, "Expected '>' after type parameters");
        return new TypeParams(p.locationFrom(start), params, p.textFrom(start));
    }
}
