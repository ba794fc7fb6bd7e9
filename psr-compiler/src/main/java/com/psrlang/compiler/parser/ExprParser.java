package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.decl.ClassDecl;
import com.psrlang.compiler.ast.decl.Decorator;
import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.psrlang.compiler.ast.expr.Literal.LiteralKind;
import com.psrlang.compiler.ast.expr.ObjectProperty.PropertyKind;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;
import com.psrlang.compiler.ast.type.TypeReference;
import com.psrlang.compiler.lexer.Token;
import com.psrlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析器（优先级爬升）
 */
class ExprParser {

    /** as / satisfies 与关系运算符同级 */
    private static final int ASSERTION_PRECEDENCE = 7;

    private final Parser p;

    /** for 语句初始化部分不允许 in 运算符 */
    boolean noIn;

    ExprParser(Parser parser) {
        this.p = parser;
    }

    // ============ 入口 ============

    /**
     * 逗号表达式
     */
    Expression parseExpression() {
        Token start = p.current;
        Expression first = parseAssignment();
        if (!p.check(COMMA)) {
            return first;
        }
        List<Expression> expressions = new ArrayList<Expression>();
        expressions.add(first);
        while (p.match(COMMA)) {
            expressions.add(parseAssignment());
        }
        return new SequenceExpr(p.locationFrom(start), expressions);
    }

    /**
     * 赋值表达式（右结合），同时负责识别箭头函数与 yield
     */
    Expression parseAssignment() {
        p.enterNesting();
        try {
            return parseAssignmentInner();
        } finally {
            p.exitNesting();
        }
    }

    private Expression parseAssignmentInner() {
        Token start = p.current;
        if (isArrowStart()) {
            return parseArrowFunction();
        }
        if (p.check(KW_YIELD)) {
            return parseYield();
        }
        Expression left = parseConditional();
        if (p.current.getType().isAssignmentOp()) {
            String operator = p.advance().getLexeme();
            Expression value = parseAssignment();
            return new AssignExpr(p.locationFrom(start), operator, left, value);
        }
        return left;
    }

    private Expression parseYield() {
        Token start = p.advance();
        boolean delegate = p.match(STAR);
        Expression argument = null;
        if (!p.current.isNewlineBefore() && !p.checkAny(RPAREN, RBRACKET, RBRACE, COMMA, SEMICOLON, COLON, EOF)) {
            argument = parseAssignment();
        }
        return new YieldExpr(p.locationFrom(start), argument, delegate);
    }

    private Expression parseConditional() {
        Token start = p.current;
        Expression condition = parseBinary(1);
        if (!p.check(QUESTION)) {
            return condition;
        }
        p.advance();
        boolean savedNoIn = noIn;
        noIn = false;
        Expression thenExpr = parseAssignment();
        noIn = savedNoIn;
        p.expect(COLON, "Expected ':' in conditional expression");
        Expression elseExpr = parseAssignment();
        return new ConditionalExpr(p.locationFrom(start), condition, thenExpr, elseExpr);
    }

    // ============ 二元运算 ============

    private Expression parseBinary(int minPrecedence) {
        Token start = p.current;
        Expression left = parseUnary();
        while (true) {
            if (p.checkAny(KW_AS, KW_SATISFIES) && !p.current.isNewlineBefore()
                    && ASSERTION_PRECEDENCE >= minPrecedence) {
                String keyword = p.advance().getLexeme();
                TypeNode type;
                if (p.check(KW_CONST)) {
                    Token c = p.advance();
                    type = new TypeReference(p.locationOf(c), "const", "const", Collections.<TypeNode>emptyList());
                } else {
                    type = p.parseType();
                }
                left = new TypeAssertionExpr(p.locationFrom(start), left, keyword, type);
                continue;
            }
            BinaryOp op = binaryOperator(p.current.getType());
            if (op == null || op.getPrecedence() < minPrecedence) {
                break;
            }
            p.advance();
            int nextMin = op.isRightAssociative() ? op.getPrecedence() : op.getPrecedence() + 1;
            Expression right = parseBinary(nextMin);
            left = new BinaryExpr(p.locationFrom(start), left, op, right);
        }
        return left;
    }

    private BinaryOp binaryOperator(TokenType type) {
        switch (type) {
            case NULLISH: return BinaryOp.NULLISH;
            case OR: return BinaryOp.OR;
            case AND: return BinaryOp.AND;
            case PIPE: return BinaryOp.BIT_OR;
            case CARET: return BinaryOp.BIT_XOR;
            case AMP: return BinaryOp.BIT_AND;
            case EQ: return BinaryOp.EQ;
            case NE: return BinaryOp.NE;
            case EQ_STRICT: return BinaryOp.EQ_STRICT;
            case NE_STRICT: return BinaryOp.NE_STRICT;
            case LT: return BinaryOp.LT;
            case GT: return BinaryOp.GT;
            case LE: return BinaryOp.LE;
            case GE: return BinaryOp.GE;
            case KW_INSTANCEOF: return BinaryOp.INSTANCEOF;
            case KW_IN: return noIn ? null : BinaryOp.IN;
            case SHL: return BinaryOp.SHL;
            case SHR: return BinaryOp.SHR;
            case USHR: return BinaryOp.USHR;
            case PLUS: return BinaryOp.ADD;
            case MINUS: return BinaryOp.SUB;
            case STAR: return BinaryOp.MUL;
            case SLASH: return BinaryOp.DIV;
            case PERCENT: return BinaryOp.MOD;
            case STAR_STAR: return BinaryOp.EXP;
            default: return null;
        }
    }

    // ============ 一元与后缀 ============

    private Expression parseUnary() {
        p.enterNesting();
        try {
            return parseUnaryInner();
        } finally {
            p.exitNesting();
        }
    }

    private Expression parseUnaryInner() {
        Token start = p.current;
        switch (p.current.getType()) {
            case NOT:
            case MINUS:
            case PLUS:
            case TILDE:
            case KW_TYPEOF:
            case KW_VOID:
            case KW_DELETE: {
                String operator = p.advance().getLexeme();
                Expression operand = parseUnary();
                return new UnaryExpr(p.locationFrom(start), operator, operand);
            }
            case INC:
            case DEC: {
                String operator = p.advance().getLexeme();
                Expression operand = parseUnary();
                return new UpdateExpr(p.locationFrom(start), operator, true, operand);
            }
            case KW_AWAIT:
                if (!p.checkAhead(1, ARROW)) {
                    p.advance();
                    Expression argument = parseUnary();
                    return new AwaitExpr(p.locationFrom(start), argument);
                }
                break;
            default:
                break;
        }
        Expression expr = parseLeftHandSide();
        if (p.checkAny(INC, DEC) && !p.current.isNewlineBefore()) {
            String operator = p.advance().getLexeme();
            return new UpdateExpr(p.locationFrom(start), operator, false, expr);
        }
        return expr;
    }

    /**
     * 调用、成员访问、下标、非空断言和带标签模板组成的后缀链
     */
    private Expression parseLeftHandSide() {
        Token start = p.current;
        Expression expr = p.check(KW_NEW) ? parseNew() : parsePrimary();
        while (true) {
            if (p.match(DOT)) {
                String name = p.expectPropertyName();
                expr = new MemberExpr(p.locationFrom(start), expr, name, false);
            } else if (p.match(QUESTION_DOT)) {
                if (p.check(LPAREN)) {
                    List<Expression> args = parseArguments();
                    expr = new CallExpr(p.locationFrom(start), expr, Collections.<TypeNode>emptyList(), args, true);
                } else if (p.match(LBRACKET)) {
                    Expression index = parseExpression();
                    p.expect(RBRACKET, "Expected ']'");
                    expr = new IndexExpr(p.locationFrom(start), expr, index, true);
                } else if (p.check(GENERIC_OPEN)) {
                    List<TypeNode> typeArgs = p.typeParser.parseTypeArgs();
                    List<Expression> args = parseArguments();
                    expr = new CallExpr(p.locationFrom(start), expr, typeArgs, args, true);
                } else {
                    String name = p.expectPropertyName();
                    expr = new MemberExpr(p.locationFrom(start), expr, name, true);
                }
            } else if (p.match(LBRACKET)) {
                Expression index = parseExpression();
                p.expect(RBRACKET, "Expected ']'");
                expr = new IndexExpr(p.locationFrom(start), expr, index, false);
            } else if (p.check(LPAREN)) {
                List<Expression> args = parseArguments();
                expr = new CallExpr(p.locationFrom(start), expr, Collections.<TypeNode>emptyList(), args, false);
            } else if (p.check(GENERIC_OPEN)) {
                List<TypeNode> typeArgs = p.typeParser.parseTypeArgs();
                if (p.check(LPAREN)) {
                    List<Expression> args = parseArguments();
                    expr = new CallExpr(p.locationFrom(start), expr, typeArgs, args, false);
                } else if (p.checkAny(TEMPLATE_STRING, TEMPLATE_HEAD)) {
                    TemplateLiteral quasi = parseTemplate();
                    expr = new TaggedTemplateExpr(p.locationFrom(start), expr, typeArgs, quasi);
                }
                // 其余情况是实例化表达式 f<T>，类型实参在输出中擦除
            } else if (p.check(NOT) && !p.current.isNewlineBefore()) {
                p.advance();
                expr = new NonNullExpr(p.locationFrom(start), expr);
            } else if (p.checkAny(TEMPLATE_STRING, TEMPLATE_HEAD)) {
                TemplateLiteral quasi = parseTemplate();
                expr = new TaggedTemplateExpr(p.locationFrom(start), expr, Collections.<TypeNode>emptyList(), quasi);
            } else {
                break;
            }
        }
        return expr;
    }

    private Expression parseNew() {
        Token start = p.advance();
        if (p.match(DOT)) {
            String property = p.expectPropertyName();
            return new MetaProperty(p.locationFrom(start), "new", property);
        }
        Expression callee = p.check(KW_NEW) ? parseNew() : parsePrimary();
        while (true) {
            if (p.match(DOT)) {
                String name = p.expectPropertyName();
                callee = new MemberExpr(p.locationFrom(start), callee, name, false);
            } else if (p.match(LBRACKET)) {
                Expression index = parseExpression();
                p.expect(RBRACKET, "Expected ']'");
                callee = new IndexExpr(p.locationFrom(start), callee, index, false);
            } else {
                break;
            }
        }
        List<TypeNode> typeArgs = Collections.emptyList();
        if (p.check(GENERIC_OPEN)) {
            typeArgs = p.typeParser.parseTypeArgs();
        }
        List<Expression> args = null;
        if (p.check(LPAREN)) {
            args = parseArguments();
        }
        return new NewExpr(p.locationFrom(start), callee, typeArgs, args);
    }

    List<Expression> parseArguments() {
        p.expect(LPAREN, "Expected '('");
        List<Expression> args = new ArrayList<Expression>();
        boolean savedNoIn = noIn;
        noIn = false;
        while (!p.check(RPAREN) && !p.isAtEnd()) {
            args.add(parseSpreadOrAssignment());
            if (!p.match(COMMA)) break;
        }
        noIn = savedNoIn;
        p.expect(RPAREN, "Expected ')' after arguments");
        return args;
    }

    private Expression parseSpreadOrAssignment() {
        if (p.check(ELLIPSIS)) {
            Token start = p.advance();
            Expression argument = parseAssignment();
            return new SpreadElement(p.locationFrom(start), argument);
        }
        return parseAssignment();
    }

    // ============ 基本表达式 ============

    private Expression parsePrimary() {
        Token start = p.current;
        switch (p.current.getType()) {
            case NUMBER_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.NUMBER, start.getLiteral(), start.getLexeme());
            case BIGINT_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.BIGINT, start.getLiteral(), start.getLexeme());
            case STRING_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.STRING, start.getLiteral(), start.getLexeme());
            case REGEX_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.REGEX, start.getLiteral(), start.getLexeme());
            case KW_TRUE:
            case KW_FALSE:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.BOOLEAN,
                        Boolean.valueOf(start.is(KW_TRUE)), start.getLexeme());
            case KW_NULL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.NULL, null, "null");
            case KW_THIS:
                p.advance();
                return new ThisExpr(p.locationOf(start));
            case KW_SUPER:
                p.advance();
                return new SuperExpr(p.locationOf(start));
            case TEMPLATE_STRING:
            case TEMPLATE_HEAD:
                return parseTemplate();
            case LPAREN: {
                p.advance();
                boolean savedNoIn = noIn;
                noIn = false;
                Expression inner = parseExpression();
                noIn = savedNoIn;
                p.expect(RPAREN, "Expected ')'");
                return new ParenExpr(p.locationFrom(start), inner);
            }
            case LBRACKET:
                return parseArrayLiteral();
            case LBRACE:
                return parseObjectLiteral();
            case KW_FUNCTION:
                return parseFunctionExpression(start, false);
            case KW_ASYNC:
                if (p.checkAhead(1, KW_FUNCTION) && !p.peek(1).isNewlineBefore()) {
                    p.advance();
                    return parseFunctionExpression(start, true);
                }
                break;
            case KW_CLASS: {
                ClassDecl decl = p.declParser.parseClass(start, Collections.<Modifier>emptyList(),
                        Collections.<Decorator>emptyList(), true);
                return new ClassExpr(p.locationFrom(start), decl);
            }
            case AT: {
                List<Decorator> decorators = p.declParser.parseDecorators();
                if (!p.check(KW_CLASS)) {
                    throw new ParseException("Decorators are only valid before a class", p.current, "class");
                }
                ClassDecl decl = p.declParser.parseClass(start, Collections.<Modifier>emptyList(), decorators, true);
                return new ClassExpr(p.locationFrom(start), decl);
            }
            case JSX_OPEN:
                return p.jsxParser.parseElementOrFragment();
            case KW_IMPORT:
                p.advance();
                if (p.match(DOT)) {
                    String property = p.expectPropertyName();
                    return new MetaProperty(p.locationFrom(start), "import", property);
                }
                if (!p.check(LPAREN)) {
                    throw new ParseException("Unexpected 'import'", start, "import(...) or import.meta");
                }
                return new Identifier(p.locationOf(start), "import");
            default:
                break;
        }
        if (p.isIdentifierToken()) {
            p.advance();
            return new Identifier(p.locationOf(start), start.getLexeme());
        }
        if (p.check(ERROR)) {
            throw new ParseException("Invalid token: " + p.current.getLiteral(), p.current);
        }
        throw new ParseException("Unexpected token", p.current, "expression");
    }

    /**
     * 模板字符串：原样片段取自词素，转义后片段取自 token 字面值
     */
    private TemplateLiteral parseTemplate() {
        Token start = p.current;
        List<String> raws = new ArrayList<String>();
        List<String> cooked = new ArrayList<String>();
        List<Expression> expressions = new ArrayList<Expression>();
        if (p.check(TEMPLATE_STRING)) {
            Token t = p.advance();
            raws.add(t.getLexeme().substring(1, t.getLexeme().length() - 1));
            cooked.add((String) t.getLiteral());
            return new TemplateLiteral(p.locationOf(start), raws, cooked, expressions);
        }
        Token head = p.expect(TEMPLATE_HEAD, "Expected template literal");
        raws.add(head.getLexeme().substring(1, head.getLexeme().length() - 2));
        cooked.add((String) head.getLiteral());
        while (true) {
            boolean savedNoIn = noIn;
            noIn = false;
            expressions.add(parseExpression());
            noIn = savedNoIn;
            if (p.check(TEMPLATE_MIDDLE)) {
                Token middle = p.advance();
                raws.add(middle.getLexeme().substring(1, middle.getLexeme().length() - 2));
                cooked.add((String) middle.getLiteral());
                continue;
            }
            Token tail = p.expect(TEMPLATE_TAIL, "Unterminated template literal");
            raws.add(tail.getLexeme().substring(1, tail.getLexeme().length() - 1));
            cooked.add((String) tail.getLiteral());
            break;
        }
        return new TemplateLiteral(p.locationFrom(start), raws, cooked, expressions);
    }

    private Expression parseArrayLiteral() {
        Token start = p.advance();
        List<Expression> elements = new ArrayList<Expression>();
        boolean savedNoIn = noIn;
        noIn = false;
        while (!p.check(RBRACKET) && !p.isAtEnd()) {
            if (p.match(COMMA)) {
                elements.add(null);
                continue;
            }
            elements.add(parseSpreadOrAssignment());
            if (!p.check(RBRACKET)) {
                p.expect(COMMA, "Expected ',' in array literal");
            }
        }
        noIn = savedNoIn;
        p.expect(RBRACKET, "Expected ']' after array literal");
        return new ArrayLiteral(p.locationFrom(start), elements);
    }

    private Expression parseObjectLiteral() {
        Token start = p.advance();
        List<ObjectProperty> properties = new ArrayList<ObjectProperty>();
        boolean savedNoIn = noIn;
        noIn = false;
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            properties.add(parseObjectProperty());
            if (!p.check(RBRACE)) {
                p.expect(COMMA, "Expected ',' in object literal");
            }
        }
        noIn = savedNoIn;
        p.expect(RBRACE, "Expected '}' after object literal");
        return new ObjectLiteral(p.locationFrom(start), properties);
    }

    private ObjectProperty parseObjectProperty() {
        Token start = p.current;
        if (p.match(ELLIPSIS)) {
            Expression argument = parseAssignment();
            return new ObjectProperty(p.locationFrom(start), PropertyKind.SPREAD, null, false, false, argument);
        }
        PropertyKind kind = PropertyKind.INIT;
        boolean async = false;
        boolean generator = false;
        if (p.checkAny(KW_GET, KW_SET) && isPropertyKeyStart(p.peek(1))) {
            kind = p.advance().is(KW_GET) ? PropertyKind.GET : PropertyKind.SET;
        } else if (p.check(KW_ASYNC) && !p.peek(1).isNewlineBefore()
                && (isPropertyKeyStart(p.peek(1)) || p.checkAhead(1, STAR))) {
            p.advance();
            async = true;
        }
        if (p.match(STAR)) {
            generator = true;
        }
        boolean computed = p.check(LBRACKET);
        Expression key = parsePropertyKey();

        if (kind != PropertyKind.INIT || async || generator || p.check(LPAREN) || p.check(GENERIC_OPEN)) {
            FunctionExpr function = p.declParser.parseFunctionRest(start, null, async, generator, false);
            PropertyKind methodKind = kind == PropertyKind.INIT ? PropertyKind.METHOD : kind;
            return new ObjectProperty(p.locationFrom(start), methodKind, key, computed, false, function);
        }
        if (p.match(COLON)) {
            Expression value = parseAssignment();
            return new ObjectProperty(p.locationFrom(start), PropertyKind.INIT, key, computed, false, value);
        }
        if (computed || !(key instanceof Identifier)) {
            throw new ParseException("Expected ':' after property key", p.current, "COLON");
        }
        Expression value = key;
        if (p.check(ASSIGN)) {
            // 解构默认值 { a = 1 }
            p.advance();
            Expression defaultValue = parseAssignment();
            value = new AssignExpr(p.locationFrom(start), "=", key, defaultValue);
        }
        return new ObjectProperty(p.locationFrom(start), PropertyKind.INIT, key, false, true, value);
    }

    static boolean isPropertyKeyStart(Token token) {
        TokenType t = token.getType();
        return t == IDENTIFIER || t == PRIVATE_NAME || t == STRING_LITERAL || t == NUMBER_LITERAL
                || t == BIGINT_LITERAL || t == LBRACKET || t.isKeyword();
    }

    /**
     * 属性键：标识符、关键词、字符串、数字、#私有名或计算键 [expr]
     */
    Expression parsePropertyKey() {
        Token start = p.current;
        switch (p.current.getType()) {
            case LBRACKET: {
                p.advance();
                Expression key = parseAssignment();
                p.expect(RBRACKET, "Expected ']' after computed key");
                return key;
            }
            case STRING_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.STRING, start.getLiteral(), start.getLexeme());
            case NUMBER_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.NUMBER, start.getLiteral(), start.getLexeme());
            case BIGINT_LITERAL:
                p.advance();
                return new Literal(p.locationOf(start), LiteralKind.BIGINT, start.getLiteral(), start.getLexeme());
            default:
                String name = p.expectPropertyName();
                return new Identifier(p.locationOf(start), name);
        }
    }

    private Expression parseFunctionExpression(Token start, boolean async) {
        p.expect(KW_FUNCTION, "Expected 'function'");
        boolean generator = p.match(STAR);
        String name = null;
        if (p.isIdentifierToken()) {
            name = p.advance().getLexeme();
        }
        return p.declParser.parseFunctionRest(start, name, async, generator, false);
    }

    /**
     * 绑定模式：标识符、数组解构或对象解构（复用字面量节点）
     */
    Expression parseBindingPattern() {
        Token start = p.current;
        if (p.check(LBRACKET)) {
            return parseArrayLiteral();
        }
        if (p.check(LBRACE)) {
            return parseObjectLiteral();
        }
        if (p.check(KW_THIS)) {
            p.advance();
            return new Identifier(p.locationOf(start), "this");
        }
        String name = p.expectIdentifier("Expected binding name");
        return new Identifier(p.locationOf(start), name);
    }

    // ============ 箭头函数 ============

    /**
     * 当前位置是否开始一个箭头函数
     */
    private boolean isArrowStart() {
        if (p.isIdentifierToken() && p.checkAhead(1, ARROW)) {
            return true;
        }
        int offset = 0;
        if (p.check(KW_ASYNC) && !p.peek(1).isNewlineBefore()) {
            if (p.peek(1).getType().isIdentifierLike() && p.checkAhead(2, ARROW)) {
                return true;
            }
            if (!p.checkAhead(1, LPAREN) && !p.checkAhead(1, GENERIC_OPEN)) {
                return false;
            }
            offset = 1;
        }
        if (p.peek(offset).is(GENERIC_OPEN)) {
            return true;
        }
        if (!p.peek(offset).is(LPAREN)) {
            return false;
        }
        int close = p.matchingCloseOffset(offset);
        if (close < 0) {
            return false;
        }
        Token after = p.peek(close + 1);
        if (after.is(ARROW)) {
            return true;
        }
        if (after.is(COLON)) {
            // (a): T => ... 与条件表达式 c ? (a) : b 需要试探解析
            int mark = p.mark();
            try {
                if (offset > 0) p.advance();
                p.declParser.parseParams();
                p.advance();
                p.typeParser.parseReturnType();
                return p.check(ARROW);
            } catch (ParseException e) {
                return false;
            } finally {
                p.reset(mark);
            }
        }
        return false;
    }

    private Expression parseArrowFunction() {
        Token start = p.current;
        if (p.isIdentifierToken() && p.checkAhead(1, ARROW)) {
            return finishArrow(start, null, Collections.singletonList(simpleParameter()), null, false);
        }
        boolean async = false;
        if (p.check(KW_ASYNC)) {
            p.advance();
            async = true;
            if (p.isIdentifierToken() && p.checkAhead(1, ARROW)) {
                return finishArrow(start, null, Collections.singletonList(simpleParameter()), null, true);
            }
        }
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        List<Parameter> params = p.declParser.parseParams();
        TypeNode returnType = null;
        if (p.match(COLON)) {
            returnType = p.typeParser.parseReturnType();
        }
        return finishArrow(start, typeParams, params, returnType, async);
    }

    private Parameter simpleParameter() {
        Token name = p.advance();
        Identifier id = new Identifier(p.locationOf(name), name.getLexeme());
        return new Parameter(p.locationOf(name), id, null, false, null, false,
                Collections.<Modifier>emptyList(), Collections.<Decorator>emptyList());
    }

    private Expression finishArrow(Token start, TypeParams typeParams, List<Parameter> params,
                                   TypeNode returnType, boolean async) {
        p.expect(ARROW, "Expected '=>'");
        AstNode body;
        if (p.check(LBRACE)) {
            body = p.parseBlock();
        } else {
            boolean savedNoIn = noIn;
            noIn = false;
            body = parseAssignment();
            noIn = savedNoIn;
        }
        return new ArrowFunction(p.locationFrom(start), typeParams, params, returnType, body, async);
    }
}
