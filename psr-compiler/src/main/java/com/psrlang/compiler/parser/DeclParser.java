package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.MethodKind;
import com.psrlang.compiler.ast.Modifier;
import com.psrlang.compiler.ast.decl.*;
import com.psrlang.compiler.ast.decl.ExportDecl.ExportKind;
import com.psrlang.compiler.ast.expr.CallExpr;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.FunctionExpr;
import com.psrlang.compiler.ast.expr.Identifier;
import com.psrlang.compiler.ast.expr.MemberExpr;
import com.psrlang.compiler.ast.expr.ParenExpr;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.ast.type.ObjectTypeNode;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;
import com.psrlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * 声明解析器：导入导出、变量、函数、组件、类、接口、类型别名、枚举和命名空间
 */
class DeclParser {

    private final Parser p;

    DeclParser(Parser parser) {
        this.p = parser;
    }

    // ============ 声明识别 ============

    /**
     * 当前 token 是否开始一个声明
     */
    boolean isDeclarationStart() {
        Token next = p.peek(1);
        boolean sameLine = !next.isNewlineBefore();
        switch (p.current.getType()) {
            case KW_FUNCTION:
            case KW_CLASS:
            case KW_VAR:
            case KW_CONST:
            case AT:
                return true;
            case KW_LET:
                return next.getType().isIdentifierLike() || next.isOneOf(LBRACKET, LBRACE);
            case KW_ASYNC:
                return next.is(KW_FUNCTION) && sameLine;
            case KW_INTERFACE:
            case KW_ENUM:
            case KW_COMPONENT:
                return next.getType().isIdentifierLike() && sameLine;
            case KW_TYPE:
                return next.getType().isIdentifierLike() && sameLine
                        && p.peek(2).isOneOf(ASSIGN, GENERIC_OPEN, LT);
            case KW_NAMESPACE:
            case KW_MODULE:
                return (next.getType().isIdentifierLike() || next.is(STRING_LITERAL)) && sameLine;
            case KW_DECLARE:
                return sameLine && (next.getType().isKeyword() || isWord(next, "global"));
            case KW_ABSTRACT:
                return next.is(KW_CLASS) && sameLine;
            default:
                return false;
        }
    }

    private static boolean isWord(Token token, String word) {
        return token.is(IDENTIFIER) && word.equals(token.getLexeme());
    }

    /**
     * 解析声明（调用前应通过 {@link #isDeclarationStart()} 判断）
     */
    Statement parseDeclaration() {
        Token start = p.current;
        List<Modifier> modifiers = new ArrayList<Modifier>();
        if (p.check(KW_DECLARE)) {
            p.advance();
            modifiers.add(Modifier.DECLARE);
            if (p.checkWord("global")) {
                return parseNamespace(start, modifiers);
            }
        }
        switch (p.current.getType()) {
            case AT: {
                List<Decorator> decorators = parseDecorators();
                if (p.match(KW_EXPORT)) {
                    // @dec export class X {} 与 export @dec class X {} 等价
                    p.match(KW_DEFAULT);
                }
                if (p.match(KW_ABSTRACT)) {
                    modifiers.add(Modifier.ABSTRACT);
                }
                return parseClass(start, modifiers, decorators, false);
            }
            case KW_VAR:
            case KW_LET:
            case KW_CONST: {
                if (p.check(KW_CONST) && p.checkAhead(1, KW_ENUM)) {
                    p.advance();
                    return parseEnum(start, modifiers, true);
                }
                VariableDecl decl = parseVariableDeclaration(start, modifiers.contains(Modifier.DECLARE));
                p.consumeSemicolon();
                return decl;
            }
            case KW_ASYNC:
                p.advance();
                modifiers.add(Modifier.ASYNC);
                return parseFunctionDeclaration(start, modifiers);
            case KW_FUNCTION:
                return parseFunctionDeclaration(start, modifiers);
            case KW_ABSTRACT:
                p.advance();
                modifiers.add(Modifier.ABSTRACT);
                return parseClass(start, modifiers, Collections.<Decorator>emptyList(), false);
            case KW_CLASS:
                return parseClass(start, modifiers, Collections.<Decorator>emptyList(), false);
            case KW_INTERFACE:
                return parseInterface(start, modifiers);
            case KW_TYPE:
                return parseTypeAlias(start, modifiers);
            case KW_ENUM:
                return parseEnum(start, modifiers, false);
            case KW_NAMESPACE:
            case KW_MODULE:
                return parseNamespace(start, modifiers);
            case KW_COMPONENT:
                return parseComponent(start, modifiers);
            default:
                throw new ParseException("Expected declaration", p.current, "declaration");
        }
    }

    // ============ 导入导出 ============

    Statement parseImport() {
        Token start = p.expect(KW_IMPORT, "Expected 'import'");
        if (p.check(STRING_LITERAL)) {
            String source = (String) p.advance().getLiteral();
            skipImportAttributes();
            p.consumeSemicolon();
            return new ImportDecl(p.locationFrom(start), source, null, null,
                    Collections.<ImportSpecifier>emptyList(), false);
        }

        boolean typeOnly = false;
        if (p.check(KW_TYPE) && (p.checkAhead(1, LBRACE) || p.checkAhead(1, STAR)
                || (p.peek(1).getType().isIdentifierLike() && !p.checkAhead(1, KW_FROM))
                || (p.checkAhead(1, KW_FROM) && p.checkAhead(2, KW_FROM)))) {
            p.advance();
            typeOnly = true;
        }

        String defaultBinding = null;
        String namespaceBinding = null;
        List<ImportSpecifier> specifiers = new ArrayList<ImportSpecifier>();
        boolean needsMore = true;
        if (p.isIdentifierToken()) {
            defaultBinding = p.advance().getLexeme();
            if (p.check(ASSIGN)) {
                throw new ParseException("Import assignments are not supported", p.current);
            }
            needsMore = p.match(COMMA);
        }
        if (needsMore) {
            if (p.match(STAR)) {
                p.expect(KW_AS, "Expected 'as' after '*'");
                namespaceBinding = p.expectIdentifier("Expected namespace name");
            } else if (p.check(LBRACE)) {
                specifiers = parseImportSpecifiers();
            } else {
                throw new ParseException("Expected import clause", p.current, "'{', '*' or identifier");
            }
        }
        if (!p.check(KW_FROM)) {
            throw new ParseException("Missing 'from' in import declaration", p.current, "from");
        }
        p.advance();
        Token source = p.expect(STRING_LITERAL, "Expected module path after 'from'");
        skipImportAttributes();
        p.consumeSemicolon();
        return new ImportDecl(p.locationFrom(start), (String) source.getLiteral(), defaultBinding,
                namespaceBinding, specifiers, typeOnly);
    }

    private List<ImportSpecifier> parseImportSpecifiers() {
        p.expect(LBRACE, "Expected '{'");
        List<ImportSpecifier> specifiers = new ArrayList<ImportSpecifier>();
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            Token start = p.current;
            boolean typeOnly = false;
            if (p.check(KW_TYPE) && !p.peek(1).isOneOf(COMMA, RBRACE, KW_AS)) {
                p.advance();
                typeOnly = true;
            }
            String imported = moduleExportName();
            String local = imported;
            if (p.match(KW_AS)) {
                local = p.expectIdentifier("Expected local name after 'as'");
            }
            specifiers.add(new ImportSpecifier(p.locationFrom(start), imported, local, typeOnly));
            if (!p.match(COMMA)) break;
        }
        p.expect(RBRACE, "Expected '}' after import specifiers");
        return specifiers;
    }

    /** 导入导出名：标识符、关键词或字符串 */
    private String moduleExportName() {
        if (p.check(STRING_LITERAL)) {
            return (String) p.advance().getLiteral();
        }
        return p.expectPropertyName();
    }

    /** import ... with { type: 'json' } */
    private void skipImportAttributes() {
        if ((p.check(KW_WITH) || p.checkWord("assert")) && p.checkAhead(1, LBRACE)
                && !p.current.isNewlineBefore()) {
            p.advance();
            p.skipBalanced();
        }
    }

    Statement parseExport() {
        Token start = p.expect(KW_EXPORT, "Expected 'export'");

        if (p.match(KW_DEFAULT)) {
            if (isDefaultDeclarationStart()) {
                Statement decl = parseDeclaration();
                return new ExportDecl(p.locationFrom(start), ExportKind.DEFAULT_DECLARATION, decl, null,
                        Collections.<ExportSpecifier>emptyList(), null, null, false);
            }
            Expression expr = p.parseAssignment();
            p.consumeSemicolon();
            return new ExportDecl(p.locationFrom(start), ExportKind.DEFAULT_EXPRESSION, null, expr,
                    Collections.<ExportSpecifier>emptyList(), null, null, false);
        }
        if (p.check(ASSIGN)) {
            throw new ParseException("'export =' is not supported", p.current);
        }
        if (p.check(KW_AS) || p.check(KW_IMPORT)) {
            throw new ParseException("Unsupported export form", p.current);
        }

        boolean typeOnly = false;
        if (p.check(KW_TYPE) && (p.checkAhead(1, LBRACE) || p.checkAhead(1, STAR))) {
            p.advance();
            typeOnly = true;
        }

        if (p.match(STAR)) {
            String alias = null;
            if (p.match(KW_AS)) {
                alias = moduleExportName();
            }
            p.expect(KW_FROM, "Expected 'from' after export *");
            Token source = p.expect(STRING_LITERAL, "Expected module path");
            p.consumeSemicolon();
            return new ExportDecl(p.locationFrom(start), ExportKind.ALL, null, null,
                    Collections.<ExportSpecifier>emptyList(), (String) source.getLiteral(), alias, typeOnly);
        }

        if (p.check(LBRACE)) {
            List<ExportSpecifier> specifiers = parseExportSpecifiers();
            String source = null;
            if (p.match(KW_FROM)) {
                source = (String) p.expect(STRING_LITERAL, "Expected module path").getLiteral();
            }
            p.consumeSemicolon();
            return new ExportDecl(p.locationFrom(start), ExportKind.NAMED, null, null, specifiers,
                    source, null, typeOnly);
        }

        if (!isDeclarationStart()) {
            throw new ParseException("Expected declaration after 'export'", p.current, "declaration");
        }
        Statement decl = parseDeclaration();
        return new ExportDecl(p.locationFrom(start), ExportKind.DECLARATION, decl, null,
                Collections.<ExportSpecifier>emptyList(), null, null, false);
    }

    private boolean isDefaultDeclarationStart() {
        Token next = p.peek(1);
        switch (p.current.getType()) {
            case KW_FUNCTION:
            case KW_CLASS:
            case AT:
                return true;
            case KW_ASYNC:
                return next.is(KW_FUNCTION) && !next.isNewlineBefore();
            case KW_ABSTRACT:
                return next.is(KW_CLASS);
            case KW_COMPONENT:
            case KW_INTERFACE:
                return next.getType().isIdentifierLike() && !next.isNewlineBefore();
            default:
                return false;
        }
    }

    private List<ExportSpecifier> parseExportSpecifiers() {
        p.expect(LBRACE, "Expected '{'");
        List<ExportSpecifier> specifiers = new ArrayList<ExportSpecifier>();
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            Token start = p.current;
            boolean typeOnly = false;
            if (p.check(KW_TYPE) && !p.peek(1).isOneOf(COMMA, RBRACE, KW_AS)) {
                p.advance();
                typeOnly = true;
            }
            String local = moduleExportName();
            String exported = local;
            if (p.match(KW_AS)) {
                exported = moduleExportName();
            }
            specifiers.add(new ExportSpecifier(p.locationFrom(start), local, exported, typeOnly));
            if (!p.match(COMMA)) break;
        }
        p.expect(RBRACE, "Expected '}' after export specifiers");
        return specifiers;
    }

    // ============ 变量 ============

    /**
     * var / let / const 声明列表（不消费结尾分号，供 for 语句复用）
     */
    VariableDecl parseVariableDeclaration(Token start, boolean declare) {
        String kind = p.advance().getLexeme();
        List<VariableDeclarator> declarators = new ArrayList<VariableDeclarator>();
        do {
            Token declStart = p.current;
            Expression target = p.exprParser.parseBindingPattern();
            boolean definite = false;
            if (p.check(NOT) && !p.current.isNewlineBefore()) {
                p.advance();
                definite = true;
            }
            TypeNode type = null;
            if (p.match(COLON)) {
                type = p.parseType();
            }
            Expression init = null;
            if (p.match(ASSIGN)) {
                init = p.parseAssignment();
            }
            declarators.add(new VariableDeclarator(p.locationFrom(declStart), target, type, init, definite));
        } while (p.match(COMMA));
        return new VariableDecl(p.locationFrom(start), kind, declarators, declare);
    }

    // ============ 函数与组件 ============

    private FunctionDecl parseFunctionDeclaration(Token start, List<Modifier> modifiers) {
        p.expect(KW_FUNCTION, "Expected 'function'");
        boolean generator = p.match(STAR);
        String name = null;
        if (p.isIdentifierToken()) {
            name = p.advance().getLexeme();
        }
        FunctionExpr fn = parseFunctionRest(start, name, modifiers.contains(Modifier.ASYNC), generator, true);
        return new FunctionDecl(p.locationFrom(start), name, modifiers, fn.getTypeParams(), fn.getParams(),
                fn.getReturnType(), fn.getBody(), fn.isAsync(), fn.isGenerator());
    }

    /**
     * 函数名之后的部分：类型参数、参数列表、返回类型和函数体
     *
     * @param allowMissingBody 重载签名、declare 函数和抽象方法可以没有函数体
     */
    FunctionExpr parseFunctionRest(Token start, String name, boolean async, boolean generator,
                                   boolean allowMissingBody) {
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        List<Parameter> params = parseParams();
        TypeNode returnType = null;
        if (p.match(COLON)) {
            returnType = p.typeParser.parseReturnType();
        }
        Block body = null;
        if (p.check(LBRACE)) {
            body = p.parseBlock();
        } else if (allowMissingBody) {
            p.consumeSemicolon();
        } else {
            throw new ParseException("Expected function body", p.current, "LBRACE");
        }
        return new FunctionExpr(p.locationFrom(start), name, typeParams, params, returnType, body,
                async, generator);
    }

    /**
     * component Name&lt;T&gt;(props): Type { ... }
     */
    private ComponentDecl parseComponent(Token start, List<Modifier> modifiers) {
        p.expect(KW_COMPONENT, "Expected 'component'");
        String name = p.expectIdentifier("Expected component name");
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        List<Parameter> params = parseParams();
        TypeNode returnType = null;
        if (p.match(COLON)) {
            returnType = p.typeParser.parseReturnType();
        }
        if (!p.check(LBRACE)) {
            throw new ParseException("Expected component body", p.current, "LBRACE");
        }
        Block body = p.parseBlock();
        return new ComponentDecl(p.locationFrom(start), name, modifiers, typeParams, params, returnType, body);
    }

    /**
     * 参数列表：( [decorators] [modifiers] [...]pattern[?][: Type][= init], ... )
     */
    List<Parameter> parseParams() {
        p.expect(LPAREN, "Expected '('");
        List<Parameter> params = new ArrayList<Parameter>();
        boolean savedNoIn = p.exprParser.noIn;
        p.exprParser.noIn = false;
        while (!p.check(RPAREN) && !p.isAtEnd()) {
            Token start = p.current;
            List<Decorator> decorators = p.check(AT) ? parseDecorators() : Collections.<Decorator>emptyList();
            List<Modifier> modifiers = new ArrayList<Modifier>();
            while (p.checkAny(KW_PUBLIC, KW_PRIVATE, KW_PROTECTED, KW_READONLY, KW_OVERRIDE)
                    && isParameterNameStart(p.peek(1))) {
                modifiers.add(memberModifier(p.advance()));
            }
            boolean rest = p.match(ELLIPSIS);
            Expression pattern = p.exprParser.parseBindingPattern();
            boolean optional = p.match(QUESTION);
            TypeNode type = null;
            if (p.match(COLON)) {
                type = p.parseType();
            }
            Expression initializer = null;
            if (p.match(ASSIGN)) {
                initializer = p.parseAssignment();
            }
            params.add(new Parameter(p.locationFrom(start), pattern, type, optional, initializer, rest,
                    modifiers, decorators));
            if (!p.match(COMMA)) break;
        }
        p.exprParser.noIn = savedNoIn;
        p.expect(RPAREN, "Expected ')' after parameters");
        return params;
    }

    private static boolean isParameterNameStart(Token token) {
        return token.getType().isIdentifierLike() || token.isOneOf(LBRACKET, LBRACE, ELLIPSIS, KW_THIS);
    }

    /**
     * 装饰器列表：@name、@a.b、@factory(args)、@(expr)
     */
    List<Decorator> parseDecorators() {
        List<Decorator> decorators = new ArrayList<Decorator>();
        while (p.check(AT)) {
            Token start = p.advance();
            Expression expr;
            if (p.check(LPAREN)) {
                Token open = p.advance();
                Expression inner = p.parseExpression();
                p.expect(RPAREN, "Expected ')'");
                expr = new ParenExpr(p.locationFrom(open), inner);
            } else {
                Token nameToken = p.current;
                expr = new Identifier(p.locationOf(nameToken), p.expectIdentifier("Expected decorator name"));
                while (p.match(DOT)) {
                    expr = new MemberExpr(p.locationFrom(nameToken), expr, p.expectPropertyName(), false);
                }
                if (p.check(LPAREN)) {
                    List<Expression> args = p.exprParser.parseArguments();
                    expr = new CallExpr(p.locationFrom(nameToken), expr, Collections.<TypeNode>emptyList(),
                            args, false);
                }
            }
            decorators.add(new Decorator(p.locationFrom(start), expr));
        }
        return decorators;
    }

    // ============ 类 ============

    ClassDecl parseClass(Token start, List<Modifier> modifiers, List<Decorator> decorators, boolean expression) {
        p.expect(KW_CLASS, "Expected 'class'");
        String name = null;
        if (p.isIdentifierToken() && !p.check(KW_IMPLEMENTS)) {
            name = p.advance().getLexeme();
        } else if (!expression && !p.check(LBRACE) && !p.check(KW_EXTENDS)) {
            throw new ParseException("Expected class name", p.current, "IDENTIFIER");
        }
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        Expression superClass = null;
        List<TypeNode> superTypeArgs = Collections.emptyList();
        if (p.match(KW_EXTENDS)) {
            superClass = parseHeritageExpression();
            if (p.check(GENERIC_OPEN)) {
                superTypeArgs = p.typeParser.parseTypeArgs();
            }
        }
        List<TypeNode> implementsTypes = new ArrayList<TypeNode>();
        if (p.match(KW_IMPLEMENTS)) {
            do {
                implementsTypes.add(p.parseType());
            } while (p.match(COMMA));
        }
        p.expect(LBRACE, "Expected '{' before class body");
        List<ClassMember> members = new ArrayList<ClassMember>();
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            if (p.match(SEMICOLON)) continue;
            members.add(parseClassMember());
        }
        p.expect(RBRACE, "Expected '}' after class body");
        return new ClassDecl(p.locationFrom(start), name, modifiers, typeParams, superClass, superTypeArgs,
                implementsTypes, members, decorators);
    }

    /** extends 子句：a.b.C 或 mixin(Base) */
    private Expression parseHeritageExpression() {
        Token start = p.current;
        Expression expr = new Identifier(p.locationOf(start), p.expectIdentifier("Expected base class"));
        while (true) {
            if (p.match(DOT)) {
                expr = new MemberExpr(p.locationFrom(start), expr, p.expectPropertyName(), false);
            } else if (p.check(LPAREN)) {
                List<Expression> args = p.exprParser.parseArguments();
                expr = new CallExpr(p.locationFrom(start), expr, Collections.<TypeNode>emptyList(), args, false);
            } else {
                return expr;
            }
        }
    }

    private ClassMember parseClassMember() {
        Token start = p.current;
        List<Decorator> decorators = p.check(AT) ? parseDecorators() : Collections.<Decorator>emptyList();
        List<Modifier> modifiers = new ArrayList<Modifier>();
        while (true) {
            Modifier modifier = memberModifier(p.current);
            if (modifier == null) break;
            Token next = p.peek(1);
            if (modifier == Modifier.STATIC && next.is(LBRACE)) {
                p.advance();
                Block body = p.parseBlock();
                return new StaticBlockMember(p.locationFrom(start), modifiers, decorators, body);
            }
            if (!ExprParser.isPropertyKeyStart(next) && !next.is(STAR)) break;
            p.advance();
            modifiers.add(modifier);
        }

        // 索引签名 [key: string]: T
        if (p.check(LBRACKET) && p.peek(1).getType().isIdentifierLike() && p.checkAhead(2, COLON)) {
            p.skipBalanced();
            p.expect(COLON, "Expected ':' after index signature");
            p.parseType();
            String text = p.textFrom(start);
            if (!p.match(COMMA)) {
                p.consumeSemicolon();
            }
            return new IndexSignatureMember(p.locationFrom(start), modifiers, decorators, text);
        }

        MethodKind kind = MethodKind.METHOD;
        if (p.checkAny(KW_GET, KW_SET) && ExprParser.isPropertyKeyStart(p.peek(1))
                && !p.peek(1).isNewlineBefore()) {
            kind = p.advance().is(KW_GET) ? MethodKind.GETTER : MethodKind.SETTER;
        }
        boolean generator = p.match(STAR);
        boolean computed = p.check(LBRACKET);
        Expression key = p.exprParser.parsePropertyKey();
        if (kind == MethodKind.METHOD && !computed && key instanceof Identifier
                && "constructor".equals(((Identifier) key).getName())) {
            kind = MethodKind.CONSTRUCTOR;
        }
        boolean optional = p.match(QUESTION);

        if (p.check(LPAREN) || p.check(GENERIC_OPEN)) {
            FunctionExpr fn = parseFunctionRest(start, null, modifiers.contains(Modifier.ASYNC), generator, true);
            return new MethodMember(p.locationFrom(start), modifiers, decorators, kind, key, computed, optional, fn);
        }
        if (kind != MethodKind.METHOD && kind != MethodKind.CONSTRUCTOR) {
            throw new ParseException("Expected '(' after accessor name", p.current, "LPAREN");
        }
        boolean definite = false;
        if (p.check(NOT) && !p.current.isNewlineBefore()) {
            p.advance();
            definite = true;
        }
        TypeNode type = null;
        if (p.match(COLON)) {
            type = p.parseType();
        }
        Expression value = null;
        if (p.match(ASSIGN)) {
            value = p.parseAssignment();
        }
        p.consumeSemicolon();
        return new PropertyMember(p.locationFrom(start), modifiers, decorators, key, computed, optional,
                definite, type, value);
    }

    private static Modifier memberModifier(Token token) {
        switch (token.getType()) {
            case KW_STATIC: return Modifier.STATIC;
            case KW_PUBLIC: return Modifier.PUBLIC;
            case KW_PRIVATE: return Modifier.PRIVATE;
            case KW_PROTECTED: return Modifier.PROTECTED;
            case KW_READONLY: return Modifier.READONLY;
            case KW_ABSTRACT: return Modifier.ABSTRACT;
            case KW_OVERRIDE: return Modifier.OVERRIDE;
            case KW_DECLARE: return Modifier.DECLARE;
            case KW_ASYNC: return Modifier.ASYNC;
            case IDENTIFIER:
                return "accessor".equals(token.getLexeme()) ? Modifier.ACCESSOR : null;
            default:
                return null;
        }
    }

    // ============ 类型层声明 ============

    private InterfaceDecl parseInterface(Token start, List<Modifier> modifiers) {
        p.expect(KW_INTERFACE, "Expected 'interface'");
        String name = p.expectIdentifier("Expected interface name");
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        List<TypeNode> extendsTypes = new ArrayList<TypeNode>();
        if (p.match(KW_EXTENDS)) {
            do {
                extendsTypes.add(p.parseType());
            } while (p.match(COMMA));
        }
        ObjectTypeNode body = p.typeParser.parseObjectType();
        return new InterfaceDecl(p.locationFrom(start), name, modifiers, typeParams, extendsTypes, body);
    }

    private TypeAliasDecl parseTypeAlias(Token start, List<Modifier> modifiers) {
        p.expect(KW_TYPE, "Expected 'type'");
        String name = p.expectIdentifier("Expected type alias name");
        TypeParams typeParams = null;
        if (p.check(GENERIC_OPEN)) {
            typeParams = p.typeParser.parseTypeParams();
        }
        p.expect(ASSIGN, "Expected '=' in type alias");
        TypeNode type = p.parseType();
        p.consumeSemicolon();
        return new TypeAliasDecl(p.locationFrom(start), name, modifiers, typeParams, type);
    }

    private EnumDecl parseEnum(Token start, List<Modifier> modifiers, boolean constEnum) {
        p.expect(KW_ENUM, "Expected 'enum'");
        String name = p.expectIdentifier("Expected enum name");
        p.expect(LBRACE, "Expected '{' after enum name");
        List<EnumMember> members = new ArrayList<EnumMember>();
        while (!p.check(RBRACE) && !p.isAtEnd()) {
            Token memberStart = p.current;
            String memberName = p.check(STRING_LITERAL)
                    ? (String) p.advance().getLiteral()
                    : p.expectPropertyName();
            Expression init = null;
            if (p.match(ASSIGN)) {
                init = p.parseAssignment();
            }
            members.add(new EnumMember(p.locationFrom(memberStart), memberName, init));
            if (!p.match(COMMA)) break;
        }
        p.expect(RBRACE, "Expected '}' after enum members");
        return new EnumDecl(p.locationFrom(start), name, modifiers, constEnum, members);
    }

    /**
     * namespace A.B { }、module 'x' { }、declare module 'x';、declare global { }
     */
    private NamespaceDecl parseNamespace(Token start, List<Modifier> modifiers) {
        String keyword = p.advance().getLexeme();
        String name;
        if ("global".equals(keyword)) {
            name = "global";
        } else if (p.check(STRING_LITERAL)) {
            name = p.advance().getLexeme();
        } else {
            StringBuilder sb = new StringBuilder(p.expectIdentifier("Expected namespace name"));
            while (p.match(DOT)) {
                sb.append('.').append(p.expectIdentifier("Expected namespace name"));
            }
            name = sb.toString();
        }
        List<Statement> body = null;
        if (p.check(LBRACE)) {
            body = p.stmtParser.parseBlock().getStatements();
        } else {
            p.consumeSemicolon();
        }
        return new NamespaceDecl(p.locationFrom(start), name, modifiers, keyword, body);
    }
}
