package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.decl.VariableDecl;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.stmt.*;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        parser.enterNesting();
        try {
            return parseStatementInner();
        } finally {
            parser.exitNesting();
        }
    }

    private Statement parseStatementInner() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        if (parser.check(SEMICOLON)) {
            Token semi = parser.advance();
            return new EmptyStmt(parser.locationOf(semi));
        }
        if (parser.check(KW_IMPORT) && !parser.checkAhead(1, LPAREN) && !parser.checkAhead(1, DOT)) {
            return parser.declParser.parseImport();
        }
        if (parser.check(KW_EXPORT)) {
            return parser.declParser.parseExport();
        }
        if (parser.check(KW_IF)) {
            return parseIfStmt();
        }
        if (parser.check(KW_FOR)) {
            return parseForStmt();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhileStmt();
        }
        if (parser.check(KW_DO)) {
            return parseDoWhileStmt();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturnStmt();
        }
        if (parser.check(KW_BREAK) || parser.check(KW_CONTINUE)) {
            return parseJumpStmt();
        }
        if (parser.check(KW_THROW)) {
            return parseThrowStmt();
        }
        if (parser.check(KW_TRY)) {
            return parseTryStmt();
        }
        if (parser.check(KW_SWITCH)) {
            return parseSwitchStmt();
        }
        if (parser.check(KW_DEBUGGER)) {
            Token start = parser.advance();
            parser.consumeSemicolon();
            return new DebuggerStmt(parser.locationFrom(start));
        }
        // 标签语句 label: for (...)
        if (parser.isIdentifierToken() && parser.checkAhead(1, COLON)) {
            Token start = parser.current;
            String label = parser.advance().getLexeme();
            parser.advance();
            Statement body = parseStatement();
            return new LabeledStmt(parser.locationFrom(start), label, body);
        }
        if (parser.declParser.isDeclarationStart()) {
            return parser.declParser.parseDeclaration();
        }
        return parseExpressionStmt();
    }

    Block parseBlock() {
        Token start = parser.expect(LBRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<Statement>();
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            statements.add(parseStatement());
        }
        parser.expect(RBRACE, "Expected '}'");
        return new Block(parser.locationFrom(start), statements);
    }

    Statement parseExpressionStmt() {
        Token start = parser.current;
        Expression expr = parser.parseExpression();
        parser.consumeSemicolon();
        return new ExpressionStmt(parser.locationFrom(start), expr);
    }

    // ============ 控制流 ============

    private Statement parseIfStmt() {
        Token start = parser.expect(KW_IF, "Expected 'if'");
        Expression condition = parseParenthesized("if");
        Statement thenBranch = parseStatement();
        Statement elseBranch = null;
        if (parser.match(KW_ELSE)) {
            elseBranch = parseStatement();
        }
        return new IfStmt(parser.locationFrom(start), condition, thenBranch, elseBranch);
    }

    private Expression parseParenthesized(String keyword) {
        parser.expect(LPAREN, "Expected '(' after '" + keyword + "'");
        Expression expr = parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after " + keyword + " condition");
        return expr;
    }

    /**
     * for (init; test; update)、for (x in obj)、for (x of list)、for await (x of stream)
     */
    private Statement parseForStmt() {
        Token start = parser.expect(KW_FOR, "Expected 'for'");
        boolean await = parser.match(KW_AWAIT);
        parser.expect(LPAREN, "Expected '(' after 'for'");

        AstNode init = null;
        if (!parser.check(SEMICOLON)) {
            boolean savedNoIn = parser.exprParser.noIn;
            parser.exprParser.noIn = true;
            if (parser.checkAny(KW_VAR, KW_CONST)
                    || (parser.check(KW_LET) && !parser.checkAhead(1, KW_IN) && !parser.checkAhead(1, KW_OF))) {
                init = parser.declParser.parseVariableDeclaration(parser.current, false);
            } else {
                init = parser.parseExpression();
            }
            parser.exprParser.noIn = savedNoIn;
        }

        if (init != null && parser.checkAny(KW_IN, KW_OF)) {
            boolean of = parser.advance().is(KW_OF);
            if (init instanceof VariableDecl && ((VariableDecl) init).getDeclarators().size() != 1) {
                throw new ParseException("Only a single binding is allowed in for-" + (of ? "of" : "in"),
                        parser.previous);
            }
            Expression right = of ? parser.parseAssignment() : parser.parseExpression();
            parser.expect(RPAREN, "Expected ')' after for header");
            Statement body = parseStatement();
            return new ForInStmt(parser.locationFrom(start), init, right, body, of, await);
        }
        if (await) {
            throw new ParseException("'for await' requires an 'of' clause", parser.current, "of");
        }

        parser.expect(SEMICOLON, "Expected ';' after for initializer");
        Expression test = parser.check(SEMICOLON) ? null : parser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after for condition");
        Expression update = parser.check(RPAREN) ? null : parser.parseExpression();
        parser.expect(RPAREN, "Expected ')' after for header");
        Statement body = parseStatement();
        return new ForStmt(parser.locationFrom(start), init, test, update, body);
    }

    private Statement parseWhileStmt() {
        Token start = parser.expect(KW_WHILE, "Expected 'while'");
        Expression condition = parseParenthesized("while");
        Statement body = parseStatement();
        return new WhileStmt(parser.locationFrom(start), condition, body);
    }

    private Statement parseDoWhileStmt() {
        Token start = parser.expect(KW_DO, "Expected 'do'");
        Statement body = parseStatement();
        parser.expect(KW_WHILE, "Expected 'while' after do body");
        Expression condition = parseParenthesized("while");
        // do-while 之后的分号可以省略，即使没有换行
        parser.match(SEMICOLON);
        return new DoWhileStmt(parser.locationFrom(start), body, condition);
    }

    private Statement parseReturnStmt() {
        Token start = parser.expect(KW_RETURN, "Expected 'return'");
        Expression value = null;
        if (!parser.checkAny(SEMICOLON, RBRACE, EOF) && !parser.current.isNewlineBefore()) {
            value = parser.parseExpression();
        }
        parser.consumeSemicolon();
        return new ReturnStmt(parser.locationFrom(start), value);
    }

    private Statement parseJumpStmt() {
        Token start = parser.advance();
        String label = null;
        if (parser.isIdentifierToken() && !parser.current.isNewlineBefore()) {
            label = parser.advance().getLexeme();
        }
        parser.consumeSemicolon();
        if (start.is(KW_BREAK)) {
            return new BreakStmt(parser.locationFrom(start), label);
        }
        return new ContinueStmt(parser.locationFrom(start), label);
    }

    private Statement parseThrowStmt() {
        Token start = parser.expect(KW_THROW, "Expected 'throw'");
        if (parser.current.isNewlineBefore()) {
            throw new ParseException("Line break is not allowed after 'throw'", parser.current);
        }
        Expression value = parser.parseExpression();
        parser.consumeSemicolon();
        return new ThrowStmt(parser.locationFrom(start), value);
    }

    private Statement parseTryStmt() {
        Token start = parser.expect(KW_TRY, "Expected 'try'");
        Block block = parseBlock();
        CatchClause handler = null;
        if (parser.check(KW_CATCH)) {
            Token catchStart = parser.advance();
            Expression param = null;
            TypeNode paramType = null;
            if (parser.match(LPAREN)) {
                param = parser.exprParser.parseBindingPattern();
                if (parser.match(COLON)) {
                    paramType = parser.parseType();
                }
                parser.expect(RPAREN, "Expected ')' after catch binding");
            }
            Block body = parseBlock();
            handler = new CatchClause(parser.locationFrom(catchStart), param, paramType, body);
        }
        Block finalizer = null;
        if (parser.match(KW_FINALLY)) {
            finalizer = parseBlock();
        }
        if (handler == null && finalizer == null) {
            throw new ParseException("Missing catch or finally after try", parser.current, "catch");
        }
        return new TryStmt(parser.locationFrom(start), block, handler, finalizer);
    }

    private Statement parseSwitchStmt() {
        Token start = parser.expect(KW_SWITCH, "Expected 'switch'");
        Expression discriminant = parseParenthesized("switch");
        parser.expect(LBRACE, "Expected '{' after switch");
        List<SwitchCase> cases = new ArrayList<SwitchCase>();
        boolean seenDefault = false;
        while (!parser.check(RBRACE) && !parser.isAtEnd()) {
            Token caseStart = parser.current;
            Expression test = null;
            if (parser.match(KW_CASE)) {
                test = parser.parseExpression();
            } else if (parser.check(KW_DEFAULT)) {
                if (seenDefault) {
                    throw new ParseException("Multiple default clauses in switch", parser.current);
                }
                parser.advance();
                seenDefault = true;
            } else {
                throw new ParseException("Expected 'case' or 'default'", parser.current, "case");
            }
            parser.expect(COLON, "Expected ':' after case");
            List<Statement> consequent = new ArrayList<Statement>();
            while (!parser.checkAny(KW_CASE, KW_DEFAULT, RBRACE) && !parser.isAtEnd()) {
                consequent.add(parseStatement());
            }
            cases.add(new SwitchCase(parser.locationFrom(caseStart), test, consequent));
        }
        parser.expect(RBRACE, "Expected '}' after switch body");
        return new SwitchStmt(parser.locationFrom(start), discriminant, cases);
    }
}
