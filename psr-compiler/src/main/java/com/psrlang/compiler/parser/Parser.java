package com.psrlang.compiler.parser;

import com.psrlang.compiler.ast.SourceLocation;
import com.psrlang.compiler.ast.decl.Program;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.stmt.Block;
import com.psrlang.compiler.ast.stmt.Statement;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.lexer.Lexer;
import com.psrlang.compiler.lexer.Token;
import com.psrlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.psrlang.compiler.lexer.TokenType.*;

/**
 * PSR 语法分析器（递归下降）
 *
 * <p>词法器的上下文栈只依赖已产生的 token，因此解析前一次性取得完整 token 序列，
 * mark/reset 回溯只需保存下标。</p>
 */
public class Parser {

    /** 未指定时的嵌套深度上限 */
    public static final int DEFAULT_MAX_DEPTH = 500;

    final String source;
    final String fileName;
    private final List<Token> tokens;
    private int index = 0;

    Token current;
    Token previous;

    private int maxDepth = DEFAULT_MAX_DEPTH;
    private int depth = 0;

    // === Helper 实例 ===
    final TypeParser typeParser = new TypeParser(this);
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);
    final JsxParser jsxParser = new JsxParser(this);

    public Parser(Lexer lexer) {
        this(lexer.scanTokens(), lexer.getSource(), lexer.getFileName());
    }

    public Parser(List<Token> tokens, String source, String fileName) {
        this.tokens = tokens;
        this.source = source;
        this.fileName = fileName;
        this.current = tokens.get(0);
    }

    /**
     * 设置表达式、语句、类型和 JSX 的嵌套深度上限
     */
    public Parser setMaxDepth(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    // ============ 嵌套深度 ============

    /**
     * 进入一层递归产生式，超过上限时在当前 token 处报错
     *
     * <p>调用方必须在 finally 中配对调用 {@link #exitNesting()}。</p>
     */
    void enterNesting() {
        depth++;
        if (depth > maxDepth) {
            throw new ParseException("Maximum nesting depth of " + maxDepth + " exceeded", current);
        }
    }

    void exitNesting() {
        depth--;
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        if (index < tokens.size() - 1) {
            index++;
        }
        current = tokens.get(index);
        return previous;
    }

    /**
     * 向前看第 n 个 token（0 为当前）
     */
    Token peek(int n) {
        int i = Math.min(index + n, tokens.size() - 1);
        return tokens.get(i);
    }

    /** 标记当前位置，用于回溯 */
    int mark() {
        return index;
    }

    /** 回溯到标记的位置 */
    void reset(int mark) {
        index = mark;
        current = tokens.get(index);
        previous = index > 0 ? tokens.get(index - 1) : null;
    }

    boolean check(TokenType type) {
        return current.getType() == type;
    }

    boolean checkAny(TokenType... types) {
        return current.isOneOf(types);
    }

    boolean checkAhead(int n, TokenType type) {
        return peek(n).getType() == type;
    }

    /** 当前是否为指定文本的标识符（is、asserts、global 等非关键词上下文词） */
    boolean checkWord(String word) {
        return check(IDENTIFIER) && word.equals(current.getLexeme());
    }

    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type.name());
    }

    /** 标识符或可作标识符的上下文关键词 */
    boolean isIdentifierToken() {
        return current.getType().isIdentifierLike();
    }

    String expectIdentifier(String message) {
        if (isIdentifierToken()) {
            return advance().getLexeme();
        }
        throw new ParseException(message, current, "IDENTIFIER");
    }

    /**
     * 属性名：标识符或任意关键词（obj.default、{ class: 1 }）
     */
    boolean isPropertyNameToken() {
        return check(IDENTIFIER) || check(PRIVATE_NAME) || current.getType().isKeyword();
    }

    String expectPropertyName() {
        if (isPropertyNameToken()) {
            return advance().getLexeme();
        }
        throw new ParseException("Expected property name", current, "IDENTIFIER");
    }

    /**
     * 自动分号插入：分号、'}'、EOF 或换行均可结束语句
     */
    void consumeSemicolon() {
        if (match(SEMICOLON)) return;
        if (check(RBRACE) || check(EOF) || current.isNewlineBefore()) return;
        throw new ParseException("Expected ';'", current, "SEMICOLON");
    }

    boolean isAtEnd() {
        return check(EOF);
    }

    int matchingCloseOffset() {
        return matchingCloseOffset(0);
    }

    /**
     * 第 from 个 token 为开括号时，返回与之匹配的闭括号相对当前位置的偏移；未闭合返回 -1
     */
    int matchingCloseOffset(int from) {
        TokenType open = peek(from).getType();
        TokenType close;
        switch (open) {
            case LPAREN: close = RPAREN; break;
            case LBRACKET: close = RBRACKET; break;
            case LBRACE: close = RBRACE; break;
            case GENERIC_OPEN: close = GENERIC_CLOSE; break;
            default: return -1;
        }
        int depth = 0;
        for (int i = index + from; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).getType();
            if (t == open) {
                depth++;
            } else if (t == close) {
                depth--;
                if (depth == 0) return i - index;
            } else if (t == EOF) {
                return -1;
            }
        }
        return -1;
    }

    /** 从当前开括号跳到匹配的闭括号之后 */
    void skipBalanced() {
        int offset = matchingCloseOffset();
        if (offset < 0) {
            throw new ParseException("Unterminated bracket", current);
        }
        for (int i = 0; i <= offset; i++) {
            advance();
        }
    }

    // ============ 位置 ============

    /** 从起始 token 到上一个已消费 token 的范围 */
    SourceLocation locationFrom(Token start) {
        Token end = previous != null && previous.getOffset() >= start.getOffset() ? previous : start;
        return new SourceLocation(fileName, start.getLine(), start.getColumn(), start.getOffset(),
                end.getLine(), end.getColumn() + end.getLexeme().length(), end.getEndOffset());
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(), token.getOffset(),
                token.getLine(), token.getColumn() + token.getLexeme().length(), token.getEndOffset());
    }

    /** 起始 token 到上一个 token 之间的源码文本，内部换行折叠为单个空格 */
    String textFrom(Token start) {
        int end = previous != null ? previous.getEndOffset() : start.getEndOffset();
        if (end <= start.getOffset()) return "";
        return collapseNewlines(source.substring(start.getOffset(), end));
    }

    static String collapseNewlines(String text) {
        if (text.indexOf('\n') < 0) return text;
        return text.replaceAll("[ \\t]*\\r?\\n\\s*", " ");
    }

    // ============ 程序解析 ============

    /**
     * 解析程序，遇到第一个语法错误时抛出 {@link ParseException}
     */
    public Program parse() {
        Token start = current;
        List<Statement> body = new ArrayList<Statement>();
        while (!isAtEnd()) {
            body.add(parseStatement());
        }
        return new Program(locationFrom(start), body);
    }

    /**
     * 容错解析：遇到错误时跳过到下一个语句边界继续解析
     */
    public ParseResult parseTolerant() {
        Token start = current;
        List<Statement> body = new ArrayList<Statement>();
        List<ParseError> errors = new ArrayList<ParseError>();
        while (!isAtEnd()) {
            int before = index;
            try {
                body.add(parseStatement());
            } catch (ParseException e) {
                errors.add(new ParseError(e));
                synchronize(before);
            }
        }
        return new ParseResult(new Program(locationFrom(start), body), errors);
    }

    /**
     * 错误恢复：跳过 token 直到分号之后或下一个语句起始关键词
     */
    private void synchronize(int failedAt) {
        if (index == failedAt) {
            advance();
        }
        while (!isAtEnd()) {
            if (previous != null && previous.is(SEMICOLON)) return;
            if (current.isNewlineBefore() && isStatementKeyword()) return;
            advance();
        }
    }

    private boolean isStatementKeyword() {
        return checkAny(KW_VAR, KW_LET, KW_CONST, KW_FUNCTION, KW_CLASS, KW_INTERFACE, KW_ENUM,
                KW_TYPE, KW_COMPONENT, KW_IMPORT, KW_EXPORT, KW_IF, KW_FOR, KW_WHILE, KW_DO,
                KW_RETURN, KW_SWITCH, KW_TRY, KW_THROW, KW_DECLARE, KW_NAMESPACE);
    }

    // ============ 委托 ============

    Statement parseStatement() { return stmtParser.parseStatement(); }
    Block parseBlock() { return stmtParser.parseBlock(); }

    Expression parseExpression() { return exprParser.parseExpression(); }
    Expression parseAssignment() { return exprParser.parseAssignment(); }

    TypeNode parseType() { return typeParser.parseType(); }
}
