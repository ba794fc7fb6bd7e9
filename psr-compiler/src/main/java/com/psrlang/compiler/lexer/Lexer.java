package com.psrlang.compiler.lexer;

import com.psrlang.compiler.emitter.StringEscapes;
import com.psrlang.compiler.lexer.LexContext.Kind;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PSR 词法分析器
 *
 * <p>'<' 可能是 JSX 开始标签、泛型参数列表或小于号。词法器维护一个显式上下文栈：
 * 进入 JSX 标签、JSX 子节点、JSX 表达式、模板插值和泛型尖括号时各压入一帧，
 * 泛型帧内的 '>' 总是单独成词，以保证 {@code Promise<Array<T>>} 能正确闭合。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;
    private final LexerOptions options;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 的起始行列
    private int tokenLine = 1;
    private int tokenColumn = 1;
    private boolean newlineSeen = false;

    private Token lastToken;
    private final Deque<LexContext> contexts = new ArrayDeque<LexContext>();
    private final List<LexError> errors = new ArrayList<LexError>();
    private int recoveryAttempts = 0;

    /** 泛型预扫描的最大字符数 */
    private static final int GENERIC_SCAN_LIMIT = 2048;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();

        // 声明
        map.put("var", TokenType.KW_VAR);
        map.put("let", TokenType.KW_LET);
        map.put("const", TokenType.KW_CONST);
        map.put("function", TokenType.KW_FUNCTION);
        map.put("class", TokenType.KW_CLASS);
        map.put("interface", TokenType.KW_INTERFACE);
        map.put("enum", TokenType.KW_ENUM);
        map.put("namespace", TokenType.KW_NAMESPACE);
        map.put("module", TokenType.KW_MODULE);
        map.put("type", TokenType.KW_TYPE);
        map.put("component", TokenType.KW_COMPONENT);
        map.put("declare", TokenType.KW_DECLARE);
        map.put("abstract", TokenType.KW_ABSTRACT);

        // 模块
        map.put("import", TokenType.KW_IMPORT);
        map.put("export", TokenType.KW_EXPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);
        map.put("default", TokenType.KW_DEFAULT);

        // 控制流
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("switch", TokenType.KW_SWITCH);
        map.put("case", TokenType.KW_CASE);
        map.put("for", TokenType.KW_FOR);
        map.put("while", TokenType.KW_WHILE);
        map.put("do", TokenType.KW_DO);
        map.put("of", TokenType.KW_OF);
        map.put("in", TokenType.KW_IN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("return", TokenType.KW_RETURN);
        map.put("throw", TokenType.KW_THROW);
        map.put("try", TokenType.KW_TRY);
        map.put("catch", TokenType.KW_CATCH);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("debugger", TokenType.KW_DEBUGGER);
        map.put("with", TokenType.KW_WITH);

        // 表达式
        map.put("new", TokenType.KW_NEW);
        map.put("this", TokenType.KW_THIS);
        map.put("super", TokenType.KW_SUPER);
        map.put("typeof", TokenType.KW_TYPEOF);
        map.put("keyof", TokenType.KW_KEYOF);
        map.put("void", TokenType.KW_VOID);
        map.put("delete", TokenType.KW_DELETE);
        map.put("instanceof", TokenType.KW_INSTANCEOF);
        map.put("await", TokenType.KW_AWAIT);
        map.put("async", TokenType.KW_ASYNC);
        map.put("yield", TokenType.KW_YIELD);
        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);
        map.put("null", TokenType.KW_NULL);
        map.put("satisfies", TokenType.KW_SATISFIES);

        // 类成员
        map.put("extends", TokenType.KW_EXTENDS);
        map.put("implements", TokenType.KW_IMPLEMENTS);
        map.put("static", TokenType.KW_STATIC);
        map.put("public", TokenType.KW_PUBLIC);
        map.put("private", TokenType.KW_PRIVATE);
        map.put("protected", TokenType.KW_PROTECTED);
        map.put("readonly", TokenType.KW_READONLY);
        map.put("override", TokenType.KW_OVERRIDE);
        map.put("get", TokenType.KW_GET);
        map.put("set", TokenType.KW_SET);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName, LexerOptions options) {
        this.source = source;
        this.fileName = fileName;
        this.options = options != null ? options : LexerOptions.defaults();
    }

    public Lexer(String source, String fileName) {
        this(source, fileName, LexerOptions.defaults());
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getSource() {
        return source;
    }

    public String getFileName() {
        return fileName;
    }

    /** 恢复模式下收集到的词法错误 */
    public List<LexError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<Token>();
        while (true) {
            Token token = nextToken();
            tokens.add(token);
            if (token.is(TokenType.EOF)) break;
        }
        return tokens;
    }

    /**
     * 获取下一个 Token（流式接口）
     */
    public Token nextToken() {
        LexContext top = contexts.peek();
        if (top != null && top.is(Kind.JSX_CHILDREN)) {
            return scanJsxChild();
        }

        skipTrivia();
        beginToken();

        if (isAtEnd()) {
            return make(TokenType.EOF, null);
        }

        if (top != null && top.is(Kind.JSX_TAG)) {
            return scanJsxTagToken(top);
        }
        return scanToken();
    }

    // ============ 普通模式 ============

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return make(TokenType.LPAREN, null);
            case ')': return make(TokenType.RPAREN, null);
            case '[': return make(TokenType.LBRACKET, null);
            case ']': return make(TokenType.RBRACKET, null);
            case ',': return make(TokenType.COMMA, null);
            case ';': return make(TokenType.SEMICOLON, null);
            case ':': return make(TokenType.COLON, null);
            case '~': return make(TokenType.TILDE, null);
            case '@': return make(TokenType.AT, null);

            case '{': {
                LexContext top = contexts.peek();
                if (top != null && (top.is(Kind.TEMPLATE_EXPR) || top.is(Kind.JSX_EXPR))) {
                    top.depth++;
                }
                return make(TokenType.LBRACE, null);
            }

            case '}': {
                LexContext top = contexts.peek();
                if (top != null && top.is(Kind.TEMPLATE_EXPR)) {
                    if (top.depth == 0) {
                        contexts.pop();
                        return template(false);
                    }
                    top.depth--;
                } else if (top != null && top.is(Kind.JSX_EXPR)) {
                    if (top.depth == 0) {
                        contexts.pop();
                        return make(TokenType.RBRACE, null);
                    }
                    top.depth--;
                }
                return make(TokenType.RBRACE, null);
            }

            case '.':
                if (isDigit(peek())) {
                    return number(c);
                }
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    return make(TokenType.ELLIPSIS, null);
                }
                return make(TokenType.DOT, null);

            case '?':
                if (peek() == '.' && !isDigit(peekNext())) {
                    advance();
                    return make(TokenType.QUESTION_DOT, null);
                }
                if (match('?')) {
                    return make(match('=') ? TokenType.NULLISH_ASSIGN : TokenType.NULLISH, null);
                }
                return make(TokenType.QUESTION, null);

            case '+':
                if (match('+')) return make(TokenType.INC, null);
                return make(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS, null);

            case '-':
                if (match('-')) return make(TokenType.DEC, null);
                return make(match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS, null);

            case '*':
                if (match('*')) {
                    return make(match('=') ? TokenType.STAR_STAR_ASSIGN : TokenType.STAR_STAR, null);
                }
                return make(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR, null);

            case '%':
                return make(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT, null);

            case '^':
                return make(match('=') ? TokenType.CARET_ASSIGN : TokenType.CARET, null);

            case '&':
                if (match('&')) {
                    return make(match('=') ? TokenType.AND_ASSIGN : TokenType.AND, null);
                }
                return make(match('=') ? TokenType.AMP_ASSIGN : TokenType.AMP, null);

            case '|':
                if (match('|')) {
                    return make(match('=') ? TokenType.OR_ASSIGN : TokenType.OR, null);
                }
                return make(match('=') ? TokenType.PIPE_ASSIGN : TokenType.PIPE, null);

            case '=':
                if (match('>')) return make(TokenType.ARROW, null);
                if (match('=')) {
                    return make(match('=') ? TokenType.EQ_STRICT : TokenType.EQ, null);
                }
                return make(TokenType.ASSIGN, null);

            case '!':
                if (match('=')) {
                    return make(match('=') ? TokenType.NE_STRICT : TokenType.NE, null);
                }
                return make(TokenType.NOT, null);

            case '<':
                return lessThan();

            case '>':
                return greaterThan();

            case '/':
                if (previousAllowsExpression()) {
                    return regex();
                }
                return make(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH, null);

            case '"':
            case '\'':
                return string(c);

            case '`':
                return template(true);

            case '#':
                if (isIdentifierStart(peek())) {
                    while (isIdentifierPart(peek())) advance();
                    return make(TokenType.PRIVATE_NAME, null);
                }
                return error("Unexpected character: #");

            default:
                if (isDigit(c)) {
                    return number(c);
                }
                if (isIdentifierStart(c)) {
                    return identifier();
                }
                return error("Unexpected character: " + c);
        }
    }

    // ============ 尖括号消歧 ============

    /**
     * '<'：JSX 开始标签、泛型开括号或小于号
     */
    private Token lessThan() {
        LexContext top = contexts.peek();
        if (top != null && top.is(Kind.GENERIC)) {
            top.depth++;
            return make(TokenType.GENERIC_OPEN, null);
        }

        if (previousAllowsExpression()) {
            char next = peek();
            if (next == '>' || isIdentifierStart(next)) {
                if (isGenericArrowParams()) {
                    contexts.push(new LexContext(Kind.GENERIC, false, 1));
                    return make(TokenType.GENERIC_OPEN, null);
                }
                contexts.push(LexContext.of(Kind.JSX_TAG));
                return make(TokenType.JSX_OPEN, null);
            }
        } else if (previousAllowsGeneric() && looksLikeGeneric()) {
            contexts.push(new LexContext(Kind.GENERIC, false, 1));
            return make(TokenType.GENERIC_OPEN, null);
        }

        if (match('<')) {
            return make(match('=') ? TokenType.SHL_ASSIGN : TokenType.SHL, null);
        }
        return make(match('=') ? TokenType.LE : TokenType.LT, null);
    }

    /**
     * '>'：泛型上下文中总是单个 GENERIC_CLOSE，否则最长匹配
     */
    private Token greaterThan() {
        LexContext top = contexts.peek();
        if (top != null && top.is(Kind.GENERIC)) {
            top.depth--;
            if (top.depth <= 0) {
                contexts.pop();
            }
            return make(TokenType.GENERIC_CLOSE, null);
        }
        if (match('>')) {
            if (match('>')) {
                return make(match('=') ? TokenType.USHR_ASSIGN : TokenType.USHR, null);
            }
            return make(match('=') ? TokenType.SHR_ASSIGN : TokenType.SHR, null);
        }
        return make(match('=') ? TokenType.GE : TokenType.GT, null);
    }

    /**
     * 表达式位置的 {@code <T,>} 或 {@code <T extends X>}：泛型箭头函数
     */
    private boolean isGenericArrowParams() {
        int i = current;
        if (i >= source.length() || !isIdentifierStart(source.charAt(i))) return false;
        while (i < source.length() && isIdentifierPart(source.charAt(i))) i++;
        int afterName = i;
        while (i < source.length() && isInlineSpace(source.charAt(i))) i++;
        if (i < source.length() && source.charAt(i) == ',') return true;
        if (i > afterName && source.startsWith("extends", i)) {
            int j = i + "extends".length();
            return j < source.length() && Character.isWhitespace(source.charAt(j));
        }
        return false;
    }

    /**
     * 有界预扫描：'<' 之后是否是一个平衡的类型参数列表，且闭合后紧跟合理的后续字符
     */
    private boolean looksLikeGeneric() {
        int depth = 1;
        int paren = 0;
        int bracket = 0;
        int brace = 0;
        int i = current;
        int limit = Math.min(source.length(), current + GENERIC_SCAN_LIMIT);

        while (i < limit) {
            char c = source.charAt(i);
            char n = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            switch (c) {
                case '<':
                    depth++;
                    break;
                case '>':
                    depth--;
                    if (depth == 0) {
                        return plausibleAfterGeneric(i + 1);
                    }
                    break;
                case '(': paren++; break;
                case ')': if (--paren < 0) return false; break;
                case '[': bracket++; break;
                case ']': if (--bracket < 0) return false; break;
                case '{': brace++; break;
                case '}': if (--brace < 0) return false; break;
                case '\'':
                case '"': {
                    int end = skipQuoted(i, c);
                    if (end < 0) return false;
                    i = end;
                    break;
                }
                case ';':
                    if (brace == 0) return false;
                    break;
                case '=':
                    if (n == '>') {
                        i++;  // 函数类型中的 =>
                    } else if (n == '=') {
                        return false;
                    }
                    break;
                case '&':
                    if (n == '&') return false;
                    break;
                case '|':
                    if (n == '|') return false;
                    break;
                case '-':
                    if (!isDigit(n)) return false;
                    break;
                case '+': case '*': case '/': case '%': case '^': case '~':
                case '!': case '@': case '#': case '`': case '\\':
                    return false;
                default:
                    break;
            }
            i++;
        }
        return false;
    }

    private boolean plausibleAfterGeneric(int i) {
        boolean sawNewline = false;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            if (source.charAt(i) == '\n') sawNewline = true;
            i++;
        }
        if (i >= source.length() || sawNewline) return true;
        char c = source.charAt(i);
        switch (c) {
            case '(': case ')': case '=': case '{': case '}': case ',': case ';':
            case '>': case '.': case '[': case ']': case '|': case '&': case '?':
            case ':': case '`':
                return true;
            default:
                break;
        }
        if (isIdentifierStart(c)) {
            int j = i;
            while (j < source.length() && isIdentifierPart(source.charAt(j))) j++;
            String word = source.substring(i, j);
            return word.equals("extends") || word.equals("implements");
        }
        return false;
    }

    private int skipQuoted(int i, char quote) {
        int j = i + 1;
        while (j < source.length()) {
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == '\n') return -1;
            if (c == quote) return j;
            j++;
        }
        return -1;
    }

    /**
     * 前一个 token 之后能否开始一个表达式（决定 '<' 是否为 JSX、'/' 是否为正则）
     */
    private boolean previousAllowsExpression() {
        if (lastToken == null) return true;
        TokenType t = lastToken.getType();
        switch (t) {
            case IDENTIFIER:
            case PRIVATE_NAME:
            case NUMBER_LITERAL:
            case BIGINT_LITERAL:
            case STRING_LITERAL:
            case REGEX_LITERAL:
            case TEMPLATE_STRING:
            case TEMPLATE_TAIL:
            case RPAREN:
            case RBRACKET:
            case RBRACE:
            case GENERIC_CLOSE:
            case INC:
            case DEC:
            case KW_THIS:
            case KW_SUPER:
            case KW_TRUE:
            case KW_FALSE:
            case KW_NULL:
            case JSX_TAG_END:
            case JSX_SELF_CLOSE:
                return false;
            default:
                break;
        }
        if (t.isKeyword()) {
            // 上下文关键词通常作为普通标识符使用
            return !t.isContextualKeyword()
                    || t == TokenType.KW_AWAIT || t == TokenType.KW_YIELD;
        }
        return true;
    }

    private boolean previousAllowsGeneric() {
        if (lastToken == null) return false;
        TokenType t = lastToken.getType();
        return t.isIdentifierLike() || t == TokenType.KW_FUNCTION;
    }

    // ============ JSX ============

    /**
     * 标签内部：标签名、属性名、属性字符串、'=', '{', '>' 和 '/>'
     */
    private Token scanJsxTagToken(LexContext tag) {
        char c = advance();
        switch (c) {
            case '>':
                contexts.pop();
                if (!tag.closingTag) {
                    contexts.push(LexContext.of(Kind.JSX_CHILDREN));
                }
                return make(TokenType.JSX_TAG_END, null);
            case '/':
                if (match('>')) {
                    contexts.pop();
                    return make(TokenType.JSX_SELF_CLOSE, null);
                }
                return error("Unexpected '/' in JSX tag");
            case '{':
                contexts.push(LexContext.of(Kind.JSX_EXPR));
                return make(TokenType.LBRACE, null);
            case '=':
                return make(TokenType.ASSIGN, null);
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    return make(TokenType.ELLIPSIS, null);
                }
                return make(TokenType.DOT, null);
            case ':':
                return make(TokenType.COLON, null);
            case '<':
                // 属性值为 JSX 元素：attr=<div/>
                contexts.push(LexContext.of(Kind.JSX_TAG));
                return make(TokenType.JSX_OPEN, null);
            case '"':
            case '\'':
                return jsxAttributeString(c);
            default:
                if (isIdentifierStart(c)) {
                    while (isIdentifierPart(peek()) || peek() == '-') advance();
                    return make(TokenType.IDENTIFIER, null);
                }
                return error("Unexpected character in JSX tag: " + c);
        }
    }

    private Token jsxAttributeString(char quote) {
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                advance();
                newLine();
            } else {
                advance();
            }
        }
        if (isAtEnd()) {
            return error("Unterminated JSX attribute string");
        }
        advance();
        return make(TokenType.JSX_ATTR_STRING, source.substring(start + 1, current - 1));
    }

    /**
     * 子节点模式：原始文本直到 '<' 或 '{'
     */
    private Token scanJsxChild() {
        beginToken();
        if (isAtEnd()) {
            return make(TokenType.EOF, null);
        }
        char c = peek();
        if (c == '<') {
            advance();
            if (peek() == '/') {
                advance();
                contexts.pop();
                contexts.push(new LexContext(Kind.JSX_TAG, true, 0));
                return make(TokenType.JSX_CLOSE_OPEN, null);
            }
            contexts.push(LexContext.of(Kind.JSX_TAG));
            return make(TokenType.JSX_OPEN, null);
        }
        if (c == '{') {
            advance();
            contexts.push(LexContext.of(Kind.JSX_EXPR));
            return make(TokenType.LBRACE, null);
        }
        while (!isAtEnd() && peek() != '<' && peek() != '{') {
            if (advance() == '\n') newLine();
        }
        return make(TokenType.JSX_TEXT, source.substring(start, current));
    }

    // ============ 复杂 Token 扫描 ============

    private Token string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = peek();
            if (c == '\n') {
                return recoverable("Unterminated string literal");
            }
            advance();
            if (c == '\\') {
                if (!escapeSequence(value)) {
                    return recoverable("Invalid escape sequence in string literal");
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            return recoverable("Unterminated string literal");
        }
        advance(); // 闭合引号
        return make(TokenType.STRING_LITERAL, value.toString());
    }

    /**
     * 处理反斜杠之后的转义，写入 value
     *
     * @return 转义格式错误时返回 false
     */
    private boolean escapeSequence(StringBuilder value) {
        if (isAtEnd()) return false;
        char e = advance();
        switch (e) {
            case '\r':
                match('\n');
                newLine();
                return true;
            case '\n':
                newLine();
                return true;
            case 'x': {
                Integer v = readHex(2);
                if (v == null) return false;
                value.append((char) v.intValue());
                return true;
            }
            case 'u': {
                if (match('{')) {
                    int from = current;
                    while (!isAtEnd() && isHexDigit(peek())) advance();
                    if (from == current || !match('}')) return false;
                    int cp;
                    try {
                        cp = Integer.parseInt(source.substring(from, current - 1), 16);
                    } catch (NumberFormatException ex) {
                        return false;
                    }
                    if (!Character.isValidCodePoint(cp)) return false;
                    value.appendCodePoint(cp);
                    return true;
                }
                Integer v = readHex(4);
                if (v == null) return false;
                value.append((char) v.intValue());
                return true;
            }
            default: {
                int r = StringEscapes.unescapeChar(e);
                value.append(r >= 0 ? (char) r : e);
                return true;
            }
        }
    }

    private Integer readHex(int count) {
        int v = 0;
        for (int i = 0; i < count; i++) {
            if (isAtEnd() || !isHexDigit(peek())) return null;
            v = v * 16 + Character.digit(advance(), 16);
        }
        return v;
    }

    /**
     * 模板字符串片段
     *
     * @param head true 表示从反引号开始，false 表示从插值结束的 '}' 继续
     */
    private Token template(boolean head) {
        StringBuilder cooked = new StringBuilder();
        while (!isAtEnd()) {
            char c = peek();
            if (c == '`') {
                advance();
                return make(head ? TokenType.TEMPLATE_STRING : TokenType.TEMPLATE_TAIL, cooked.toString());
            }
            if (c == '$' && peekNext() == '{') {
                advance();
                advance();
                contexts.push(LexContext.of(Kind.TEMPLATE_EXPR));
                return make(head ? TokenType.TEMPLATE_HEAD : TokenType.TEMPLATE_MIDDLE, cooked.toString());
            }
            advance();
            if (c == '\\') {
                if (!escapeSequence(cooked)) {
                    return recoverable("Invalid escape sequence in template literal");
                }
            } else {
                if (c == '\n') newLine();
                cooked.append(c);
            }
        }
        return recoverable("Unterminated template literal");
    }

    private Token regex() {
        boolean inClass = false;
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                return recoverable("Unterminated regular expression literal");
            }
            char c = advance();
            if (c == '\\') {
                if (isAtEnd() || peek() == '\n') {
                    return recoverable("Unterminated regular expression literal");
                }
                advance();
            } else if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
        }
        int bodyEnd = current - 1;
        while (isIdentifierPart(peek())) advance();
        String pattern = source.substring(start + 1, bodyEnd);
        return make(TokenType.REGEX_LITERAL, pattern);
    }

    private Token number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            return radixNumber(16);
        }
        if (first == '0' && (peek() == 'o' || peek() == 'O')) {
            return radixNumber(8);
        }
        if (first == '0' && (peek() == 'b' || peek() == 'B')) {
            return radixNumber(2);
        }
        if (first == '0' && isDigit(peek())) {
            // 旧式八进制 017
            while (isDigit(peek()) || peek() == '_') advance();
            String digits = stripUnderscores(source.substring(start + 1, current));
            if (digits.chars().allMatch(ch -> ch >= '0' && ch <= '7')) {
                return numberToken(new BigInteger(digits, 8).doubleValue());
            }
            return numberToken(Double.parseDouble(stripUnderscores(source.substring(start, current))));
        }

        if (first != '.') {
            advanceDigits();
            if (peek() == 'n') {
                String text = stripUnderscores(source.substring(start, current));
                advance();
                return checkNumberEnd(TokenType.BIGINT_LITERAL, new BigInteger(text));
            }
            if (peek() == '.') {
                advance();
                advanceDigits();
            }
        } else {
            advanceDigits();
        }

        if (peek() == 'e' || peek() == 'E') {
            char after = peekNext();
            if (isDigit(after) || ((after == '+' || after == '-') && current + 2 < source.length()
                    && isDigit(source.charAt(current + 2)))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                advanceDigits();
            } else {
                return recoverable("Malformed exponent in numeric literal");
            }
        }

        String text = stripUnderscores(source.substring(start, current));
        try {
            return numberToken(Double.parseDouble(text));
        } catch (NumberFormatException ex) {
            return recoverable("Invalid numeric literal: " + source.substring(start, current));
        }
    }

    private Token radixNumber(int radix) {
        advance(); // 进制前缀字母
        int from = current;
        while (Character.digit(peek(), radix) >= 0 || peek() == '_') advance();
        if (from == current) {
            return recoverable("Expected digits after numeric prefix");
        }
        BigInteger value = new BigInteger(stripUnderscores(source.substring(from, current)), radix);
        if (peek() == 'n') {
            advance();
            return checkNumberEnd(TokenType.BIGINT_LITERAL, value);
        }
        return checkNumberEnd(TokenType.NUMBER_LITERAL, value.doubleValue());
    }

    private Token numberToken(double value) {
        return checkNumberEnd(TokenType.NUMBER_LITERAL, value);
    }

    /** 数字后不能紧跟标识符字符（如 3in） */
    private Token checkNumberEnd(TokenType type, Object literal) {
        if (isIdentifierStart(peek())) {
            return recoverable("Identifier directly after numeric literal");
        }
        return make(type, literal);
    }

    private void advanceDigits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) advance();
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    private Token identifier() {
        while (isIdentifierPart(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        // 属性访问之后的关键词按标识符处理：obj.default、a?.new
        if (type != TokenType.IDENTIFIER && lastToken != null
                && lastToken.isOneOf(TokenType.DOT, TokenType.QUESTION_DOT)) {
            type = TokenType.IDENTIFIER;
        }
        return make(type, null);
    }

    // ============ 空白与注释 ============

    private void skipTrivia() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                advance();
                newLine();
                newlineSeen = true;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B'
                    || c == '\u00A0' || c == '\uFEFF' || Character.isSpaceChar(c)) {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                blockComment();
            } else if (c == '#' && current == 0 && peekNext() == '!') {
                // hashbang
                while (!isAtEnd() && peek() != '\n') advance();
            } else {
                break;
            }
        }
    }

    private void blockComment() {
        beginToken();
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                return;
            }
            if (advance() == '\n') {
                newLine();
                newlineSeen = true;
            }
        }
        // 注释不产生 token，错误直接记录
        reportError("Unterminated block comment");
    }

    // ============ 辅助方法 ============

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private void beginToken() {
        start = current;
        tokenLine = line;
        tokenColumn = column;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t';
    }

    public static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || c == '_' || c == '$'
                || (c > 0x7F && Character.isUnicodeIdentifierStart(c));
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c)
                || (c > 0x7F && Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }

    /** 字符串是否是合法标识符（用于对象键是否需要加引号） */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) return false;
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierPart(text.charAt(i))) return false;
        }
        return true;
    }

    // ============ Token 构建 ============

    private Token make(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        Token token = new Token(type, lexeme, literal, tokenLine, tokenColumn, start, current, newlineSeen);
        newlineSeen = false;
        if (type != TokenType.ERROR) {
            lastToken = token;
        }
        return token;
    }

    // ============ 错误处理 ============

    /**
     * 单字符错误：严格模式抛出；恢复模式输出 ERROR token，RESILIENT 额外跳过到空白处
     */
    private Token error(String message) {
        reportError(message);
        if (options.getMode() == LexerMode.RESILIENT) {
            skipRegion(false);
        }
        return make(TokenType.ERROR, message);
    }

    /**
     * 区域性错误（未闭合字符串等）：RESILIENT 模式跳到行尾
     */
    private Token recoverable(String message) {
        reportError(message);
        if (options.getMode() == LexerMode.RESILIENT) {
            skipRegion(true);
        }
        return make(TokenType.ERROR, message);
    }

    private void reportError(String message) {
        if (options.getMode() == LexerMode.STRICT) {
            throw new LexerException(message, fileName, tokenLine, tokenColumn);
        }
        errors.add(new LexError(message, tokenLine, tokenColumn, start));
        if (errors.size() > options.getMaxErrors()) {
            throw new LexerException("Too many lexical errors (" + errors.size() + "), giving up",
                    fileName, tokenLine, tokenColumn);
        }
    }

    private void skipRegion(boolean toEndOfLine) {
        if (++recoveryAttempts > options.getMaxRecoveryAttempts()) {
            throw new LexerException("Too many recovery attempts, giving up", fileName, line, column);
        }
        while (!isAtEnd() && peek() != '\n') {
            if (!toEndOfLine && Character.isWhitespace(peek())) break;
            advance();
        }
    }
}
