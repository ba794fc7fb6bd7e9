package com.psrlang.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // ============ 字面量 ============
    NUMBER_LITERAL,
    BIGINT_LITERAL,
    STRING_LITERAL,
    REGEX_LITERAL,
    TEMPLATE_STRING,     // `abc`（无插值）
    TEMPLATE_HEAD,       // `abc${
    TEMPLATE_MIDDLE,     // }abc${
    TEMPLATE_TAIL,       // }abc`

    // ============ 标识符 ============
    IDENTIFIER,
    PRIVATE_NAME,        // #name

    // ============ 关键词：声明 ============
    KW_VAR,
    KW_LET,
    KW_CONST,
    KW_FUNCTION,
    KW_CLASS,
    KW_INTERFACE,
    KW_ENUM,
    KW_NAMESPACE,
    KW_MODULE,
    KW_TYPE,
    KW_COMPONENT,
    KW_DECLARE,
    KW_ABSTRACT,

    // ============ 关键词：模块 ============
    KW_IMPORT,
    KW_EXPORT,
    KW_FROM,
    KW_AS,
    KW_DEFAULT,

    // ============ 关键词：控制流 ============
    KW_IF,
    KW_ELSE,
    KW_SWITCH,
    KW_CASE,
    KW_FOR,
    KW_WHILE,
    KW_DO,
    KW_OF,
    KW_IN,
    KW_BREAK,
    KW_CONTINUE,
    KW_RETURN,
    KW_THROW,
    KW_TRY,
    KW_CATCH,
    KW_FINALLY,
    KW_DEBUGGER,
    KW_WITH,

    // ============ 关键词：表达式 ============
    KW_NEW,
    KW_THIS,
    KW_SUPER,
    KW_TYPEOF,
    KW_KEYOF,
    KW_VOID,
    KW_DELETE,
    KW_INSTANCEOF,
    KW_AWAIT,
    KW_ASYNC,
    KW_YIELD,
    KW_TRUE,
    KW_FALSE,
    KW_NULL,
    KW_SATISFIES,

    // ============ 关键词：类成员 ============
    KW_EXTENDS,
    KW_IMPLEMENTS,
    KW_STATIC,
    KW_PUBLIC,
    KW_PRIVATE,
    KW_PROTECTED,
    KW_READONLY,
    KW_OVERRIDE,
    KW_GET,
    KW_SET,

    // ============ 运算符 ============
    PLUS,               // +
    MINUS,              // -
    STAR,               // *
    STAR_STAR,          // **
    SLASH,              // /
    PERCENT,            // %
    INC,                // ++
    DEC,                // --

    LT,                 // <
    GT,                 // >
    LE,                 // <=
    GE,                 // >=
    EQ,                 // ==
    NE,                 // !=
    EQ_STRICT,          // ===
    NE_STRICT,          // !==

    AND,                // &&
    OR,                 // ||
    NOT,                // !
    NULLISH,            // ??

    AMP,                // &
    PIPE,               // |
    CARET,              // ^
    TILDE,              // ~
    SHL,                // <<
    SHR,                // >>
    USHR,               // >>>

    ASSIGN,             // =
    PLUS_ASSIGN,        // +=
    MINUS_ASSIGN,       // -=
    STAR_ASSIGN,        // *=
    STAR_STAR_ASSIGN,   // **=
    SLASH_ASSIGN,       // /=
    PERCENT_ASSIGN,     // %=
    AMP_ASSIGN,         // &=
    PIPE_ASSIGN,        // |=
    CARET_ASSIGN,       // ^=
    SHL_ASSIGN,         // <<=
    SHR_ASSIGN,         // >>=
    USHR_ASSIGN,        // >>>=
    AND_ASSIGN,         // &&=
    OR_ASSIGN,          // ||=
    NULLISH_ASSIGN,     // ??=

    ARROW,              // =>
    QUESTION,           // ?
    QUESTION_DOT,       // ?.
    DOT,                // .
    ELLIPSIS,           // ...
    COLON,              // :

    // ============ 泛型 ============
    GENERIC_OPEN,       // < （类型参数）
    GENERIC_CLOSE,      // > （类型参数）

    // ============ 分隔符 ============
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    COMMA,
    SEMICOLON,
    AT,

    // ============ JSX ============
    JSX_OPEN,           // < 开始标签
    JSX_CLOSE_OPEN,     // </
    JSX_TAG_END,        // > 结束标签头
    JSX_SELF_CLOSE,     // />
    JSX_TEXT,
    JSX_ATTR_STRING,

    // ============ 特殊 ============
    ERROR,
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为赋值运算符
     */
    public boolean isAssignmentOp() {
        switch (this) {
            case ASSIGN:
            case PLUS_ASSIGN:
            case MINUS_ASSIGN:
            case STAR_ASSIGN:
            case STAR_STAR_ASSIGN:
            case SLASH_ASSIGN:
            case PERCENT_ASSIGN:
            case AMP_ASSIGN:
            case PIPE_ASSIGN:
            case CARET_ASSIGN:
            case SHL_ASSIGN:
            case SHR_ASSIGN:
            case USHR_ASSIGN:
            case AND_ASSIGN:
            case OR_ASSIGN:
            case NULLISH_ASSIGN:
                return true;
            default:
                return false;
        }
    }

    /**
     * 是否为上下文关键词（可以作为标识符使用）
     */
    public boolean isContextualKeyword() {
        switch (this) {
            case KW_TYPE:
            case KW_COMPONENT:
            case KW_NAMESPACE:
            case KW_MODULE:
            case KW_DECLARE:
            case KW_ABSTRACT:
            case KW_FROM:
            case KW_AS:
            case KW_OF:
            case KW_KEYOF:
            case KW_ASYNC:
            case KW_AWAIT:
            case KW_YIELD:
            case KW_LET:
            case KW_STATIC:
            case KW_PUBLIC:
            case KW_PRIVATE:
            case KW_PROTECTED:
            case KW_READONLY:
            case KW_OVERRIDE:
            case KW_GET:
            case KW_SET:
            case KW_SATISFIES:
            case KW_IMPLEMENTS:
                return true;
            default:
                return false;
        }
    }

    /**
     * 可以出现在标识符位置（普通标识符或上下文关键词）
     */
    public boolean isIdentifierLike() {
        return this == IDENTIFIER || isContextualKeyword();
    }
}
