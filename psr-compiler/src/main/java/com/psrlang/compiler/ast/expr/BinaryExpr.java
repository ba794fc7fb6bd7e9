package com.psrlang.compiler.ast.expr;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.AstVisitor;
import com.psrlang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public List<AstNode> getChildren() {
        return childrenOf(left, right);
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     *
     * <p>优先级数值越大绑定越紧，与 ECMAScript 运算符优先级表一致。</p>
     */
    public enum BinaryOp {
        // 逻辑
        NULLISH("??", 1),
        OR("||", 1),
        AND("&&", 2),

        // 位运算
        BIT_OR("|", 3),
        BIT_XOR("^", 4),
        BIT_AND("&", 5),

        // 相等
        EQ("==", 6),
        NE("!=", 6),
        EQ_STRICT("===", 6),
        NE_STRICT("!==", 6),

        // 关系
        LT("<", 7),
        GT(">", 7),
        LE("<=", 7),
        GE(">=", 7),
        INSTANCEOF("instanceof", 7),
        IN("in", 7),

        // 移位
        SHL("<<", 8),
        SHR(">>", 8),
        USHR(">>>", 8),

        // 算术
        ADD("+", 9),
        SUB("-", 9),
        MUL("*", 10),
        DIV("/", 10),
        MOD("%", 10),
        EXP("**", 11);

        private final String symbol;
        private final int precedence;

        BinaryOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getPrecedence() {
            return precedence;
        }

        /** ** 是唯一的右结合二元运算符 */
        public boolean isRightAssociative() {
            return this == EXP;
        }

        public boolean isLogical() {
            return this == AND || this == OR || this == NULLISH;
        }

        public static BinaryOp fromSymbol(String symbol) {
            for (BinaryOp op : values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            return null;
        }
    }
}
