package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 内建运算（比较、算术、逻辑）。
 */
public class OperationExpr extends Expr implements ShapeCombination {

    public enum Operator {
        EQUALS("=", 2),
        NOT_EQUALS("<>", 2),
        LESS("<", 2),
        LESS_EQUAL("<=", 2),
        GREATER(">", 2),
        GREATER_EQUAL(">=", 2),
        ADD("+", 2),
        SUBTRACT("-", 2),
        MULTIPLY("*", 2),
        DIVIDE("/", 2),
        MODULO("%", 2),
        NEGATE("-", 1),
        NOT("not", 1),
        AND("&&", 2),
        OR("||", 2);

        private final String symbol;
        private final int arity;

        Operator(String symbol, int arity) {
            this.symbol = symbol;
            this.arity = arity;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getArity() {
            return arity;
        }

        public boolean isComparison() {
            return ordinal() <= GREATER_EQUAL.ordinal();
        }
    }

    private final Operator operator;
    private final List<Expr> operands;
    private final TypeDescriptor type;

    public OperationExpr(Operator operator, List<Expr> operands, TypeDescriptor type) {
        if (operands.size() != operator.getArity()) {
            throw new IllegalArgumentException("Operator " + operator + " expects " + operator.getArity()
                    + " operands, got " + operands.size());
        }
        this.operator = operator;
        this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        this.type = type;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expr> getOperands() {
        return operands;
    }

    @Override
    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.OPERATION;
    }

    @Override
    public List<Expr> getChildren() {
        return operands;
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        return new OperationExpr(operator, children, type);
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitOperation(this, context);
    }
}
