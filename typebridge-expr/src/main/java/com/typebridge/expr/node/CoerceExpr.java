package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TypeDescriptor;

/**
 * 类型强转（不改变运行时值）。
 */
public class CoerceExpr extends Expr {

    private final Expr operand;
    private final TypeDescriptor targetType;

    public CoerceExpr(Expr operand, TypeDescriptor targetType) {
        this.operand = operand;
        this.targetType = targetType;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public TypeDescriptor getType() {
        return targetType;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.COERCE;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCoerce(this, context);
    }
}
