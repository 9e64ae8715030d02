package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.model.TypeDescriptor;

import java.util.Collections;
import java.util.List;

/**
 * 常量。值和类型都属于形状元数据，重建时不变。
 */
public class ValueExpr extends Expr implements ShapeCombination {

    private final Object value;
    private final TypeDescriptor type;

    public ValueExpr(Object value, TypeDescriptor type) {
        this.value = value;
        this.type = type;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.VALUE;
    }

    @Override
    public List<Expr> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        if (!children.isEmpty()) {
            throw new IllegalArgumentException("Value has no children, got " + children.size());
        }
        return this;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitValue(this, context);
    }
}
