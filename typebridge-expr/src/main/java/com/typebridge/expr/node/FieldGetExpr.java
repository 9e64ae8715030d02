package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.TypeDescriptor;

public class FieldGetExpr extends Expr {

    private final Expr target;
    private final FieldDescriptor field;

    public FieldGetExpr(Expr target, FieldDescriptor field) {
        this.target = target;
        this.field = field;
    }

    public Expr getTarget() {
        return target;
    }

    public FieldDescriptor getField() {
        return field;
    }

    @Override
    public TypeDescriptor getType() {
        return field.getFieldType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.FIELD_GET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitFieldGet(this, context);
    }
}
