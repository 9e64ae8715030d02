package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;

public class FieldSetExpr extends Expr {

    private final Expr target;
    private final FieldDescriptor field;
    private final Expr value;

    public FieldSetExpr(Expr target, FieldDescriptor field, Expr value) {
        this.target = target;
        this.field = field;
        this.value = value;
    }

    public Expr getTarget() {
        return target;
    }

    public FieldDescriptor getField() {
        return field;
    }

    public Expr getValue() {
        return value;
    }

    @Override
    public TypeDescriptor getType() {
        return PrimitiveType.VOID;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.FIELD_SET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitFieldSet(this, context);
    }
}
