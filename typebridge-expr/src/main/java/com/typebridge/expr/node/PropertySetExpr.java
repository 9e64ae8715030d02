package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PropertySetExpr extends Expr {

    private final Expr target;
    private final PropertyDescriptor property;
    private final List<Expr> indexArgs;
    private final Expr value;

    public PropertySetExpr(Expr target, PropertyDescriptor property, List<Expr> indexArgs, Expr value) {
        this.target = target;
        this.property = property;
        this.indexArgs = Collections.unmodifiableList(new ArrayList<>(indexArgs));
        this.value = value;
    }

    public Expr getTarget() {
        return target;
    }

    public PropertyDescriptor getProperty() {
        return property;
    }

    public List<Expr> getIndexArgs() {
        return indexArgs;
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
        return ExprKind.PROPERTY_SET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitPropertySet(this, context);
    }
}
