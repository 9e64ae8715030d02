package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 属性读取，可带索引参数。
 */
public class PropertyGetExpr extends Expr {

    private final Expr target;
    private final PropertyDescriptor property;
    private final List<Expr> indexArgs;

    public PropertyGetExpr(Expr target, PropertyDescriptor property, List<Expr> indexArgs) {
        this.target = target;
        this.property = property;
        this.indexArgs = Collections.unmodifiableList(new ArrayList<>(indexArgs));
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

    @Override
    public TypeDescriptor getType() {
        return property.getPropertyType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.PROPERTY_GET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyGet(this, context);
    }
}
