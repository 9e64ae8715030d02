package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一维数组构造。
 */
public class NewArrayExpr extends Expr {

    private final TypeDescriptor elementType;
    private final List<Expr> elements;

    public NewArrayExpr(TypeDescriptor elementType, List<Expr> elements) {
        this.elementType = elementType;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public TypeDescriptor getElementType() {
        return elementType;
    }

    public List<Expr> getElements() {
        return elements;
    }

    @Override
    public TypeDescriptor getType() {
        return elementType.makeArrayType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_ARRAY;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewArray(this, context);
    }
}
