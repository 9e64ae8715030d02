package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TupleType;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元组构造，类型由元素类型推出。
 */
public class NewTupleExpr extends Expr {

    private final List<Expr> elements;
    private final TupleType type;

    public NewTupleExpr(List<Expr> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        List<TypeDescriptor> types = new ArrayList<>(elements.size());
        for (Expr e : elements) types.add(e.getType());
        this.type = TupleType.of(types);
    }

    public List<Expr> getElements() {
        return elements;
    }

    @Override
    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_TUPLE;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewTuple(this, context);
    }
}
