package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TypeDescriptor;

import java.util.List;

/**
 * 元组投影。
 */
public class TupleGetExpr extends Expr {

    private final Expr tuple;
    private final int index;
    private final TypeDescriptor type;

    public TupleGetExpr(Expr tuple, int index) {
        List<TypeDescriptor> elements = tuple.getType().getTupleElements();
        if (index < 0 || index >= elements.size()) {
            throw new IllegalArgumentException("Tuple index " + index + " out of range for '" + tuple.getType() + "'");
        }
        this.tuple = tuple;
        this.index = index;
        this.type = elements.get(index);
    }

    public Expr getTuple() {
        return tuple;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public TypeDescriptor getType() {
        return type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.TUPLE_GET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitTupleGet(this, context);
    }
}
