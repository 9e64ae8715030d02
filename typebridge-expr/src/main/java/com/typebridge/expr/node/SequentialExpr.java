package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.model.TypeDescriptor;

import java.util.Arrays;
import java.util.List;

/**
 * first; second，结果为 second 的值。
 */
public class SequentialExpr extends Expr implements ShapeCombination {

    private final Expr first;
    private final Expr second;

    public SequentialExpr(Expr first, Expr second) {
        this.first = first;
        this.second = second;
    }

    public Expr getFirst() {
        return first;
    }

    public Expr getSecond() {
        return second;
    }

    @Override
    public TypeDescriptor getType() {
        return second.getType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SEQUENTIAL;
    }

    @Override
    public List<Expr> getChildren() {
        return Arrays.asList(first, second);
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        return new SequentialExpr(children.get(0), children.get(1));
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSequential(this, context);
    }
}
