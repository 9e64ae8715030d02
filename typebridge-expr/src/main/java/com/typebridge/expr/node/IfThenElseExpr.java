package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.model.TypeDescriptor;

import java.util.Arrays;
import java.util.List;

public class IfThenElseExpr extends Expr implements ShapeCombination {

    private final Expr condition;
    private final Expr thenExpr;
    private final Expr elseExpr;

    public IfThenElseExpr(Expr condition, Expr thenExpr, Expr elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getThenExpr() {
        return thenExpr;
    }

    public Expr getElseExpr() {
        return elseExpr;
    }

    @Override
    public TypeDescriptor getType() {
        return thenExpr.getType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.IF_THEN_ELSE;
    }

    @Override
    public List<Expr> getChildren() {
        return Arrays.asList(condition, thenExpr, elseExpr);
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        return new IfThenElseExpr(children.get(0), children.get(1), children.get(2));
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitIfThenElse(this, context);
    }
}
