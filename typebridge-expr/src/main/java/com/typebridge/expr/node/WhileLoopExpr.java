package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;

import java.util.Arrays;
import java.util.List;

public class WhileLoopExpr extends Expr implements ShapeCombination {

    private final Expr condition;
    private final Expr body;

    public WhileLoopExpr(Expr condition, Expr body) {
        this.condition = condition;
        this.body = body;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getBody() {
        return body;
    }

    @Override
    public TypeDescriptor getType() {
        return PrimitiveType.VOID;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.WHILE_LOOP;
    }

    @Override
    public List<Expr> getChildren() {
        return Arrays.asList(condition, body);
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        return new WhileLoopExpr(children.get(0), children.get(1));
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitWhileLoop(this, context);
    }
}
