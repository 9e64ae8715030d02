package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.Var;
import com.typebridge.model.TypeDescriptor;

/**
 * let var = value in body
 */
public class LetExpr extends Expr {

    private final Var var;
    private final Expr value;
    private final Expr body;

    public LetExpr(Var var, Expr value, Expr body) {
        this.var = var;
        this.value = value;
        this.body = body;
    }

    public Var getVar() {
        return var;
    }

    public Expr getValue() {
        return value;
    }

    public Expr getBody() {
        return body;
    }

    @Override
    public TypeDescriptor getType() {
        return body.getType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LET;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLet(this, context);
    }
}
