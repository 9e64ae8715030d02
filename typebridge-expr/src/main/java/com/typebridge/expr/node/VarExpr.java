package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.Var;
import com.typebridge.model.TypeDescriptor;

public class VarExpr extends Expr {

    private final Var var;

    public VarExpr(Var var) {
        this.var = var;
    }

    public Var getVar() {
        return var;
    }

    @Override
    public TypeDescriptor getType() {
        return var.getType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.VAR;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitVar(this, context);
    }
}
