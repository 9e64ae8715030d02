package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.ShapeCombination;
import com.typebridge.expr.Var;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;

import java.util.Arrays;
import java.util.List;

/**
 * 可变变量赋值。被赋值的变量以 {@link VarExpr} 子节点出现，
 * 这样变换器改写变量引用时赋值目标也随之改写。
 */
public class VarSetExpr extends Expr implements ShapeCombination {

    private final VarExpr target;
    private final Expr value;

    public VarSetExpr(Var var, Expr value) {
        this.target = new VarExpr(var);
        this.value = value;
    }

    public Var getVar() {
        return target.getVar();
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
        return ExprKind.VAR_SET;
    }

    @Override
    public List<Expr> getChildren() {
        return Arrays.asList(target, value);
    }

    @Override
    public Expr rebuild(List<Expr> children) {
        Expr newTarget = children.get(0);
        if (!(newTarget instanceof VarExpr)) {
            throw new IllegalArgumentException("Assignment target must be a variable, got " + newTarget.getKind());
        }
        return new VarSetExpr(((VarExpr) newTarget).getVar(), children.get(1));
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitVarSet(this, context);
    }
}
