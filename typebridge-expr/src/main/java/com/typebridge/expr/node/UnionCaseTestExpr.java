package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.UnionCaseInfo;

/**
 * 判断联合值是否为指定用例。
 */
public class UnionCaseTestExpr extends Expr {

    private final Expr target;
    private final UnionCaseInfo unionCase;

    public UnionCaseTestExpr(Expr target, UnionCaseInfo unionCase) {
        this.target = target;
        this.unionCase = unionCase;
    }

    public Expr getTarget() {
        return target;
    }

    public UnionCaseInfo getUnionCase() {
        return unionCase;
    }

    @Override
    public TypeDescriptor getType() {
        return PrimitiveType.BOOLEAN;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.UNION_CASE_TEST;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitUnionCaseTest(this, context);
    }
}
