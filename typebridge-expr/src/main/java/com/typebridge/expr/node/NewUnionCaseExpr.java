package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.UnionCaseInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 联合类型用例构造，如 {@code Some(5)}。
 */
public class NewUnionCaseExpr extends Expr {

    private final UnionCaseInfo unionCase;
    private final List<Expr> args;

    public NewUnionCaseExpr(UnionCaseInfo unionCase, List<Expr> args) {
        this.unionCase = unionCase;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public UnionCaseInfo getUnionCase() {
        return unionCase;
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public TypeDescriptor getType() {
        return unionCase.getDeclaringType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_UNION_CASE;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewUnionCase(this, context);
    }
}
