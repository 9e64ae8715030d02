package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.Var;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 委托构造：参数列表 + 主体，一次性接收全部参数（非柯里化）。
 */
public class NewDelegateExpr extends Expr {

    private final TypeDescriptor delegateType;
    private final List<Var> parameters;
    private final Expr body;

    public NewDelegateExpr(TypeDescriptor delegateType, List<Var> parameters, Expr body) {
        this.delegateType = delegateType;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = body;
    }

    public List<Var> getParameters() {
        return parameters;
    }

    public Expr getBody() {
        return body;
    }

    @Override
    public TypeDescriptor getType() {
        return delegateType;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_DELEGATE;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewDelegate(this, context);
    }
}
