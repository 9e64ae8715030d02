package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.Var;
import com.typebridge.model.TypeDescriptor;

/**
 * 单参数函数字面量（一等函数值）。functionType 是承载 Invoke 方法的函数类型。
 */
public class LambdaExpr extends Expr {

    private final Var parameter;
    private final Expr body;
    private final TypeDescriptor functionType;

    public LambdaExpr(Var parameter, Expr body, TypeDescriptor functionType) {
        this.parameter = parameter;
        this.body = body;
        this.functionType = functionType;
    }

    public Var getParameter() {
        return parameter;
    }

    public Expr getBody() {
        return body;
    }

    @Override
    public TypeDescriptor getType() {
        return functionType;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LAMBDA;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLambda(this, context);
    }
}
