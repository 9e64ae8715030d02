package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.TypeDescriptor;

/**
 * 函数值应用 {@code f e}。函数值的类型必须有唯一的 Invoke 方法。
 */
public class ApplicationExpr extends Expr {

    public static final String INVOKE = "Invoke";

    private final Expr function;
    private final Expr argument;

    public ApplicationExpr(Expr function, Expr argument) {
        if (function.getType().getMethod(INVOKE) == null) {
            throw new IllegalArgumentException("Type '" + function.getType() + "' is not a function type");
        }
        this.function = function;
        this.argument = argument;
    }

    public Expr getFunction() {
        return function;
    }

    public Expr getArgument() {
        return argument;
    }

    public MethodDescriptor getInvokeMethod() {
        return function.getType().getMethod(INVOKE);
    }

    @Override
    public TypeDescriptor getType() {
        return getInvokeMethod().getReturnType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.APPLICATION;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitApplication(this, context);
    }
}
