package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 方法调用。静态调用时 target 为 null。
 */
public class CallExpr extends Expr {

    private final Expr target;
    private final MethodDescriptor method;
    private final List<Expr> args;

    public CallExpr(Expr target, MethodDescriptor method, List<Expr> args) {
        this.target = target;
        this.method = method;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Expr getTarget() {
        return target;
    }

    public boolean isStatic() {
        return target == null;
    }

    public MethodDescriptor getMethod() {
        return method;
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public TypeDescriptor getType() {
        return method.getReturnType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CALL;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
