package com.typebridge.expr;

import com.typebridge.model.TypeDescriptor;

/**
 * 表达式节点基类。所有节点都携带静态类型，子节点归父节点所有；
 * 只有对同一 {@link Var} 的多次引用是有意的共享。
 */
public abstract class Expr {

    public abstract TypeDescriptor getType();

    public abstract ExprKind getKind();

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
