package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 对象构造，类型即构造器的声明类型。
 */
public class NewObjectExpr extends Expr {

    private final ConstructorDescriptor constructor;
    private final List<Expr> args;

    public NewObjectExpr(ConstructorDescriptor constructor, List<Expr> args) {
        this.constructor = constructor;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public ConstructorDescriptor getConstructor() {
        return constructor;
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public TypeDescriptor getType() {
        return constructor.getDeclaringType();
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_OBJECT;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewObject(this, context);
    }
}
