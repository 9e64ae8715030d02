package com.typebridge.expr.node;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprKind;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 记录构造，参数按记录字段声明顺序给出。
 */
public class NewRecordExpr extends Expr {

    private final TypeDescriptor recordType;
    private final List<Expr> args;

    public NewRecordExpr(TypeDescriptor recordType, List<Expr> args) {
        this.recordType = recordType;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public List<Expr> getArgs() {
        return args;
    }

    @Override
    public TypeDescriptor getType() {
        return recordType;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.NEW_RECORD;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitNewRecord(this, context);
    }
}
