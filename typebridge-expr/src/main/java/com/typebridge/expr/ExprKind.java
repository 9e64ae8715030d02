package com.typebridge.expr;

/**
 * 表达式节点种类（封闭集合）。
 */
public enum ExprKind {
    CALL,
    PROPERTY_GET,
    PROPERTY_SET,
    FIELD_GET,
    FIELD_SET,
    NEW_OBJECT,
    COERCE,
    NEW_ARRAY,
    NEW_TUPLE,
    TUPLE_GET,
    NEW_DELEGATE,
    LET,
    VAR,
    LAMBDA,

    // 可脱糖的高层节点
    APPLICATION,
    NEW_UNION_CASE,
    NEW_RECORD,
    UNION_CASE_TEST,

    // 结构组合（ShapeCombination）
    VALUE,
    OPERATION,
    IF_THEN_ELSE,
    SEQUENTIAL,
    VAR_SET,
    WHILE_LOOP;

    public boolean isShapeCombination() {
        return ordinal() >= VALUE.ordinal();
    }
}
