package com.typebridge.expr;

import java.util.List;

/**
 * 结构组合节点：子表达式之外的元数据（常量、运算符、结果类型）与类型宇宙无关，
 * 重建时原样保留。
 */
public interface ShapeCombination {

    List<Expr> getChildren();

    /**
     * 用新的子表达式重建同形节点。子节点数量必须与 {@link #getChildren()} 一致。
     */
    Expr rebuild(List<Expr> children);
}
