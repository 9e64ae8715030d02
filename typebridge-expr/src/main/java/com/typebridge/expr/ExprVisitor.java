package com.typebridge.expr;

import com.typebridge.expr.node.*;

/**
 * 表达式访问者接口，每种 {@link ExprKind} 一个 visit 方法。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface ExprVisitor<R, C> {

    // ===== 成员访问 (8) =====
    R visitCall(CallExpr node, C context);
    R visitPropertyGet(PropertyGetExpr node, C context);
    R visitPropertySet(PropertySetExpr node, C context);
    R visitFieldGet(FieldGetExpr node, C context);
    R visitFieldSet(FieldSetExpr node, C context);
    R visitNewObject(NewObjectExpr node, C context);
    R visitCoerce(CoerceExpr node, C context);
    R visitNewArray(NewArrayExpr node, C context);

    // ===== 元组 / 委托 / 绑定 (6) =====
    R visitNewTuple(NewTupleExpr node, C context);
    R visitTupleGet(TupleGetExpr node, C context);
    R visitNewDelegate(NewDelegateExpr node, C context);
    R visitLet(LetExpr node, C context);
    R visitVar(VarExpr node, C context);
    R visitLambda(LambdaExpr node, C context);

    // ===== 可脱糖 (4) =====
    R visitApplication(ApplicationExpr node, C context);
    R visitNewUnionCase(NewUnionCaseExpr node, C context);
    R visitNewRecord(NewRecordExpr node, C context);
    R visitUnionCaseTest(UnionCaseTestExpr node, C context);

    // ===== 结构组合 (6) =====
    R visitValue(ValueExpr node, C context);
    R visitOperation(OperationExpr node, C context);
    R visitIfThenElse(IfThenElseExpr node, C context);
    R visitSequential(SequentialExpr node, C context);
    R visitVarSet(VarSetExpr node, C context);
    R visitWhileLoop(WhileLoopExpr node, C context);
}
