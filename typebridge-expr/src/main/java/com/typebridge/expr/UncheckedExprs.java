package com.typebridge.expr;

import com.typebridge.expr.node.*;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.UnionCaseInfo;

import java.util.Arrays;
import java.util.List;

/**
 * 原始构造（raw construct）：与 {@link Exprs} 相同的节点，但不做任何静态/实例、参数个数、
 * 类型兼容性校验。
 * <p>
 * 仅供变换器内部使用：跨类型宇宙改写时，节点持有的成员签名只在<b>另一个</b>宇宙里成立，
 * 按当前宇宙校验必然失败。不安全，不要在业务代码里直接使用。
 */
public final class UncheckedExprs {

    private UncheckedExprs() {
    }

    public static Expr call(Expr target, MethodDescriptor method, List<Expr> args) {
        return new CallExpr(target, method, args);
    }

    public static Expr propertyGet(Expr target, PropertyDescriptor property, List<Expr> indexArgs) {
        return new PropertyGetExpr(target, property, indexArgs);
    }

    public static Expr propertySet(Expr target, PropertyDescriptor property, List<Expr> indexArgs, Expr value) {
        return new PropertySetExpr(target, property, indexArgs, value);
    }

    public static Expr fieldGet(Expr target, FieldDescriptor field) {
        return new FieldGetExpr(target, field);
    }

    public static Expr fieldSet(Expr target, FieldDescriptor field, Expr value) {
        return new FieldSetExpr(target, field, value);
    }

    public static Expr newObject(ConstructorDescriptor constructor, List<Expr> args) {
        return new NewObjectExpr(constructor, args);
    }

    public static Expr coerce(Expr operand, TypeDescriptor targetType) {
        return new CoerceExpr(operand, targetType);
    }

    public static Expr newArray(TypeDescriptor elementType, List<Expr> elements) {
        return new NewArrayExpr(elementType, elements);
    }

    public static Expr newTuple(List<Expr> elements) {
        return new NewTupleExpr(elements);
    }

    public static Expr tupleGet(Expr tuple, int index) {
        return new TupleGetExpr(tuple, index);
    }

    public static Expr newDelegate(TypeDescriptor delegateType, List<Var> parameters, Expr body) {
        return new NewDelegateExpr(delegateType, parameters, body);
    }

    public static Expr let(Var var, Expr value, Expr body) {
        return new LetExpr(var, value, body);
    }

    public static Expr var(Var var) {
        return new VarExpr(var);
    }

    public static Expr lambda(Var parameter, Expr body, TypeDescriptor functionType) {
        return new LambdaExpr(parameter, body, functionType);
    }

    public static Expr application(Expr function, Expr argument) {
        return new ApplicationExpr(function, argument);
    }

    public static Expr newUnionCase(UnionCaseInfo unionCase, List<Expr> args) {
        return new NewUnionCaseExpr(unionCase, args);
    }

    public static Expr newRecord(TypeDescriptor recordType, List<Expr> args) {
        return new NewRecordExpr(recordType, args);
    }

    public static Expr unionCaseTest(Expr target, UnionCaseInfo unionCase) {
        return new UnionCaseTestExpr(target, unionCase);
    }

    public static Expr value(Object value, TypeDescriptor type) {
        return new ValueExpr(value, type);
    }

    public static Expr operation(OperationExpr.Operator operator, TypeDescriptor type, Expr... operands) {
        return new OperationExpr(operator, Arrays.asList(operands), type);
    }

    public static Expr ifThenElse(Expr condition, Expr thenExpr, Expr elseExpr) {
        return new IfThenElseExpr(condition, thenExpr, elseExpr);
    }

    public static Expr sequential(Expr first, Expr second) {
        return new SequentialExpr(first, second);
    }

    public static Expr varSet(Var var, Expr value) {
        return new VarSetExpr(var, value);
    }

    public static Expr whileLoop(Expr condition, Expr body) {
        return new WhileLoopExpr(condition, body);
    }
}
