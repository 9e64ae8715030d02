package com.typebridge.expr;

import com.typebridge.expr.node.*;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.UnionCaseInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点、类型、成员都无变化时返回原节点，否则用
 * {@link UncheckedExprs} 构造新节点。
 * <p>
 * 子类通过 transformType / transformMethod 等钩子替换节点引用的类型与成员，
 * 或覆盖特定 visit 方法改写整类节点。
 */
public class ExprTransformer implements ExprVisitor<Expr, Void> {

    public Expr transform(Expr expr) {
        if (expr == null) return null;
        return expr.accept(this, null);
    }

    // ==================== 钩子 ====================

    protected TypeDescriptor transformType(TypeDescriptor type) {
        return type;
    }

    protected MethodDescriptor transformMethod(MethodDescriptor method) {
        return method;
    }

    protected PropertyDescriptor transformProperty(PropertyDescriptor property) {
        return property;
    }

    protected FieldDescriptor transformField(FieldDescriptor field) {
        return field;
    }

    protected ConstructorDescriptor transformConstructor(ConstructorDescriptor constructor) {
        return constructor;
    }

    protected Var transformVar(Var var) {
        return var;
    }

    protected UnionCaseInfo transformUnionCase(UnionCaseInfo unionCase) {
        return unionCase;
    }

    // ==================== 辅助方法 ====================

    protected List<Expr> transformExprs(List<Expr> exprs) {
        List<Expr> result = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expr original = exprs.get(i);
            Expr transformed = transform(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(exprs.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : exprs;
    }

    protected List<Var> transformVars(List<Var> vars) {
        List<Var> result = null;
        for (int i = 0; i < vars.size(); i++) {
            Var original = vars.get(i);
            Var transformed = transformVar(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(vars.subList(0, i));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : vars;
    }

    /**
     * 结构组合的通用处理：只变换子节点，元数据保持不变。
     */
    protected Expr transformCombination(Expr node) {
        ShapeCombination shape = (ShapeCombination) node;
        List<Expr> children = shape.getChildren();
        List<Expr> transformed = transformExprs(children);
        if (transformed == children) return node;
        return shape.rebuild(transformed);
    }

    // ==================== 成员访问 ====================

    @Override
    public Expr visitCall(CallExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        MethodDescriptor method = transformMethod(node.getMethod());
        List<Expr> args = transformExprs(node.getArgs());
        if (target == node.getTarget() && method == node.getMethod() && args == node.getArgs()) return node;
        return UncheckedExprs.call(target, method, args);
    }

    @Override
    public Expr visitPropertyGet(PropertyGetExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        PropertyDescriptor property = transformProperty(node.getProperty());
        List<Expr> indexArgs = transformExprs(node.getIndexArgs());
        if (target == node.getTarget() && property == node.getProperty()
                && indexArgs == node.getIndexArgs()) return node;
        return UncheckedExprs.propertyGet(target, property, indexArgs);
    }

    @Override
    public Expr visitPropertySet(PropertySetExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        PropertyDescriptor property = transformProperty(node.getProperty());
        List<Expr> indexArgs = transformExprs(node.getIndexArgs());
        Expr value = transform(node.getValue());
        if (target == node.getTarget() && property == node.getProperty()
                && indexArgs == node.getIndexArgs() && value == node.getValue()) return node;
        return UncheckedExprs.propertySet(target, property, indexArgs, value);
    }

    @Override
    public Expr visitFieldGet(FieldGetExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        FieldDescriptor field = transformField(node.getField());
        if (target == node.getTarget() && field == node.getField()) return node;
        return UncheckedExprs.fieldGet(target, field);
    }

    @Override
    public Expr visitFieldSet(FieldSetExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        FieldDescriptor field = transformField(node.getField());
        Expr value = transform(node.getValue());
        if (target == node.getTarget() && field == node.getField() && value == node.getValue()) return node;
        return UncheckedExprs.fieldSet(target, field, value);
    }

    @Override
    public Expr visitNewObject(NewObjectExpr node, Void ctx) {
        ConstructorDescriptor constructor = transformConstructor(node.getConstructor());
        List<Expr> args = transformExprs(node.getArgs());
        if (constructor == node.getConstructor() && args == node.getArgs()) return node;
        return UncheckedExprs.newObject(constructor, args);
    }

    @Override
    public Expr visitCoerce(CoerceExpr node, Void ctx) {
        Expr operand = transform(node.getOperand());
        TypeDescriptor type = transformType(node.getType());
        if (operand == node.getOperand() && type == node.getType()) return node;
        return UncheckedExprs.coerce(operand, type);
    }

    @Override
    public Expr visitNewArray(NewArrayExpr node, Void ctx) {
        TypeDescriptor elementType = transformType(node.getElementType());
        List<Expr> elements = transformExprs(node.getElements());
        if (elementType == node.getElementType() && elements == node.getElements()) return node;
        return UncheckedExprs.newArray(elementType, elements);
    }

    // ==================== 元组 / 委托 / 绑定 ====================

    @Override
    public Expr visitNewTuple(NewTupleExpr node, Void ctx) {
        List<Expr> elements = transformExprs(node.getElements());
        if (elements == node.getElements()) return node;
        return UncheckedExprs.newTuple(elements);
    }

    @Override
    public Expr visitTupleGet(TupleGetExpr node, Void ctx) {
        Expr tuple = transform(node.getTuple());
        if (tuple == node.getTuple()) return node;
        return UncheckedExprs.tupleGet(tuple, node.getIndex());
    }

    @Override
    public Expr visitNewDelegate(NewDelegateExpr node, Void ctx) {
        TypeDescriptor type = transformType(node.getType());
        List<Var> parameters = transformVars(node.getParameters());
        Expr body = transform(node.getBody());
        if (type == node.getType() && parameters == node.getParameters() && body == node.getBody()) return node;
        return UncheckedExprs.newDelegate(type, parameters, body);
    }

    @Override
    public Expr visitLet(LetExpr node, Void ctx) {
        Var var = transformVar(node.getVar());
        Expr value = transform(node.getValue());
        Expr body = transform(node.getBody());
        if (var == node.getVar() && value == node.getValue() && body == node.getBody()) return node;
        return UncheckedExprs.let(var, value, body);
    }

    @Override
    public Expr visitVar(VarExpr node, Void ctx) {
        Var var = transformVar(node.getVar());
        if (var == node.getVar()) return node;
        return UncheckedExprs.var(var);
    }

    @Override
    public Expr visitLambda(LambdaExpr node, Void ctx) {
        Var parameter = transformVar(node.getParameter());
        Expr body = transform(node.getBody());
        TypeDescriptor type = transformType(node.getType());
        if (parameter == node.getParameter() && body == node.getBody() && type == node.getType()) return node;
        return UncheckedExprs.lambda(parameter, body, type);
    }

    // ==================== 可脱糖 ====================

    @Override
    public Expr visitApplication(ApplicationExpr node, Void ctx) {
        Expr function = transform(node.getFunction());
        Expr argument = transform(node.getArgument());
        if (function == node.getFunction() && argument == node.getArgument()) return node;
        return UncheckedExprs.application(function, argument);
    }

    @Override
    public Expr visitNewUnionCase(NewUnionCaseExpr node, Void ctx) {
        UnionCaseInfo unionCase = transformUnionCase(node.getUnionCase());
        List<Expr> args = transformExprs(node.getArgs());
        if (unionCase == node.getUnionCase() && args == node.getArgs()) return node;
        return UncheckedExprs.newUnionCase(unionCase, args);
    }

    @Override
    public Expr visitNewRecord(NewRecordExpr node, Void ctx) {
        TypeDescriptor type = transformType(node.getType());
        List<Expr> args = transformExprs(node.getArgs());
        if (type == node.getType() && args == node.getArgs()) return node;
        return UncheckedExprs.newRecord(type, args);
    }

    @Override
    public Expr visitUnionCaseTest(UnionCaseTestExpr node, Void ctx) {
        Expr target = transform(node.getTarget());
        UnionCaseInfo unionCase = transformUnionCase(node.getUnionCase());
        if (target == node.getTarget() && unionCase == node.getUnionCase()) return node;
        return UncheckedExprs.unionCaseTest(target, unionCase);
    }

    // ==================== 结构组合 ====================

    @Override
    public Expr visitValue(ValueExpr node, Void ctx) {
        return transformCombination(node);
    }

    @Override
    public Expr visitOperation(OperationExpr node, Void ctx) {
        return transformCombination(node);
    }

    @Override
    public Expr visitIfThenElse(IfThenElseExpr node, Void ctx) {
        return transformCombination(node);
    }

    @Override
    public Expr visitSequential(SequentialExpr node, Void ctx) {
        return transformCombination(node);
    }

    @Override
    public Expr visitVarSet(VarSetExpr node, Void ctx) {
        return transformCombination(node);
    }

    @Override
    public Expr visitWhileLoop(WhileLoopExpr node, Void ctx) {
        return transformCombination(node);
    }
}
