package com.typebridge.expr;

import com.typebridge.expr.node.*;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.RecordInfo;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.UnionCaseInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 带校验的表达式工厂。
 * <p>
 * 校验静态/实例一致、参数个数、参数类型可赋值，不通过时抛 {@link IllegalArgumentException}。
 * 类型兼容按描述符判断，所以来自另一个类型宇宙的同名类型会被拒绝；
 * 跨宇宙重建请用 {@link UncheckedExprs}。
 */
public final class Exprs {

    private Exprs() {
    }

    // ==================== 成员访问 ====================

    public static Expr call(Expr target, MethodDescriptor method, List<Expr> args) {
        checkReceiver(method.isStatic(), target, method.getDeclaringType(), method.toString());
        checkArguments(method.toString(), method.getParameterTypes(), args);
        return new CallExpr(target, method, args);
    }

    public static Expr call(Expr target, MethodDescriptor method, Expr... args) {
        return call(target, method, Arrays.asList(args));
    }

    public static Expr callStatic(MethodDescriptor method, Expr... args) {
        return call(null, method, Arrays.asList(args));
    }

    public static Expr propertyGet(Expr target, PropertyDescriptor property, List<Expr> indexArgs) {
        if (!property.canRead()) {
            throw new IllegalArgumentException("Property '" + property + "' has no getter");
        }
        checkReceiver(property.isStatic(), target, property.getDeclaringType(), property.toString());
        checkArguments(property.toString(), parameterTypes(property), indexArgs);
        return new PropertyGetExpr(target, property, indexArgs);
    }

    public static Expr propertyGet(Expr target, PropertyDescriptor property) {
        return propertyGet(target, property, Collections.emptyList());
    }

    public static Expr propertySet(Expr target, PropertyDescriptor property, List<Expr> indexArgs, Expr value) {
        if (!property.canWrite()) {
            throw new IllegalArgumentException("Property '" + property + "' has no setter");
        }
        checkReceiver(property.isStatic(), target, property.getDeclaringType(), property.toString());
        checkArguments(property.toString(), parameterTypes(property), indexArgs);
        checkAssignable(property.getPropertyType(), value, "value of '" + property + "'");
        return new PropertySetExpr(target, property, indexArgs, value);
    }

    public static Expr propertySet(Expr target, PropertyDescriptor property, Expr value) {
        return propertySet(target, property, Collections.emptyList(), value);
    }

    public static Expr fieldGet(Expr target, FieldDescriptor field) {
        checkReceiver(field.isStatic(), target, field.getDeclaringType(), field.toString());
        return new FieldGetExpr(target, field);
    }

    public static Expr fieldSet(Expr target, FieldDescriptor field, Expr value) {
        checkReceiver(field.isStatic(), target, field.getDeclaringType(), field.toString());
        checkAssignable(field.getFieldType(), value, "value of '" + field + "'");
        return new FieldSetExpr(target, field, value);
    }

    public static Expr newObject(ConstructorDescriptor constructor, Expr... args) {
        List<Expr> list = Arrays.asList(args);
        checkArguments(constructor.toString(), constructor.getParameterTypes(), list);
        return new NewObjectExpr(constructor, list);
    }

    public static Expr coerce(Expr operand, TypeDescriptor targetType) {
        return new CoerceExpr(operand, targetType);
    }

    public static Expr newArray(TypeDescriptor elementType, Expr... elements) {
        for (Expr e : elements) {
            checkAssignable(elementType, e, "array element");
        }
        return new NewArrayExpr(elementType, Arrays.asList(elements));
    }

    // ==================== 元组 / 委托 / 绑定 ====================

    public static Expr newTuple(Expr... elements) {
        if (elements.length < 2) {
            throw new IllegalArgumentException("A tuple needs at least two elements, got " + elements.length);
        }
        return new NewTupleExpr(Arrays.asList(elements));
    }

    public static Expr tupleGet(Expr tuple, int index) {
        if (!tuple.getType().isTuple()) {
            throw new IllegalArgumentException("'" + tuple.getType() + "' is not a tuple type");
        }
        return new TupleGetExpr(tuple, index);
    }

    public static Expr newDelegate(TypeDescriptor delegateType, List<Var> parameters, Expr body) {
        MethodDescriptor invoke = delegateType.getMethod(ApplicationExpr.INVOKE);
        if (invoke == null) {
            throw new IllegalArgumentException("Type '" + delegateType + "' is not a delegate type");
        }
        List<TypeDescriptor> varTypes = new ArrayList<>();
        for (Var v : parameters) varTypes.add(v.getType());
        if (!invoke.getParameterTypes().equals(varTypes)) {
            throw new IllegalArgumentException("Delegate '" + delegateType + "' expects parameters "
                    + invoke.getParameterTypes() + ", got " + varTypes);
        }
        checkAssignable(invoke.getReturnType(), body, "delegate body");
        return new NewDelegateExpr(delegateType, parameters, body);
    }

    public static Expr let(Var var, Expr value, Expr body) {
        checkAssignable(var.getType(), value, "binding of '" + var.getName() + "'");
        return new LetExpr(var, value, body);
    }

    public static Expr var(Var var) {
        return new VarExpr(var);
    }

    public static Expr lambda(Var parameter, Expr body, TypeDescriptor functionType) {
        MethodDescriptor invoke = functionType.getMethod(ApplicationExpr.INVOKE);
        if (invoke == null || invoke.getParameterTypes().size() != 1) {
            throw new IllegalArgumentException("Type '" + functionType + "' is not a single-argument function type");
        }
        if (!invoke.getParameterTypes().get(0).equals(parameter.getType())) {
            throw new IllegalArgumentException("Lambda parameter '" + parameter.getName() + "' has type '"
                    + parameter.getType() + "', function type expects '" + invoke.getParameterTypes().get(0) + "'");
        }
        checkAssignable(invoke.getReturnType(), body, "lambda body");
        return new LambdaExpr(parameter, body, functionType);
    }

    // ==================== 可脱糖 ====================

    public static Expr application(Expr function, Expr argument) {
        ApplicationExpr app = new ApplicationExpr(function, argument);
        checkArguments(app.getInvokeMethod().toString(), app.getInvokeMethod().getParameterTypes(),
                Collections.singletonList(argument));
        return app;
    }

    public static Expr newUnionCase(UnionCaseInfo unionCase, Expr... args) {
        List<Expr> list = Arrays.asList(args);
        checkArguments(unionCase.toString(), unionCase.getFieldTypes(), list);
        return new NewUnionCaseExpr(unionCase, list);
    }

    public static Expr newRecord(TypeDescriptor recordType, Expr... args) {
        RecordInfo info = recordType.getRecordInfo();
        if (info == null) {
            throw new IllegalArgumentException("Type '" + recordType + "' is not a record type");
        }
        List<Expr> list = Arrays.asList(args);
        checkArguments(recordType.toString(), info.getFieldTypes(), list);
        return new NewRecordExpr(recordType, list);
    }

    public static Expr unionCaseTest(Expr target, UnionCaseInfo unionCase) {
        checkAssignable(unionCase.getDeclaringType(), target, "union case test target");
        return new UnionCaseTestExpr(target, unionCase);
    }

    // ==================== 结构组合 ====================

    public static Expr value(Object value, TypeDescriptor type) {
        return new ValueExpr(value, type);
    }

    public static Expr value(int value) {
        return new ValueExpr(value, PrimitiveType.INT);
    }

    public static Expr value(boolean value) {
        return new ValueExpr(value, PrimitiveType.BOOLEAN);
    }

    /**
     * 比较与逻辑运算结果为 boolean，算术运算结果为第一个操作数的类型。
     */
    public static Expr operation(OperationExpr.Operator operator, Expr... operands) {
        List<Expr> list = Arrays.asList(operands);
        TypeDescriptor type;
        switch (operator) {
            case NOT:
            case AND:
            case OR:
                for (Expr e : list) checkAssignable(PrimitiveType.BOOLEAN, e, operator + " operand");
                type = PrimitiveType.BOOLEAN;
                break;
            default:
                if (list.size() == 2 && !list.get(0).getType().equals(list.get(1).getType())) {
                    throw new IllegalArgumentException("Operands of " + operator + " differ: '"
                            + list.get(0).getType() + "' vs '" + list.get(1).getType() + "'");
                }
                type = operator.isComparison() ? PrimitiveType.BOOLEAN : list.get(0).getType();
        }
        return new OperationExpr(operator, list, type);
    }

    public static Expr ifThenElse(Expr condition, Expr thenExpr, Expr elseExpr) {
        checkAssignable(PrimitiveType.BOOLEAN, condition, "condition");
        if (!thenExpr.getType().equals(elseExpr.getType())) {
            throw new IllegalArgumentException("Branches differ: '" + thenExpr.getType()
                    + "' vs '" + elseExpr.getType() + "'");
        }
        return new IfThenElseExpr(condition, thenExpr, elseExpr);
    }

    public static Expr sequential(Expr first, Expr second) {
        return new SequentialExpr(first, second);
    }

    public static Expr varSet(Var var, Expr value) {
        if (!var.isMutable()) {
            throw new IllegalArgumentException("Variable '" + var.getName() + "' is not mutable");
        }
        checkAssignable(var.getType(), value, "assignment to '" + var.getName() + "'");
        return new VarSetExpr(var, value);
    }

    public static Expr whileLoop(Expr condition, Expr body) {
        checkAssignable(PrimitiveType.BOOLEAN, condition, "loop condition");
        return new WhileLoopExpr(condition, body);
    }

    // ==================== 校验 ====================

    private static List<TypeDescriptor> parameterTypes(PropertyDescriptor property) {
        List<TypeDescriptor> types = new ArrayList<>();
        property.getIndexParameters().forEach(p -> types.add(p.getType()));
        return types;
    }

    private static void checkReceiver(boolean isStatic, Expr target, TypeDescriptor declaringType, String member) {
        if (isStatic && target != null) {
            throw new IllegalArgumentException("Static member '" + member + "' must not have a target");
        }
        if (!isStatic) {
            if (target == null) {
                throw new IllegalArgumentException("Instance member '" + member + "' requires a target");
            }
            checkAssignable(declaringType, target, "target of '" + member + "'");
        }
    }

    private static void checkArguments(String member, List<TypeDescriptor> expected, List<Expr> args) {
        if (expected.size() != args.size()) {
            throw new IllegalArgumentException("'" + member + "' expects " + expected.size()
                    + " arguments, got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            checkAssignable(expected.get(i), args.get(i), "argument " + i + " of '" + member + "'");
        }
    }

    private static void checkAssignable(TypeDescriptor expected, Expr actual, String what) {
        if (!expected.isAssignableFrom(actual.getType())) {
            throw new IllegalArgumentException("Type mismatch for " + what + ": expected '" + expected
                    + "', got '" + actual.getType() + "'");
        }
    }
}
