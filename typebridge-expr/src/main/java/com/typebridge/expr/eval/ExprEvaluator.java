package com.typebridge.expr.eval;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprVisitor;
import com.typebridge.expr.Var;
import com.typebridge.expr.node.*;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.DataTypeReflection;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MemberDescriptor;
import com.typebridge.model.MemberInvoker;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.runtime.DelegateValue;
import com.typebridge.model.runtime.FunctionValue;
import com.typebridge.model.runtime.ObjectValue;
import com.typebridge.model.runtime.UnionValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 参考求值器：通过成员上挂的 {@link MemberInvoker} 执行表达式树。
 * <p>
 * 运行时值约定：
 * <ul>
 *   <li>基本类型用装箱值（Integer、Boolean ...）</li>
 *   <li>数组为 Object[]，元组为不可变 List</li>
 *   <li>lambda 求值为 {@link FunctionValue}，委托求值为 {@link DelegateValue}</li>
 *   <li>联合值为 {@link UnionValue}，实例字段存于 {@link ObjectValue}</li>
 * </ul>
 * 静态字段存放在求值器实例内。
 */
public final class ExprEvaluator implements ExprVisitor<Object, EvalEnvironment> {

    private final Map<String, Object> staticFields = new HashMap<>();

    public Object evaluate(Expr expr) {
        return evaluate(expr, EvalEnvironment.empty());
    }

    public Object evaluate(Expr expr, EvalEnvironment env) {
        return expr.accept(this, env);
    }

    private Object eval(Expr expr, EvalEnvironment env) {
        return expr == null ? null : expr.accept(this, env);
    }

    private List<Object> evalAll(List<Expr> exprs, EvalEnvironment env) {
        List<Object> values = new ArrayList<>(exprs.size());
        for (Expr e : exprs) values.add(eval(e, env));
        return values;
    }

    private static Object invoke(MemberDescriptor member, MemberInvoker invoker, Object target, List<Object> args) {
        if (invoker == null) {
            throw new EvaluationException("Member '" + member + "' has no implementation");
        }
        try {
            return invoker.invoke(target, args);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Invocation of '" + member + "' failed: " + e.getMessage(), e);
        }
    }

    private static String staticKey(FieldDescriptor field) {
        return field.getDeclaringType().getFullName() + "::" + field.getName();
    }

    // ==================== 成员访问 ====================

    @Override
    public Object visitCall(CallExpr node, EvalEnvironment env) {
        Object target = eval(node.getTarget(), env);
        List<Object> args = evalAll(node.getArgs(), env);
        MethodDescriptor method = node.getMethod();
        return invoke(method, method.getInvoker(), target, args);
    }

    @Override
    public Object visitPropertyGet(PropertyGetExpr node, EvalEnvironment env) {
        Object target = eval(node.getTarget(), env);
        List<Object> args = evalAll(node.getIndexArgs(), env);
        MethodDescriptor getter = node.getProperty().getGetter();
        if (getter == null) {
            throw new EvaluationException("Property '" + node.getProperty() + "' has no getter");
        }
        return invoke(node.getProperty(), getter.getInvoker(), target, args);
    }

    @Override
    public Object visitPropertySet(PropertySetExpr node, EvalEnvironment env) {
        Object target = eval(node.getTarget(), env);
        List<Object> args = evalAll(node.getIndexArgs(), env);
        args.add(eval(node.getValue(), env));
        MethodDescriptor setter = node.getProperty().getSetter();
        if (setter == null) {
            throw new EvaluationException("Property '" + node.getProperty() + "' has no setter");
        }
        invoke(node.getProperty(), setter.getInvoker(), target, args);
        return null;
    }

    @Override
    public Object visitFieldGet(FieldGetExpr node, EvalEnvironment env) {
        FieldDescriptor field = node.getField();
        if (node.getTarget() == null) {
            return staticFields.get(staticKey(field));
        }
        return asObject(eval(node.getTarget(), env), field).getField(field.getName());
    }

    @Override
    public Object visitFieldSet(FieldSetExpr node, EvalEnvironment env) {
        FieldDescriptor field = node.getField();
        if (node.getTarget() == null) {
            staticFields.put(staticKey(field), eval(node.getValue(), env));
            return null;
        }
        ObjectValue target = asObject(eval(node.getTarget(), env), field);
        target.setField(field.getName(), eval(node.getValue(), env));
        return null;
    }

    private static ObjectValue asObject(Object value, FieldDescriptor field) {
        if (!(value instanceof ObjectValue)) {
            throw new EvaluationException("Field '" + field + "' read on non-object value " + value);
        }
        return (ObjectValue) value;
    }

    @Override
    public Object visitNewObject(NewObjectExpr node, EvalEnvironment env) {
        ConstructorDescriptor constructor = node.getConstructor();
        return invoke(constructor, constructor.getInvoker(), null, evalAll(node.getArgs(), env));
    }

    @Override
    public Object visitCoerce(CoerceExpr node, EvalEnvironment env) {
        return eval(node.getOperand(), env);
    }

    @Override
    public Object visitNewArray(NewArrayExpr node, EvalEnvironment env) {
        return evalAll(node.getElements(), env).toArray();
    }

    // ==================== 元组 / 委托 / 绑定 ====================

    @Override
    public Object visitNewTuple(NewTupleExpr node, EvalEnvironment env) {
        return Collections.unmodifiableList(evalAll(node.getElements(), env));
    }

    @Override
    public Object visitTupleGet(TupleGetExpr node, EvalEnvironment env) {
        Object tuple = eval(node.getTuple(), env);
        if (!(tuple instanceof List)) {
            throw new EvaluationException("Tuple projection on non-tuple value " + tuple);
        }
        return ((List<?>) tuple).get(node.getIndex());
    }

    @Override
    public Object visitNewDelegate(NewDelegateExpr node, EvalEnvironment env) {
        final List<Var> parameters = node.getParameters();
        final Expr body = node.getBody();
        return (DelegateValue) args -> {
            if (args.size() != parameters.size()) {
                throw new EvaluationException("Delegate expects " + parameters.size()
                        + " arguments, got " + args.size());
            }
            EvalEnvironment inner = env;
            for (int i = 0; i < parameters.size(); i++) {
                inner = inner.bind(parameters.get(i), args.get(i));
            }
            return eval(body, inner);
        };
    }

    @Override
    public Object visitLet(LetExpr node, EvalEnvironment env) {
        Object value = eval(node.getValue(), env);
        return eval(node.getBody(), env.bind(node.getVar(), value));
    }

    @Override
    public Object visitVar(VarExpr node, EvalEnvironment env) {
        return env.lookup(node.getVar());
    }

    @Override
    public Object visitLambda(LambdaExpr node, EvalEnvironment env) {
        final Var parameter = node.getParameter();
        final Expr body = node.getBody();
        return (FunctionValue) arg -> eval(body, env.bind(parameter, arg));
    }

    // ==================== 可脱糖 ====================

    @Override
    public Object visitApplication(ApplicationExpr node, EvalEnvironment env) {
        Object function = eval(node.getFunction(), env);
        Object argument = eval(node.getArgument(), env);
        if (!(function instanceof FunctionValue)) {
            throw new EvaluationException("Application of non-function value " + function);
        }
        return ((FunctionValue) function).apply(argument);
    }

    @Override
    public Object visitNewUnionCase(NewUnionCaseExpr node, EvalEnvironment env) {
        MethodDescriptor constructor = DataTypeReflection.precomputeUnionConstructor(node.getUnionCase());
        return invoke(constructor, constructor.getInvoker(), null, evalAll(node.getArgs(), env));
    }

    @Override
    public Object visitNewRecord(NewRecordExpr node, EvalEnvironment env) {
        ConstructorDescriptor constructor = DataTypeReflection.precomputeRecordConstructor(node.getType());
        return invoke(constructor, constructor.getInvoker(), null, evalAll(node.getArgs(), env));
    }

    @Override
    public Object visitUnionCaseTest(UnionCaseTestExpr node, EvalEnvironment env) {
        Object value = eval(node.getTarget(), env);
        if (!(value instanceof UnionValue)) {
            throw new EvaluationException("Union case test on non-union value " + value);
        }
        return ((UnionValue) value).getTag() == node.getUnionCase().getTag();
    }

    // ==================== 结构组合 ====================

    @Override
    public Object visitValue(ValueExpr node, EvalEnvironment env) {
        return node.getValue();
    }

    @Override
    public Object visitOperation(OperationExpr node, EvalEnvironment env) {
        OperationExpr.Operator op = node.getOperator();
        List<Expr> operands = node.getOperands();
        switch (op) {
            case AND:
                return asBoolean(eval(operands.get(0), env)) && asBoolean(eval(operands.get(1), env));
            case OR:
                return asBoolean(eval(operands.get(0), env)) || asBoolean(eval(operands.get(1), env));
            case NOT:
                return !asBoolean(eval(operands.get(0), env));
            case EQUALS:
                return Objects.equals(eval(operands.get(0), env), eval(operands.get(1), env));
            case NOT_EQUALS:
                return !Objects.equals(eval(operands.get(0), env), eval(operands.get(1), env));
            case LESS:
                return compare(operands, env) < 0;
            case LESS_EQUAL:
                return compare(operands, env) <= 0;
            case GREATER:
                return compare(operands, env) > 0;
            case GREATER_EQUAL:
                return compare(operands, env) >= 0;
            default:
                return arithmetic(op, evalAll(operands, env), node.getType());
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private int compare(List<Expr> operands, EvalEnvironment env) {
        Object left = eval(operands.get(0), env);
        Object right = eval(operands.get(1), env);
        if (!(left instanceof Comparable)) {
            throw new EvaluationException("Value " + left + " is not comparable");
        }
        return ((Comparable) left).compareTo(right);
    }

    private static Object arithmetic(OperationExpr.Operator op, List<Object> values, TypeDescriptor type) {
        Number a = asNumber(values.get(0));
        if (op == OperationExpr.Operator.NEGATE) {
            if (type == PrimitiveType.INT) return -a.intValue();
            if (type == PrimitiveType.LONG) return -a.longValue();
            if (type == PrimitiveType.DOUBLE) return -a.doubleValue();
            throw new EvaluationException("Unsupported operand type '" + type + "' for " + op);
        }
        Number b = asNumber(values.get(1));
        if (type == PrimitiveType.INT) {
            int x = a.intValue(), y = b.intValue();
            switch (op) {
                case ADD: return x + y;
                case SUBTRACT: return x - y;
                case MULTIPLY: return x * y;
                case DIVIDE: checkDivisor(y); return x / y;
                case MODULO: checkDivisor(y); return x % y;
                default: break;
            }
        } else if (type == PrimitiveType.LONG) {
            long x = a.longValue(), y = b.longValue();
            switch (op) {
                case ADD: return x + y;
                case SUBTRACT: return x - y;
                case MULTIPLY: return x * y;
                case DIVIDE: checkDivisor(y); return x / y;
                case MODULO: checkDivisor(y); return x % y;
                default: break;
            }
        } else if (type == PrimitiveType.DOUBLE) {
            double x = a.doubleValue(), y = b.doubleValue();
            switch (op) {
                case ADD: return x + y;
                case SUBTRACT: return x - y;
                case MULTIPLY: return x * y;
                case DIVIDE: return x / y;
                case MODULO: return x % y;
                default: break;
            }
        }
        throw new EvaluationException("Unsupported operand type '" + type + "' for " + op);
    }

    private static void checkDivisor(long value) {
        if (value == 0) throw new EvaluationException("Division by zero");
    }

    private static Number asNumber(Object value) {
        if (!(value instanceof Number)) {
            throw new EvaluationException("Expected a number, got " + value);
        }
        return (Number) value;
    }

    private static boolean asBoolean(Object value) {
        if (!(value instanceof Boolean)) {
            throw new EvaluationException("Expected a boolean, got " + value);
        }
        return (Boolean) value;
    }

    @Override
    public Object visitIfThenElse(IfThenElseExpr node, EvalEnvironment env) {
        return asBoolean(eval(node.getCondition(), env))
                ? eval(node.getThenExpr(), env)
                : eval(node.getElseExpr(), env);
    }

    @Override
    public Object visitSequential(SequentialExpr node, EvalEnvironment env) {
        eval(node.getFirst(), env);
        return eval(node.getSecond(), env);
    }

    @Override
    public Object visitVarSet(VarSetExpr node, EvalEnvironment env) {
        env.assign(node.getVar(), eval(node.getValue(), env));
        return null;
    }

    @Override
    public Object visitWhileLoop(WhileLoopExpr node, EvalEnvironment env) {
        while (asBoolean(eval(node.getCondition(), env))) {
            eval(node.getBody(), env);
        }
        return null;
    }

    /**
     * 以给定参数值求值：依次把 vars 绑定到 values。
     */
    public Object evaluate(Expr expr, List<Var> vars, Object... values) {
        if (vars.size() != values.length) {
            throw new IllegalArgumentException("Expected " + vars.size() + " values, got " + values.length);
        }
        EvalEnvironment env = EvalEnvironment.empty();
        List<Object> list = Arrays.asList(values);
        for (int i = 0; i < vars.size(); i++) {
            env = env.bind(vars.get(i), list.get(i));
        }
        return evaluate(expr, env);
    }
}
