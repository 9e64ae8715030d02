package com.typebridge.retarget;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprTransformer;
import com.typebridge.expr.UncheckedExprs;
import com.typebridge.expr.Var;
import com.typebridge.expr.node.ApplicationExpr;
import com.typebridge.expr.node.LambdaExpr;
import com.typebridge.expr.node.NewRecordExpr;
import com.typebridge.expr.node.NewUnionCaseExpr;
import com.typebridge.expr.node.OperationExpr;
import com.typebridge.expr.node.UnionCaseTestExpr;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.DataTypeReflection;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MemberDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.Collections;

/**
 * 单方向的表达式改写器。
 * <p>
 * 所有类型、成员、变量引用交给解析器和身份表替换；节点一律用
 * {@link UncheckedExprs} 重建，因为改写中的树会暂时混合两个宇宙的签名。
 * <p>
 * 跨宇宙表示不稳定的语言构造先在原宇宙里脱糖，再对结果递归改写：
 * <ul>
 *   <li>函数应用 f x → f.Invoke(x)</li>
 *   <li>联合用例构造 → 静态 New&lt;Case&gt; 方法调用</li>
 *   <li>记录构造 → 记录构造器</li>
 *   <li>用例测试 → 读取标签后与用例标签比较</li>
 * </ul>
 * lambda 不能脱糖，直接拒绝。
 */
public class ExpressionRewriter extends ExprTransformer {

    private final Direction direction;
    private final TypeUniverseResolver types;
    private final MemberResolver members;
    private final VariableIdentityTable variables;

    public ExpressionRewriter(Direction direction, TypeUniverseResolver types, MemberResolver members,
                              VariableIdentityTable variables) {
        this.direction = direction;
        this.types = types;
        this.members = members;
        this.variables = variables;
    }

    public Direction getDirection() {
        return direction;
    }

    // ==================== 钩子 ====================

    @Override
    protected TypeDescriptor transformType(TypeDescriptor type) {
        return types.resolve(direction, type);
    }

    @Override
    protected MethodDescriptor transformMethod(MethodDescriptor method) {
        return members.resolveMethod(direction, method);
    }

    @Override
    protected PropertyDescriptor transformProperty(PropertyDescriptor property) {
        return members.resolveProperty(direction, property);
    }

    @Override
    protected FieldDescriptor transformField(FieldDescriptor field) {
        return members.resolveField(direction, field);
    }

    @Override
    protected ConstructorDescriptor transformConstructor(ConstructorDescriptor constructor) {
        return members.resolveConstructor(direction, constructor);
    }

    @Override
    protected Var transformVar(Var var) {
        return variables.rewrite(direction, var);
    }

    // ==================== 脱糖 ====================

    @Override
    public Expr visitApplication(ApplicationExpr node, Void ctx) {
        Expr call = UncheckedExprs.call(node.getFunction(), node.getInvokeMethod(),
                Collections.singletonList(node.getArgument()));
        return transform(call);
    }

    @Override
    public Expr visitNewUnionCase(NewUnionCaseExpr node, Void ctx) {
        MethodDescriptor constructor = DataTypeReflection.precomputeUnionConstructor(node.getUnionCase());
        return transform(UncheckedExprs.call(null, constructor, node.getArgs()));
    }

    @Override
    public Expr visitNewRecord(NewRecordExpr node, Void ctx) {
        ConstructorDescriptor constructor = DataTypeReflection.precomputeRecordConstructor(node.getType());
        return transform(UncheckedExprs.newObject(constructor, node.getArgs()));
    }

    @Override
    public Expr visitUnionCaseTest(UnionCaseTestExpr node, Void ctx) {
        Expr target = node.getTarget();
        MemberDescriptor tagMember = DataTypeReflection.precomputeUnionTagMember(
                node.getUnionCase().getDeclaringType());
        Expr tag;
        switch (tagMember.getMemberKind()) {
            case PROPERTY:
                tag = UncheckedExprs.propertyGet(target, (PropertyDescriptor) tagMember,
                        Collections.<Expr>emptyList());
                break;
            case METHOD:
                MethodDescriptor method = (MethodDescriptor) tagMember;
                tag = method.isStatic()
                        ? UncheckedExprs.call(null, method, Collections.singletonList(target))
                        : UncheckedExprs.call(target, method, Collections.<Expr>emptyList());
                break;
            default:
                throw new IllegalStateException("unreachable: unexpected tag member '" + tagMember
                        + "' of kind " + tagMember.getMemberKind() + " for union type '"
                        + node.getUnionCase().getDeclaringType() + "'");
        }
        Expr test = UncheckedExprs.operation(OperationExpr.Operator.EQUALS, PrimitiveType.BOOLEAN,
                tag, UncheckedExprs.value(node.getUnionCase().getTag(), PrimitiveType.INT));
        return transform(test);
    }

    // ==================== 拒绝 ====================

    @Override
    public Expr visitLambda(LambdaExpr node, Void ctx) {
        throw new UnsupportedConstructException(direction,
                "It's not possible to create a lambda '" + node.getParameter() + " -> ...' when retargeting "
                        + "to a different core library. Make sure you're not calling a function with signature "
                        + "A->(B->C) instead of A->B->C (point-free composition causes this).");
    }
}
