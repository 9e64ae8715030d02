package com.typebridge.retarget;

import com.typebridge.expr.Expr;
import com.typebridge.expr.Var;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;

import java.util.logging.Logger;

/**
 * 两个类型宇宙之间的替换器，一个实例对应一次会话。
 * <p>
 * 持有双向解析缓存和变量身份表；正向（origin → target）生成对外可见的签名和表达式，
 * 反向（target → origin）在声明体被调用前把实参带回原宇宙。
 * <p>
 * 非线程安全：同一实例同一时刻只能有一个改写在进行。
 *
 * <pre>
 * UniverseReplacer replacer = new UniverseReplacer(designTime, runtime);
 * TypeDescriptor t = replacer.typeToTarget(listOfString);
 * Expr body = replacer.exprToTarget(userBody);
 * </pre>
 */
public class UniverseReplacer {

    private static final Logger LOG = Logger.getLogger(UniverseReplacer.class.getName());

    private final TypeUniverse origin;
    private final TypeUniverse target;
    private final ReplacerOptions options;
    private final TypeUniverseResolver typeResolver;
    private final MemberResolver memberResolver;
    private final VariableIdentityTable variableTable;
    private final ExpressionRewriter forwardRewriter;
    private final ExpressionRewriter backwardRewriter;

    public UniverseReplacer(TypeUniverse origin, TypeUniverse target) {
        this(origin, target, ReplacerOptions.defaults());
    }

    public UniverseReplacer(TypeUniverse origin, TypeUniverse target, ReplacerOptions options) {
        if (origin == null || target == null || options == null) {
            throw new IllegalArgumentException("origin, target and options must not be null");
        }
        this.origin = origin;
        this.target = target;
        this.options = options;
        this.typeResolver = new TypeUniverseResolver(origin, target, options);
        this.memberResolver = new MemberResolver(typeResolver);
        this.variableTable = new VariableIdentityTable(typeResolver);
        this.forwardRewriter = new ExpressionRewriter(Direction.FORWARD, typeResolver, memberResolver, variableTable);
        this.backwardRewriter = new ExpressionRewriter(Direction.BACKWARD, typeResolver, memberResolver, variableTable);
        LOG.fine("Replacer created: " + origin + " <-> " + target);
    }

    public TypeUniverse getOrigin() {
        return origin;
    }

    public TypeUniverse getTarget() {
        return target;
    }

    public ReplacerOptions getOptions() {
        return options;
    }

    public TypeUniverseResolver getTypeResolver() {
        return typeResolver;
    }

    public MemberResolver getMemberResolver() {
        return memberResolver;
    }

    public VariableIdentityTable getVariableTable() {
        return variableTable;
    }

    // ==================== 类型 ====================

    public TypeDescriptor resolveType(Direction direction, TypeDescriptor type) {
        return typeResolver.resolve(direction, type);
    }

    public TypeDescriptor typeToTarget(TypeDescriptor type) {
        return resolveType(Direction.FORWARD, type);
    }

    public TypeDescriptor typeToOrigin(TypeDescriptor type) {
        return resolveType(Direction.BACKWARD, type);
    }

    // ==================== 成员 ====================

    public MethodDescriptor resolveMethod(Direction direction, MethodDescriptor method) {
        return memberResolver.resolveMethod(direction, method);
    }

    public PropertyDescriptor resolveProperty(Direction direction, PropertyDescriptor property) {
        return memberResolver.resolveProperty(direction, property);
    }

    public FieldDescriptor resolveField(Direction direction, FieldDescriptor field) {
        return memberResolver.resolveField(direction, field);
    }

    public ConstructorDescriptor resolveConstructor(Direction direction, ConstructorDescriptor constructor) {
        return memberResolver.resolveConstructor(direction, constructor);
    }

    // ==================== 变量 / 表达式 ====================

    public Var rewriteVar(Direction direction, Var var) {
        return variableTable.rewrite(direction, var);
    }

    /**
     * 改写整棵表达式树。第一次失败即抛出 {@link RetargetException}，不返回部分结果。
     */
    public Expr rewrite(Direction direction, Expr expr) {
        return (direction.isForward() ? forwardRewriter : backwardRewriter).transform(expr);
    }

    public Expr exprToTarget(Expr expr) {
        return rewrite(Direction.FORWARD, expr);
    }

    public Expr exprToOrigin(Expr expr) {
        return rewrite(Direction.BACKWARD, expr);
    }

    @Override
    public String toString() {
        return "UniverseReplacer[" + origin + " -> " + target + "]";
    }
}
