package com.typebridge.provider;

import com.typebridge.expr.Expr;
import com.typebridge.expr.ExprTransformer;
import com.typebridge.expr.node.CallExpr;
import com.typebridge.expr.node.NewObjectExpr;
import com.typebridge.expr.node.PropertyGetExpr;
import com.typebridge.expr.node.PropertySetExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * 把对合成成员的调用展开为其 invoke code 生成的表达式，模拟宿主在调用点拼接声明体。
 * <p>
 * 实例成员的 this 作为第一个实参传入。展开结果会再次遍历，嵌套的合成调用一并展开；
 * 超过 {@link #MAX_DEPTH} 层视为自我递归的声明体。
 */
public class ProvidedCodeSplicer extends ExprTransformer {

    static final int MAX_DEPTH = 64;

    private int depth;

    @Override
    public Expr visitCall(CallExpr node, Void ctx) {
        if (!(node.getMethod() instanceof ProvidedMethod)) {
            return super.visitCall(node, ctx);
        }
        ProvidedMethod method = (ProvidedMethod) node.getMethod();
        return splice(method.getName(), method.generateCode(arguments(node.getTarget(), node.getArgs())));
    }

    @Override
    public Expr visitPropertyGet(PropertyGetExpr node, Void ctx) {
        if (!(node.getProperty() instanceof ProvidedProperty)) {
            return super.visitPropertyGet(node, ctx);
        }
        ProvidedProperty property = (ProvidedProperty) node.getProperty();
        if (!property.canRead()) {
            throw new IllegalStateException("Provided property '" + property.getName() + "' has no getter");
        }
        return splice(property.getName(),
                property.getProvidedGetter().generateCode(arguments(node.getTarget(), node.getIndexArgs())));
    }

    @Override
    public Expr visitPropertySet(PropertySetExpr node, Void ctx) {
        if (!(node.getProperty() instanceof ProvidedProperty)) {
            return super.visitPropertySet(node, ctx);
        }
        ProvidedProperty property = (ProvidedProperty) node.getProperty();
        if (!property.canWrite()) {
            throw new IllegalStateException("Provided property '" + property.getName() + "' has no setter");
        }
        List<Expr> args = arguments(node.getTarget(), node.getIndexArgs());
        args.add(transform(node.getValue()));
        return splice(property.getName(), property.getProvidedSetter().generateCode(args));
    }

    @Override
    public Expr visitNewObject(NewObjectExpr node, Void ctx) {
        if (!(node.getConstructor() instanceof ProvidedConstructor)) {
            return super.visitNewObject(node, ctx);
        }
        ProvidedConstructor constructor = (ProvidedConstructor) node.getConstructor();
        return splice(constructor.toString(), constructor.generateCode(arguments(null, node.getArgs())));
    }

    private List<Expr> arguments(Expr target, List<Expr> args) {
        List<Expr> result = new ArrayList<>(args.size() + 1);
        if (target != null) {
            result.add(transform(target));
        }
        result.addAll(transformExprs(args));
        return result;
    }

    private Expr splice(String member, Expr generated) {
        if (depth >= MAX_DEPTH) {
            throw new IllegalStateException("Splicing '" + member + "' exceeded " + MAX_DEPTH
                    + " nested levels; the provided code is probably self-recursive");
        }
        depth++;
        try {
            return transform(generated);
        } finally {
            depth--;
        }
    }
}
