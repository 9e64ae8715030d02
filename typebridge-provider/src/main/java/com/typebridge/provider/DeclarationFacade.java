package com.typebridge.provider;

import com.typebridge.expr.Expr;
import com.typebridge.model.ModuleHandle;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.retarget.UniverseReplacer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 跨宇宙声明门面。
 * <p>
 * 调用方用 origin 宇宙的类型描述声明，门面正向改写得到 target 宇宙的签名；
 * 声明体在展开时先把实参反向改写回 origin 宇宙，再调用用户的 invoke code，
 * 最后把结果正向改写到 target 宇宙。
 *
 * <pre>
 * DeclarationFacade facade = new DeclarationFacade(new UniverseReplacer(designTime, runtime));
 * ProvidedMethod m = facade.method("Parse", params, designTimeResult, true, args -> ...);
 * </pre>
 */
public class DeclarationFacade {

    private static final Logger LOG = Logger.getLogger(DeclarationFacade.class.getName());

    private final UniverseReplacer replacer;

    public DeclarationFacade(UniverseReplacer replacer) {
        this.replacer = replacer;
    }

    public UniverseReplacer getReplacer() {
        return replacer;
    }

    // ==================== 参数 / 成员 ====================

    public ProvidedParameter parameter(String name, TypeDescriptor type) {
        return new ProvidedParameter(name, replacer.typeToTarget(type));
    }

    public ProvidedParameter optionalParameter(String name, TypeDescriptor type, Object defaultValue) {
        return new ProvidedParameter(name, replacer.typeToTarget(type), defaultValue);
    }

    public ProvidedProperty property(String name, TypeDescriptor type, InvokeCode getterCode) {
        return property(name, type, false, getterCode);
    }

    public ProvidedProperty property(String name, TypeDescriptor type, boolean isStatic, InvokeCode getterCode) {
        return new ProvidedProperty(name, replacer.typeToTarget(type), isStatic, wrap(name, getterCode));
    }

    public ProvidedConstructor constructor(List<ProvidedParameter> parameters, InvokeCode invokeCode) {
        return new ProvidedConstructor(parameters, wrap(".ctor", invokeCode));
    }

    public ProvidedMethod method(String name, List<ProvidedParameter> parameters, TypeDescriptor resultType,
                                 boolean isStatic, InvokeCode invokeCode) {
        return new ProvidedMethod(name, parameters, replacer.typeToTarget(resultType), isStatic,
                wrap(name, invokeCode));
    }

    // ==================== 类型定义 ====================

    public ProvidedTypeDefinition typeDefinition(String name, TypeDescriptor baseType,
                                                 boolean hideObjectMethods, boolean nonNullable) {
        return new ProvidedTypeDefinition(name, replacer.typeToTarget(baseType), hideObjectMethods, nonNullable);
    }

    public ProvidedTypeDefinition typeDefinition(ModuleHandle module, String namespace, String typeName,
                                                 TypeDescriptor baseType, boolean hideObjectMethods,
                                                 boolean nonNullable) {
        return new ProvidedTypeDefinition(module, namespace, typeName, replacer.typeToTarget(baseType),
                hideObjectMethods, nonNullable);
    }

    // ==================== 声明体 ====================

    private InvokeCode wrap(final String member, final InvokeCode code) {
        if (code == null) {
            return null;
        }
        return args -> {
            List<Expr> originArgs = new ArrayList<>(args.size());
            for (Expr arg : args) {
                originArgs.add(replacer.exprToOrigin(arg));
            }
            Expr result = code.generate(originArgs);
            if (result == null) {
                throw new IllegalStateException("Invoke code of '" + member + "' returned no expression");
            }
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Generated code for '" + member + "': " + result);
            }
            return replacer.exprToTarget(result);
        };
    }
}
