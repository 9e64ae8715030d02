package com.typebridge.provider;

import com.typebridge.expr.Expr;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.List;

/**
 * 合成方法：没有可执行实现，调用点由 {@link ProvidedCodeSplicer} 展开为 invoke code 生成的表达式。
 */
public class ProvidedMethod extends MethodDescriptor implements ProvidedMember {

    private final InvokeCode invokeCode;

    public ProvidedMethod(String name, List<? extends ProvidedParameter> parameters, TypeDescriptor returnType,
                          boolean isStatic, InvokeCode invokeCode) {
        super(null, name, parameters, returnType, isStatic, true, null);
        this.invokeCode = invokeCode;
    }

    public InvokeCode getInvokeCode() {
        return invokeCode;
    }

    public Expr generateCode(List<Expr> args) {
        if (invokeCode == null) {
            throw new IllegalStateException("Provided method '" + getName() + "' has no invoke code");
        }
        return invokeCode.generate(args);
    }

    @Override
    public boolean isHostDefined() {
        return true;
    }

    @Override
    public void attachTo(TypeDescriptor owner) {
        setDeclaringType(owner);
    }
}
