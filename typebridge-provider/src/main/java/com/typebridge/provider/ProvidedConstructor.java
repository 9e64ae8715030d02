package com.typebridge.provider;

import com.typebridge.expr.Expr;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.List;

public class ProvidedConstructor extends ConstructorDescriptor implements ProvidedMember {

    private final InvokeCode invokeCode;

    public ProvidedConstructor(List<? extends ProvidedParameter> parameters, InvokeCode invokeCode) {
        super(null, parameters, true, null);
        this.invokeCode = invokeCode;
    }

    public InvokeCode getInvokeCode() {
        return invokeCode;
    }

    public Expr generateCode(List<Expr> args) {
        if (invokeCode == null) {
            throw new IllegalStateException("Provided constructor of '" + getDeclaringType() + "' has no invoke code");
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
