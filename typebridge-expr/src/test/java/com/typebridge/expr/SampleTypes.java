package com.typebridge.expr;

import com.typebridge.model.DefinedType;
import com.typebridge.model.InMemoryModule;
import com.typebridge.model.ParameterInfo;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TagAccessorKind;
import com.typebridge.model.TypeBuilder;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.runtime.DelegateValue;
import com.typebridge.model.runtime.FunctionValue;
import com.typebridge.model.runtime.ObjectValue;

/**
 * 表达式测试用的小型类型集合。
 */
public final class SampleTypes {

    public final InMemoryModule module = new InMemoryModule("sample");
    public final DefinedType func;
    public final DefinedType action;
    public final DefinedType option;
    public final DefinedType point;
    public final DefinedType counter;
    public final DefinedType math;

    public SampleTypes() {
        TypeBuilder f = module.defineType("demo.Func", "A", "R");
        func = f.method("Invoke").parameter("arg", f.typeParameter(0)).returns(f.typeParameter(1))
                .invoker((target, args) -> ((FunctionValue) target).apply(args.get(0)))
                .add().build();

        action = module.defineType("demo.IntAdder").method("Invoke")
                .parameter("a", PrimitiveType.INT).parameter("b", PrimitiveType.INT).returns(PrimitiveType.INT)
                .invoker((target, args) -> ((DelegateValue) target).invoke(args))
                .add().build();

        TypeBuilder o = module.defineType("demo.Option", "T");
        option = o.union(TagAccessorKind.STATIC_METHOD)
                .unionCase("None")
                .unionCase("Some", ParameterInfo.of("Value", o.typeParameter(0)))
                .build();

        point = module.defineType("demo.Point")
                .record(ParameterInfo.of("X", PrimitiveType.INT), ParameterInfo.of("Y", PrimitiveType.INT))
                .build();

        TypeBuilder c = module.defineType("demo.Counter");
        counter = c.constructor((target, args) -> {
                    ObjectValue v = new ObjectValue("demo.Counter");
                    v.setField("Count", 0);
                    return v;
                })
                .field("Count", PrimitiveType.INT)
                .autoProperty("Label", PrimitiveType.INT)
                .build();

        math = module.defineType("demo.Math").method("Twice").asStatic()
                .parameter("x", PrimitiveType.INT).returns(PrimitiveType.INT)
                .invoker((target, args) -> (Integer) args.get(0) * 2)
                .add().build();
    }

    public TypeDescriptor funcOf(TypeDescriptor arg, TypeDescriptor result) {
        return func.makeGenericType(arg, result);
    }

    public TypeDescriptor optionOf(TypeDescriptor arg) {
        return option.makeGenericType(arg);
    }
}
