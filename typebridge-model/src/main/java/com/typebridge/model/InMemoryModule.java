package com.typebridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存模块：测试替身和 JSON 清单加载的落脚点。
 *
 * <pre>
 * InMemoryModule core = new InMemoryModule("core");
 * TypeBuilder option = core.defineType("demo.Option", "T");
 * option.union(TagAccessorKind.STATIC_METHOD)
 *       .unionCase("None")
 *       .unionCase("Some", ParameterInfo.of("Value", option.typeParameter(0)))
 *       .build();
 * </pre>
 */
public final class InMemoryModule implements ModuleHandle {

    private final String name;
    private final Map<String, TypeDescriptor> types = new LinkedHashMap<>();

    public InMemoryModule(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * 定义新类型并立即注册，返回用于填充成员的构建器。
     */
    public TypeBuilder defineType(String fullName, String... genericParameterNames) {
        DefinedType type = DefinedType.ofFullName(this, fullName, Arrays.asList(genericParameterNames));
        addType(type);
        return new TypeBuilder(type);
    }

    public void addType(TypeDescriptor type) {
        String key = type.getFullName();
        if (types.containsKey(key)) {
            throw new IllegalArgumentException("Module '" + name + "' already defines type '" + key + "'");
        }
        types.put(key, type);
    }

    @Override
    public List<TypeDescriptor> getTypes() {
        return new ArrayList<>(types.values());
    }

    @Override
    public TypeDescriptor findType(String fullName) {
        return types.get(fullName);
    }

    @Override
    public String toString() {
        return name;
    }
}
