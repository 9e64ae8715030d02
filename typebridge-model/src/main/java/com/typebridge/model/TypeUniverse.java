package com.typebridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 类型宇宙：有序的模块列表。
 */
public final class TypeUniverse {

    private final String label;
    private final List<ModuleHandle> modules;

    public TypeUniverse(String label, List<? extends ModuleHandle> modules) {
        this.label = label;
        this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
    }

    public static TypeUniverse of(String label, ModuleHandle... modules) {
        return new TypeUniverse(label, Arrays.asList(modules));
    }

    public String getLabel() {
        return label;
    }

    public List<ModuleHandle> getModules() {
        return modules;
    }

    /**
     * 在各模块中按顺序查找，返回第一个匹配。
     */
    public TypeDescriptor findType(String fullName) {
        for (ModuleHandle module : modules) {
            TypeDescriptor t = module.findType(fullName);
            if (t != null) return t;
        }
        return null;
    }

    /**
     * 模块名列表，错误消息中原样引用。
     */
    public String describeModules() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < modules.size(); i++) {
            if (i > 0) sb.append("; ");
            sb.append(modules.get(i).getName());
        }
        return sb.append(']').toString();
    }

    @Override
    public String toString() {
        return label + describeModules();
    }
}
