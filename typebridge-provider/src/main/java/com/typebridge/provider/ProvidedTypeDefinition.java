package com.typebridge.provider;

import com.typebridge.model.DefinedType;
import com.typebridge.model.MemberDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.ModuleHandle;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 合成类型定义。
 * <p>
 * 由本系统构造，跨宇宙改写时原样通过。基类必须已经是目标宇宙的类型。
 * {@link #getPresentedMembers()} 是对外呈现的成员视图：自身成员加上基类链上的公开实例方法，
 * hideObjectMethods 时去掉对象身份方法（Equals、GetHashCode、GetType、ToString）。
 */
public class ProvidedTypeDefinition extends DefinedType {

    static final Set<String> OBJECT_IDENTITY_METHODS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "Equals", "GetHashCode", "GetType", "ToString",
            "equals", "hashCode", "getClass", "toString")));

    private final boolean hideObjectMethods;
    private final boolean nonNullable;

    public ProvidedTypeDefinition(ModuleHandle module, String namespace, String name, TypeDescriptor baseType,
                                  boolean hideObjectMethods, boolean nonNullable) {
        super(module, namespace, name);
        this.hideObjectMethods = hideObjectMethods;
        this.nonNullable = nonNullable;
        setBaseType(baseType);
    }

    /**
     * 嵌套或擦除类型：不属于任何模块和命名空间。
     */
    public ProvidedTypeDefinition(String name, TypeDescriptor baseType, boolean hideObjectMethods,
                                  boolean nonNullable) {
        this(null, null, name, baseType, hideObjectMethods, nonNullable);
    }

    @Override
    public boolean isHostDefined() {
        return true;
    }

    public boolean isHideObjectMethods() {
        return hideObjectMethods;
    }

    public boolean isNonNullable() {
        return nonNullable;
    }

    // ==================== 成员 ====================

    public ProvidedTypeDefinition addMember(ProvidedMember member) {
        member.attachTo(this);
        if (member instanceof ProvidedMethod) {
            addMethod((ProvidedMethod) member);
        } else if (member instanceof ProvidedProperty) {
            addProperty((ProvidedProperty) member);
        } else if (member instanceof ProvidedConstructor) {
            addConstructor((ProvidedConstructor) member);
        } else {
            throw new IllegalArgumentException("Unsupported provided member: " + member);
        }
        return this;
    }

    public ProvidedTypeDefinition addMembers(List<? extends ProvidedMember> members) {
        for (ProvidedMember m : members) {
            addMember(m);
        }
        return this;
    }

    public List<MemberDescriptor> getPresentedMembers() {
        List<MemberDescriptor> result = new ArrayList<>();
        result.addAll(getConstructors());
        result.addAll(getProperties());
        result.addAll(getMethods());

        Set<String> seen = new HashSet<>();
        for (PropertyDescriptor p : getProperties()) {
            seen.add("property " + p.getName());
        }
        for (MethodDescriptor m : getMethods()) {
            seen.add(signature(m));
        }
        for (TypeDescriptor t = getBaseType(); t != null; t = t.getBaseType()) {
            for (PropertyDescriptor p : t.getProperties()) {
                if (p.isPublic() && !p.isStatic() && seen.add("property " + p.getName())) {
                    result.add(p);
                }
            }
            for (MethodDescriptor m : t.getMethods()) {
                if (!m.isPublic() || m.isStatic()) continue;
                if (hideObjectMethods && OBJECT_IDENTITY_METHODS.contains(m.getName())) continue;
                if (seen.add(signature(m))) {
                    result.add(m);
                }
            }
        }
        return result;
    }

    private static String signature(MethodDescriptor m) {
        return m.getName() + m.getParameterTypes();
    }
}
