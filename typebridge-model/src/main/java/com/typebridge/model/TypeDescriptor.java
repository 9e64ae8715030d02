package com.typebridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 类型描述符基类。
 * <p>
 * 描述某个类型宇宙（一组模块）中的一个类型。具名定义（{@link DefinedType}）按引用比较，
 * 构造类型（泛型实例、数组、引用、指针、元组）按结构比较。
 * 成员查找只做精确签名匹配，不做重载决议。
 */
public abstract class TypeDescriptor {

    public abstract String getName();

    public String getNamespace() {
        return null;
    }

    public String getFullName() {
        String ns = getNamespace();
        return ns == null || ns.isEmpty() ? getName() : ns + "." + getName();
    }

    /**
     * 定义该类型的模块；构造类型返回其定义所在模块，基本类型返回 null。
     */
    public ModuleHandle getModule() {
        return null;
    }

    /**
     * 由本系统自己合成的类型（provided 声明），跨宇宙时原样通过。
     */
    public boolean isHostDefined() {
        return false;
    }

    /**
     * 类型缩写（别名），跨宇宙时原样通过。
     */
    public boolean isTypeAbbreviation() {
        return false;
    }

    public boolean isPrimitive() {
        return false;
    }

    // ==================== 泛型 ====================

    public boolean isGenericType() {
        return false;
    }

    public boolean isGenericTypeDefinition() {
        return false;
    }

    public TypeDescriptor getGenericTypeDefinition() {
        throw new IllegalStateException("'" + this + "' is not a generic type");
    }

    /**
     * 泛型定义返回其类型参数，泛型实例返回实参，其余返回空列表。
     */
    public List<TypeDescriptor> getGenericArguments() {
        return Collections.emptyList();
    }

    public TypeDescriptor makeGenericType(List<? extends TypeDescriptor> arguments) {
        throw new IllegalStateException("'" + this + "' is not a generic type definition");
    }

    public final TypeDescriptor makeGenericType(TypeDescriptor... arguments) {
        return makeGenericType(Arrays.asList(arguments));
    }

    public boolean isGenericParameter() {
        return false;
    }

    // ==================== 元素类型 ====================

    public boolean isArray() {
        return false;
    }

    public int getArrayRank() {
        throw new IllegalStateException("'" + this + "' is not an array type");
    }

    public boolean isByRef() {
        return false;
    }

    public boolean isPointer() {
        return false;
    }

    public TypeDescriptor getElementType() {
        return null;
    }

    public boolean hasElementType() {
        return getElementType() != null;
    }

    public TypeDescriptor makeArrayType() {
        return new ArrayType(this, 1);
    }

    public TypeDescriptor makeArrayType(int rank) {
        return new ArrayType(this, rank);
    }

    public TypeDescriptor makeByRefType() {
        return new ByRefType(this);
    }

    public TypeDescriptor makePointerType() {
        return new PointerType(this);
    }

    // ==================== 元组 ====================

    public boolean isTuple() {
        return false;
    }

    public List<TypeDescriptor> getTupleElements() {
        return Collections.emptyList();
    }

    // ==================== 继承 ====================

    public TypeDescriptor getBaseType() {
        return null;
    }

    public List<TypeDescriptor> getInterfaces() {
        return Collections.emptyList();
    }

    /**
     * 赋值兼容：相同类型，或 other 的基类/接口链上出现本类型。
     */
    public boolean isAssignableFrom(TypeDescriptor other) {
        if (other == null) return false;
        if (this.equals(other)) return true;
        Set<TypeDescriptor> seen = new HashSet<>();
        List<TypeDescriptor> pending = new ArrayList<>();
        pending.add(other);
        while (!pending.isEmpty()) {
            TypeDescriptor current = pending.remove(pending.size() - 1);
            if (!seen.add(current)) continue;
            if (this.equals(current)) return true;
            if (current.getBaseType() != null) pending.add(current.getBaseType());
            pending.addAll(current.getInterfaces());
        }
        return false;
    }

    // ==================== 成员 ====================

    public List<FieldDescriptor> getFields() {
        return Collections.emptyList();
    }

    public List<PropertyDescriptor> getProperties() {
        return Collections.emptyList();
    }

    public List<MethodDescriptor> getMethods() {
        return Collections.emptyList();
    }

    public List<ConstructorDescriptor> getConstructors() {
        return Collections.emptyList();
    }

    public UnionInfo getUnionInfo() {
        return null;
    }

    public RecordInfo getRecordInfo() {
        return null;
    }

    /**
     * 按名称和绑定标志查找属性，先查本类型再沿基类链查找。
     */
    public PropertyDescriptor getProperty(String name, Set<BindingFlag> flags) {
        for (TypeDescriptor t = this; t != null; t = t.getBaseType()) {
            for (PropertyDescriptor p : t.getProperties()) {
                if (p.getName().equals(name) && BindingFlag.matches(flags, p.isPublic(), p.isStatic())) {
                    return p;
                }
            }
        }
        return null;
    }

    public FieldDescriptor getField(String name, Set<BindingFlag> flags) {
        for (TypeDescriptor t = this; t != null; t = t.getBaseType()) {
            for (FieldDescriptor f : t.getFields()) {
                if (f.getName().equals(name) && BindingFlag.matches(flags, f.isPublic(), f.isStatic())) {
                    return f;
                }
            }
        }
        return null;
    }

    /**
     * 按名称和参数类型精确查找方法。同一层级出现多个精确匹配时视为找不到。
     */
    public MethodDescriptor getMethod(String name, List<TypeDescriptor> parameterTypes) {
        for (TypeDescriptor t = this; t != null; t = t.getBaseType()) {
            MethodDescriptor found = null;
            int matches = 0;
            for (MethodDescriptor m : t.getMethods()) {
                if (m.getName().equals(name) && m.getParameterTypes().equals(parameterTypes)) {
                    found = m;
                    matches++;
                }
            }
            if (matches == 1) return found;
            if (matches > 1) return null;
        }
        return null;
    }

    /**
     * 按名称查找唯一的方法（如函数值的 Invoke）。
     */
    public MethodDescriptor getMethod(String name) {
        for (TypeDescriptor t = this; t != null; t = t.getBaseType()) {
            MethodDescriptor found = null;
            int matches = 0;
            for (MethodDescriptor m : t.getMethods()) {
                if (m.getName().equals(name)) {
                    found = m;
                    matches++;
                }
            }
            if (matches == 1) return found;
            if (matches > 1) return null;
        }
        return null;
    }

    public ConstructorDescriptor getConstructor(List<TypeDescriptor> parameterTypes) {
        ConstructorDescriptor found = null;
        for (ConstructorDescriptor c : getConstructors()) {
            if (c.getParameterTypes().equals(parameterTypes)) {
                if (found != null) return null;
                found = c;
            }
        }
        return found;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}
