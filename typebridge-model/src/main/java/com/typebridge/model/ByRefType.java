package com.typebridge.model;

/**
 * 按引用传递的类型（T&amp;）。
 */
public final class ByRefType extends TypeDescriptor {

    private final TypeDescriptor elementType;

    ByRefType(TypeDescriptor elementType) {
        this.elementType = elementType;
    }

    @Override
    public String getName() {
        return elementType.getName() + "&";
    }

    @Override
    public String getNamespace() {
        return elementType.getNamespace();
    }

    @Override
    public String getFullName() {
        return elementType.getFullName() + "&";
    }

    @Override
    public ModuleHandle getModule() {
        return elementType.getModule();
    }

    @Override
    public boolean isByRef() {
        return true;
    }

    @Override
    public TypeDescriptor getElementType() {
        return elementType;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ByRefType && elementType.equals(((ByRefType) o).elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31 + 1;
    }

    @Override
    public String toString() {
        return elementType + "&";
    }
}
