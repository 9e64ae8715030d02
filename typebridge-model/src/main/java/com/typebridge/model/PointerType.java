package com.typebridge.model;

/**
 * 指针类型（T*）。
 */
public final class PointerType extends TypeDescriptor {

    private final TypeDescriptor elementType;

    PointerType(TypeDescriptor elementType) {
        this.elementType = elementType;
    }

    @Override
    public String getName() {
        return elementType.getName() + "*";
    }

    @Override
    public String getNamespace() {
        return elementType.getNamespace();
    }

    @Override
    public String getFullName() {
        return elementType.getFullName() + "*";
    }

    @Override
    public ModuleHandle getModule() {
        return elementType.getModule();
    }

    @Override
    public boolean isPointer() {
        return true;
    }

    @Override
    public TypeDescriptor getElementType() {
        return elementType;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PointerType && elementType.equals(((PointerType) o).elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31 + 2;
    }

    @Override
    public String toString() {
        return elementType + "*";
    }
}
