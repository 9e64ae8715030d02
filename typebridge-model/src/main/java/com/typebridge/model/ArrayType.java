package com.typebridge.model;

/**
 * 数组类型，保留精确的维数。
 */
public final class ArrayType extends TypeDescriptor {

    private final TypeDescriptor elementType;
    private final int rank;

    ArrayType(TypeDescriptor elementType, int rank) {
        if (rank < 1) throw new IllegalArgumentException("Array rank must be positive: " + rank);
        this.elementType = elementType;
        this.rank = rank;
    }

    private String suffix() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 1; i < rank; i++) sb.append(',');
        return sb.append(']').toString();
    }

    @Override
    public String getName() {
        return elementType.getName() + suffix();
    }

    @Override
    public String getNamespace() {
        return elementType.getNamespace();
    }

    @Override
    public String getFullName() {
        return elementType.getFullName() + suffix();
    }

    @Override
    public ModuleHandle getModule() {
        return elementType.getModule();
    }

    @Override
    public boolean isArray() {
        return true;
    }

    @Override
    public int getArrayRank() {
        return rank;
    }

    @Override
    public TypeDescriptor getElementType() {
        return elementType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayType)) return false;
        ArrayType other = (ArrayType) o;
        return rank == other.rank && elementType.equals(other.elementType);
    }

    @Override
    public int hashCode() {
        return elementType.hashCode() * 31 + rank;
    }

    @Override
    public String toString() {
        return elementType + suffix();
    }
}
