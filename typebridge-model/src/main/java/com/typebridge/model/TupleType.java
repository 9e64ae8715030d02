package com.typebridge.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 元组类型，按元素类型结构比较。
 */
public final class TupleType extends TypeDescriptor {

    private final List<TypeDescriptor> elements;

    private TupleType(List<? extends TypeDescriptor> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static TupleType of(List<? extends TypeDescriptor> elements) {
        if (elements.size() < 2) {
            throw new IllegalArgumentException("A tuple needs at least two elements, got " + elements.size());
        }
        return new TupleType(elements);
    }

    public static TupleType of(TypeDescriptor... elements) {
        return of(Arrays.asList(elements));
    }

    @Override
    public String getName() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i));
        }
        return sb.append(')').toString();
    }

    @Override
    public boolean isTuple() {
        return true;
    }

    @Override
    public List<TypeDescriptor> getTupleElements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TupleType && elements.equals(((TupleType) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
