package com.typebridge.expr;

import com.typebridge.model.TypeDescriptor;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 绑定变量。
 * <p>
 * 变量只等于它自己：名称、类型、可变性全同的两个变量也不可互换。
 * 每个变量带一个进程内唯一的 stamp，供按整数键的身份表使用。
 */
public final class Var {

    private static final AtomicLong STAMPS = new AtomicLong();

    private final long stamp;
    private final String name;
    private final TypeDescriptor type;
    private final boolean mutable;

    public Var(String name, TypeDescriptor type, boolean mutable) {
        this.stamp = STAMPS.incrementAndGet();
        this.name = name;
        this.type = type;
        this.mutable = mutable;
    }

    public Var(String name, TypeDescriptor type) {
        this(name, type, false);
    }

    public long getStamp() {
        return stamp;
    }

    public String getName() {
        return name;
    }

    public TypeDescriptor getType() {
        return type;
    }

    public boolean isMutable() {
        return mutable;
    }

    @Override
    public String toString() {
        return name;
    }
}
