package com.typebridge.model;

import java.util.Set;

/**
 * 成员查找绑定标志（可见性 + 静态性）。
 */
public enum BindingFlag {
    PUBLIC, NON_PUBLIC, STATIC, INSTANCE;

    /**
     * 成员的可见性和静态性都被标志集合覆盖时匹配。
     */
    public static boolean matches(Set<BindingFlag> flags, boolean isPublic, boolean isStatic) {
        boolean visibility = isPublic ? flags.contains(PUBLIC) : flags.contains(NON_PUBLIC);
        boolean binding = isStatic ? flags.contains(STATIC) : flags.contains(INSTANCE);
        return visibility && binding;
    }
}
