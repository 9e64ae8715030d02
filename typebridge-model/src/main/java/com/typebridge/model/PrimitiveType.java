package com.typebridge.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * JVM 基本类型：在所有类型宇宙中都是同一个实例，因此是跨宇宙解析的不动点。
 * {@link #VOID} 是规范的 void 类型。
 */
public final class PrimitiveType extends TypeDescriptor {

    public enum Kind {
        VOID("void"), BOOLEAN("boolean"), BYTE("byte"), SHORT("short"), CHAR("char"),
        INT("int"), LONG("long"), FLOAT("float"), DOUBLE("double");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String getKeyword() {
            return keyword;
        }
    }

    private static final Map<Kind, PrimitiveType> BY_KIND = new EnumMap<>(Kind.class);
    private static final Map<String, PrimitiveType> BY_KEYWORD = new HashMap<>();

    public static final PrimitiveType VOID = register(Kind.VOID);
    public static final PrimitiveType BOOLEAN = register(Kind.BOOLEAN);
    public static final PrimitiveType BYTE = register(Kind.BYTE);
    public static final PrimitiveType SHORT = register(Kind.SHORT);
    public static final PrimitiveType CHAR = register(Kind.CHAR);
    public static final PrimitiveType INT = register(Kind.INT);
    public static final PrimitiveType LONG = register(Kind.LONG);
    public static final PrimitiveType FLOAT = register(Kind.FLOAT);
    public static final PrimitiveType DOUBLE = register(Kind.DOUBLE);

    private final Kind kind;

    private PrimitiveType(Kind kind) {
        this.kind = kind;
    }

    private static PrimitiveType register(Kind kind) {
        PrimitiveType type = new PrimitiveType(kind);
        BY_KIND.put(kind, type);
        BY_KEYWORD.put(kind.getKeyword(), type);
        return type;
    }

    public static PrimitiveType of(Kind kind) {
        return BY_KIND.get(kind);
    }

    /**
     * 按关键字查找，不是基本类型关键字时返回 null。
     */
    public static PrimitiveType forKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    public static Map<String, PrimitiveType> all() {
        return Collections.unmodifiableMap(BY_KEYWORD);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return kind.getKeyword();
    }

    @Override
    public boolean isPrimitive() {
        return true;
    }
}
