package com.typebridge.retarget;

/**
 * 改写会话的配置。
 *
 * <p>使用示例：</p>
 * <pre>
 * // 默认配置
 * UniverseReplacer replacer = new UniverseReplacer(origin, target, ReplacerOptions.defaults());
 *
 * // 自定义
 * ReplacerOptions options = ReplacerOptions.custom()
 *     .interactiveNamespacePrefix("FSI_")
 *     .interactiveModulePrefix("FSI-ASSEMBLY")
 *     .voidTypeName("System.Void")
 *     .build();
 * </pre>
 */
public final class ReplacerOptions {

    public static final String DEFAULT_INTERACTIVE_NAMESPACE_PREFIX = "REPL_";
    public static final String DEFAULT_INTERACTIVE_MODULE_PREFIX = "REPL-MODULE";
    public static final String DEFAULT_VOID_TYPE_NAME = "void";

    // --- 交互式宿主命名修正 ---
    private final String interactiveNamespacePrefix;
    private final String interactiveModulePrefix;

    // --- 解析 ---
    private final String voidTypeName;
    private final boolean recordStats;

    private ReplacerOptions(Builder builder) {
        this.interactiveNamespacePrefix = builder.interactiveNamespacePrefix;
        this.interactiveModulePrefix = builder.interactiveModulePrefix;
        this.voidTypeName = builder.voidTypeName;
        this.recordStats = builder.recordStats;
    }

    // ============ 工厂方法 ============

    public static ReplacerOptions defaults() {
        return new Builder().build();
    }

    public static Builder custom() {
        return new Builder();
    }

    // ============ Getters ============

    /** 交互式宿主给命名空间加的合成前缀，全名以它开头时去掉第一个 '.' 之前的部分 */
    public String getInteractiveNamespacePrefix() { return interactiveNamespacePrefix; }

    /** 名称以此开头的模块按交互式规则查找：扫描全部类型，取全名字典序最后的匹配，结果不缓存 */
    public String getInteractiveModulePrefix() { return interactiveModulePrefix; }

    /** 全名等于此值的类型总是映射到规范 void */
    public String getVoidTypeName() { return voidTypeName; }

    public boolean isRecordStats() { return recordStats; }

    /**
     * 去掉交互式命名空间前缀段。
     */
    public String fixName(String fullName) {
        if (fullName.startsWith(interactiveNamespacePrefix)) {
            return fullName.substring(fullName.indexOf('.') + 1);
        }
        return fullName;
    }

    public boolean isInteractiveModule(String moduleName) {
        return moduleName != null && moduleName.startsWith(interactiveModulePrefix);
    }

    @Override
    public String toString() {
        return "ReplacerOptions{namespacePrefix=" + interactiveNamespacePrefix
                + ", modulePrefix=" + interactiveModulePrefix
                + ", void=" + voidTypeName
                + ", recordStats=" + recordStats + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private String interactiveNamespacePrefix = DEFAULT_INTERACTIVE_NAMESPACE_PREFIX;
        private String interactiveModulePrefix = DEFAULT_INTERACTIVE_MODULE_PREFIX;
        private String voidTypeName = DEFAULT_VOID_TYPE_NAME;
        private boolean recordStats = true;

        private Builder() {
        }

        public Builder interactiveNamespacePrefix(String prefix) {
            this.interactiveNamespacePrefix = requireNonEmpty(prefix, "interactiveNamespacePrefix");
            return this;
        }

        public Builder interactiveModulePrefix(String prefix) {
            this.interactiveModulePrefix = requireNonEmpty(prefix, "interactiveModulePrefix");
            return this;
        }

        public Builder voidTypeName(String name) {
            this.voidTypeName = requireNonEmpty(name, "voidTypeName");
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public ReplacerOptions build() {
            return new ReplacerOptions(this);
        }

        private static String requireNonEmpty(String value, String what) {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException(what + " must not be empty");
            }
            return value;
        }
    }
}
