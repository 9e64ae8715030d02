package com.typebridge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * 模块中的具名类型定义。按引用比较。
 * <p>
 * 成员可以延迟填充：设置 memberInitializer 后，第一次访问成员、基类或接口时才执行。
 */
public class DefinedType extends TypeDescriptor {

    private final ModuleHandle module;
    private final String namespace;
    private final String name;
    private final List<GenericParameterType> genericParameters;

    private TypeDescriptor baseType;
    private final List<TypeDescriptor> interfaces = new ArrayList<>();
    private final List<FieldDescriptor> fields = new ArrayList<>();
    private final List<PropertyDescriptor> properties = new ArrayList<>();
    private final List<MethodDescriptor> methods = new ArrayList<>();
    private final List<ConstructorDescriptor> constructors = new ArrayList<>();
    private UnionInfo unionInfo;
    private RecordInfo recordInfo;

    private Consumer<DefinedType> memberInitializer;

    public DefinedType(ModuleHandle module, String namespace, String name, List<String> genericParameterNames) {
        this.module = module;
        this.namespace = namespace;
        this.name = name;
        List<GenericParameterType> params = new ArrayList<>();
        if (genericParameterNames != null) {
            for (int i = 0; i < genericParameterNames.size(); i++) {
                params.add(new GenericParameterType(genericParameterNames.get(i), i, false));
            }
        }
        this.genericParameters = Collections.unmodifiableList(params);
    }

    public DefinedType(ModuleHandle module, String namespace, String name) {
        this(module, namespace, name, Collections.emptyList());
    }

    /**
     * 按全限定名创建，最后一个 '.' 之前为命名空间。
     */
    public static DefinedType ofFullName(ModuleHandle module, String fullName, List<String> genericParameterNames) {
        int dot = fullName.lastIndexOf('.');
        String ns = dot >= 0 ? fullName.substring(0, dot) : null;
        String simple = dot >= 0 ? fullName.substring(dot + 1) : fullName;
        return new DefinedType(module, ns, simple, genericParameterNames);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getNamespace() {
        return namespace;
    }

    @Override
    public ModuleHandle getModule() {
        return module;
    }

    // ==================== 泛型 ====================

    @Override
    public boolean isGenericType() {
        return !genericParameters.isEmpty();
    }

    @Override
    public boolean isGenericTypeDefinition() {
        return !genericParameters.isEmpty();
    }

    @Override
    public TypeDescriptor getGenericTypeDefinition() {
        if (genericParameters.isEmpty()) return super.getGenericTypeDefinition();
        return this;
    }

    @Override
    public List<TypeDescriptor> getGenericArguments() {
        return new ArrayList<>(genericParameters);
    }

    public List<GenericParameterType> getGenericParameters() {
        return genericParameters;
    }

    public GenericParameterType getGenericParameter(int position) {
        return genericParameters.get(position);
    }

    @Override
    public TypeDescriptor makeGenericType(List<? extends TypeDescriptor> arguments) {
        if (genericParameters.isEmpty()) return super.makeGenericType(arguments);
        if (arguments.size() != genericParameters.size()) {
            throw new IllegalArgumentException("Type '" + getFullName() + "' expects " + genericParameters.size()
                    + " type arguments but got " + arguments.size());
        }
        return new GenericInstanceType(this, arguments);
    }

    /**
     * 以自身类型参数实例化的类型（如 Option&lt;T&gt;），非泛型时返回自身。
     */
    public TypeDescriptor getSelfType() {
        return genericParameters.isEmpty() ? this : new GenericInstanceType(this, genericParameters);
    }

    // ==================== 继承 ====================

    @Override
    public TypeDescriptor getBaseType() {
        ensureMembers();
        return baseType;
    }

    public void setBaseType(TypeDescriptor baseType) {
        this.baseType = baseType;
    }

    @Override
    public List<TypeDescriptor> getInterfaces() {
        ensureMembers();
        return Collections.unmodifiableList(interfaces);
    }

    public void addInterface(TypeDescriptor iface) {
        interfaces.add(iface);
    }

    // ==================== 成员 ====================

    @Override
    public List<FieldDescriptor> getFields() {
        ensureMembers();
        return Collections.unmodifiableList(fields);
    }

    @Override
    public List<PropertyDescriptor> getProperties() {
        ensureMembers();
        return Collections.unmodifiableList(properties);
    }

    @Override
    public List<MethodDescriptor> getMethods() {
        ensureMembers();
        return Collections.unmodifiableList(methods);
    }

    @Override
    public List<ConstructorDescriptor> getConstructors() {
        ensureMembers();
        return Collections.unmodifiableList(constructors);
    }

    public void addField(FieldDescriptor field) {
        fields.add(field);
    }

    public void addProperty(PropertyDescriptor property) {
        properties.add(property);
    }

    public void addMethod(MethodDescriptor method) {
        methods.add(method);
    }

    public void addConstructor(ConstructorDescriptor constructor) {
        constructors.add(constructor);
    }

    @Override
    public UnionInfo getUnionInfo() {
        ensureMembers();
        return unionInfo;
    }

    public void setUnionInfo(UnionInfo unionInfo) {
        this.unionInfo = unionInfo;
    }

    @Override
    public RecordInfo getRecordInfo() {
        ensureMembers();
        return recordInfo;
    }

    public void setRecordInfo(RecordInfo recordInfo) {
        this.recordInfo = recordInfo;
    }

    public void setMemberInitializer(Consumer<DefinedType> memberInitializer) {
        this.memberInitializer = memberInitializer;
    }

    protected final void ensureMembers() {
        Consumer<DefinedType> init = memberInitializer;
        if (init != null) {
            // 先清空，初始化过程中的自引用不会再次触发
            memberInitializer = null;
            init.accept(this);
        }
    }
}
