package com.typebridge.loader;

import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.DefinedType;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.GenericParameterType;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.ModuleHandle;
import com.typebridge.model.ParameterInfo;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TypeDescriptor;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;
import org.objectweb.asm.signature.SignatureReader;
import org.objectweb.asm.signature.SignatureVisitor;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 用 ASM 读取目录或 JAR 中的 class 文件构成的模块。
 *
 * <p>首次查询时扫描全部条目，只解析类头（名字、泛型签名）建立索引；
 * 字段、方法、构造器、基类和接口在类型成员第一次被访问时才解析。</p>
 *
 * <p>成员签名中引用的类型经 {@link #setTypeResolver(Function)} 设置的解析函数查找
 * （通常是所属宇宙），找不到时返回不属于任何模块的占位类型，只保留全限定名。</p>
 */
public final class ClassFileModule implements ModuleHandle {

    private static final Logger LOG = Logger.getLogger(ClassFileModule.class.getName());

    private static final int PARSE_FLAGS = ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES;

    private final String name;
    private final Path location;

    /** 全限定名 → 类型，延迟构建 */
    private volatile Map<String, DefinedType> index;
    private final Map<String, DefinedType> placeholders = new ConcurrentHashMap<>();
    private volatile Function<String, TypeDescriptor> typeResolver;

    public ClassFileModule(String name, Path location) {
        this.name = name;
        this.location = location;
        this.typeResolver = this::findType;
    }

    @Override
    public String getName() {
        return name;
    }

    public Path getLocation() {
        return location;
    }

    /**
     * 设置成员签名中类型引用的解析函数；返回 null 表示无法解析。
     */
    public void setTypeResolver(Function<String, TypeDescriptor> typeResolver) {
        this.typeResolver = typeResolver;
    }

    @Override
    public List<TypeDescriptor> getTypes() {
        return new ArrayList<TypeDescriptor>(index().values());
    }

    @Override
    public TypeDescriptor findType(String fullName) {
        return index().get(fullName);
    }

    @Override
    public String toString() {
        return name;
    }

    // ==================== 索引 ====================

    private Map<String, DefinedType> index() {
        if (index == null) {
            synchronized (this) {
                if (index == null) {
                    index = buildIndex();
                }
            }
        }
        return index;
    }

    private Map<String, DefinedType> buildIndex() {
        Map<String, byte[]> classes = new LinkedHashMap<>();
        try {
            if (Files.isDirectory(location)) {
                readDirectory(classes);
            } else {
                readJar(classes);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read class files of module '" + name + "' from " + location, e);
        }

        Map<String, DefinedType> types = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : classes.entrySet()) {
            DefinedType type = parseHeader(entry.getKey(), entry.getValue());
            if (type != null) {
                types.put(type.getFullName(), type);
            }
        }
        LOG.info("Class file index built for module '" + name + "': " + types.size() + " classes from " + location);
        return Collections.unmodifiableMap(types);
    }

    private void readDirectory(Map<String, byte[]> classes) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(location)) {
            files = walk.filter(p -> isClassEntry(location.relativize(p).toString().replace('\\', '/')))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            try (InputStream is = Files.newInputStream(file)) {
                classes.put(location.relativize(file).toString().replace('\\', '/'), readAllBytes(is));
            } catch (IOException e) {
                LOG.fine("Failed to read class file: " + file);
            }
        }
    }

    private void readJar(Map<String, byte[]> classes) throws IOException {
        try (JarFile jar = new JarFile(location.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (entry.isDirectory() || !isClassEntry(entry.getName())) continue;
                try (InputStream is = jar.getInputStream(entry)) {
                    classes.put(entry.getName(), readAllBytes(is));
                } catch (IOException e) {
                    LOG.fine("Failed to read " + entry.getName() + " from JAR: " + location);
                }
            }
        }
    }

    private static boolean isClassEntry(String path) {
        return path.endsWith(".class") && !path.endsWith("module-info.class") && !path.endsWith("package-info.class");
    }

    private DefinedType parseHeader(String entry, byte[] bytecode) {
        try {
            ClassReader reader = new ClassReader(bytecode);
            String fullName = reader.getClassName().replace('/', '.');
            List<String> typeParams = new ArrayList<>();
            reader.accept(new ClassVisitor(Opcodes.ASM9) {
                @Override
                public void visit(int version, int access, String name, String signature,
                                  String superName, String[] interfaces) {
                    if (signature != null) {
                        new SignatureReader(signature).accept(new SignatureVisitor(Opcodes.ASM9) {
                            @Override
                            public void visitFormalTypeParameter(String name) {
                                typeParams.add(name);
                            }
                        });
                    }
                }
            }, PARSE_FLAGS);
            DefinedType type = DefinedType.ofFullName(this, fullName, typeParams);
            type.setMemberInitializer(t -> populate(t, bytecode));
            return type;
        } catch (RuntimeException e) {
            LOG.fine("Failed to parse class header of " + entry + ": " + e.getMessage());
            return null;
        }
    }

    // ==================== 成员 ====================

    private void populate(DefinedType type, byte[] bytecode) {
        final Map<String, TypeDescriptor> classVariables = new HashMap<>();
        for (GenericParameterType g : type.getGenericParameters()) {
            classVariables.put(g.getName(), g);
        }
        new ClassReader(bytecode).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public void visit(int version, int access, String name, String signature,
                              String superName, String[] interfaces) {
                if (signature != null) {
                    new SignatureReader(signature).accept(new SignatureVisitor(Opcodes.ASM9) {
                        @Override
                        public SignatureVisitor visitSuperclass() {
                            return new TypeSignatureBuilder(classVariables, type::setBaseType);
                        }

                        @Override
                        public SignatureVisitor visitInterface() {
                            return new TypeSignatureBuilder(classVariables, type::addInterface);
                        }

                        @Override
                        public SignatureVisitor visitClassBound() {
                            return new TypeSignatureBuilder(classVariables, t -> { });
                        }

                        @Override
                        public SignatureVisitor visitInterfaceBound() {
                            return new TypeSignatureBuilder(classVariables, t -> { });
                        }
                    });
                    return;
                }
                if (superName != null) {
                    type.setBaseType(reference(superName.replace('/', '.')));
                }
                if (interfaces != null) {
                    for (String iface : interfaces) {
                        type.addInterface(reference(iface.replace('/', '.')));
                    }
                }
            }

            @Override
            public FieldVisitor visitField(int access, String name, String descriptor,
                                           String signature, Object value) {
                if ((access & Opcodes.ACC_SYNTHETIC) != 0) return null;
                TypeDescriptor fieldType;
                if (signature != null) {
                    TypeDescriptor[] holder = new TypeDescriptor[1];
                    new SignatureReader(signature).acceptType(
                            new TypeSignatureBuilder(classVariables, t -> holder[0] = t));
                    fieldType = holder[0];
                } else {
                    fieldType = fromDescriptor(Type.getType(descriptor));
                }
                type.addField(new FieldDescriptor(type, name, fieldType,
                        (access & Opcodes.ACC_STATIC) != 0, (access & Opcodes.ACC_PUBLIC) != 0));
                return null;
            }

            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor,
                                             String signature, String[] exceptions) {
                if ((access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0 || name.equals("<clinit>")) {
                    return null;
                }
                addMethod(type, classVariables, access, name, descriptor, signature);
                return null;
            }
        }, PARSE_FLAGS);
    }

    private void addMethod(DefinedType type, Map<String, TypeDescriptor> classVariables, int access,
                           String name, String descriptor, String signature) {
        boolean isStatic = (access & Opcodes.ACC_STATIC) != 0;
        boolean isPublic = (access & Opcodes.ACC_PUBLIC) != 0;
        final List<GenericParameterType> methodTypeParams = new ArrayList<>();
        final List<TypeDescriptor> paramTypes = new ArrayList<>();
        final TypeDescriptor[] returnType = new TypeDescriptor[1];

        if (signature != null) {
            final Map<String, TypeDescriptor> variables = new HashMap<>(classVariables);
            new SignatureReader(signature).accept(new SignatureVisitor(Opcodes.ASM9) {
                @Override
                public void visitFormalTypeParameter(String typeParam) {
                    GenericParameterType g = new GenericParameterType(typeParam, methodTypeParams.size(), true);
                    methodTypeParams.add(g);
                    variables.put(typeParam, g);
                }

                @Override
                public SignatureVisitor visitClassBound() {
                    return new TypeSignatureBuilder(variables, t -> { });
                }

                @Override
                public SignatureVisitor visitInterfaceBound() {
                    return new TypeSignatureBuilder(variables, t -> { });
                }

                @Override
                public SignatureVisitor visitParameterType() {
                    return new TypeSignatureBuilder(variables, paramTypes::add);
                }

                @Override
                public SignatureVisitor visitReturnType() {
                    return new TypeSignatureBuilder(variables, t -> returnType[0] = t);
                }

                @Override
                public SignatureVisitor visitExceptionType() {
                    return new TypeSignatureBuilder(variables, t -> { });
                }
            });
        }
        // 内部类构造器等场景的签名可能省略合成参数，此时以描述符为准
        Type[] argTypes = Type.getArgumentTypes(descriptor);
        if (signature == null || paramTypes.size() != argTypes.length) {
            paramTypes.clear();
            for (Type t : argTypes) {
                paramTypes.add(fromDescriptor(t));
            }
        }
        if (returnType[0] == null) {
            returnType[0] = fromDescriptor(Type.getReturnType(descriptor));
        }

        List<ParameterInfo> params = new ArrayList<>(paramTypes.size());
        for (int i = 0; i < paramTypes.size(); i++) {
            params.add(new ParameterInfo("arg" + i, paramTypes.get(i)));
        }
        if (name.equals(ConstructorDescriptor.NAME)) {
            type.addConstructor(new ConstructorDescriptor(type, params, isPublic, null));
        } else {
            type.addMethod(new MethodDescriptor(type, name, params, returnType[0], isStatic, isPublic,
                    methodTypeParams, null));
        }
    }

    // ==================== 类型引用 ====================

    /**
     * 按全限定名解析引用的类型，找不到时返回占位类型。
     */
    TypeDescriptor reference(String fullName) {
        TypeDescriptor found = typeResolver.apply(fullName);
        if (found != null) return found;
        return placeholders.computeIfAbsent(fullName,
                n -> DefinedType.ofFullName(null, n, Collections.<String>emptyList()));
    }

    private TypeDescriptor fromDescriptor(Type type) {
        switch (type.getSort()) {
            case Type.VOID:    return PrimitiveType.VOID;
            case Type.BOOLEAN: return PrimitiveType.BOOLEAN;
            case Type.CHAR:    return PrimitiveType.CHAR;
            case Type.BYTE:    return PrimitiveType.BYTE;
            case Type.SHORT:   return PrimitiveType.SHORT;
            case Type.INT:     return PrimitiveType.INT;
            case Type.FLOAT:   return PrimitiveType.FLOAT;
            case Type.LONG:    return PrimitiveType.LONG;
            case Type.DOUBLE:  return PrimitiveType.DOUBLE;
            case Type.ARRAY: {
                TypeDescriptor t = fromDescriptor(type.getElementType());
                for (int i = 0; i < type.getDimensions(); i++) {
                    t = t.makeArrayType();
                }
                return t;
            }
            default:
                return reference(type.getClassName());
        }
    }

    private static TypeDescriptor fromPrimitiveDescriptor(char descriptor) {
        switch (descriptor) {
            case 'V': return PrimitiveType.VOID;
            case 'Z': return PrimitiveType.BOOLEAN;
            case 'C': return PrimitiveType.CHAR;
            case 'B': return PrimitiveType.BYTE;
            case 'S': return PrimitiveType.SHORT;
            case 'I': return PrimitiveType.INT;
            case 'F': return PrimitiveType.FLOAT;
            case 'J': return PrimitiveType.LONG;
            case 'D': return PrimitiveType.DOUBLE;
            default:
                throw new IllegalArgumentException("Unknown primitive descriptor: " + descriptor);
        }
    }

    /**
     * 把一个类型签名（JVMS 4.7.9.1 的 JavaTypeSignature）拼成类型描述符，完成时交给 sink。
     * 通配符取其边界，无界通配符取 java.lang.Object。
     */
    private final class TypeSignatureBuilder extends SignatureVisitor {

        private final Map<String, TypeDescriptor> variables;
        private final Consumer<TypeDescriptor> sink;
        private String className;
        private List<TypeDescriptor> arguments;

        TypeSignatureBuilder(Map<String, TypeDescriptor> variables, Consumer<TypeDescriptor> sink) {
            super(Opcodes.ASM9);
            this.variables = variables;
            this.sink = sink;
        }

        @Override
        public void visitBaseType(char descriptor) {
            sink.accept(fromPrimitiveDescriptor(descriptor));
        }

        @Override
        public void visitTypeVariable(String variable) {
            TypeDescriptor t = variables.get(variable);
            sink.accept(t != null ? t : reference("java.lang.Object"));
        }

        @Override
        public SignatureVisitor visitArrayType() {
            return new TypeSignatureBuilder(variables, element -> sink.accept(element.makeArrayType()));
        }

        @Override
        public void visitClassType(String internalName) {
            className = internalName.replace('/', '.');
            arguments = new ArrayList<>();
        }

        @Override
        public void visitInnerClassType(String innerName) {
            className = className + "$" + innerName;
            arguments = new ArrayList<>();
        }

        @Override
        public void visitTypeArgument() {
            arguments.add(reference("java.lang.Object"));
        }

        @Override
        public SignatureVisitor visitTypeArgument(char wildcard) {
            return new TypeSignatureBuilder(variables, arguments::add);
        }

        @Override
        public void visitEnd() {
            TypeDescriptor raw = reference(className);
            if (!arguments.isEmpty() && raw.isGenericTypeDefinition()
                    && raw.getGenericArguments().size() == arguments.size()) {
                sink.accept(raw.makeGenericType(arguments));
            } else {
                sink.accept(raw);
            }
        }
    }

    private static byte[] readAllBytes(InputStream is) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        byte[] tmp = new byte[8192];
        int n;
        while ((n = is.read(tmp)) != -1) {
            buf.write(tmp, 0, n);
        }
        return buf.toByteArray();
    }
}
