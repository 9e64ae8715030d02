package com.typebridge.retarget;

import com.typebridge.model.BindingFlag;
import com.typebridge.model.ConstructorDescriptor;
import com.typebridge.model.FieldDescriptor;
import com.typebridge.model.MethodDescriptor;
import com.typebridge.model.PropertyDescriptor;
import com.typebridge.model.TypeDescriptor;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 成员解析：先把声明类型解析到目标宇宙，再在解析后的类型上按名称和签名查找对应成员。
 * <p>
 * 宿主合成的成员原样通过。成员不缓存，每次按解析后的类型重新查找。
 */
public final class MemberResolver {

    private static final Logger LOG = Logger.getLogger(MemberResolver.class.getName());

    private final TypeUniverseResolver types;

    public MemberResolver(TypeUniverseResolver types) {
        this.types = types;
    }

    // ==================== 属性 / 字段 ====================

    /**
     * 属性按名称查找，可见性不限，静态性与原属性的访问器一致。
     */
    public PropertyDescriptor resolveProperty(Direction direction, PropertyDescriptor property) {
        if (property.isHostDefined()) {
            return property;
        }
        TypeDescriptor declaring = types.resolve(direction, property.getDeclaringType());
        Set<BindingFlag> flags = EnumSet.of(BindingFlag.PUBLIC, BindingFlag.NON_PUBLIC,
                isStaticAccessor(property) ? BindingFlag.STATIC : BindingFlag.INSTANCE);
        PropertyDescriptor found = declaring.getProperty(property.getName(), flags);
        if (found == null) {
            throw new MemberNotFoundException(direction, property, declaring);
        }
        trace(direction, property, found);
        return found;
    }

    private static boolean isStaticAccessor(PropertyDescriptor property) {
        MethodDescriptor getter = property.getGetter();
        MethodDescriptor setter = property.getSetter();
        return (getter != null && getter.isStatic()) || (setter != null && setter.isStatic());
    }

    /**
     * 字段按名称查找，可见性与静态性都取自原字段。
     */
    public FieldDescriptor resolveField(Direction direction, FieldDescriptor field) {
        if (field.isHostDefined()) {
            return field;
        }
        TypeDescriptor declaring = types.resolve(direction, field.getDeclaringType());
        Set<BindingFlag> flags = EnumSet.of(
                field.isPublic() ? BindingFlag.PUBLIC : BindingFlag.NON_PUBLIC,
                field.isStatic() ? BindingFlag.STATIC : BindingFlag.INSTANCE);
        FieldDescriptor found = declaring.getField(field.getName(), flags);
        if (found == null) {
            throw new MemberNotFoundException(direction, field, declaring);
        }
        trace(direction, field, found);
        return found;
    }

    // ==================== 方法 / 构造器 ====================

    /**
     * 泛型方法实例：先解析其泛型定义，再用解析后的类型实参重新实例化。
     * 其余方法按名称和解析后的参数类型精确匹配。
     */
    public MethodDescriptor resolveMethod(Direction direction, MethodDescriptor method) {
        if (method.isHostDefined()) {
            return method;
        }
        MethodDescriptor found;
        if (method.isGenericMethod() && !method.isGenericMethodDefinition()) {
            MethodDescriptor definition = findMethod(direction, method.getGenericMethodDefinition());
            found = definition.makeGenericMethod(types.resolveAll(direction, method.getGenericArguments()));
        } else {
            found = findMethod(direction, method);
        }
        trace(direction, method, found);
        return found;
    }

    private MethodDescriptor findMethod(Direction direction, MethodDescriptor method) {
        TypeDescriptor declaring = types.resolve(direction, method.getDeclaringType());
        List<TypeDescriptor> parameterTypes = types.resolveAll(direction, method.getParameterTypes());
        MethodDescriptor found = declaring.getMethod(method.getName(), parameterTypes);
        if (found == null) {
            throw new MemberNotFoundException(direction, method, declaring);
        }
        return found;
    }

    public ConstructorDescriptor resolveConstructor(Direction direction, ConstructorDescriptor constructor) {
        if (constructor.isHostDefined()) {
            return constructor;
        }
        TypeDescriptor declaring = types.resolve(direction, constructor.getDeclaringType());
        ConstructorDescriptor found = declaring.getConstructor(
                types.resolveAll(direction, constructor.getParameterTypes()));
        if (found == null) {
            throw new MemberNotFoundException(direction, constructor, declaring);
        }
        trace(direction, constructor, found);
        return found;
    }

    private static void trace(Direction direction, Object from, Object to) {
        if (LOG.isLoggable(Level.FINER)) {
            LOG.finer(direction + " member " + from + " --> " + to);
        }
    }
}
