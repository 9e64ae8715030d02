package com.typebridge.retarget;

import com.typebridge.model.ModuleHandle;
import com.typebridge.model.PrimitiveType;
import com.typebridge.model.TupleType;
import com.typebridge.model.TypeDescriptor;
import com.typebridge.model.TypeUniverse;
import com.typebridge.retarget.cache.CacheStats;
import com.typebridge.retarget.cache.CaffeineResolutionCache;
import com.typebridge.retarget.cache.ResolutionCache;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 类型宇宙解析器：把一个宇宙里的类型描述符映射到另一个宇宙里结构对应的描述符。
 * <p>
 * 分解规则：
 * <ul>
 *   <li>宿主合成类型与类型缩写原样通过，泛型参数原样通过</li>
 *   <li>泛型实例：解析泛型定义和每个实参，在目标宇宙重新实例化</li>
 *   <li>数组/引用/指针：解析元素类型后按原秩、原修饰重建；元组逐元素解析</li>
 *   <li>其余按修正后的全名在目标宇宙的每个模块中查找，恰好一个候选才算成功</li>
 * </ul>
 * 只有稳定的匹配写入缓存；交互式宿主模块里的匹配每次重新计算。
 * <p>
 * 非线程安全，一个实例只服务一个会话。
 */
public final class TypeUniverseResolver {

    private static final Logger LOG = Logger.getLogger(TypeUniverseResolver.class.getName());

    private final TypeUniverse origin;
    private final TypeUniverse target;
    private final ReplacerOptions options;
    private final ResolutionCache<TypeDescriptor, TypeDescriptor> forwardCache;
    private final ResolutionCache<TypeDescriptor, TypeDescriptor> backwardCache;

    public TypeUniverseResolver(TypeUniverse origin, TypeUniverse target, ReplacerOptions options) {
        this.origin = origin;
        this.target = target;
        this.options = options;
        this.forwardCache = new CaffeineResolutionCache<>(options.isRecordStats());
        this.backwardCache = new CaffeineResolutionCache<>(options.isRecordStats());
    }

    public TypeUniverse getOrigin() {
        return origin;
    }

    public TypeUniverse getTarget() {
        return target;
    }

    /**
     * 查找发生的宇宙：正向查 target，反向查 origin。
     */
    public TypeUniverse destinationOf(Direction direction) {
        return direction.isForward() ? target : origin;
    }

    public TypeDescriptor resolve(Direction direction, TypeDescriptor type) {
        if (type.isHostDefined() || type.isTypeAbbreviation()) {
            return type;
        }
        if (type.isGenericType() && !type.isGenericTypeDefinition()) {
            TypeDescriptor definition = resolveDefinition(direction, type.getGenericTypeDefinition());
            return definition.makeGenericType(resolveAll(direction, type.getGenericArguments()));
        }
        if (type.isGenericParameter()) {
            return type;
        }
        if (type.isArray() || type.isByRef() || type.isPointer()) {
            TypeDescriptor element = resolve(direction, type.getElementType());
            if (type.isArray()) {
                int rank = type.getArrayRank();
                return rank == 1 ? element.makeArrayType() : element.makeArrayType(rank);
            }
            return type.isByRef() ? element.makeByRefType() : element.makePointerType();
        }
        if (type.isTuple()) {
            return TupleType.of(resolveAll(direction, type.getTupleElements()));
        }
        return resolveDefinition(direction, type);
    }

    public List<TypeDescriptor> resolveAll(Direction direction, List<TypeDescriptor> types) {
        List<TypeDescriptor> result = new ArrayList<>(types.size());
        for (TypeDescriptor t : types) {
            result.add(resolve(direction, t));
        }
        return result;
    }

    private TypeDescriptor resolveDefinition(Direction direction, TypeDescriptor type) {
        ResolutionCache<TypeDescriptor, TypeDescriptor> cache = cacheFor(direction);
        TypeDescriptor cached = cache.get(type);
        if (cached != null) {
            return cached;
        }

        String fullName = options.fixName(type.getFullName());
        if (fullName.equals(options.getVoidTypeName())) {
            return PrimitiveType.VOID;
        }
        if (type.isPrimitive()) {
            return type;
        }

        TypeUniverse destination = destinationOf(direction);
        List<Candidate> candidates = new ArrayList<>();
        for (ModuleHandle module : destination.getModules()) {
            Candidate candidate = findInModule(fullName, module);
            if (candidate != null && !candidates.contains(candidate)) {
                candidates.add(candidate);
            }
        }

        if (candidates.size() == 1) {
            Candidate found = candidates.get(0);
            if (found.stable) {
                cache.put(type, found.type);
            }
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine(direction + " " + type + " --> " + found.type + (found.stable ? "" : " (unstable, not cached)"));
            }
            return found.type;
        }
        if (candidates.isEmpty()) {
            throw new TypeNotFoundException(direction, type, destination);
        }
        List<TypeDescriptor> types = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) types.add(c.type);
        throw new AmbiguousTypeException(direction, type, destination, types);
    }

    /**
     * 交互式宿主的模块可能含有同一声明的多个版本（REPL_0001.T、REPL_0002.T ...），
     * 取全名字典序最后的一个，并标记为不稳定。
     */
    private Candidate findInModule(String fullName, ModuleHandle module) {
        if (options.isInteractiveModule(module.getName())) {
            TypeDescriptor last = null;
            for (TypeDescriptor t : module.getTypes()) {
                if (options.fixName(t.getFullName()).equals(fullName)
                        && (last == null || t.getFullName().compareTo(last.getFullName()) >= 0)) {
                    last = t;
                }
            }
            return last == null ? null : new Candidate(last, false);
        }
        TypeDescriptor found = module.findType(fullName);
        return found == null ? null : new Candidate(found, true);
    }

    private ResolutionCache<TypeDescriptor, TypeDescriptor> cacheFor(Direction direction) {
        return direction.isForward() ? forwardCache : backwardCache;
    }

    // ==================== 诊断 ====================

    public boolean isCached(Direction direction, TypeDescriptor type) {
        return cacheFor(direction).contains(type);
    }

    public CacheStats getCacheStats(Direction direction) {
        return cacheFor(direction).getStats();
    }

    private static final class Candidate {
        final TypeDescriptor type;
        final boolean stable;

        Candidate(TypeDescriptor type, boolean stable) {
            this.type = type;
            this.stable = stable;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Candidate)) return false;
            Candidate other = (Candidate) o;
            return stable == other.stable && type.equals(other.type);
        }

        @Override
        public int hashCode() {
            return type.hashCode() * 31 + (stable ? 1 : 0);
        }
    }
}
