package avm.runtime.types;

import avm.runtime.AvmError;
import avm.runtime.AvmValue;
import avm.runtime.QName;
import avm.runtime.cache.BoundedCache;
import avm.runtime.cache.CacheStats;
import avm.runtime.cache.CaffeineCache;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * AVM 类描述符，可以是泛型类（声明一个类型参数）。
 *
 * <p>特化结果缓存在泛型基类自身上，域里只保存未特化的基类。
 * 特化类按 (基类, 参数类) 结构相等，缓存条目被淘汰后重建的实例与原实例不可区分。</p>
 */
public final class AvmClass extends AvmValue {

    private static final Logger LOG = Logger.getLogger(AvmClass.class.getName());

    /** 特化缓存默认容量 */
    public static final int DEFAULT_SPECIALIZATION_CACHE_SIZE = 256;

    private final QName name;
    private final boolean generic;
    private final int specializationCacheSize;

    // 仅特化类非 null
    private final AvmClass genericBase;
    private final AvmClass param;

    // 延迟分配：只有被特化过的泛型类才需要
    private BoundedCache<AvmClass, AvmClass> specializations;

    private AvmClass(QName name, boolean generic, int specializationCacheSize,
                     AvmClass genericBase, AvmClass param) {
        this.name = Objects.requireNonNull(name, "name");
        this.generic = generic;
        this.specializationCacheSize = specializationCacheSize;
        this.genericBase = genericBase;
        this.param = param;
    }

    /** 普通（非泛型）类 */
    public static AvmClass of(QName name) {
        return new AvmClass(name, false, 0, null, null);
    }

    /** 泛型类 */
    public static AvmClass generic(QName name) {
        return generic(name, DEFAULT_SPECIALIZATION_CACHE_SIZE);
    }

    /**
     * 泛型类
     *
     * @param specializationCacheSize 特化缓存容量
     */
    public static AvmClass generic(QName name, int specializationCacheSize) {
        if (specializationCacheSize <= 0) {
            throw new IllegalArgumentException("specializationCacheSize must be positive");
        }
        return new AvmClass(name, true, specializationCacheSize, null, null);
    }

    public QName getName() {
        return name;
    }

    public boolean isGeneric() {
        return generic;
    }

    public boolean isSpecialization() {
        return genericBase != null;
    }

    public AvmClass getGenericBase() {
        return genericBase;
    }

    /** 已应用的类型参数，未特化返回 null */
    public AvmClass getParam() {
        return param;
    }

    // ============ 泛型特化 ============

    /**
     * 以参数类特化本类。
     *
     * @param param 参数类，null 表示任意类型，直接返回本类
     * @throws AvmError 本类不是泛型类（TypeError #1127）
     */
    public AvmClass withTypeParam(AvmClass param) {
        if (param == null) {
            return this;
        }
        if (!generic) {
            throw AvmError.typeError("Type application attempted on a non-parameterized type "
                    + name.toQualifiedName() + ".", AvmError.NON_PARAMETERIZED_TYPE);
        }
        if (specializations == null) {
            specializations = new CaffeineCache<>(specializationCacheSize);
        }
        return specializations.computeIfAbsent(param, this::specialize);
    }

    /**
     * 值层面的类型应用（{@code Vector.<T>} 的运行时形式）。
     *
     * @param arg 类对象；null 或 undefined 表示任意类型
     */
    public AvmClass apply(AvmValue arg) {
        if (arg == null || arg.isUndefined()) {
            return withTypeParam(null);
        }
        if (arg instanceof AvmClass) {
            return withTypeParam((AvmClass) arg);
        }
        throw AvmError.typeError("Type Coercion failed: cannot convert " + arg.getTypeName()
                + " to Class.", AvmError.TYPE_COERCION_FAILED);
    }

    /** 特化缓存统计，未特化过返回 null */
    public CacheStats getSpecializationStats() {
        return specializations != null ? specializations.getStats() : null;
    }

    private AvmClass specialize(AvmClass p) {
        QName specializedName = new QName(name.getNamespace(),
                name.getLocalName() + ".<" + p.getName().toQualifiedName() + ">");
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Specialized " + name.toQualifiedName() + " as " + specializedName.toQualifiedName());
        }
        return new AvmClass(specializedName, false, 0, this, p);
    }

    // ============ AvmValue ============

    @Override
    public String getTypeName() {
        return "Class";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (genericBase == null || !(o instanceof AvmClass)) return false;
        AvmClass other = (AvmClass) o;
        return genericBase == other.genericBase && param.equals(other.param);
    }

    @Override
    public int hashCode() {
        if (genericBase == null) return System.identityHashCode(this);
        return 31 * System.identityHashCode(genericBase) + param.hashCode();
    }

    @Override
    public String toString() {
        return "[class " + name.getLocalName() + "]";
    }
}
