package avm.runtime.types;

import avm.runtime.AvmError;
import avm.runtime.AvmValue;
import avm.runtime.Multiname;
import avm.runtime.QName;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 应用域：共享同一组定义的脚本和影片集合。
 *
 * <p>每个域持有两张导出表（脚本、类）、一个不可变的父域引用和一块域内存。
 * 查找先查本地表，未命中则沿父链向上，父链只在构造时设置，因此必然无环。</p>
 *
 * <p>相等性为引用相等：两个句柄相等当且仅当指向同一个域。</p>
 */
public final class Domain {

    private static final Logger LOG = Logger.getLogger(Domain.class.getName());

    /** 所有导出的定义及导出它们的脚本 */
    private final PropertyMap<Script> defs = new PropertyMap<>();

    /** 本域定义的所有类 */
    private final PropertyMap<AvmClass> classes = new PropertyMap<>();

    private final Domain parent;

    /**
     * 域内存。只有引导阶段的系统域会暂时为 null（此时字节缓冲类型尚未可用），
     * 用户代码运行前必须通过 {@link #initDefaultDomainMemory} 补齐。
     */
    private MemoryRegion domainMemory;

    private Domain(Domain parent) {
        this.parent = parent;
    }

    /**
     * 创建没有域内存的域。
     *
     * <p>仅用于字节缓冲类型可用之前创建的系统域；调用方必须在用户代码运行前调用
     * {@link #initDefaultDomainMemory}。</p>
     *
     * @param parent 父域，可为 null
     */
    public static Domain uninitializedDomain(Domain parent) {
        Domain domain = new Domain(parent);
        LOG.fine("Created uninitialized domain");
        return domain;
    }

    /**
     * 创建内容域，构造时即分配默认域内存。
     */
    public static Domain movieDomain(Domain parent, MemoryRegionFactory memoryFactory) {
        Objects.requireNonNull(parent, "parent");
        Domain domain = new Domain(parent);
        domain.initDefaultDomainMemory(memoryFactory);
        LOG.fine("Created movie domain");
        return domain;
    }

    public Domain getParentDomain() {
        return parent;
    }

    // ============ 定义查询 ============

    /**
     * 本域或任一祖先域是否导出了该名称的脚本定义
     */
    public boolean hasDefinition(QName name) {
        for (Domain d = this; d != null; d = d.parent) {
            if (d.defs.containsKey(name)) return true;
        }
        return false;
    }

    /**
     * 本域或任一祖先域是否定义了该名称的类
     */
    public boolean hasClass(QName name) {
        for (Domain d = this; d != null; d = d.parent) {
            if (d.classes.containsKey(name)) return true;
        }
        return false;
    }

    /**
     * 解析多名称，返回提供它的脚本及匹配到的限定名。
     *
     * @return 未找到返回 null（不是错误，由调用方决定是否致命）
     */
    public ScriptDefinition getDefiningScript(Multiname multiname) {
        if (multiname.hasLocalName()) {
            PropertyMap.Match<Script> match = defs.getWithNsForMultiname(multiname);
            if (match != null) {
                return new ScriptDefinition(new QName(match.getNamespace(), multiname.getLocalName()),
                        match.getValue());
            }
        }
        return parent != null ? parent.getDefiningScript(multiname) : null;
    }

    /**
     * 解析多名称，找不到时抛出 ReferenceError #1065。
     *
     * @throws IllegalArgumentException 多名称没有本地名（调用方误用）
     */
    public ScriptDefinition findDefiningScript(Multiname multiname) {
        ScriptDefinition definition = getDefiningScript(multiname);
        if (definition != null) {
            return definition;
        }
        if (!multiname.hasLocalName()) {
            throw new IllegalArgumentException("Attempted to resolve uninitiated multiname");
        }
        throw AvmError.referenceError("Error #1065: Variable " + multiname.getLocalName()
                + " is not defined.", AvmError.VARIABLE_NOT_DEFINED);
    }

    /**
     * 解析类。多名称携带非通配类型参数时，沿同一条域链解析参数类后特化基类；
     * 参数类解析不到则整个查找返回 null。
     */
    public AvmClass getClass(Multiname multiname) {
        AvmClass base = getClassInner(multiname);
        if (base == null) {
            return null;
        }
        Multiname param = multiname.getParam();
        if (param == null || param.isAnyName()) {
            return base;
        }
        AvmClass resolvedParam = getClass(param);
        if (resolvedParam == null) {
            return null;
        }
        return base.withTypeParam(resolvedParam);
    }

    private AvmClass getClassInner(Multiname multiname) {
        for (Domain d = this; d != null; d = d.parent) {
            AvmClass cls = d.classes.getForMultiname(multiname);
            if (cls != null) return cls;
        }
        return null;
    }

    /**
     * 读取本域中可见的定义值：找到定义脚本，必要时运行它，再从其全局对象读取。
     */
    public AvmValue getDefinedValue(QName name) {
        ScriptDefinition definition = findDefiningScript(name.toMultiname());
        ScriptGlobals globals = definition.getScript().globals();
        return globals.getProperty(definition.getName());
    }

    /**
     * 本域导出表中的名称快照（不含祖先），按插入顺序
     */
    public List<QName> getDefinedNames() {
        return defs.names();
    }

    /** 本域类表中的名称快照（不含祖先），按插入顺序 */
    public List<QName> getClassNames() {
        return classes.names();
    }

    // ============ 导出 ============

    /**
     * 导出脚本定义。本域或祖先已有同名定义时什么也不做：先导出者胜出。
     */
    public void exportDefinition(QName name, Script script) {
        if (hasDefinition(name)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Ignoring export of " + name.toQualifiedName() + " from " + script
                        + ": already defined");
            }
            return;
        }
        defs.insert(name, script);
    }

    /**
     * 导出类，键为类自身的名称。本域或祖先已有同名类时什么也不做。
     */
    public void exportClass(AvmClass cls) {
        QName name = cls.getName();
        if (hasClass(name)) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Ignoring export of class " + name.toQualifiedName() + ": already defined");
            }
            return;
        }
        classes.insert(name, cls);
    }

    // ============ 域内存 ============

    /**
     * @throws IllegalStateException 域内存缺失（构造顺序错误，不可恢复）
     */
    public MemoryRegion getDomainMemory() {
        if (domainMemory == null) {
            throw new IllegalStateException("Domain must have valid memory at all times");
        }
        return domainMemory;
    }

    public boolean hasDomainMemory() {
        return domainMemory != null;
    }

    public void setDomainMemory(MemoryRegion domainMemory) {
        this.domainMemory = Objects.requireNonNull(domainMemory, "domainMemory");
    }

    /**
     * 分配默认域内存（若尚未分配）。对已完整初始化的域无效果。
     */
    public void initDefaultDomainMemory(MemoryRegionFactory memoryFactory) {
        if (domainMemory != null) {
            return;
        }
        MemoryRegion memory = memoryFactory.create();
        if (memory == null) {
            throw new IllegalStateException("Memory factory returned no domain memory");
        }
        this.domainMemory = memory;
    }

    @Override
    public String toString() {
        return "<domain: defs=" + defs.size() + ", classes=" + classes.size()
                + (parent == null ? ", root" : "") + ">";
    }
}
