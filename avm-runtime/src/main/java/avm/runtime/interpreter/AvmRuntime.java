package avm.runtime.interpreter;

import avm.runtime.types.Domain;
import avm.runtime.types.MemoryRegionFactory;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * AVM 运行时：负责系统域的引导和内容域的创建。
 *
 * <p>引导顺序：</p>
 * <ol>
 *   <li>以 {@link Domain#uninitializedDomain} 创建系统域（此时字节缓冲类型还不存在）</li>
 *   <li>导出内置类，其中包括 ByteArray</li>
 *   <li>ByteArray 可用后为系统域（及舞台域）补齐默认域内存</li>
 * </ol>
 * <p>构造函数返回后，任何域都不会缺少域内存。</p>
 */
public final class AvmRuntime {

    private static final Logger LOG = Logger.getLogger(AvmRuntime.class.getName());

    private final AvmConfig config;
    private final Domain systemDomain;
    private final Domain stageDomain;
    private final BuiltinClasses builtins;
    private final MemoryRegionFactory memoryFactory;

    public AvmRuntime() {
        this(AvmConfig.defaults());
    }

    public AvmRuntime(AvmConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.systemDomain = Domain.uninitializedDomain(null);
        this.stageDomain = config.hasStageDomain() ? Domain.uninitializedDomain(systemDomain) : null;
        this.builtins = BuiltinClasses.install(systemDomain, config);
        if (!systemDomain.hasClass(BuiltinClasses.BYTE_ARRAY)) {
            throw new IllegalStateException("ByteArray must be installed before domain memory");
        }
        this.memoryFactory = MemoryRegionFactory.ofLength(config.getDefaultDomainMemoryLength());
        systemDomain.initDefaultDomainMemory(memoryFactory);
        if (stageDomain != null) {
            stageDomain.initDefaultDomainMemory(memoryFactory);
        }
        LOG.info("AVM runtime initialized: " + config);
    }

    public AvmConfig getConfig() {
        return config;
    }

    /** 系统（playerglobals）域 */
    public Domain getSystemDomain() {
        return systemDomain;
    }

    /**
     * 舞台域；配置关闭舞台域时返回系统域
     */
    public Domain getStageDomain() {
        return stageDomain != null ? stageDomain : systemDomain;
    }

    public BuiltinClasses getBuiltins() {
        return builtins;
    }

    public MemoryRegionFactory getMemoryFactory() {
        return memoryFactory;
    }

    /** 引用相等判断是否为系统域 */
    public boolean isSystemDomain(Domain domain) {
        return domain == systemDomain;
    }

    /**
     * 创建以舞台域为父域的内容域
     */
    public Domain createMovieDomain() {
        return createMovieDomain(getStageDomain());
    }

    /**
     * 创建内容域，构造时即分配默认域内存
     */
    public Domain createMovieDomain(Domain parent) {
        return Domain.movieDomain(parent, memoryFactory);
    }

    /** 为指定域创建解释器句柄 */
    public Activation activation(Domain domain) {
        return new Activation(this, domain);
    }
}
