package avm.runtime.interpreter;

import avm.runtime.Multiname;
import avm.runtime.types.AvmClass;
import avm.runtime.types.Domain;
import avm.runtime.types.MemoryRegion;
import avm.runtime.types.ScriptDefinition;

import java.util.Objects;

/**
 * 解释器调用帧使用的域句柄。
 *
 * <p>名称查找指令走 {@link #resolveScript}/{@link #requireScript}/{@link #resolveClass}，
 * 域内存指令走 {@link #getDomainMemory}。</p>
 */
public final class Activation {

    private final AvmRuntime runtime;
    private final Domain domain;

    Activation(AvmRuntime runtime, Domain domain) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    public AvmRuntime getRuntime() {
        return runtime;
    }

    public Domain getDomain() {
        return domain;
    }

    /** 未找到返回 null */
    public ScriptDefinition resolveScript(Multiname multiname) {
        return domain.getDefiningScript(multiname);
    }

    /** 未找到抛出 ReferenceError #1065 */
    public ScriptDefinition requireScript(Multiname multiname) {
        return domain.findDefiningScript(multiname);
    }

    /** 未找到返回 null */
    public AvmClass resolveClass(Multiname multiname) {
        return domain.getClass(multiname);
    }

    public MemoryRegion getDomainMemory() {
        return domain.getDomainMemory();
    }

    public DomainReflection reflection() {
        return new DomainReflection(domain);
    }
}
