package avm.runtime.types;

/**
 * 字节缓冲提供者。
 *
 * <p>引导阶段系统域创建时该类型尚不可用，因此域只在拿到工厂后才分配内存。</p>
 */
@FunctionalInterface
public interface MemoryRegionFactory {

    /**
     * 分配一块新的默认域内存
     */
    MemoryRegion create();

    /** 按固定长度分配的工厂 */
    static MemoryRegionFactory ofLength(int length) {
        return () -> new MemoryRegion(length);
    }
}
