package avm.runtime.interpreter;

import avm.runtime.types.AvmClass;
import avm.runtime.types.MemoryRegion;

/**
 * 运行时配置
 *
 * <p>使用示例：</p>
 * <pre>
 * AvmRuntime runtime = new AvmRuntime(AvmConfig.defaults());
 *
 * AvmConfig config = AvmConfig.custom()
 *     .defaultDomainMemoryLength(64 * 1024)
 *     .specializationCacheSize(32)
 *     .build();
 * </pre>
 */
public final class AvmConfig {

    private final int defaultDomainMemoryLength;
    private final int specializationCacheSize;
    private final boolean stageDomain;

    private AvmConfig(Builder builder) {
        this.defaultDomainMemoryLength = builder.defaultDomainMemoryLength;
        this.specializationCacheSize = builder.specializationCacheSize;
        this.stageDomain = builder.stageDomain;
    }

    /** 默认配置：1024 字节域内存，创建舞台域 */
    public static AvmConfig defaults() {
        return new Builder().build();
    }

    public static Builder custom() {
        return new Builder();
    }

    public int getDefaultDomainMemoryLength() {
        return defaultDomainMemoryLength;
    }

    public int getSpecializationCacheSize() {
        return specializationCacheSize;
    }

    /** 是否在系统域和内容域之间创建舞台域 */
    public boolean hasStageDomain() {
        return stageDomain;
    }

    @Override
    public String toString() {
        return "AvmConfig{memory=" + defaultDomainMemoryLength
                + ", specializationCache=" + specializationCacheSize
                + ", stageDomain=" + stageDomain + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private int defaultDomainMemoryLength = MemoryRegion.DEFAULT_LENGTH;
        private int specializationCacheSize = AvmClass.DEFAULT_SPECIALIZATION_CACHE_SIZE;
        private boolean stageDomain = true;

        private Builder() {
        }

        /** 新域的默认内存长度，不得小于 1024 */
        public Builder defaultDomainMemoryLength(int length) {
            if (length < MemoryRegion.DEFAULT_LENGTH) {
                throw new IllegalArgumentException("defaultDomainMemoryLength must be >= "
                        + MemoryRegion.DEFAULT_LENGTH + ", got " + length);
            }
            this.defaultDomainMemoryLength = length;
            return this;
        }

        /** 每个泛型类的特化缓存容量 */
        public Builder specializationCacheSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("specializationCacheSize must be positive");
            }
            this.specializationCacheSize = size;
            return this;
        }

        public Builder stageDomain(boolean enabled) {
            this.stageDomain = enabled;
            return this;
        }

        public AvmConfig build() {
            return new AvmConfig(this);
        }
    }
}
