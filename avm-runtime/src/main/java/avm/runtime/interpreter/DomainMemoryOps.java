package avm.runtime.interpreter;

/**
 * 域内存指令：li8/li16/li32/lf32/lf64、si8/si16/si32/sf32/sf64 以及符号扩展 sxi1/sxi8/sxi16。
 *
 * <p>地址越界由 {@link avm.runtime.types.MemoryRegion} 抛出 RangeError。
 * 存储指令按目标宽度截断。</p>
 */
public final class DomainMemoryOps {

    private DomainMemoryOps() {}

    // ============ 加载 ============

    /** 读无符号 8 位 */
    public static int li8(Activation activation, int address) {
        return activation.getDomainMemory().readUnsignedByte(address);
    }

    /** 读无符号 16 位 */
    public static int li16(Activation activation, int address) {
        return activation.getDomainMemory().readUnsignedShort(address);
    }

    public static int li32(Activation activation, int address) {
        return activation.getDomainMemory().readInt(address);
    }

    public static double lf32(Activation activation, int address) {
        return activation.getDomainMemory().readFloat(address);
    }

    public static double lf64(Activation activation, int address) {
        return activation.getDomainMemory().readDouble(address);
    }

    // ============ 存储 ============

    public static void si8(Activation activation, int value, int address) {
        activation.getDomainMemory().writeByte(address, value);
    }

    public static void si16(Activation activation, int value, int address) {
        activation.getDomainMemory().writeShort(address, value);
    }

    public static void si32(Activation activation, int value, int address) {
        activation.getDomainMemory().writeInt(address, value);
    }

    public static void sf32(Activation activation, double value, int address) {
        activation.getDomainMemory().writeFloat(address, (float) value);
    }

    public static void sf64(Activation activation, double value, int address) {
        activation.getDomainMemory().writeDouble(address, value);
    }

    // ============ 符号扩展 ============

    /** 最低位扩展为 0 或 -1 */
    public static int sxi1(int value) {
        return -(value & 1);
    }

    public static int sxi8(int value) {
        return (byte) value;
    }

    public static int sxi16(int value) {
        return (short) value;
    }
}
