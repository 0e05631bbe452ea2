package avm.runtime.types;

import avm.runtime.AvmError;

/**
 * 域内存：可调整大小的线性字节缓冲，供 li8/si32 等低级内存指令使用。
 *
 * <p>所有多字节读写均为小端序。越界访问抛出 RangeError（#1506），不会截断或静默失败。</p>
 */
public final class MemoryRegion {

    /** 默认（也是最小的初始）长度 */
    public static final int DEFAULT_LENGTH = 1024;

    private byte[] bytes;
    private int length;

    public MemoryRegion() {
        this(DEFAULT_LENGTH);
    }

    /**
     * @param length 初始长度，不得小于 {@link #DEFAULT_LENGTH}
     */
    public MemoryRegion(int length) {
        if (length < DEFAULT_LENGTH) {
            throw new IllegalArgumentException(
                    "Domain memory must be at least " + DEFAULT_LENGTH + " bytes, got " + length);
        }
        this.bytes = new byte[length];
        this.length = length;
    }

    public int getLength() {
        return length;
    }

    /**
     * 调整逻辑长度。增长部分填 0，收缩时丢弃尾部字节。
     * 新数组在完整拷贝后才替换旧数组。
     */
    public void setLength(int newLength) {
        if (newLength < 0) {
            throw rangeError(newLength, 0);
        }
        if (newLength == length) return;
        byte[] resized = new byte[newLength];
        System.arraycopy(bytes, 0, resized, 0, Math.min(length, newLength));
        this.bytes = resized;
        this.length = newLength;
    }

    // ============ 读取 ============

    public byte readByte(int offset) {
        checkRange(offset, 1);
        return bytes[offset];
    }

    public int readUnsignedByte(int offset) {
        return readByte(offset) & 0xFF;
    }

    public short readShort(int offset) {
        checkRange(offset, 2);
        return (short) ((bytes[offset] & 0xFF) | (bytes[offset + 1] << 8));
    }

    public int readUnsignedShort(int offset) {
        return readShort(offset) & 0xFFFF;
    }

    public int readInt(int offset) {
        checkRange(offset, 4);
        return (bytes[offset] & 0xFF)
                | ((bytes[offset + 1] & 0xFF) << 8)
                | ((bytes[offset + 2] & 0xFF) << 16)
                | (bytes[offset + 3] << 24);
    }

    public float readFloat(int offset) {
        return Float.intBitsToFloat(readInt(offset));
    }

    public double readDouble(int offset) {
        checkRange(offset, 8);
        long lo = readInt(offset) & 0xFFFFFFFFL;
        long hi = readInt(offset + 4) & 0xFFFFFFFFL;
        return Double.longBitsToDouble(lo | (hi << 32));
    }

    // ============ 写入 ============

    public void writeByte(int offset, int value) {
        checkRange(offset, 1);
        bytes[offset] = (byte) value;
    }

    public void writeShort(int offset, int value) {
        checkRange(offset, 2);
        bytes[offset] = (byte) value;
        bytes[offset + 1] = (byte) (value >> 8);
    }

    public void writeInt(int offset, int value) {
        checkRange(offset, 4);
        bytes[offset] = (byte) value;
        bytes[offset + 1] = (byte) (value >> 8);
        bytes[offset + 2] = (byte) (value >> 16);
        bytes[offset + 3] = (byte) (value >> 24);
    }

    public void writeFloat(int offset, float value) {
        writeInt(offset, Float.floatToRawIntBits(value));
    }

    public void writeDouble(int offset, double value) {
        checkRange(offset, 8);
        long bits = Double.doubleToRawLongBits(value);
        writeInt(offset, (int) bits);
        writeInt(offset + 4, (int) (bits >>> 32));
    }

    private void checkRange(int offset, int width) {
        // long 运算避免 offset + width 溢出
        if (offset < 0 || (long) offset + width > length) {
            throw rangeError(offset, width);
        }
    }

    private AvmError rangeError(int offset, int width) {
        return AvmError.rangeError("The specified range is invalid (offset=" + offset
                + ", width=" + width + ", length=" + length + ").", AvmError.INVALID_RANGE);
    }

    @Override
    public String toString() {
        return "<domain memory: " + length + " bytes>";
    }
}
