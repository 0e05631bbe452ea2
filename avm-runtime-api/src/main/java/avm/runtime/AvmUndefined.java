package avm.runtime;

/**
 * AVM undefined 值
 */
public final class AvmUndefined extends AvmValue {

    /** 唯一实例 */
    public static final AvmUndefined UNDEFINED = new AvmUndefined();

    private AvmUndefined() {
    }

    @Override
    public String getTypeName() {
        return "void";
    }

    @Override
    public Object toJavaValue() {
        return null;
    }

    @Override
    public boolean isUndefined() {
        return true;
    }

    @Override
    public String toString() {
        return "undefined";
    }
}
