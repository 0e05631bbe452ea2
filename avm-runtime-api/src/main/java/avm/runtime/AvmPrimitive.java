package avm.runtime;

import java.util.Objects;

/**
 * 包装宿主原始值（数字、字符串、布尔）的 AvmValue。
 */
public final class AvmPrimitive extends AvmValue {

    private final Object value;

    private AvmPrimitive(Object value) {
        this.value = value;
    }

    public static AvmPrimitive of(Object value) {
        if (value == null) {
            throw new AvmException("Cannot wrap null as a primitive, use AvmUndefined");
        }
        if (!(value instanceof Number || value instanceof String || value instanceof Boolean)) {
            throw new AvmException("Not a primitive value: " + value.getClass().getName());
        }
        return new AvmPrimitive(value);
    }

    @Override
    public String getTypeName() {
        if (value instanceof String) return "String";
        if (value instanceof Boolean) return "Boolean";
        if (value instanceof Integer) return "int";
        return "Number";
    }

    @Override
    public Object toJavaValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AvmPrimitive)) return false;
        return value.equals(((AvmPrimitive) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
