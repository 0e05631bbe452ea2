package avm.runtime.types;

import avm.runtime.AvmUndefined;
import avm.runtime.AvmValue;
import avm.runtime.QName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 脚本全局对象：保存脚本运行后产生的顶层定义。
 */
public final class ScriptGlobals extends AvmValue {

    private final Script script;
    private final Map<QName, AvmValue> slots = new LinkedHashMap<>();

    ScriptGlobals(Script script) {
        this.script = script;
    }

    public Script getScript() {
        return script;
    }

    public void defineProperty(QName name, AvmValue value) {
        slots.put(name, value);
    }

    /**
     * 读取属性，不存在返回 undefined
     */
    public AvmValue getProperty(QName name) {
        AvmValue value = slots.get(name);
        return value != null ? value : AvmUndefined.UNDEFINED;
    }

    void clear() {
        slots.clear();
    }

    @Override
    public String getTypeName() {
        return "global";
    }

    @Override
    public Object toJavaValue() {
        return this;
    }

    @Override
    public String toString() {
        return "[global " + script.getName() + "]";
    }
}
