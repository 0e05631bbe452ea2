package avm.runtime.types;

import avm.runtime.QName;

/**
 * 名称解析结果：完整限定名 + 定义它的脚本
 */
public final class ScriptDefinition {

    private final QName name;
    private final Script script;

    public ScriptDefinition(QName name, Script script) {
        this.name = name;
        this.script = script;
    }

    public QName getName() {
        return name;
    }

    public Script getScript() {
        return script;
    }

    @Override
    public String toString() {
        return name.toQualifiedName() + " from " + script;
    }
}
