package avm.runtime.types;

/**
 * 脚本初始化器：由加载器提供，执行脚本顶层代码并填充全局对象。
 */
@FunctionalInterface
public interface ScriptInitializer {

    void initialize(Script script, ScriptGlobals globals);
}
