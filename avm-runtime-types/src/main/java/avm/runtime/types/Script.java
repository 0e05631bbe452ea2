package avm.runtime.types;

import java.util.Objects;

/**
 * 可执行单元。首次访问全局对象时运行一次初始化器。
 *
 * <p>多个域可以导出同一个脚本引用，脚本本身不属于任何一个域。</p>
 */
public final class Script {

    private enum State { UNINITIALIZED, INITIALIZING, INITIALIZED }

    private final String name;
    private final ScriptInitializer initializer;
    private final ScriptGlobals globals;
    private State state = State.UNINITIALIZED;

    public Script(String name, ScriptInitializer initializer) {
        this.name = Objects.requireNonNull(name, "name");
        this.initializer = Objects.requireNonNull(initializer, "initializer");
        this.globals = new ScriptGlobals(this);
    }

    public String getName() {
        return name;
    }

    public boolean isInitialized() {
        return state == State.INITIALIZED;
    }

    /**
     * 返回脚本全局对象，必要时先运行初始化器。
     *
     * <p>初始化过程中的重入访问直接拿到正在填充的全局对象（循环引用）。
     * 初始化失败则清空已写入的槽位并回到未初始化状态，下次访问重试。</p>
     */
    public ScriptGlobals globals() {
        if (state == State.UNINITIALIZED) {
            state = State.INITIALIZING;
            try {
                initializer.initialize(this, globals);
                state = State.INITIALIZED;
            } catch (RuntimeException | Error e) {
                globals.clear();
                state = State.UNINITIALIZED;
                throw e;
            }
        }
        return globals;
    }

    @Override
    public String toString() {
        return "script " + name;
    }
}
