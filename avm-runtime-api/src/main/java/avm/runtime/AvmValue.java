package avm.runtime;

/**
 * AVM 运行时值的基类
 *
 * <p>脚本全局对象中保存的定义（类、函数、常量）都以此类型出现。</p>
 */
public abstract class AvmValue {

    /**
     * 获取值的类型名称
     */
    public abstract String getTypeName();

    /**
     * 获取底层 Java 值
     */
    public abstract Object toJavaValue();

    public boolean isUndefined() {
        return false;
    }
}
