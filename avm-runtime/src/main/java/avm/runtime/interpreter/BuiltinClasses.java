package avm.runtime.interpreter;

import avm.runtime.Namespace;
import avm.runtime.QName;
import avm.runtime.types.AvmClass;
import avm.runtime.types.Domain;
import avm.runtime.types.Script;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 系统域中的内置类。
 *
 * <p>所有内置类由同一个 "playerglobals" 脚本导出：类对象先创建，同时进入类表和脚本全局对象，
 * 保证 {@link Domain#getClass} 和 {@link Domain#getDefinedValue} 拿到同一个实例。</p>
 */
public final class BuiltinClasses {

    public static final String VECTOR_PACKAGE = "__AS3__.vec";
    public static final QName VECTOR = new QName(Namespace.packageNs(VECTOR_PACKAGE), "Vector");
    public static final QName BYTE_ARRAY = new QName(Namespace.packageNs("flash.utils"), "ByteArray");

    private final Script script;
    private final List<AvmClass> classes;
    private final AvmClass object;
    private final AvmClass intClass;
    private final AvmClass uintClass;
    private final AvmClass number;
    private final AvmClass string;
    private final AvmClass bool;
    private final AvmClass vector;
    private final AvmClass byteArray;

    private BuiltinClasses(AvmConfig config) {
        this.object = AvmClass.of(QName.publicName("Object"));
        this.intClass = AvmClass.of(QName.publicName("int"));
        this.uintClass = AvmClass.of(QName.publicName("uint"));
        this.number = AvmClass.of(QName.publicName("Number"));
        this.string = AvmClass.of(QName.publicName("String"));
        this.bool = AvmClass.of(QName.publicName("Boolean"));
        this.vector = AvmClass.generic(VECTOR, config.getSpecializationCacheSize());
        this.byteArray = AvmClass.of(BYTE_ARRAY);
        this.classes = Collections.unmodifiableList(Arrays.asList(
                object, intClass, uintClass, number, string, bool, vector, byteArray));
        this.script = new Script("playerglobals", (s, globals) -> {
            for (AvmClass cls : classes) {
                globals.defineProperty(cls.getName(), cls);
            }
        });
    }

    /**
     * 创建内置类并导出到系统域
     */
    static BuiltinClasses install(Domain systemDomain, AvmConfig config) {
        BuiltinClasses builtins = new BuiltinClasses(config);
        for (AvmClass cls : builtins.classes) {
            systemDomain.exportDefinition(cls.getName(), builtins.script);
            systemDomain.exportClass(cls);
        }
        return builtins;
    }

    public Script getScript() {
        return script;
    }

    public List<AvmClass> getClasses() {
        return classes;
    }

    public AvmClass object() { return object; }
    public AvmClass intClass() { return intClass; }
    public AvmClass uintClass() { return uintClass; }
    public AvmClass number() { return number; }
    public AvmClass string() { return string; }
    public AvmClass bool() { return bool; }
    public AvmClass vector() { return vector; }
    public AvmClass byteArray() { return byteArray; }
}
