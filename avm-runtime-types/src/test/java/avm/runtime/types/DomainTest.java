package avm.runtime.types;

import avm.runtime.AvmError;
import avm.runtime.AvmPrimitive;
import avm.runtime.Multiname;
import avm.runtime.Namespace;
import avm.runtime.QName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 应用域单元测试
 */
class DomainTest {

    private static final MemoryRegionFactory MEMORY = MemoryRegionFactory.ofLength(MemoryRegion.DEFAULT_LENGTH);
    private static final QName FOO = QName.publicName("Foo");
    private static final QName VECTOR = new QName(Namespace.packageNs("__AS3__.vec"), "Vector");

    private Domain root;
    private Domain movie;

    @BeforeEach
    void setUp() {
        root = Domain.uninitializedDomain(null);
        root.initDefaultDomainMemory(MEMORY);
        movie = Domain.movieDomain(root, MEMORY);
    }

    private static Script script(String name) {
        return new Script(name, (s, globals) -> { });
    }

    // ============ 导出 ============

    @Nested
    @DisplayName("先导出者胜出")
    class FirstWinsTests {

        @Test
        @DisplayName("同名第二次导出被忽略")
        void testSecondExportIgnored() {
            Script s1 = script("s1");
            Script s2 = script("s2");
            movie.exportDefinition(FOO, s1);
            movie.exportDefinition(FOO, s2);

            assertSame(s1, movie.getDefiningScript(FOO.toMultiname()).getScript());
            assertEquals(1, movie.getDefinedNames().size());
        }

        @Test
        @DisplayName("祖先已定义时子域导出被忽略，且不修改父域")
        void testAncestorBlocksExport() {
            Script parentScript = script("parent");
            root.exportDefinition(FOO, parentScript);
            movie.exportDefinition(FOO, script("child"));

            assertTrue(movie.getDefinedNames().isEmpty());
            assertSame(parentScript, movie.getDefiningScript(FOO.toMultiname()).getScript());
            assertEquals(Collections.singletonList(FOO), root.getDefinedNames());
        }

        @Test
        @DisplayName("子域导出不影响父域")
        void testChildExportIsLocal() {
            movie.exportDefinition(FOO, script("child"));
            assertFalse(root.hasDefinition(FOO));
            assertTrue(movie.hasDefinition(FOO));
            assertNull(root.getDefiningScript(FOO.toMultiname()));
        }

        @Test
        @DisplayName("类导出以类自身名称为键")
        void testClassExport() {
            AvmClass first = AvmClass.of(FOO);
            AvmClass second = AvmClass.of(FOO);
            movie.exportClass(first);
            movie.exportClass(second);

            assertSame(first, movie.getClass(FOO.toMultiname()));
            assertTrue(movie.hasClass(FOO));
            assertFalse(root.hasClass(FOO));
        }
    }

    // ============ 解析 ============

    @Nested
    @DisplayName("名称解析")
    class ResolutionTests {

        @Test
        @DisplayName("子域未定义时返回父域定义")
        void testFallsBackToParent() {
            Script s = script("root");
            root.exportDefinition(FOO, s);

            ScriptDefinition def = movie.getDefiningScript(FOO.toMultiname());
            assertNotNull(def);
            assertSame(s, def.getScript());
            assertEquals(FOO, def.getName());
        }

        @Test
        @DisplayName("候选命名空间集合匹配，返回匹配到的完整限定名")
        void testNamespaceSetMatch() {
            QName qualified = new QName(Namespace.packageNs("flash.display"), "Sprite");
            Script s = script("display");
            root.exportDefinition(qualified, s);

            ScriptDefinition def = movie.getDefiningScript(
                    Multiname.of("Sprite", Namespace.PUBLIC, Namespace.packageNs("flash.display")));
            assertEquals(qualified, def.getName());
        }

        @Test
        @DisplayName("未定义名称返回 null，而不是抛出")
        void testNotFound() {
            Domain deep = movie;
            for (int i = 0; i < 50; i++) {
                deep = Domain.movieDomain(deep, MEMORY);
            }
            assertNull(deep.getDefiningScript(Multiname.publicName("Missing")));
            assertNull(deep.getClass(Multiname.publicName("Missing")));
            assertFalse(deep.hasDefinition(QName.publicName("Missing")));
        }

        @Test
        @DisplayName("require 未定义名称抛出 ReferenceError #1065")
        void testRequireNotFound() {
            AvmError error = assertThrows(AvmError.class,
                    () -> movie.findDefiningScript(Multiname.publicName("Missing")));
            assertEquals(AvmError.ErrorType.REFERENCE_ERROR, error.getType());
            assertEquals(1065, error.getCode());
            assertTrue(error.getMessage().contains("Variable Missing is not defined"));
        }

        @Test
        @DisplayName("require 没有本地名的多名称是调用方误用")
        void testRequireAnyName() {
            assertThrows(IllegalArgumentException.class, () -> movie.findDefiningScript(Multiname.any()));
            assertNull(movie.getDefiningScript(Multiname.any()));
        }

        @Test
        @DisplayName("读取定义值会运行定义脚本")
        void testGetDefinedValue() {
            Script s = new Script("consts", (self, globals) ->
                    globals.defineProperty(QName.publicName("ANSWER"), AvmPrimitive.of(42)));
            root.exportDefinition(QName.publicName("ANSWER"), s);

            assertFalse(s.isInitialized());
            assertEquals(AvmPrimitive.of(42), movie.getDefinedValue(QName.publicName("ANSWER")));
            assertTrue(s.isInitialized());
        }

        @Test
        @DisplayName("getDefinedNames 只含本域，按导出顺序")
        void testDefinedNamesLocalOnly() {
            root.exportDefinition(QName.publicName("RootOnly"), script("r"));
            movie.exportDefinition(QName.publicName("B"), script("b"));
            movie.exportDefinition(QName.publicName("A"), script("a"));

            assertEquals(Arrays.asList(QName.publicName("B"), QName.publicName("A")), movie.getDefinedNames());
        }
    }

    // ============ 泛型 ============

    @Nested
    @DisplayName("泛型实例化")
    class GenericTests {

        private AvmClass vector;
        private AvmClass intClass;

        @BeforeEach
        void setUpClasses() {
            vector = AvmClass.generic(VECTOR);
            intClass = AvmClass.of(QName.publicName("int"));
            root.exportClass(vector);
            root.exportClass(intClass);
        }

        @Test
        @DisplayName("带参数的多名称解析为特化类")
        void testResolvesSpecialization() {
            AvmClass resolved = movie.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("int")));
            assertNotNull(resolved);
            assertSame(vector, resolved.getGenericBase());
            assertSame(intClass, resolved.getParam());
            assertSame(resolved, movie.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("int"))));
        }

        @Test
        @DisplayName("参数类解析不到时整个查找返回 null")
        void testUnresolvedParam() {
            assertNull(movie.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("Nope"))));
        }

        @Test
        @DisplayName("任意类型参数返回未特化基类")
        void testAnyParam() {
            assertSame(vector, movie.getClass(VECTOR.toMultiname().withParam(Multiname.any())));
        }

        @Test
        @DisplayName("参数类可以在子域中定义")
        void testParamFromChildDomain() {
            AvmClass local = AvmClass.of(QName.publicName("Point"));
            movie.exportClass(local);
            AvmClass resolved = movie.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("Point")));
            assertSame(local, resolved.getParam());
            assertNull(root.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("Point"))));
        }

        @Test
        @DisplayName("嵌套参数递归解析")
        void testNestedParam() {
            Multiname inner = VECTOR.toMultiname().withParam(Multiname.publicName("int"));
            AvmClass resolved = movie.getClass(VECTOR.toMultiname().withParam(inner));
            assertNotNull(resolved);
            assertSame(vector.withTypeParam(intClass), resolved.getParam());
        }

        @Test
        @DisplayName("域中只保存未特化的基类")
        void testDomainStoresBaseOnly() {
            movie.getClass(VECTOR.toMultiname().withParam(Multiname.publicName("int")));
            assertEquals(Arrays.asList(VECTOR, QName.publicName("int")), root.getClassNames());
            assertTrue(movie.getClassNames().isEmpty());
        }
    }

    // ============ 域内存 ============

    @Nested
    @DisplayName("域内存")
    class DomainMemoryTests {

        @Test
        @DisplayName("内容域构造时即有 1024 字节内存")
        void testMovieDomainHasMemory() {
            assertEquals(1024, movie.getDomainMemory().getLength());
        }

        @Test
        @DisplayName("未初始化域访问内存是不变量违例")
        void testUninitializedDomain() {
            Domain bare = Domain.uninitializedDomain(null);
            assertFalse(bare.hasDomainMemory());
            assertThrows(IllegalStateException.class, bare::getDomainMemory);
        }

        @Test
        @DisplayName("默认内存初始化幂等")
        void testInitIdempotent() {
            MemoryRegion before = movie.getDomainMemory();
            movie.initDefaultDomainMemory(MEMORY);
            assertSame(before, movie.getDomainMemory());
        }

        @Test
        @DisplayName("每个域的内存相互隔离")
        void testIsolation() {
            Domain sibling = Domain.movieDomain(root, MEMORY);
            movie.getDomainMemory().writeInt(0, 99);
            assertEquals(0, sibling.getDomainMemory().readInt(0));
            assertNotSame(root.getDomainMemory(), movie.getDomainMemory());
        }

        @Test
        @DisplayName("可替换域内存")
        void testSetDomainMemory() {
            MemoryRegion replacement = new MemoryRegion(4096);
            movie.setDomainMemory(replacement);
            assertSame(replacement, movie.getDomainMemory());
        }
    }

    @Test
    @DisplayName("域按引用相等")
    void testReferenceIdentity() {
        Domain a = Domain.movieDomain(root, MEMORY);
        Domain b = Domain.movieDomain(root, MEMORY);
        assertNotEquals(a, b);
        assertSame(root, a.getParentDomain());
        assertNull(root.getParentDomain());
    }
}
