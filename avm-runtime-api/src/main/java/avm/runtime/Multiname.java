package avm.runtime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 多名称：带候选命名空间集合的名称引用，可选携带一个类型参数。
 *
 * <p>本地名为 null 表示 "任意名称"（{@code *}），这样的多名称无法被解析。
 * 类型参数用于表达 {@code Vector.<T>} 这类泛型实例化。</p>
 */
public final class Multiname {

    private static final Multiname ANY_NAME = new Multiname(
            Collections.singletonList(Namespace.ANY), null, null);

    private final List<Namespace> namespaceSet;
    private final String localName;
    private final Multiname param;

    private Multiname(List<Namespace> namespaceSet, String localName, Multiname param) {
        this.namespaceSet = namespaceSet;
        this.localName = localName;
        this.param = param;
    }

    /** 任意名称 {@code *}，也用作 "任意类型" 参数 */
    public static Multiname any() {
        return ANY_NAME;
    }

    /** 单命名空间的多名称 */
    public static Multiname of(QName name) {
        return new Multiname(Collections.singletonList(name.getNamespace()), name.getLocalName(), null);
    }

    /** 公共包中的名称 */
    public static Multiname publicName(String localName) {
        return new Multiname(Collections.singletonList(Namespace.PUBLIC), localName, null);
    }

    /** 带候选命名空间集合的名称（非限定查找） */
    public static Multiname of(String localName, Namespace... namespaces) {
        if (namespaces.length == 0) {
            throw new IllegalArgumentException("Multiname needs at least one namespace");
        }
        return new Multiname(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(namespaces))),
                localName, null);
    }

    /** 返回携带类型参数的副本 */
    public Multiname withParam(Multiname param) {
        return new Multiname(namespaceSet, localName, param);
    }

    public List<Namespace> getNamespaceSet() {
        return namespaceSet;
    }

    public String getLocalName() {
        return localName;
    }

    public Multiname getParam() {
        return param;
    }

    public boolean hasLocalName() {
        return localName != null;
    }

    public boolean isAnyName() {
        return localName == null;
    }

    /** 候选集合是否包含 ns（含通配命名空间） */
    public boolean containsNamespace(Namespace ns) {
        for (Namespace candidate : namespaceSet) {
            if (candidate.isAny() || candidate.equals(ns)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (namespaceSet.size() == 1) {
            Namespace ns = namespaceSet.get(0);
            if (!ns.isPublic()) sb.append(ns).append("::");
        } else {
            sb.append(namespaceSet).append("::");
        }
        sb.append(localName == null ? "*" : localName);
        if (param != null) {
            sb.append(".<").append(param).append(">");
        }
        return sb.toString();
    }
}
