package avm.runtime;

import java.util.Objects;

/**
 * 限定名：命名空间 + 本地名，唯一标识一个定义。
 */
public final class QName {

    private final Namespace namespace;
    private final String localName;

    public QName(Namespace namespace, String localName) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.localName = Objects.requireNonNull(localName, "localName");
    }

    /** 公共包中的名称 */
    public static QName publicName(String localName) {
        return new QName(Namespace.PUBLIC, localName);
    }

    /**
     * 解析文本形式的限定名。
     * <pre>
     * flash.display::Sprite → (flash.display, Sprite)
     * flash.display.Sprite  → (flash.display, Sprite)
     * Sprite                → (公共包, Sprite)
     * </pre>
     *
     * @throws IllegalArgumentException 本地名为空
     */
    public static QName fromQualifiedName(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Qualified name must not be null");
        }
        String pkg;
        String local;
        int sep = text.lastIndexOf("::");
        if (sep >= 0) {
            pkg = text.substring(0, sep);
            local = text.substring(sep + 2);
        } else {
            int dot = text.lastIndexOf('.');
            pkg = dot >= 0 ? text.substring(0, dot) : "";
            local = dot >= 0 ? text.substring(dot + 1) : text;
        }
        if (local.isEmpty()) {
            throw new IllegalArgumentException("Malformed qualified name: '" + text + "'");
        }
        return new QName(Namespace.packageNs(pkg), local);
    }

    public Namespace getNamespace() {
        return namespace;
    }

    public String getLocalName() {
        return localName;
    }

    /** 渲染为 {@code pkg::Name}，公共包只输出本地名 */
    public String toQualifiedName() {
        if (namespace.getUri().isEmpty()) return localName;
        return namespace.getUri() + "::" + localName;
    }

    public Multiname toMultiname() {
        return Multiname.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QName)) return false;
        QName other = (QName) o;
        return namespace.equals(other.namespace) && localName.equals(other.localName);
    }

    @Override
    public int hashCode() {
        return 31 * namespace.hashCode() + localName.hashCode();
    }

    @Override
    public String toString() {
        return toQualifiedName();
    }
}
