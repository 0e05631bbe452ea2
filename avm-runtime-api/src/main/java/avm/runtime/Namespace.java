package avm.runtime;

import java.util.Objects;

/**
 * 命名空间：种类 + URI，相等性精确比较。
 *
 * <p>{@link #ANY} 仅出现在多名称的候选集合中，匹配任意命名空间。</p>
 */
public final class Namespace {

    /** 命名空间种类 */
    public enum Kind { PACKAGE, PACKAGE_INTERNAL, PRIVATE, ANY }

    /** 公共包（空 URI） */
    public static final Namespace PUBLIC = new Namespace(Kind.PACKAGE, "");

    /** 通配命名空间 */
    public static final Namespace ANY = new Namespace(Kind.ANY, "");

    private final Kind kind;
    private final String uri;

    private Namespace(Kind kind, String uri) {
        this.kind = kind;
        this.uri = uri;
    }

    public static Namespace packageNs(String uri) {
        if (uri == null || uri.isEmpty()) return PUBLIC;
        return new Namespace(Kind.PACKAGE, uri);
    }

    public static Namespace internalNs(String uri) {
        return new Namespace(Kind.PACKAGE_INTERNAL, uri == null ? "" : uri);
    }

    public static Namespace privateNs(String uri) {
        return new Namespace(Kind.PRIVATE, uri == null ? "" : uri);
    }

    public Kind getKind() {
        return kind;
    }

    public String getUri() {
        return uri;
    }

    public boolean isAny() {
        return kind == Kind.ANY;
    }

    public boolean isPublic() {
        return kind == Kind.PACKAGE && uri.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Namespace)) return false;
        Namespace other = (Namespace) o;
        return kind == other.kind && uri.equals(other.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, uri);
    }

    @Override
    public String toString() {
        if (isAny()) return "*";
        return kind == Kind.PACKAGE ? uri : kind.name().toLowerCase() + ":" + uri;
    }
}
