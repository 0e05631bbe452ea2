package avm.runtime.types;

import avm.runtime.Multiname;
import avm.runtime.Namespace;
import avm.runtime.QName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 按名称索引的导出表。
 *
 * <p>条目按本地名分桶，桶内保存 (命名空间, 值) 列表，支持以多名称的候选命名空间集合查找。
 * 额外记录全局插入顺序，供 {@link #names()} 枚举。</p>
 *
 * <p>不做同步：宿主 VM 以单一执行游标串行化所有访问。</p>
 */
public final class PropertyMap<V> {

    /** 多名称查找的结果：匹配到的命名空间及其值 */
    public static final class Match<V> {
        private final Namespace namespace;
        private final V value;

        Match(Namespace namespace, V value) {
            this.namespace = namespace;
            this.value = value;
        }

        public Namespace getNamespace() {
            return namespace;
        }

        public V getValue() {
            return value;
        }
    }

    private static final class Slot<V> {
        final Namespace namespace;
        V value;

        Slot(Namespace namespace, V value) {
            this.namespace = namespace;
            this.value = value;
        }
    }

    private final Map<String, List<Slot<V>>> buckets = new HashMap<>();
    private final List<QName> order = new ArrayList<>();

    /**
     * 插入或覆盖条目。先到先得的导出规则由 {@link Domain} 负责，这里只做存储。
     */
    public void insert(QName name, V value) {
        List<Slot<V>> bucket = buckets.computeIfAbsent(name.getLocalName(), k -> new ArrayList<>(1));
        for (Slot<V> slot : bucket) {
            if (slot.namespace.equals(name.getNamespace())) {
                slot.value = value;
                return;
            }
        }
        bucket.add(new Slot<>(name.getNamespace(), value));
        order.add(name);
    }

    public boolean containsKey(QName name) {
        return find(name) != null;
    }

    /**
     * 精确查找
     *
     * @return 值，不存在返回 null
     */
    public V get(QName name) {
        Slot<V> slot = find(name);
        return slot != null ? slot.value : null;
    }

    /**
     * 以多名称查找，返回桶中第一个命名空间属于候选集合的值。
     */
    public V getForMultiname(Multiname multiname) {
        Match<V> match = getWithNsForMultiname(multiname);
        return match != null ? match.getValue() : null;
    }

    /**
     * 以多名称查找，同时返回匹配到的命名空间（调用方据此重建完整限定名）。
     * 没有本地名的多名称永远不匹配。
     */
    public Match<V> getWithNsForMultiname(Multiname multiname) {
        if (!multiname.hasLocalName()) return null;
        List<Slot<V>> bucket = buckets.get(multiname.getLocalName());
        if (bucket == null) return null;
        for (Slot<V> slot : bucket) {
            if (multiname.containsNamespace(slot.namespace)) {
                return new Match<>(slot.namespace, slot.value);
            }
        }
        return null;
    }

    /** 所有键，按插入顺序 */
    public List<QName> names() {
        return Collections.unmodifiableList(new ArrayList<>(order));
    }

    public int size() {
        return order.size();
    }

    private Slot<V> find(QName name) {
        List<Slot<V>> bucket = buckets.get(name.getLocalName());
        if (bucket == null) return null;
        for (Slot<V> slot : bucket) {
            if (slot.namespace.equals(name.getNamespace())) return slot;
        }
        return null;
    }
}
