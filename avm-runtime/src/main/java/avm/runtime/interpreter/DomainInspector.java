package avm.runtime.interpreter;

import avm.runtime.QName;
import avm.runtime.types.Domain;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 域链诊断：把域及其全部祖先渲染为 JSON，最近的域在前。
 *
 * <pre>
 * [
 *   {"depth": 0, "system": false, "definitions": ["Foo"], "classes": ["Foo"], "memoryLength": 1024},
 *   {"depth": 1, "system": true, ...}
 * ]
 * </pre>
 */
public final class DomainInspector {

    private final AvmRuntime runtime;
    private final Gson gson;

    public DomainInspector(AvmRuntime runtime) {
        this.runtime = runtime;
        this.gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
    }

    public JsonArray describe(Domain domain) {
        JsonArray chain = new JsonArray();
        int depth = 0;
        for (Domain d = domain; d != null; d = d.getParentDomain()) {
            JsonObject level = new JsonObject();
            level.addProperty("depth", depth++);
            level.addProperty("system", runtime.isSystemDomain(d));
            level.add("definitions", names(d.getDefinedNames()));
            level.add("classes", names(d.getClassNames()));
            if (d.hasDomainMemory()) {
                level.addProperty("memoryLength", d.getDomainMemory().getLength());
            } else {
                level.add("memoryLength", JsonNull.INSTANCE);
            }
            chain.add(level);
        }
        return chain;
    }

    public String toJson(Domain domain) {
        return gson.toJson(describe(domain));
    }

    private static JsonArray names(List<QName> names) {
        JsonArray array = new JsonArray();
        for (QName name : names) {
            array.add(name.toQualifiedName());
        }
        return array;
    }
}
