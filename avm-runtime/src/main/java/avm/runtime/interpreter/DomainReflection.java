package avm.runtime.interpreter;

import avm.runtime.AvmError;
import avm.runtime.AvmException;
import avm.runtime.AvmValue;
import avm.runtime.QName;
import avm.runtime.types.AvmClass;
import avm.runtime.types.Domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ApplicationDomain 反射接口：getDefinition / hasDefinition / getQualifiedDefinitionNames。
 *
 * <p>文本名中的 {@code Vector.<T>} 先经 {@link GenericName} 拆分，
 * 基类与参数类各自解析后再做类型应用。</p>
 */
public final class DomainReflection {

    private final Domain domain;

    public DomainReflection(Domain domain) {
        this.domain = Objects.requireNonNull(domain, "domain");
    }

    /**
     * 按文本限定名取定义值。
     *
     * <p>Vector 形式下基类查找失败时仍会先解析参数类，参数类的错误优先抛出。</p>
     *
     * @throws AvmError 名称未定义（ReferenceError #1065）
     * @throws IllegalArgumentException 名称无法解析为限定名
     */
    public AvmValue getDefinition(String name) {
        GenericName generic = GenericName.parse(name);
        QName baseName = QName.fromQualifiedName(generic.getBaseName());
        if (!generic.hasParam()) {
            return domain.getDefinedValue(baseName);
        }
        return resolveVector(baseName, QName.fromQualifiedName(generic.getParamName()));
    }

    /**
     * 名称是否可解析为定义。未定义和畸形名称返回 false，其他错误照常抛出。
     */
    public boolean hasDefinition(String name) {
        QName baseName;
        QName paramName;
        try {
            GenericName generic = GenericName.parse(name);
            baseName = QName.fromQualifiedName(generic.getBaseName());
            paramName = generic.hasParam() ? QName.fromQualifiedName(generic.getParamName()) : null;
        } catch (IllegalArgumentException e) {
            return false;
        }
        try {
            if (paramName == null) {
                domain.getDefinedValue(baseName);
            } else {
                resolveVector(baseName, paramName);
            }
            return true;
        } catch (AvmError e) {
            if (e.getType() == AvmError.ErrorType.REFERENCE_ERROR) {
                return false;
            }
            throw e;
        }
    }

    /**
     * 本域（不含祖先）导出的全部定义名，{@code pkg::Name} 形式，按导出顺序
     */
    public List<String> getQualifiedDefinitionNames() {
        List<QName> names = domain.getDefinedNames();
        List<String> result = new ArrayList<>(names.size());
        for (QName name : names) {
            result.add(name.toQualifiedName());
        }
        return result;
    }

    private AvmValue resolveVector(QName baseName, QName paramName) {
        AvmValue base = null;
        AvmError baseError = null;
        try {
            base = domain.getDefinedValue(baseName);
        } catch (AvmError e) {
            baseError = e;
        }
        AvmValue param = domain.getDefinedValue(paramName);
        if (baseError != null) {
            throw baseError;
        }
        if (!(base instanceof AvmClass)) {
            throw new AvmException("Vector type " + base + " was not a class");
        }
        return ((AvmClass) base).apply(param);
    }
}
