package avm.runtime.interpreter;

/**
 * 文本形式泛型名的拆分：{@code Vector.<Inner>} → (Vector 基类名, Inner)。
 *
 * <p>纯文本变换，与域链解析无关。只处理一层 {@code <...>}，不校验嵌套或畸形输入，
 * 畸形的参数文本会在随后的限定名解析中失败。</p>
 */
public final class GenericName {

    private static final String QUALIFIED_PREFIX = BuiltinClasses.VECTOR_PACKAGE + "::Vector.<";
    private static final String SHORT_PREFIX = "Vector.<";

    private final String baseName;
    private final String paramName;

    private GenericName(String baseName, String paramName) {
        this.baseName = baseName;
        this.paramName = paramName;
    }

    /**
     * 拆分文本名。非 Vector 泛型形式原样返回，参数为 null。
     */
    public static GenericName parse(String text) {
        if ((text.startsWith(QUALIFIED_PREFIX) || text.startsWith(SHORT_PREFIX)) && text.endsWith(">")) {
            int start = text.indexOf(".<");
            return new GenericName(BuiltinClasses.VECTOR.toQualifiedName(),
                    text.substring(start + 2, text.length() - 1));
        }
        return new GenericName(text, null);
    }

    public String getBaseName() {
        return baseName;
    }

    /** 类型参数文本，非泛型形式返回 null */
    public String getParamName() {
        return paramName;
    }

    public boolean hasParam() {
        return paramName != null;
    }

    @Override
    public String toString() {
        return hasParam() ? baseName + ".<" + paramName + ">" : baseName;
    }
}
