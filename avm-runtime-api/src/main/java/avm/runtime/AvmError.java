package avm.runtime;

/**
 * 脚本可见的运行时错误（ReferenceError / RangeError / TypeError）。
 *
 * <p>由解释器捕获后转换为脚本层面可 catch 的异常对象，{@link #getCode()} 即宿主显示的 "Error #xxxx"。</p>
 */
public class AvmError extends AvmException {

    /** 错误类型 */
    public enum ErrorType {
        REFERENCE_ERROR("ReferenceError"),
        RANGE_ERROR("RangeError"),
        TYPE_ERROR("TypeError");

        private final String scriptName;

        ErrorType(String scriptName) {
            this.scriptName = scriptName;
        }

        public String getScriptName() {
            return scriptName;
        }
    }

    // ============ 常用错误码 ============

    public static final int VARIABLE_NOT_DEFINED = 1065;
    public static final int TYPE_COERCION_FAILED = 1034;
    public static final int NON_PARAMETERIZED_TYPE = 1127;
    public static final int INVALID_RANGE = 1506;

    private final ErrorType type;
    private final int code;

    public AvmError(ErrorType type, String message, int code) {
        super(message);
        this.type = type;
        this.code = code;
    }

    public static AvmError referenceError(String message, int code) {
        return new AvmError(ErrorType.REFERENCE_ERROR, message, code);
    }

    public static AvmError rangeError(String message, int code) {
        return new AvmError(ErrorType.RANGE_ERROR, message, code);
    }

    public static AvmError typeError(String message, int code) {
        return new AvmError(ErrorType.TYPE_ERROR, message, code);
    }

    public ErrorType getType() {
        return type;
    }

    public int getCode() {
        return code;
    }

    /** 返回不含类型前缀的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return type.getScriptName() + ": " + super.getMessage();
    }
}
