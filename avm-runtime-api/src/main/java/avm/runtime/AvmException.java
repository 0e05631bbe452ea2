package avm.runtime;

/**
 * AVM 基础运行时异常。
 *
 * <p>{@link AvmError} 继承此类，附带脚本可见的错误类型和错误码。</p>
 */
public class AvmException extends RuntimeException {

    public AvmException(String message) {
        super(message);
    }

    public AvmException(String message, Throwable cause) {
        super(message, cause);
    }
}
