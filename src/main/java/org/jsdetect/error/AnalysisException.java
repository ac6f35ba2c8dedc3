package org.jsdetect.error;

/**
 * 单文件分析失败的基类。
 * <p>
 * 所有子类都只影响当前文件：批处理捕获后记录状态并继续处理其它文件。
 */
public abstract class AnalysisException extends RuntimeException {

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return 该失败对应的文件状态
     */
    public abstract FileStatus status();
}
