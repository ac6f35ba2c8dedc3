package org.jsdetect.error;

/**
 * break / continue 找不到可跳转的循环、switch 或标签
 */
public class MalformedControlFlowException extends AnalysisException {

    private final int offset;

    public MalformedControlFlowException(String message, int offset) {
        super(message + (offset >= 0 ? " (offset " + offset + ")" : ""));
        this.offset = offset;
    }

    /**
     * @return 出错语句在源码中的起始偏移，未知时为 -1
     */
    public int offset() {
        return offset;
    }

    @Override
    public FileStatus status() {
        return FileStatus.MALFORMED_CONTROL_FLOW;
    }
}
