package org.jsdetect.ast;

/**
 * 源码字符区间 [start, end)，解析器未给出时两端均为 -1
 */
public record SourceRange(int start, int end) {

    public static final SourceRange UNKNOWN = new SourceRange(-1, -1);

    public boolean isKnown() {
        return start >= 0;
    }

    public boolean contains(SourceRange other) {
        return isKnown() && other.isKnown() && start <= other.start && other.end <= end;
    }
}
