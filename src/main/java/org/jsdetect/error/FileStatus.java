package org.jsdetect.error;

/**
 * 单个文件分析结束时的状态
 */
public enum FileStatus {
    OK,
    PARSE_FAILURE,
    MALFORMED_CONTROL_FLOW,
    GRAPH_SIZE_EXCEEDED,
    TIMEOUT,
    IO_ERROR
}
