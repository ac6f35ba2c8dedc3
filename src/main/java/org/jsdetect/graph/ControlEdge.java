package org.jsdetect.graph;

/**
 * 基本块之间的控制流边，端点是文件内唯一的块 id
 */
public record ControlEdge(int from, int to, EdgeKind kind) {
}
