package org.jsdetect.graph;

/**
 * 控制流边的类型
 */
public enum EdgeKind {
    UNCONDITIONAL,
    TRUE_BRANCH,
    FALSE_BRANCH,
    EXCEPTION,
    LOOP_BACK
}
