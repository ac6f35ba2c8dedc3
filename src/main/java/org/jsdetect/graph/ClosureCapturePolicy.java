package org.jsdetect.graph;

import com.google.gson.annotations.SerializedName;

/**
 * 嵌套函数读取外层变量时，从外层函数带入哪些定义
 */
public enum ClosureCapturePolicy {
    /**
     * 从声明点可达的任一语句项上到达的定义；提升的函数声明以外层入口为声明点
     */
    @SerializedName("reachable-from-declaration")
    REACHABLE_FROM_DECLARATION,

    /**
     * 只取声明项处 IN 集合中的定义
     */
    @SerializedName("declaration-point")
    DECLARATION_POINT
}
