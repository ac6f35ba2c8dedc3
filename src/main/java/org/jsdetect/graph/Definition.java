package org.jsdetect.graph;

import org.jsdetect.scope.Binding;

/**
 * 一个定义：site 是数据边的起点；generator 是在本函数中产生它的语句项，
 * 参数、提升的函数和捕获的外层定义都由入口项产生。
 */
public record Definition(Binding binding, StmtNode site, StmtNode generator) {
}
