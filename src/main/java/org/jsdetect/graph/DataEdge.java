package org.jsdetect.graph;

/**
 * 定义 -> 使用：from 是定义所在语句项，to 是读取该变量的语句项
 */
public record DataEdge(int from, int to, String variable) implements Comparable<DataEdge> {

    @Override
    public int compareTo(DataEdge o) {
        if (from != o.from) {
            return Integer.compare(from, o.from);
        }
        if (to != o.to) {
            return Integer.compare(to, o.to);
        }
        return variable.compareTo(o.variable);
    }
}
