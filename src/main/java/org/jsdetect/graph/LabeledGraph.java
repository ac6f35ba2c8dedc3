package org.jsdetect.graph;

import java.util.*;
import java.util.function.IntFunction;

/**
 * 特征提取使用的有向图：节点下标 0..n-1，每个节点一个标签和一个有序的后继数组。
 * origin 记录节点来自哪里（语句项 id、AST 节点 id 或词法单元下标）。
 */
public class LabeledGraph {
    private final String[] labels;
    private final int[] origin;
    private final int[][] successors;

    LabeledGraph(String[] labels, int[] origin, int[][] successors) {
        this.labels = labels;
        this.origin = origin;
        this.successors = successors;
    }

    /**
     * 线性链：词法单元序列、AST 前序序列
     */
    public static LabeledGraph chain(List<String> labels, int[] origin) {
        int n = labels.size();
        int[][] succ = new int[n][];
        for (int i = 0; i < n; i++) {
            succ[i] = i + 1 < n ? new int[]{i + 1} : new int[0];
        }
        return new LabeledGraph(labels.toArray(new String[0]), origin, succ);
    }

    public static LabeledGraph chain(List<String> labels) {
        int[] origin = new int[labels.size()];
        for (int i = 0; i < origin.length; i++) {
            origin[i] = i;
        }
        return chain(labels, origin);
    }

    /**
     * 由边表构建；只保留至少连着一条边的节点，节点按原始 id 排序
     *
     * @param labelOf 原始 id -> 标签
     * @param edges   原始 id 对 (from, to)
     */
    public static LabeledGraph fromEdges(IntFunction<String> labelOf, Collection<int[]> edges) {
        SortedSet<Integer> ids = new TreeSet<>();
        for (int[] e : edges) {
            ids.add(e[0]);
            ids.add(e[1]);
        }
        Map<Integer, Integer> index = new HashMap<>();
        int[] origin = new int[ids.size()];
        String[] labels = new String[ids.size()];
        int i = 0;
        for (int id : ids) {
            index.put(id, i);
            origin[i] = id;
            labels[i] = labelOf.apply(id);
            i++;
        }
        List<SortedSet<Integer>> succ = new ArrayList<>();
        for (int k = 0; k < origin.length; k++) {
            succ.add(new TreeSet<>());
        }
        for (int[] e : edges) {
            succ.get(index.get(e[0])).add(index.get(e[1]));
        }
        int[][] arrays = new int[origin.length][];
        for (int k = 0; k < origin.length; k++) {
            arrays[k] = succ.get(k).stream().mapToInt(Integer::intValue).toArray();
        }
        return new LabeledGraph(labels, origin, arrays);
    }

    public int size() {
        return labels.length;
    }

    public String label(int node) {
        return labels[node];
    }

    public int origin(int node) {
        return origin[node];
    }

    public int[] successors(int node) {
        return successors[node];
    }

    public int edgeCount() {
        int count = 0;
        for (int[] s : successors) {
            count += s.length;
        }
        return count;
    }
}
