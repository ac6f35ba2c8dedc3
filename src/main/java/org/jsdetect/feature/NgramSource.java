package org.jsdetect.feature;

import org.jsdetect.error.Deadline;
import org.jsdetect.error.GraphSizeExceededException;
import org.jsdetect.graph.LabeledGraph;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 图上的 n-gram：从每个节点出发枚举恰好 k 个节点的简单路径，每条路径产生一个键
 * （标签以空格连接）。已经在路径上的节点结束该分支，所以环上的回边至多走一次。
 * <p>
 * 每次调用 {@link #iterator()} 都从头开始一次惰性的深度优先遍历，顺序确定。
 */
public class NgramSource implements Iterable<String> {

    private static final int CHECK_INTERVAL = 1024;

    private final LabeledGraph graph;
    private final int k;
    private final long maxPaths;
    private final Deadline deadline;

    public NgramSource(LabeledGraph graph, int k) {
        this(graph, k, Long.MAX_VALUE, Deadline.none());
    }

    /**
     * @param maxPaths 允许枚举的最大路径数，超过抛出 {@link GraphSizeExceededException}
     */
    public NgramSource(LabeledGraph graph, int k, long maxPaths, Deadline deadline) {
        if (k < 1) {
            throw new IllegalArgumentException("n-gram length must be positive: " + k);
        }
        this.graph = graph;
        this.k = k;
        this.maxPaths = maxPaths;
        this.deadline = deadline;
    }

    @Override
    public Iterator<String> iterator() {
        return new PathIterator();
    }

    private final class PathIterator implements Iterator<String> {
        private final int[] path = new int[k];
        private final int[] cursor = new int[k];   // 每层下一个要试的后继下标
        private final boolean[] onPath = new boolean[graph.size()];
        private int depth = 0;
        private int start = 0;
        private long emitted = 0;
        private String next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String key = next;
            next = null;
            return key;
        }

        private String advance() {
            while (true) {
                if (depth == 0) {
                    if (start >= graph.size()) {
                        return null;
                    }
                    push(start++);
                } else {
                    int top = path[depth - 1];
                    int[] succ = graph.successors(top);
                    if (cursor[depth - 1] >= succ.length) {
                        pop();
                        continue;
                    }
                    int candidate = succ[cursor[depth - 1]++];
                    if (onPath[candidate]) {
                        continue;
                    }
                    push(candidate);
                }
                if (depth == k) {
                    String key = key();
                    pop();
                    count();
                    return key;
                }
            }
        }

        private void push(int node) {
            path[depth] = node;
            cursor[depth] = 0;
            onPath[node] = true;
            depth++;
        }

        private void pop() {
            depth--;
            onPath[path[depth]] = false;
        }

        private void count() {
            emitted++;
            if (emitted > maxPaths) {
                throw new GraphSizeExceededException("n-gram paths", emitted, maxPaths);
            }
            if (emitted % CHECK_INTERVAL == 0) {
                deadline.checkpoint();
            }
        }

        private String key() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < k; i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(graph.label(path[i]));
            }
            return sb.toString();
        }
    }
}
