package org.jsdetect.export;

import org.jsdetect.graph.LabeledGraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把层级图渲染成 Graphviz DOT 文本，便于人工查看
 */
public final class DotRenderer {

    private DotRenderer() {
    }

    public static String render(String name, LabeledGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(escape(name)).append("\" {\n");
        sb.append("  node [shape=box];\n");
        for (int i = 0; i < graph.size(); i++) {
            sb.append("  n").append(i)
                    .append(" [label=\"").append(graph.origin(i)).append(": ")
                    .append(escape(graph.label(i))).append("\"];\n");
        }
        for (int i = 0; i < graph.size(); i++) {
            for (int s : graph.successors(i)) {
                sb.append("  n").append(i).append(" -> n").append(s).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    public static void write(String name, LabeledGraph graph, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.writeString(file, render(name, graph), StandardCharsets.UTF_8);
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
