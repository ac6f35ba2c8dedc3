package org.jsdetect.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.jsdetect.ast.ParsedScript;
import org.jsdetect.ast.SourceRange;
import org.jsdetect.graph.*;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把一个文件在某个层级上的图写成 JSON。节点和边都按 id 排序，同一输入总是得到同样的文本。
 */
public class GraphJsonWriter {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public JsonObject toJson(AnalysisLevel level, ParsedScript script, ProgramGraph graph) {
        JsonObject root = new JsonObject();
        root.addProperty("level", level.key());
        if (level.needsProgramGraph()) {
            writeItems(root, level, graph);
        } else {
            writeChain(root, GraphViews.view(level, script, graph));
        }
        return root;
    }

    public String write(AnalysisLevel level, ParsedScript script, ProgramGraph graph) {
        return GSON.toJson(toJson(level, script, graph));
    }

    public void write(AnalysisLevel level, ParsedScript script, ProgramGraph graph, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(level, script, graph), out);
        }
    }

    private static void writeChain(JsonObject root, LabeledGraph view) {
        JsonArray nodes = new JsonArray();
        JsonArray edges = new JsonArray();
        for (int i = 0; i < view.size(); i++) {
            JsonObject n = new JsonObject();
            n.addProperty("id", i);
            n.addProperty("label", view.label(i));
            n.addProperty("origin", view.origin(i));
            nodes.add(n);
            for (int s : view.successors(i)) {
                edges.add(edge(i, s, "sequence"));
            }
        }
        root.add("nodes", nodes);
        root.add("edges", edges);
    }

    private static void writeItems(JsonObject root, AnalysisLevel level, ProgramGraph graph) {
        boolean control = level == AnalysisLevel.CFG || level == AnalysisLevel.PDG;
        boolean data = level == AnalysisLevel.PDG_DFG || level == AnalysisLevel.PDG;

        JsonArray nodes = new JsonArray();
        for (StmtNode item : graph.items) {
            JsonObject n = new JsonObject();
            n.addProperty("id", item.id);
            n.addProperty("label", item.label);
            n.addProperty("function", item.function);
            n.addProperty("block", item.block);
            if (item.entry) {
                n.addProperty("entry", true);
            }
            SourceRange range = item.astNode.range;
            if (range.isKnown()) {
                JsonArray r = new JsonArray();
                r.add(range.start());
                r.add(range.end());
                n.add("range", r);
            }
            nodes.add(n);
        }
        root.add("nodes", nodes);

        JsonArray edges = new JsonArray();
        if (control) {
            graph.cfgSucc.forEach((from, tos) -> {
                for (int to : tos) {
                    edges.add(edge(from, to, "control"));
                }
            });
        }
        if (data) {
            for (DataEdge e : graph.dataEdges) {
                JsonObject o = edge(e.from(), e.to(), "data");
                o.addProperty("variable", e.variable());
                edges.add(o);
            }
        }
        root.add("edges", edges);

        // 块级控制边带类型
        if (control) {
            JsonArray blocks = new JsonArray();
            for (ControlFlowGraph cfg : graph.functions) {
                for (ControlEdge e : cfg.edges) {
                    JsonObject o = new JsonObject();
                    o.addProperty("function", cfg.index);
                    o.addProperty("from", e.from());
                    o.addProperty("to", e.to());
                    o.addProperty("kind", e.kind().name());
                    blocks.add(o);
                }
            }
            root.add("blockEdges", blocks);
        }

        if (!graph.unbound.isEmpty()) {
            JsonArray unbound = new JsonArray();
            graph.unbound.forEach(u -> {
                JsonObject o = new JsonObject();
                o.addProperty("name", u.name());
                o.addProperty("offset", u.range().start());
                unbound.add(o);
            });
            root.add("unbound", unbound);
        }
    }

    private static JsonObject edge(int from, int to, String type) {
        JsonObject o = new JsonObject();
        o.addProperty("from", from);
        o.addProperty("to", to);
        o.addProperty("type", type);
        return o;
    }
}
