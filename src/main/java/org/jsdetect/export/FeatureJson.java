package org.jsdetect.export;

import com.google.gson.*;
import com.google.gson.reflect.TypeToken;
import org.jsdetect.ensemble.Decision;
import org.jsdetect.ensemble.ModelOutput;
import org.jsdetect.feature.FeatureVector;
import org.jsdetect.select.SelectedFeatures;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 特征向量、选中特征集合和投票结果的 JSON 读写
 */
public final class FeatureJson {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
    private static final Type COUNTS = new TypeToken<TreeMap<String, Integer>>() {
    }.getType();
    private static final Type KEYS = new TypeToken<List<String>>() {
    }.getType();

    private FeatureJson() {
    }

    // ---------------------------------------------------------------- 特征向量：有序的 key -> count

    public static String vectorToJson(FeatureVector vector) {
        return GSON.toJson(vector.counts(), COUNTS);
    }

    public static FeatureVector vectorFromJson(String json) {
        Map<String, Integer> counts = GSON.fromJson(json, COUNTS);
        FeatureVector vector = new FeatureVector();
        if (counts != null) {
            counts.forEach(vector::add);
        }
        return vector;
    }

    public static void writeVector(FeatureVector vector, Path file) throws IOException {
        writeString(vectorToJson(vector), file);
    }

    // ---------------------------------------------------------------- 选中特征：有序的 key 数组

    public static String selectedToJson(SelectedFeatures features) {
        return GSON.toJson(features.keys(), KEYS);
    }

    public static SelectedFeatures selectedFromJson(String json) {
        List<String> keys = GSON.fromJson(json, KEYS);
        if (keys == null) {
            throw new JsonParseException("Selected features must be a JSON array");
        }
        return new SelectedFeatures(keys);
    }

    public static void writeSelected(SelectedFeatures features, Path file) throws IOException {
        writeString(selectedToJson(features), file);
    }

    public static SelectedFeatures readSelected(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<String> keys = GSON.fromJson(reader, KEYS);
            if (keys == null) {
                throw new JsonParseException("Selected features must be a JSON array: " + file);
            }
            return new SelectedFeatures(keys);
        }
    }

    // ---------------------------------------------------------------- 投票结果

    public static String decisionToJson(String file, Decision decision, Map<String, ModelOutput> outputs) {
        JsonObject root = new JsonObject();
        root.addProperty("file", file);
        root.addProperty("state", decision.state().name());
        if (decision.label() != null) {
            root.addProperty("label", decision.label().key());
        }
        root.addProperty("tier", decision.tier().name());
        JsonObject modules = new JsonObject();
        outputs.forEach((name, output) -> {
            JsonObject o = new JsonObject();
            o.addProperty("label", output.label().key());
            o.addProperty("confidence", output.confidence());
            modules.add(name, o);
        });
        root.add("outputs", modules);
        return GSON.toJson(root);
    }

    private static void writeString(String json, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write(json);
        }
    }
}
