package org.jsdetect.pipeline;

import org.jsdetect.ensemble.Label;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 一个待分析的 AST 文件和它的真值标签（未知为 null）
 */
public record Sample(Path path, Label label) {

    /**
     * 目录下所有 *.json 文件，按路径排序
     */
    public static List<Sample> listFolder(CorpusEntry entry) throws IOException {
        List<Sample> samples = new ArrayList<>();
        try (Stream<Path> files = Files.walk(Path.of(entry.folder))) {
            files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .forEach(p -> samples.add(new Sample(p, entry.label())));
        }
        return samples;
    }
}
