package org.jsdetect.pipeline;

import org.jsdetect.ensemble.Label;

/**
 * 配置中的一个语料目录及其标签（"benign"、"malicious" 或表示未知的 "?"）
 */
public class CorpusEntry {
    public String folder;
    public String label = "?";

    public CorpusEntry() {
    }

    public CorpusEntry(String folder, String label) {
        this.folder = folder;
        this.label = label;
    }

    /**
     * @return 标签，未知时为 null
     */
    public Label label() {
        return Label.fromKey(label);
    }

    @Override
    public String toString() {
        return folder + " (" + label + ")";
    }
}
