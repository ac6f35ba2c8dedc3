package org.jsdetect.graph;

import com.google.gson.annotations.SerializedName;

/**
 * 提取特征时使用的程序表示
 */
public enum AnalysisLevel {
    @SerializedName("tokens")
    TOKENS("tokens"),
    @SerializedName("ast")
    AST("ast"),
    @SerializedName("cfg")
    CFG("cfg"),
    @SerializedName("pdg-dfg")
    PDG_DFG("pdg-dfg"),
    @SerializedName("pdg")
    PDG("pdg");

    private final String key;

    AnalysisLevel(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @return 是否需要 CFG / PDG（否则只用词法单元或 AST）
     */
    public boolean needsProgramGraph() {
        return this == CFG || this == PDG_DFG || this == PDG;
    }

    public static AnalysisLevel fromKey(String key) {
        for (AnalysisLevel level : values()) {
            if (level.key.equals(key)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown analysis level: " + key);
    }
}
