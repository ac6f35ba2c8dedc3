package org.jsdetect.feature;

import com.google.gson.annotations.SerializedName;

public enum FeatureKind {
    @SerializedName("ngrams")
    NGRAMS("ngrams"),
    @SerializedName("value")
    VALUE("value");

    private final String key;

    FeatureKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FeatureKind fromKey(String key) {
        for (FeatureKind kind : values()) {
            if (kind.key.equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown feature kind: " + key);
    }
}
