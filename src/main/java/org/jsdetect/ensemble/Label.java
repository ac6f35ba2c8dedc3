package org.jsdetect.ensemble;

import com.google.gson.annotations.SerializedName;

public enum Label {
    @SerializedName("benign")
    BENIGN("benign"),
    @SerializedName("malicious")
    MALICIOUS("malicious");

    private final String key;

    Label(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public Label opposite() {
        return this == BENIGN ? MALICIOUS : BENIGN;
    }

    /**
     * @return 对应的标签；"?" 等未知真值返回 null
     */
    public static Label fromKey(String key) {
        for (Label label : values()) {
            if (label.key.equalsIgnoreCase(key)) {
                return label;
            }
        }
        return null;
    }
}
