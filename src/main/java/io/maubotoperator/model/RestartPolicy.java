package io.maubotoperator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RestartPolicy {
    RESTART("restart"),
    IGNORE("ignore");

    private final String wireName;

    RestartPolicy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
