package com.sandcastle.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutputKind {
    TEXT,
    IMAGE,
    ERROR;

    @JsonValue
    public String wire() {
        return name().toLowerCase();
    }
}
