package com.catagent.actions;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActionStatus {
    PENDING_CONFIRMATION, DENIED, EXECUTING, SUCCEEDED, FAILED;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == DENIED || this == SUCCEEDED || this == FAILED;
    }

    public static ActionStatus fromId(String id) {
        return valueOf(id.toUpperCase(Locale.ROOT));
    }
}
