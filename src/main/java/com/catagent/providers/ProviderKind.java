package com.catagent.providers;

import java.util.Locale;

public enum ProviderKind {
    OPENROUTER("openrouter"),
    GROQ("groq");

    private final String id;

    ProviderKind(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static ProviderKind fromId(String id) {
        if (id == null) throw new IllegalArgumentException("provider must not be empty");
        for (var kind : values()) {
            if (kind.id.equals(id.toLowerCase(Locale.ROOT))) return kind;
        }
        throw new IllegalArgumentException("Unknown provider: " + id);
    }
}
