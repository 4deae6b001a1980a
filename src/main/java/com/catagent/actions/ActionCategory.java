package com.catagent.actions;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionCategory {
    ENTITY_MANAGEMENT("entity_management", "Entities",
        "Create and manage products, services, projects, causes, and events", false),
    COMMUNICATION("communication", "Communication", "Post to timeline and send messages", false),
    PAYMENTS("payments", "Payments", "Send Bitcoin and fund projects", false),
    ORGANIZATION("organization", "Organizations", "Create and manage organizations", false),
    SETTINGS("settings", "Settings", "Manage your account settings", false),
    CONTEXT("context", "Context", "Manage what My Cat knows about you", true);

    private final String id;
    private final String displayName;
    private final String description;
    private final boolean defaultEnabled;

    ActionCategory(String id, String displayName, String description, boolean defaultEnabled) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.defaultEnabled = defaultEnabled;
    }

    @JsonValue
    public String id() { return id; }

    public String displayName() { return displayName; }

    public String description() { return description; }

    public boolean defaultEnabled() { return defaultEnabled; }

    public static ActionCategory fromId(String id) {
        for (var category : values()) {
            if (category.id.equals(id)) return category;
        }
        throw new IllegalArgumentException("Unknown category: " + id);
    }
}
