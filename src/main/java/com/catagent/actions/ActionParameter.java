package com.catagent.actions;

public record ActionParameter(String name, Type type, boolean required, String description, Object defaultValue) {

    public enum Type { STRING, NUMBER, BOOLEAN, ENTITY_ID, USER_ID, SATS }

    public static ActionParameter required(String name, Type type, String description) {
        return new ActionParameter(name, type, true, description, null);
    }

    public static ActionParameter optional(String name, Type type, String description) {
        return new ActionParameter(name, type, false, description, null);
    }

    public static ActionParameter optional(String name, Type type, String description, Object defaultValue) {
        return new ActionParameter(name, type, false, description, defaultValue);
    }
}
