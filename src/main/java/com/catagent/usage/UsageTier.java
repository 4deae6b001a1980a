package com.catagent.usage;

public enum UsageTier {
    PLATFORM("platform"),
    OWN_KEY("own_key");

    private final String id;

    UsageTier(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static UsageTier of(boolean usesOwnKey) {
        return usesOwnKey ? OWN_KEY : PLATFORM;
    }
}
