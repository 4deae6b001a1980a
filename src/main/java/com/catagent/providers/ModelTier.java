package com.catagent.providers;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ModelTier {
    FREE, ECONOMY, STANDARD, PREMIUM;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
