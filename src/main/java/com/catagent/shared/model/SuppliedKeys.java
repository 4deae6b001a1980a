package com.catagent.shared.model;

/** Provider keys passed on a single request. Never persisted. */
public record SuppliedKeys(String openRouterKey, String groqKey) {

    public static SuppliedKeys none() {
        return new SuppliedKeys(null, null);
    }

    @Override
    public String toString() {
        return "SuppliedKeys[openRouterKey=" + mask(openRouterKey) + ", groqKey=" + mask(groqKey) + "]";
    }

    private static String mask(String key) {
        return key == null || key.isBlank() ? "<none>" : "****";
    }
}
