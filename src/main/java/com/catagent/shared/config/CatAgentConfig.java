package com.catagent.shared.config;

public record CatAgentConfig(
    int serverPort,
    ProvidersConfig providers,
    EngineConfig engine,
    StorageMode storageMode,
    String secretsMasterKey
) {
    public enum StorageMode { JDBC, MEMORY }

    public static CatAgentConfig defaults() {
        return new CatAgentConfig(8080, ProvidersConfig.defaults(), EngineConfig.defaults(),
            StorageMode.JDBC, "");
    }

    @Override
    public String toString() {
        return "CatAgentConfig[serverPort=" + serverPort + ", providers=" + providers
            + ", engine=" + engine + ", storageMode=" + storageMode
            + ", secretsMasterKey=" + (secretsMasterKey == null || secretsMasterKey.isEmpty() ? "<unset>" : "****") + "]";
    }
}
