package dtm.registry.storage;

public enum ServiceScope {
    GLOBAL,
    WORKSPACE
}
