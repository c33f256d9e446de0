package net.lookvault.model;

/**
 * Where a try-on render came from.
 */
public enum AssetSource {
    CACHE("cache"),
    GENERATED("generated");

    private final String wireValue;

    AssetSource(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
