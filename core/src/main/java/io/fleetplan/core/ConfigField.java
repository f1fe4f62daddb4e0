package io.fleetplan.core;

/**
 * Fields a {@link ConfigKey} can be built from.
 *
 * The external name is the property used in configuration files and
 * provisioning requests; the image field is always the last field of a key.
 */
public enum ConfigField {
    SHARD("shard"),
    IMAGE("image_uuid");

    private final String externalName;

    ConfigField(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }
}
