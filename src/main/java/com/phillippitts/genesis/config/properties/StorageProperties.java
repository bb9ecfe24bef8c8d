package com.phillippitts.genesis.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the JSON key/value store file.
 */
@Validated
@ConfigurationProperties(prefix = "genesis.storage")
public class StorageProperties {

    @NotBlank
    private String path = "data/genesis-store.json";

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
