package com.phillippitts.commandrouter.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the contacts/applications directory file.
 */
@Validated
@ConfigurationProperties(prefix = "router.directory")
public class DirectoryProperties {

    @NotBlank
    private final String location;

    @ConstructorBinding
    public DirectoryProperties(String location) {
        this.location = location == null ? "classpath:directory.json" : location;
    }

    public String getLocation() {
        return location;
    }
}
