package com.roapid.sync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Lua module page ({@code <namespace>:Roapid}) installed on startup. Disabled while {@code source} is empty.
 */
@ConfigurationProperties(prefix = "roapid.module")
@NoArgsConstructor
@Getter
@Setter
public class WikiModuleProperties {

    /** Path of the module template; placeholders are substituted before upload. */
    private String source;

    /** Written as the first line ({@code -- <version>}) and compared on every start. */
    private String version = "0.0.17";

    private String queueNote = "Publish this page and wait at least a minute for data to be fetched.";

    private String fieldPathNotFound = "Field path not found (%s), [[%s|see fields]].";

    public boolean isEnabled() {
        return source != null && !source.isBlank();
    }
}
