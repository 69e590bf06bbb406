package com.roapid.sync.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "roapid.open-cloud")
@NoArgsConstructor
@Getter
@Setter
public class OpenCloudProperties {

    /** Sent as {@code x-api-key} to authenticated endpoint types. */
    private String apiKey;
}
