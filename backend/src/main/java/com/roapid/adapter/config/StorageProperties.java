package com.roapid.adapter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where persisted artifacts live. The directory doubles as the restart memory of the scheduler.
 */
@ConfigurationProperties(prefix = "roapid.storage")
@NoArgsConstructor
@Getter
@Setter
public class StorageProperties {

    private String dataDir = "data";
}
