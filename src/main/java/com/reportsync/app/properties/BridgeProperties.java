package com.reportsync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
    private int poolSize = 5;
}
