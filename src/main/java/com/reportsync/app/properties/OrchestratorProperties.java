package com.reportsync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {
    private long pollIntervalMs = 1000L;
    private String awaitStrategy = "POLL";
}
