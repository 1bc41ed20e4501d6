package com.reportsync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    private boolean enabled = true;
    private List<String> files = new ArrayList<>(List.of(
            "data/TS_todays_activity.xlsx",
            "data/TS_todays_support.xlsx",
            "data/TS_todays_close.xlsx"
    ));
    private int maxRetries = 5;
    private long retryDelayMs = 2000L;
    private long refreshIntervalMs = 5000L;
}
