package com.reportsync.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "session")
public class SessionProperties {
    private boolean enabled = true;
    private boolean headless = false;
    private Webdriver webdriver = new Webdriver();
    private Reporter reporter = new Reporter();
    private Retry retry = new Retry();
    private int elementTimeoutSec = 10;
    private long settleMs = 5000L;
    private long stepSettleMs = 2000L;
    private long tabSettleMs = 1000L;
    private List<String> template = new ArrayList<>(List.of("パブリック", "対応状況集計表用-TVS"));
    private List<String> dateInputs = new ArrayList<>(List.of("0", "1"));
    private String tabId = "2";

    @Getter
    @Setter
    public static class Webdriver {
        private String url = "http://127.0.0.1:9515";
    }

    @Getter
    @Setter
    public static class Reporter {
        private String url = "";
        private String id = "";
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long delayMs = 2000L;
    }
}
