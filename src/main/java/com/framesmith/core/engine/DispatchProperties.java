package com.framesmith.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "framesmith.dispatch")
public class DispatchProperties {

    /** Screens generated at the same time. 1 processes screens sequentially. */
    private int maxConcurrency = 3;

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }
}
