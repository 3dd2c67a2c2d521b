package com.serviceradar.srql.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "srql")
public class SrqlProperties {

    private long defaultLimit = 100;
    private long maxLimit = 500;

    public long getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(long defaultLimit) {
        this.defaultLimit = Math.max(1, defaultLimit);
    }

    public long getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(long maxLimit) {
        this.maxLimit = Math.max(1, maxLimit);
    }
}
