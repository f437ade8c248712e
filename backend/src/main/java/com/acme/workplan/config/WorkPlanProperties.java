package com.acme.workplan.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.workplan")
public record WorkPlanProperties(
        @DefaultValue("500") int changelogMaxLimit,
        @DefaultValue("5000") int importMaxItems
) {
}
