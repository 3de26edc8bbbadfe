package com.fincraft.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "fetch")
public class FetchProperties {
    private int concurrent = 4;
    private int timeoutSec = 30;
    private int requestsPerMinute = 75;
}
