package com.fincraft.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "alphavantage")
public class AlphaVantageProperties {
    private String baseUrl = "https://www.alphavantage.co/query";
    private String apiKey = "";
}
