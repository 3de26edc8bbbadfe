package com.fincraft.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "db")
public class DbProperties {
    private String url = "jdbc:postgresql://localhost:5432/fincraft";
    private String user = "fincraft";
    private String pass = "fincraft";
    private String schema = "source";
    private SqlLog sqlLog = new SqlLog();

    @Getter
    @Setter
    public static class SqlLog {
        private boolean enabled = false;
        private long slowMs = 250L;
    }
}
