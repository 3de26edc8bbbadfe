package com.fincraft.app;

import com.fincraft.app.properties.DbProperties;
import com.fincraft.app.properties.FetchProperties;
import com.fincraft.etl.config.Config;
import com.fincraft.etl.table.TableRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class FinCraftBootstrapConfigTest {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(FinCraftBootstrapConfig.class);

    @Test
    void context_shouldBindPropertiesWithoutTouchingDatabase() {
        contextRunner
                .withPropertyValues("db.schema=reporting", "fetch.requests-per-minute=30")
                .run(context -> {
                    assertNotNull(context.getBean(Config.class));
                    assertFalse(context.getBean(TableRegistry.class).tableNames().isEmpty());
                    assertEquals("reporting", context.getBean(DbProperties.class).getSchema());
                    assertEquals(30, context.getBean(FetchProperties.class).getRequestsPerMinute());
                });
    }
}
