package com.fincraft.etl.db;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

final class DbTime {
    private DbTime() {
    }

    static OffsetDateTime utc(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
