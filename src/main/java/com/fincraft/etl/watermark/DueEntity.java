package com.fincraft.etl.watermark;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.Tier;
import com.fincraft.etl.model.Watermark;

import java.time.Instant;
import java.time.LocalDate;

/**
 * An entity eligible for fetching, with the state it was judged on.
 */
public final class DueEntity {
    public final CatalogEntity entity;
    public final Watermark watermark;
    public final Tier tier;
    public final LocalDate latestPeriod;

    public DueEntity(CatalogEntity entity, Watermark watermark, Tier tier, LocalDate latestPeriod) {
        this.entity = entity;
        this.watermark = watermark;
        this.tier = tier;
        this.latestPeriod = latestPeriod;
    }

    public String entityId() {
        return entity.entityId;
    }

    public boolean neverProcessed() {
        return watermark == null || watermark.lastSuccessTime == null;
    }

    public Instant lastSuccessTime() {
        return watermark == null ? null : watermark.lastSuccessTime;
    }

    public String lastFingerprint() {
        return watermark == null ? null : watermark.lastFingerprint;
    }
}
