package com.fincraft.etl.model;

import java.time.Instant;

/**
 * One trackable identifier in the entity catalog.
 */
public final class CatalogEntity {
    public final String entityId;
    public final String name;
    public final EntityKind kind;
    public final String assetType;
    public final String exchange;
    public final String status;
    public final boolean active;
    public final String source;
    public final Instant updatedAt;

    public CatalogEntity(
            String entityId,
            String name,
            EntityKind kind,
            String assetType,
            String exchange,
            String status,
            boolean active,
            String source,
            Instant updatedAt
    ) {
        if (entityId == null || entityId.trim().isEmpty()) {
            throw new IllegalArgumentException("entity_id must not be empty");
        }
        this.entityId = entityId.trim();
        this.name = name;
        this.kind = kind == null ? EntityKind.SYMBOL : kind;
        this.assetType = assetType;
        this.exchange = exchange;
        this.status = status;
        this.active = active;
        this.source = source;
        this.updatedAt = updatedAt;
    }

    public static CatalogEntity symbol(String entityId, String name, String assetType, String exchange) {
        return new CatalogEntity(entityId, name, EntityKind.SYMBOL, assetType, exchange, "Active", true, "manual", null);
    }

    public static CatalogEntity indicator(String entityId, String name) {
        return new CatalogEntity(entityId, name, EntityKind.INDICATOR, "Indicator", null, "Active", true, "indicators", null);
    }
}
