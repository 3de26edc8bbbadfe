package com.fincraft.etl.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogRow {
    private String entityId;
    private String name;
    private String entityKind;
    private String assetType;
    private String exchange;
    private String status;
    private boolean active;
    private String source;
    private OffsetDateTime updatedAt;
}
