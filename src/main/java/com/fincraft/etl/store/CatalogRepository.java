package com.fincraft.etl.store;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityKind;

import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CatalogRepository {

    /**
     * Active entities of one kind. An empty asset-type filter matches every asset type.
     */
    List<CatalogEntity> listActive(EntityKind kind, Collection<String> assetTypes) throws SQLException;

    Optional<CatalogEntity> find(String entityId) throws SQLException;

    /**
     * Deactivates the rows of {@code source} missing from {@code entities} and upserts the rest.
     * Rows are never deleted.
     */
    int replaceFromSource(String source, List<CatalogEntity> entities) throws SQLException;
}
