package com.fincraft.etl.catalog;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.store.CatalogRepository;
import com.fincraft.etl.table.IndicatorSeries;
import com.fincraft.etl.table.TableDescriptor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates trackable entities per table and maintains the catalog rows.
 */
public final class EntityCatalog {
    private static final Logger LOG = LogManager.getLogger(EntityCatalog.class);
    public static final String INDICATOR_SOURCE = "indicators";

    private final CatalogRepository repository;
    private final SymbolScreener screener;

    public EntityCatalog(CatalogRepository repository, SymbolScreener screener) {
        this.repository = repository;
        this.screener = screener;
    }

    public List<CatalogEntity> trackable(TableDescriptor descriptor) throws SQLException {
        List<CatalogEntity> active = repository.listActive(descriptor.getEntityKind(), descriptor.getAssetTypes());
        if (!descriptor.isScreened()) {
            return active;
        }
        List<CatalogEntity> out = new ArrayList<>(active.size());
        int rejected = 0;
        for (CatalogEntity entity : active) {
            if (screener.accept(entity.entityId)) {
                out.add(entity);
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            LOG.debug("screened out {} of {} entities for table={}", rejected, active.size(), descriptor.getTableName());
        }
        return out;
    }

    public int importListing(String source, List<CatalogEntity> entities) throws SQLException {
        if (entities == null || entities.isEmpty()) {
            LOG.warn("listing import skipped: no rows for source={}", source);
            return 0;
        }
        int count = repository.replaceFromSource(source, entities);
        LOG.info("listing import source={} rows={}", source, count);
        return count;
    }

    public int seedIndicators() throws SQLException {
        List<CatalogEntity> entities = new ArrayList<>();
        for (IndicatorSeries series : IndicatorSeries.values()) {
            entities.add(CatalogEntity.indicator(series.name(), series.displayName()));
        }
        return repository.replaceFromSource(INDICATOR_SOURCE, entities);
    }
}
