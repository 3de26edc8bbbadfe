package com.fincraft.etl.support;

import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityKind;
import com.fincraft.etl.store.CatalogRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

public final class InMemoryCatalogRepository implements CatalogRepository {
    private final Map<String, CatalogEntity> rows = new TreeMap<>();

    public InMemoryCatalogRepository add(CatalogEntity... entities) {
        for (CatalogEntity entity : entities) {
            rows.put(entity.entityId, entity);
        }
        return this;
    }

    public InMemoryCatalogRepository addSymbols(String... ids) {
        for (String id : ids) {
            add(CatalogEntity.symbol(id, id + " Inc", "Stock", "NYSE"));
        }
        return this;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public synchronized List<CatalogEntity> listActive(EntityKind kind, Collection<String> assetTypes) {
        List<CatalogEntity> out = new ArrayList<>();
        for (CatalogEntity entity : rows.values()) {
            if (!entity.active || entity.kind != kind) {
                continue;
            }
            if (assetTypes != null && !assetTypes.isEmpty() && !containsIgnoreCase(assetTypes, entity.assetType)) {
                continue;
            }
            out.add(entity);
        }
        return out;
    }

    @Override
    public synchronized Optional<CatalogEntity> find(String entityId) {
        return Optional.ofNullable(rows.get(entityId));
    }

    @Override
    public synchronized int replaceFromSource(String source, List<CatalogEntity> entities) {
        Set<String> incoming = new java.util.HashSet<>();
        for (CatalogEntity entity : entities) {
            incoming.add(entity.entityId);
            rows.put(entity.entityId, entity);
        }
        for (Map.Entry<String, CatalogEntity> e : new ArrayList<>(rows.entrySet())) {
            CatalogEntity existing = e.getValue();
            if (source.equals(existing.source) && !incoming.contains(e.getKey()) && existing.active) {
                rows.put(e.getKey(), new CatalogEntity(existing.entityId, existing.name, existing.kind,
                        existing.assetType, existing.exchange, "Delisted", false, existing.source, existing.updatedAt));
            }
        }
        return entities.size();
    }

    private static boolean containsIgnoreCase(Collection<String> values, String target) {
        if (target == null) {
            return false;
        }
        String t = target.toLowerCase(Locale.ROOT);
        for (String v : values) {
            if (v != null && v.toLowerCase(Locale.ROOT).equals(t)) {
                return true;
            }
        }
        return false;
    }
}
