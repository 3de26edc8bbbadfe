package com.fincraft.etl.db;

import com.fincraft.etl.db.mybatis.CatalogMapper;
import com.fincraft.etl.db.mybatis.CatalogRow;
import com.fincraft.etl.db.mybatis.MyBatisSupport;
import com.fincraft.etl.model.CatalogEntity;
import com.fincraft.etl.model.EntityKind;
import com.fincraft.etl.store.CatalogRepository;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class CatalogDao implements CatalogRepository {
    private final Database database;
    private final Clock clock;

    public CatalogDao(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public List<CatalogEntity> listActive(EntityKind kind, Collection<String> assetTypes) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            CatalogMapper mapper = session.getMapper(CatalogMapper.class);
            List<CatalogEntity> out = new ArrayList<>();
            for (CatalogRow row : mapper.listActive(kind.name(), assetTypes)) {
                out.add(toEntity(row));
            }
            return out;
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public Optional<CatalogEntity> find(String entityId) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            CatalogRow row = session.getMapper(CatalogMapper.class).find(entityId);
            return row == null ? Optional.empty() : Optional.of(toEntity(row));
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    @Override
    public int replaceFromSource(String source, List<CatalogEntity> entities) throws SQLException {
        if (entities == null || entities.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = DbTime.utc(clock.instant());
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            CatalogMapper mapper = session.getMapper(CatalogMapper.class);
            mapper.deactivateBySource(source, now);
            for (CatalogEntity entity : entities) {
                mapper.upsert(CatalogRow.builder()
                        .entityId(entity.entityId)
                        .name(entity.name)
                        .entityKind(entity.kind.name())
                        .assetType(entity.assetType)
                        .exchange(entity.exchange)
                        .status(entity.status)
                        .active(entity.active)
                        .source(source)
                        .updatedAt(now)
                        .build());
            }
            conn.commit();
            return entities.size();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }

    private static CatalogEntity toEntity(CatalogRow row) {
        return new CatalogEntity(
                row.getEntityId(),
                row.getName(),
                EntityKind.fromText(row.getEntityKind()),
                row.getAssetType(),
                row.getExchange(),
                row.getStatus(),
                row.isActive(),
                row.getSource(),
                DbTime.instant(row.getUpdatedAt())
        );
    }
}
