package com.fincraft.etl.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

public interface CatalogMapper {
    @Update("UPDATE entity_catalog SET active=FALSE, updated_at=#{updatedAt} WHERE source=#{source} AND active=TRUE")
    int deactivateBySource(@Param("source") String source, @Param("updatedAt") OffsetDateTime updatedAt);

    @Insert("INSERT INTO entity_catalog(entity_id, name, entity_kind, asset_type, exchange, status, active, source, updated_at) " +
            "VALUES(#{entityId}, #{name,jdbcType=VARCHAR}, #{entityKind}, #{assetType,jdbcType=VARCHAR}, " +
            "#{exchange,jdbcType=VARCHAR}, #{status,jdbcType=VARCHAR}, #{active}, #{source}, #{updatedAt}) " +
            "ON CONFLICT(entity_id) DO UPDATE SET " +
            "name=excluded.name, entity_kind=excluded.entity_kind, asset_type=excluded.asset_type, " +
            "exchange=excluded.exchange, status=excluded.status, active=excluded.active, " +
            "source=excluded.source, updated_at=excluded.updated_at")
    int upsert(CatalogRow row);

    @Select({
            "<script>",
            "SELECT entity_id, name, entity_kind, asset_type, exchange, status, active, source, updated_at",
            "FROM entity_catalog WHERE active=TRUE AND entity_kind=#{kind}",
            "<if test='assetTypes != null and !assetTypes.isEmpty()'>",
            "AND asset_type IN <foreach collection='assetTypes' item='t' open='(' separator=',' close=')'>#{t}</foreach>",
            "</if>",
            "ORDER BY entity_id ASC",
            "</script>"
    })
    List<CatalogRow> listActive(@Param("kind") String kind, @Param("assetTypes") Collection<String> assetTypes);

    @Select("SELECT entity_id, name, entity_kind, asset_type, exchange, status, active, source, updated_at " +
            "FROM entity_catalog WHERE entity_id=#{entityId}")
    CatalogRow find(@Param("entityId") String entityId);
}
