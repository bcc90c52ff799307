package com.finsight.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface ArtifactMapper {
    @Insert("INSERT INTO artifact_versions(symbol, kind, version, payload, created_at) " +
            "VALUES(#{symbol}, #{kind}, #{version}, #{payload}, #{createdAt})")
    int insertVersion(ArtifactVersionParam row);

    @Select("SELECT payload FROM artifact_versions WHERE symbol=#{symbol} AND kind=#{kind} AND version=#{version}")
    String findPayload(@Param("symbol") String symbol, @Param("kind") String kind, @Param("version") String version);

    @Select("SELECT COUNT(1) FROM artifact_versions WHERE symbol=#{symbol} AND kind=#{kind} AND version=#{version}")
    int countVersion(@Param("symbol") String symbol, @Param("kind") String kind, @Param("version") String version);

    @Select("SELECT version FROM artifact_latest WHERE symbol=#{symbol} AND kind=#{kind}")
    String findLatestVersion(@Param("symbol") String symbol, @Param("kind") String kind);

    @Insert("INSERT INTO artifact_latest(symbol, kind, version, updated_at) VALUES(#{symbol}, #{kind}, #{version}, now()) " +
            "ON CONFLICT(symbol, kind) DO UPDATE SET version=excluded.version, updated_at=excluded.updated_at")
    int upsertLatest(@Param("symbol") String symbol, @Param("kind") String kind, @Param("version") String version);
}
