package com.finsight.store;

import com.finsight.db.Database;
import com.finsight.db.mybatis.ArtifactMapper;
import com.finsight.db.mybatis.ArtifactVersionParam;
import com.finsight.db.mybatis.MyBatisSupport;
import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONException;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Artifact store on PostgreSQL: insert-only {@code artifact_versions} plus a pointer row per symbol/kind in
 * {@code artifact_latest}, updated inside a transaction.
 */
public final class PostgresArtifactStore implements ArtifactStore {
    private final Database database;

    public PostgresArtifactStore(Database database) {
        this.database = database;
    }

    @Override
    public void put(ArtifactKey key, JSONObject payload) throws StoreError {
        if (key.isLatest()) {
            throw new StoreError("cannot put to the latest pointer: " + key);
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ArtifactMapper mapper = session.getMapper(ArtifactMapper.class);
            if (mapper.countVersion(key.symbol.value, key.kind.segment(), key.version) > 0) {
                conn.rollback();
                throw new StoreError("artifact version already exists: " + key);
            }
            mapper.insertVersion(ArtifactVersionParam.builder()
                    .symbol(key.symbol.value)
                    .kind(key.kind.segment())
                    .version(key.version)
                    .payload(CanonicalJson.write(payload))
                    .createdAt(OffsetDateTime.now(ZoneOffset.UTC))
                    .build());
            conn.commit();
        } catch (SQLException | PersistenceException e) {
            throw new StoreError("failed writing " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void advanceLatest(Symbol symbol, ArtifactKind kind, String version) throws StoreError {
        ArtifactKey target = ArtifactKey.version(symbol, kind, version);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ArtifactMapper mapper = session.getMapper(ArtifactMapper.class);
            if (mapper.countVersion(symbol.value, kind.segment(), version) == 0) {
                conn.rollback();
                throw new StoreError("cannot advance latest to missing version: " + target);
            }
            mapper.upsertLatest(symbol.value, kind.segment(), version);
            conn.commit();
        } catch (SQLException | PersistenceException e) {
            throw new StoreError("failed advancing latest for " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<JSONObject> get(ArtifactKey key) throws StoreError {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            ArtifactMapper mapper = session.getMapper(ArtifactMapper.class);
            String version = key.version;
            if (key.isLatest()) {
                version = mapper.findLatestVersion(key.symbol.value, key.kind.segment());
                if (version == null) {
                    return Optional.empty();
                }
            }
            String payload = mapper.findPayload(key.symbol.value, key.kind.segment(), version);
            return payload == null ? Optional.empty() : Optional.of(new JSONObject(payload));
        } catch (SQLException | PersistenceException | JSONException e) {
            throw new StoreError("failed reading " + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> latestVersion(Symbol symbol, ArtifactKind kind) throws StoreError {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(session.getMapper(ArtifactMapper.class).findLatestVersion(symbol.value, kind.segment()));
        } catch (SQLException | PersistenceException e) {
            throw new StoreError("failed reading latest pointer " + symbol + "/" + kind.segment() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(ArtifactKey key) throws StoreError {
        if (key.isLatest()) {
            return latestVersion(key.symbol, key.kind).isPresent();
        }
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(ArtifactMapper.class).countVersion(key.symbol.value, key.kind.segment(), key.version) > 0;
        } catch (SQLException | PersistenceException e) {
            throw new StoreError("failed checking " + key + ": " + e.getMessage(), e);
        }
    }
}
