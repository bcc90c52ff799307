package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 模块说明：FileArtifactStore（class）。
 * 主要职责：以目录树 {root}/{symbol}/{kind}/{version}.json 保存产物，latest 指针为同目录下的 latest 文件。
 * 使用建议：所有写入先落临时文件再原子移动，读者不会看到半写入的内容；同一 symbol/kind 的写入串行化。
 */
public final class FileArtifactStore implements ArtifactStore {
    private static final Logger LOG = LogManager.getLogger(FileArtifactStore.class);
    private static final String POINTER_FILE = "latest";
    private static final String SUFFIX = ".json";

    private final Path root;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public void put(ArtifactKey key, JSONObject payload) throws StoreError {
        if (key.isLatest()) {
            throw new StoreError("cannot put to the latest pointer: " + key);
        }
        ReentrantLock lock = lockFor(key.symbol, key.kind);
        lock.lock();
        try {
            Path target = versionPath(key);
            if (Files.exists(target)) {
                throw new StoreError("artifact version already exists: " + key);
            }
            writeAtomically(target, CanonicalJson.write(payload));
            LOG.debug("stored {}", key);
        } catch (IOException e) {
            throw new StoreError("failed writing " + key + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void advanceLatest(Symbol symbol, ArtifactKind kind, String version) throws StoreError {
        ArtifactKey target = ArtifactKey.version(symbol, kind, version);
        ReentrantLock lock = lockFor(symbol, kind);
        lock.lock();
        try {
            if (!Files.exists(versionPath(target))) {
                throw new StoreError("cannot advance latest to missing version: " + target);
            }
            writeAtomically(kindDir(symbol, kind).resolve(POINTER_FILE), version);
            LOG.debug("latest {} -> {}", ArtifactKey.latest(symbol, kind), version);
        } catch (IOException e) {
            throw new StoreError("failed advancing latest for " + target + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<JSONObject> get(ArtifactKey key) throws StoreError {
        ArtifactKey resolved = key;
        if (key.isLatest()) {
            Optional<String> version = latestVersion(key.symbol, key.kind);
            if (version.isEmpty()) {
                return Optional.empty();
            }
            resolved = ArtifactKey.version(key.symbol, key.kind, version.get());
        }
        try {
            String text = Files.readString(versionPath(resolved), StandardCharsets.UTF_8);
            return Optional.of(new JSONObject(text));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException | JSONException e) {
            throw new StoreError("failed reading " + resolved + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> latestVersion(Symbol symbol, ArtifactKind kind) throws StoreError {
        Path pointer = kindDir(symbol, kind).resolve(POINTER_FILE);
        try {
            String version = Files.readString(pointer, StandardCharsets.UTF_8).trim();
            return version.isEmpty() ? Optional.empty() : Optional.of(version);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreError("failed reading latest pointer " + pointer + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(ArtifactKey key) throws StoreError {
        if (key.isLatest()) {
            return latestVersion(key.symbol, key.kind).isPresent();
        }
        return Files.exists(versionPath(key));
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path kindDir(Symbol symbol, ArtifactKind kind) {
        return root.resolve(symbol.value).resolve(kind.segment());
    }

    private Path versionPath(ArtifactKey key) {
        return kindDir(key.symbol, key.kind).resolve(key.version + SUFFIX);
    }

    private ReentrantLock lockFor(Symbol symbol, ArtifactKind kind) {
        return locks.computeIfAbsent(symbol.value + "/" + kind.segment(), ignored -> new ReentrantLock());
    }
}
