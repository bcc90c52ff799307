package com.finsight.support;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import com.finsight.store.ArtifactStore;
import org.json.JSONObject;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delegating store that fails puts of chosen kinds and can fail every read.
 */
public final class FailingStore implements ArtifactStore {
    private final ArtifactStore delegate;
    private final Set<ArtifactKind> failingPuts = ConcurrentHashMap.newKeySet();
    private volatile boolean readsDown = false;

    public FailingStore(ArtifactStore delegate) {
        this.delegate = delegate;
    }

    public FailingStore failPutsOf(ArtifactKind kind) {
        failingPuts.add(kind);
        return this;
    }

    public FailingStore readsDown(boolean down) {
        this.readsDown = down;
        return this;
    }

    @Override
    public void put(ArtifactKey key, JSONObject payload) throws StoreError {
        if (failingPuts.contains(key.kind)) {
            throw new StoreError("disk full writing " + key);
        }
        delegate.put(key, payload);
    }

    @Override
    public void advanceLatest(Symbol symbol, ArtifactKind kind, String version) throws StoreError {
        delegate.advanceLatest(symbol, kind, version);
    }

    @Override
    public Optional<JSONObject> get(ArtifactKey key) throws StoreError {
        if (readsDown) {
            throw new StoreError("store offline reading " + key);
        }
        return delegate.get(key);
    }

    @Override
    public Optional<String> latestVersion(Symbol symbol, ArtifactKind kind) throws StoreError {
        if (readsDown) {
            throw new StoreError("store offline reading " + symbol + "/" + kind.segment());
        }
        return delegate.latestVersion(symbol, kind);
    }

    @Override
    public boolean exists(ArtifactKey key) throws StoreError {
        return delegate.exists(key);
    }
}
