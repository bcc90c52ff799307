package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Read-only view of the artifact store. A {@code latest} key resolves through the pointer.
 */
public interface ArtifactReader {

    Optional<JSONObject> get(ArtifactKey key) throws StoreError;

    Optional<String> latestVersion(Symbol symbol, ArtifactKind kind) throws StoreError;

    boolean exists(ArtifactKey key) throws StoreError;
}
