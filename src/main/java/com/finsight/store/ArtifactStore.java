package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import org.json.JSONObject;

/**
 * 模块说明：ArtifactStore（interface）。
 * 主要职责：按键存取带版本的产物，并原子地推进每个 symbol/kind 的 latest 指针。
 * 使用建议：put 只允许新建；只有编排器可以调用 advanceLatest，读侧只拿到 ArtifactReader。
 */
public interface ArtifactStore extends ArtifactReader {

    /**
     * Creates a new version. Fails with StoreError when the version already exists.
     */
    void put(ArtifactKey key, JSONObject payload) throws StoreError;

    /**
     * Points {@code latest} at an existing version. Readers see either the old or the new target.
     */
    void advanceLatest(Symbol symbol, ArtifactKind kind, String version) throws StoreError;

    /**
     * First free version for {@code baseVersion}: the base itself, then base.1, base.2 and so on.
     */
    default String nextVersion(Symbol symbol, ArtifactKind kind, String baseVersion) throws StoreError {
        if (!exists(ArtifactKey.version(symbol, kind, baseVersion))) {
            return baseVersion;
        }
        for (int suffix = 1; suffix < 10_000; suffix++) {
            String candidate = baseVersion + "." + suffix;
            if (!exists(ArtifactKey.version(symbol, kind, candidate))) {
                return candidate;
            }
        }
        throw new StoreError("no free version for " + symbol + "/" + kind.segment() + "/" + baseVersion);
    }
}
