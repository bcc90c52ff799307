package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.model.ArtifactKey;
import com.finsight.model.ArtifactKind;
import com.finsight.model.Symbol;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileArtifactStoreTest {
    private static final Symbol AAPL = Symbol.of("AAPL");

    @TempDir
    Path tempDir;

    @Test
    void putShouldBeCreateOnly() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);
        ArtifactKey key = ArtifactKey.version(AAPL, ArtifactKind.RAW, "20240603T120000Z");

        store.put(key, payload(1));

        StoreError error = assertThrows(StoreError.class, () -> store.put(key, payload(2)));
        assertTrue(error.getMessage().contains("already exists"));
        assertEquals(1, store.get(key).orElseThrow().getInt("n"));
        assertTrue(Files.exists(tempDir.resolve("AAPL").resolve("raw").resolve("20240603T120000Z.json")));
    }

    @Test
    void latestShouldResolveOnlyAfterAdvance() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);
        ArtifactKey v1 = ArtifactKey.version(AAPL, ArtifactKind.FORECAST, "20240603T060000Z");
        ArtifactKey v2 = ArtifactKey.version(AAPL, ArtifactKind.FORECAST, "20240603T120000Z");
        store.put(v1, payload(1));
        store.put(v2, payload(2));

        assertEquals(Optional.empty(), store.latestVersion(AAPL, ArtifactKind.FORECAST));
        assertFalse(store.get(ArtifactKey.latest(AAPL, ArtifactKind.FORECAST)).isPresent());

        store.advanceLatest(AAPL, ArtifactKind.FORECAST, v1.version);
        assertEquals(1, store.get(ArtifactKey.latest(AAPL, ArtifactKind.FORECAST)).orElseThrow().getInt("n"));

        store.advanceLatest(AAPL, ArtifactKind.FORECAST, v2.version);
        assertEquals(Optional.of(v2.version), store.latestVersion(AAPL, ArtifactKind.FORECAST));
        assertEquals(2, store.get(ArtifactKey.latest(AAPL, ArtifactKind.FORECAST)).orElseThrow().getInt("n"));
    }

    @Test
    void advanceShouldRequireExistingVersion() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);

        assertThrows(StoreError.class, () -> store.advanceLatest(AAPL, ArtifactKind.INSIGHT, "20240603T120000Z"));
        assertThrows(StoreError.class, () -> store.put(ArtifactKey.latest(AAPL, ArtifactKind.INSIGHT), payload(1)));
        assertFalse(store.exists(ArtifactKey.latest(AAPL, ArtifactKind.INSIGHT)));
    }

    @Test
    void nextVersionShouldAppendSuffixes() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);
        String base = "20240603T120000Z";

        assertEquals(base, store.nextVersion(AAPL, ArtifactKind.RAW, base));
        store.put(ArtifactKey.version(AAPL, ArtifactKind.RAW, base), payload(1));
        assertEquals(base + ".1", store.nextVersion(AAPL, ArtifactKind.RAW, base));
        store.put(ArtifactKey.version(AAPL, ArtifactKind.RAW, base + ".1"), payload(2));
        assertEquals(base + ".2", store.nextVersion(AAPL, ArtifactKind.RAW, base));
        assertEquals(base, store.nextVersion(AAPL, ArtifactKind.PROCESSED, base));
    }

    @Test
    void corruptPayloadShouldRaiseStoreError() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);
        Path file = tempDir.resolve("AAPL").resolve("raw").resolve("bad.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{not json");

        assertThrows(StoreError.class, () -> store.get(ArtifactKey.version(AAPL, ArtifactKind.RAW, "bad")));
    }

    @Test
    void concurrentPutsOfOneVersionShouldAdmitExactlyOneWriter() throws Exception {
        FileArtifactStore store = new FileArtifactStore(tempDir);
        ArtifactKey key = ArtifactKey.version(AAPL, ArtifactKind.MODEL, "20240603T120000Z");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        store.put(key, payload(n));
                        return true;
                    } catch (StoreError e) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    private static JSONObject payload(int n) {
        JSONObject obj = new JSONObject();
        obj.put("n", n);
        return obj;
    }
}
