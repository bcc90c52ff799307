package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.runner.RunReport;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One JSON object per line, appended under a lock.
 */
public final class JsonlRunLedger implements RunLedger {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlRunLedger(Path file) {
        this.file = file;
    }

    @Override
    public void record(RunReport report) throws StoreError {
        String line = CanonicalJson.write(RunReportCodec.encode(report)) + "\n";
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StoreError("failed appending run " + report.runId + " to " + file + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<JSONObject> recent(int limit) throws StoreError {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            List<JSONObject> out = new ArrayList<>();
            for (int i = lines.size() - 1; i >= 0 && out.size() < Math.max(0, limit); i--) {
                String line = lines.get(i).trim();
                if (!line.isEmpty()) {
                    out.add(new JSONObject(line));
                }
            }
            return Collections.unmodifiableList(out);
        } catch (IOException | JSONException e) {
            throw new StoreError("failed reading run ledger " + file + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }
}
