package com.finsight.store;

import com.finsight.errors.StoreError;
import com.finsight.runner.RunReport;
import org.json.JSONObject;

import java.util.List;

/**
 * Append-only record of pipeline runs.
 */
public interface RunLedger {

    void record(RunReport report) throws StoreError;

    /**
     * Most recent runs first.
     */
    List<JSONObject> recent(int limit) throws StoreError;
}
