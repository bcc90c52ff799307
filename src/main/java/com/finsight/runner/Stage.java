package com.finsight.runner;

public enum Stage {
    FETCH,
    IDEMPOTENCE,
    TRANSFORM,
    FORECAST,
    INSIGHT,
    COMMIT
}
