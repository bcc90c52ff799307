package com.finsight.runner;

public enum StageStatus {
    OK,
    FAILED,
    SKIPPED,
    REUSED
}
