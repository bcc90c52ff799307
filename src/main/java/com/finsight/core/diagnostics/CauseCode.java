package com.finsight.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：统一描述阶段失败或跳过的原因，写入运行台账与日志。
 * 使用建议：新增原因码时同步检查 RunLedger 的序列化与视图端的展示。
 */
public enum CauseCode {
    NONE,
    NO_DATA,
    FETCH_FAILED,
    RATE_LIMITED,
    TIMEOUT,
    PARSE,
    INSUFFICIENT_HISTORY,
    FORECAST_FAILED,
    INSIGHT_FAILED,
    STORE_ERROR,
    CANCELLED,
    UNCHANGED,
    CONFIG_INVALID,
    RUNTIME_ERROR
}
