package com.finsight.errors;

import com.finsight.core.diagnostics.CauseCode;

/**
 * 模块说明：PipelineStageException（class）。
 * 主要职责：流水线各阶段可恢复错误的共同父类，携带 CauseCode 供编排器转换为阶段结果。
 * 使用建议：阶段内部只抛出其子类，编排器负责捕获，错误不越过单个标的任务边界。
 */
public abstract class PipelineStageException extends Exception {
    private final CauseCode causeCode;

    protected PipelineStageException(CauseCode causeCode, String message) {
        super(message);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    protected PipelineStageException(CauseCode causeCode, String message, Throwable cause) {
        super(message, cause);
        this.causeCode = causeCode == null ? CauseCode.RUNTIME_ERROR : causeCode;
    }

    public CauseCode causeCode() {
        return causeCode;
    }
}
