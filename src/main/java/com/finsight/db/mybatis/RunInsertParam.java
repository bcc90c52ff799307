package com.finsight.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunInsertParam {
    private String runId;
    private String trigger;
    private OffsetDateTime asOf;
    private boolean forceRefresh;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String status;
    private String reportJson;
}
