package com.finsight.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSymbolInsertParam {
    private String runId;
    private String symbol;
    private String state;
    private String cause;
    private String stagesJson;
}
