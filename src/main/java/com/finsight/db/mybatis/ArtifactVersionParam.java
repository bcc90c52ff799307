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
public class ArtifactVersionParam {
    private String symbol;
    private String kind;
    private String version;
    private String payload;
    private OffsetDateTime createdAt;
}
