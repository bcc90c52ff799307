package com.finsight.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface RunMapper {
    @Insert("INSERT INTO runs(run_id, run_trigger, as_of, force_refresh, started_at, finished_at, status, report_json) " +
            "VALUES(#{runId}, #{trigger}, #{asOf}, #{forceRefresh}, #{startedAt}, #{finishedAt}, #{status}, #{reportJson})")
    int insertRun(RunInsertParam run);

    @Insert("INSERT INTO run_symbols(run_id, symbol, state, cause, stages_json) " +
            "VALUES(#{runId}, #{symbol}, #{state}, #{cause}, #{stagesJson})")
    int insertRunSymbol(RunSymbolInsertParam row);

    @Select("SELECT report_json FROM runs ORDER BY started_at DESC LIMIT #{limit}")
    List<String> listRecentReports(@Param("limit") int limit);
}
