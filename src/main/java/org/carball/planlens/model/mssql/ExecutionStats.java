package org.carball.planlens.model.mssql;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime counters present only in actual (post-execution) plans. Absent values stay null.
 */
@Value
@Builder
public class ExecutionStats {
    Long actualRows;
    Integer rowSize;
    Long logicalReads;
    Long physicalReads;
    Double executionTimeMs;
    Double cpuTimeMs;
    Double elapsedTimeMs;

    public static ExecutionStats empty() {
        return ExecutionStats.builder().build();
    }
}
