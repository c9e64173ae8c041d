package org.carball.planlens.model.postgres;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.planlens.model.plan.NodeDetails;
import org.carball.planlens.model.plan.PlanEngine;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class PostgresNodeDetails implements NodeDetails {
    String nodeType;
    String rawText;
    int indentation;
    Integer width;
    TimeRange actualTime;
    Integer loops;
    boolean neverExecuted;
    BufferStats buffers;

    /** Detail lines such as {@code Sort Key: ...} or {@code Index Cond: ...}, in input order. */
    @Singular
    List<String> detailLines;

    @Override
    public PlanEngine engine() {
        return PlanEngine.POSTGRES;
    }

    public boolean hasDetailStartingWith(String prefix) {
        return detailLines.stream().anyMatch(line -> line.startsWith(prefix));
    }
}
