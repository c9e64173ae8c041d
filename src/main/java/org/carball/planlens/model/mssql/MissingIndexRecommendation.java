package org.carball.planlens.model.mssql;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A missing index suggestion from a {@code MissingIndexGroup}. Column names are
 * stored without brackets. A recommendation without key columns is kept but
 * never gets a runnable script.
 */
@Value
@Builder(toBuilder = true)
public class MissingIndexRecommendation {
    public static final String UNKNOWN_TABLE = "(unknown table)";

    String database;
    String schema;
    String table;
    double impact;

    @Builder.Default
    List<String> equalityColumns = List.of();

    @Builder.Default
    List<String> inequalityColumns = List.of();

    @Builder.Default
    List<String> includedColumns = List.of();

    String ddlScript;

    /**
     * Equality columns followed by inequality columns, in index key order.
     */
    @JsonIgnore
    public List<String> getKeyColumns() {
        List<String> keys = new ArrayList<>(equalityColumns);
        keys.addAll(inequalityColumns);
        return keys;
    }

    public boolean isNoKeyColumns() {
        return equalityColumns.isEmpty() && inequalityColumns.isEmpty();
    }

    /**
     * True when the plan did not name the table, as in truncated payloads.
     */
    public boolean isNoTable() {
        return table == null || table.isBlank();
    }

    /**
     * {@code schema.table}, or a placeholder when the table is unknown.
     */
    @JsonIgnore
    public String getQualifiedTable() {
        String name = isNoTable() ? UNKNOWN_TABLE : table;
        return schema != null ? schema + "." + name : name;
    }
}
