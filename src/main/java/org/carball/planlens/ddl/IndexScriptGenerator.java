package org.carball.planlens.ddl;

import lombok.extern.slf4j.Slf4j;
import org.carball.planlens.model.mssql.MissingIndexRecommendation;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Generates a {@code CREATE NONCLUSTERED INDEX} script and a verification query
 * for a missing index recommendation. Recommendations without key columns or
 * without a table get a comment-only script.
 */
@Slf4j
public class IndexScriptGenerator {

    public static final int SQL_SERVER_IDENTIFIER_LIMIT = 128;

    private final int maxNameLength;

    public IndexScriptGenerator() {
        this(SQL_SERVER_IDENTIFIER_LIMIT);
    }

    public IndexScriptGenerator(int maxNameLength) {
        this.maxNameLength = maxNameLength;
    }

    public String generate(MissingIndexRecommendation recommendation) {
        if (recommendation.isNoKeyColumns()) {
            log.debug("Missing index on {} has no key columns, skipping script", recommendation.getTable());
            return IndexScriptTemplate.NO_KEY_COLUMNS;
        }
        if (recommendation.isNoTable()) {
            log.debug("Missing index on columns {} names no table, skipping script", recommendation.getKeyColumns());
            return IndexScriptTemplate.NO_TABLE;
        }

        String table = clean(recommendation.getTable());
        String schema = recommendation.getSchema() != null ? clean(recommendation.getSchema()) : "dbo";
        List<String> keyColumns = recommendation.getKeyColumns().stream()
                .map(IndexScriptGenerator::clean)
                .collect(Collectors.toList());
        String indexName = indexName(table, keyColumns);

        StringBuilder script = new StringBuilder();
        script.append(String.format(Locale.ROOT, IndexScriptTemplate.HEADER_TEMPLATE, recommendation.getImpact()));
        if (recommendation.getDatabase() != null) {
            script.append(String.format(IndexScriptTemplate.USE_DATABASE_TEMPLATE,
                    clean(recommendation.getDatabase())));
        }

        script.append(String.format(IndexScriptTemplate.CREATE_INDEX_TEMPLATE,
                indexName, schema, table,
                columnList(keyColumns, IndexScriptTemplate.KEY_COLUMN_TEMPLATE)));

        if (!recommendation.getIncludedColumns().isEmpty()) {
            List<String> included = recommendation.getIncludedColumns().stream()
                    .map(IndexScriptGenerator::clean)
                    .collect(Collectors.toList());
            script.append(String.format(IndexScriptTemplate.INCLUDE_TEMPLATE,
                    columnList(included, IndexScriptTemplate.INCLUDED_COLUMN_TEMPLATE)));
        }

        script.append(IndexScriptTemplate.INDEX_OPTIONS);
        script.append(String.format(IndexScriptTemplate.VERIFY_TEMPLATE,
                quoteLiteral(schema), quoteLiteral(table), quoteLiteral(indexName)));

        return script.toString();
    }

    public MissingIndexRecommendation withScript(MissingIndexRecommendation recommendation) {
        return recommendation.toBuilder()
                .ddlScript(generate(recommendation))
                .build();
    }

    public List<MissingIndexRecommendation> withScripts(List<MissingIndexRecommendation> recommendations) {
        return recommendations.stream()
                .map(this::withScript)
                .collect(Collectors.toList());
    }

    /**
     * {@code IX_<table>_<key columns joined by _>}, cut to the identifier limit.
     */
    String indexName(String table, List<String> keyColumns) {
        String name = "IX_" + table.replaceAll("[()]", "") + "_" + String.join("_", keyColumns);
        return name.length() > maxNameLength ? name.substring(0, maxNameLength) : name;
    }

    private static String columnList(List<String> columns, String template) {
        return columns.stream()
                .map(column -> String.format(template, column))
                .collect(Collectors.joining(",\n"));
    }

    private static String clean(String identifier) {
        return identifier.replaceAll("[\\[\\]]", "");
    }

    private static String quoteLiteral(String value) {
        return value.replace("'", "''");
    }
}
