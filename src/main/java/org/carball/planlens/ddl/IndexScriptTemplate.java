package org.carball.planlens.ddl;

public final class IndexScriptTemplate {

    private IndexScriptTemplate() {
    }

    public static final String NO_KEY_COLUMNS =
            "-- Unable to generate index script: No key columns specified";

    public static final String NO_TABLE =
            "-- Unable to generate index script: Table name missing from plan";

    public static final String HEADER_TEMPLATE = """
        -- Missing Index Script (Impact: %.1f%%)
        -- Generated from execution plan analysis
        """;

    public static final String USE_DATABASE_TEMPLATE = """
        USE [%s];
        GO

        """;

    public static final String CREATE_INDEX_TEMPLATE = """
        CREATE NONCLUSTERED INDEX [%s]
        ON [%s].[%s] (
        %s
        )""";

    public static final String INCLUDE_TEMPLATE = """

        INCLUDE (
        %s
        )""";

    public static final String INDEX_OPTIONS = """

        WITH (
            PAD_INDEX = OFF,
            STATISTICS_NORECOMPUTE = OFF,
            SORT_IN_TEMPDB = OFF,
            DROP_EXISTING = OFF,
            ONLINE = OFF,
            ALLOW_ROW_LOCKS = ON,
            ALLOW_PAGE_LOCKS = ON
        );
        GO

        """;

    public static final String VERIFY_TEMPLATE = """
        -- Verify index creation
        SELECT
            i.name AS IndexName,
            i.type_desc AS IndexType,
            STUFF((
                SELECT ', ' + c.name
                FROM sys.index_columns ic
                INNER JOIN sys.columns c ON ic.object_id = c.object_id AND ic.column_id = c.column_id
                WHERE ic.object_id = i.object_id AND ic.index_id = i.index_id AND ic.is_included_column = 0
                ORDER BY ic.key_ordinal
                FOR XML PATH('')
            ), 1, 2, '') AS KeyColumns,
            STUFF((
                SELECT ', ' + c.name
                FROM sys.index_columns ic
                INNER JOIN sys.columns c ON ic.object_id = c.object_id AND ic.column_id = c.column_id
                WHERE ic.object_id = i.object_id AND ic.index_id = i.index_id AND ic.is_included_column = 1
                ORDER BY ic.key_ordinal
                FOR XML PATH('')
            ), 1, 2, '') AS IncludedColumns
        FROM sys.indexes i
        INNER JOIN sys.objects o ON i.object_id = o.object_id
        INNER JOIN sys.schemas s ON o.schema_id = s.schema_id
        WHERE s.name = '%s' AND o.name = '%s' AND i.name = '%s';
        """;

    public static final String KEY_COLUMN_TEMPLATE = "    [%s] ASC";

    public static final String INCLUDED_COLUMN_TEMPLATE = "    [%s]";
}
