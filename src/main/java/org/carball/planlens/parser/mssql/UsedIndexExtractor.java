package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.UsedIndex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.flag;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.stripBrackets;

/**
 * Indexes the plan touches. The first two strategies accumulate; the last two
 * only run when nothing has been found so far. Results are deduplicated by name.
 */
public final class UsedIndexExtractor {

    private record Strategy(String name, boolean fallbackOnly, Function<String, List<UsedIndex>> finder) {
    }

    private static final Pattern OBJECT_TAG = Pattern.compile("<Object\\b[^>]*>");
    private static final Pattern INDEX_SCAN = Pattern.compile("<IndexScan\\b([^>]*)>(.*?)</IndexScan>", Pattern.DOTALL);
    private static final Pattern SEEK_PREDICATES = Pattern.compile("<SeekPredicates>(.*?)</SeekPredicates>", Pattern.DOTALL);
    private static final Pattern COLUMN_REFERENCE = Pattern.compile("<ColumnReference\\b[^>]*>");
    private static final Pattern CLUSTERED_SCAN = Pattern.compile("PhysicalOp=\"Clustered Index Scan\"");

    private static final List<Strategy> STRATEGIES = List.of(
            new Strategy("object-index-kind", false, UsedIndexExtractor::fromObjectTags),
            new Strategy("index-scan-block", false, UsedIndexExtractor::fromIndexScans),
            new Strategy("seek-predicates", true, UsedIndexExtractor::fromSeekPredicates),
            new Strategy("clustered-scan", true, UsedIndexExtractor::fromClusteredScan));

    private UsedIndexExtractor() {
        // Utility class - prevent instantiation
    }

    public static List<UsedIndex> extract(String xml) {
        Map<String, UsedIndex> found = new LinkedHashMap<>();
        for (Strategy strategy : STRATEGIES) {
            if (strategy.fallbackOnly() && !found.isEmpty()) {
                continue;
            }
            for (UsedIndex index : strategy.finder().apply(xml)) {
                found.putIfAbsent(index.name(), index);
            }
        }
        return new ArrayList<>(found.values());
    }

    private static List<UsedIndex> fromObjectTags(String xml) {
        List<UsedIndex> indexes = new ArrayList<>();
        Matcher tag = OBJECT_TAG.matcher(xml);
        while (tag.find()) {
            String index = attribute(tag.group(), "Index");
            String kind = attribute(tag.group(), "IndexKind");
            if (index != null && kind != null) {
                indexes.add(new UsedIndex(stripBrackets(index), kind));
            }
        }
        return indexes;
    }

    private static List<UsedIndex> fromIndexScans(String xml) {
        List<UsedIndex> indexes = new ArrayList<>();
        Matcher scan = INDEX_SCAN.matcher(xml);
        while (scan.find()) {
            Matcher tag = OBJECT_TAG.matcher(scan.group(2));
            if (!tag.find()) {
                continue;
            }
            String index = attribute(tag.group(), "Index");
            if (index == null) {
                continue;
            }
            String kind = attribute(tag.group(), "IndexKind");
            if (kind == null) {
                kind = Boolean.TRUE.equals(flag(scan.group(1), "Lookup")) ? "Lookup" : "NonClustered";
            }
            indexes.add(new UsedIndex(stripBrackets(index), kind));
        }
        return indexes;
    }

    private static List<UsedIndex> fromSeekPredicates(String xml) {
        List<UsedIndex> indexes = new ArrayList<>();
        Matcher seek = SEEK_PREDICATES.matcher(xml);
        while (seek.find()) {
            Matcher reference = COLUMN_REFERENCE.matcher(seek.group(1));
            if (reference.find()) {
                String table = attribute(reference.group(), "Table");
                if (table != null) {
                    indexes.add(new UsedIndex(stripBrackets(table) + " (Implicit)", "Unknown"));
                }
            }
        }
        return indexes;
    }

    private static List<UsedIndex> fromClusteredScan(String xml) {
        if (!CLUSTERED_SCAN.matcher(xml).find()) {
            return List.of();
        }
        Matcher tag = OBJECT_TAG.matcher(xml);
        if (!tag.find()) {
            return List.of();
        }
        String index = attribute(tag.group(), "Index");
        String table = attribute(tag.group(), "Table");
        if (index != null) {
            return List.of(new UsedIndex(stripBrackets(index), "Clustered"));
        }
        return table != null ? List.of(new UsedIndex("PK_" + stripBrackets(table), "Clustered")) : List.of();
    }
}
