package org.carball.planlens.parser.mssql;

import org.carball.planlens.model.mssql.MissingIndexRecommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.carball.planlens.parser.mssql.ShowPlanAttributes.attribute;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.number;
import static org.carball.planlens.parser.mssql.ShowPlanAttributes.stripBrackets;

/**
 * Reads {@code MissingIndexGroup} blocks into recommendations. One group can
 * hold several indexes, all sharing the group's impact.
 */
public final class MissingIndexExtractor {

    private static final Pattern GROUP = Pattern.compile(
            "<MissingIndexGroup\\b([^>]*)>(.*?)</MissingIndexGroup>", Pattern.DOTALL);
    private static final Pattern INDEX = Pattern.compile(
            "<MissingIndex\\b([^>]*)>(.*?)</MissingIndex>", Pattern.DOTALL);
    private static final Pattern COLUMN_GROUP = Pattern.compile(
            "<ColumnGroup\\b([^>]*)>(.*?)</ColumnGroup>", Pattern.DOTALL);
    private static final Pattern COLUMN = Pattern.compile(
            "<Column\\b[^>]*?\\bName=\"\\[?([^\\]\"]+)\\]?\"");

    private MissingIndexExtractor() {
        // Utility class - prevent instantiation
    }

    public static List<MissingIndexRecommendation> extract(String xml) {
        List<MissingIndexRecommendation> recommendations = new ArrayList<>();

        Matcher group = GROUP.matcher(xml);
        while (group.find()) {
            Double impact = number(group.group(1), "Impact");

            Matcher index = INDEX.matcher(group.group(2));
            while (index.find()) {
                recommendations.add(toRecommendation(index.group(1), index.group(2),
                        impact != null ? impact : 0.0));
            }
        }
        return recommendations;
    }

    private static MissingIndexRecommendation toRecommendation(String attributes, String body, double impact) {
        List<String> equality = new ArrayList<>();
        List<String> inequality = new ArrayList<>();
        List<String> include = new ArrayList<>();

        Matcher columnGroup = COLUMN_GROUP.matcher(body);
        while (columnGroup.find()) {
            String usage = attribute(columnGroup.group(1), "Usage");
            List<String> target;
            if ("EQUALITY".equalsIgnoreCase(usage)) {
                target = equality;
            } else if ("INEQUALITY".equalsIgnoreCase(usage)) {
                target = inequality;
            } else if ("INCLUDE".equalsIgnoreCase(usage)) {
                target = include;
            } else {
                continue;
            }

            Matcher column = COLUMN.matcher(columnGroup.group(2));
            while (column.find()) {
                target.add(column.group(1));
            }
        }

        return MissingIndexRecommendation.builder()
                .database(stripBrackets(attribute(attributes, "Database")))
                .schema(stripBrackets(attribute(attributes, "Schema")))
                .table(stripBrackets(attribute(attributes, "Table")))
                .impact(impact)
                .equalityColumns(List.copyOf(equality))
                .inequalityColumns(List.copyOf(inequality))
                .includedColumns(List.copyOf(include))
                .build();
    }
}
