package org.carball.planlens.parser.mssql;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.merge.Merge;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import org.carball.planlens.model.mssql.StatementSummary;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags plans that look like a sample or a plan for some other statement:
 * placeholder table names, or a statement type that disagrees with the query
 * the caller expected.
 */
@Slf4j
public class GenericPlanDetector {

    private static final Pattern PLACEHOLDER_TABLE = Pattern.compile(
            "\\bTable=\"\\[?(TableName|YourTable|SampleTable|MyTable|Table1)\\]?\"", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_KEYWORD = Pattern.compile("^\\s*(\\w+)");
    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]+)\\]");

    public Optional<String> detect(String xml, StatementSummary summary, String expectedQuery) {
        Matcher placeholder = PLACEHOLDER_TABLE.matcher(xml);
        if (placeholder.find()) {
            return Optional.of("Plan references placeholder table [" + placeholder.group(1)
                    + "]; it is likely a generic example rather than the plan of this query");
        }

        if (expectedQuery == null || expectedQuery.isBlank() || summary.getStatementType() == null) {
            return Optional.empty();
        }

        String expectedType = statementType(expectedQuery);
        if (expectedType == null || summary.getStatementType().startsWith(expectedType)) {
            return Optional.empty();
        }

        return Optional.of("Plan statement type " + summary.getStatementType()
                + " does not match the expected " + expectedType + " query");
    }

    /**
     * Statement type of a SQL text, using JSqlParser and falling back to the first keyword.
     */
    static String statementType(String sql) {
        // JSqlParser does not accept T-SQL bracket quoting
        String processed = BRACKETED.matcher(sql).replaceAll("$1");
        try {
            Statement statement = CCJSqlParserUtil.parse(processed);
            if (statement instanceof Select) {
                return "SELECT";
            } else if (statement instanceof Insert) {
                return "INSERT";
            } else if (statement instanceof Update) {
                return "UPDATE";
            } else if (statement instanceof Delete) {
                return "DELETE";
            } else if (statement instanceof Merge) {
                return "MERGE";
            }
        } catch (JSQLParserException e) {
            log.debug("Could not parse expected query, using first keyword: {}", e.getMessage());
        }

        Matcher keyword = FIRST_KEYWORD.matcher(sql);
        return keyword.find() ? keyword.group(1).toUpperCase(Locale.ROOT) : null;
    }
}
