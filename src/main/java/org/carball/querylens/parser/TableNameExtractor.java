package org.carball.querylens.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.parser.ParseException;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.update.Update;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the primary table a statement reads from or writes to.
 */
@Slf4j
public class TableNameExtractor {

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "(?:FROM|JOIN|UPDATE|INTO)\\s+[`\"\\[]?(?:[A-Za-z_][A-Za-z0-9_]*[`\"\\]]?\\.[`\"\\[]?)?([A-Za-z_][A-Za-z0-9_]*)",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern QUOTES = Pattern.compile("[`\"\\[\\]]");

    /**
     * Parses the statement with JSqlParser and falls back to a regex scan when the
     * dialect is not understood.
     */
    public Optional<String> primaryTable(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.empty();
        }

        try {
            Statement statement = CCJSqlParserUtil.newParser(sql).Statement();
            Table table = tableOf(statement);
            if (table != null) {
                return Optional.of(unquote(table.getName()));
            }
        } catch (ParseException | RuntimeException e) {
            log.debug("Could not parse statement, falling back to pattern scan: {}", e.getMessage());
        }

        return scan(sql);
    }

    private static Table tableOf(Statement statement) {
        if (statement instanceof PlainSelect select && select.getFromItem() instanceof Table table) {
            return table;
        }
        if (statement instanceof Update update) {
            return update.getTable();
        }
        if (statement instanceof Delete delete) {
            return delete.getTable();
        }
        if (statement instanceof Insert insert) {
            return insert.getTable();
        }
        return null;
    }

    static Optional<String> scan(String sql) {
        Matcher matcher = TABLE_PATTERN.matcher(sql);
        if (matcher.find()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static String unquote(String name) {
        return QUOTES.matcher(name).replaceAll("");
    }
}
