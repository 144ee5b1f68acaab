package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletserver.QueryEngine;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A validated split request: the parts of the query the splitter rewrites, the split columns,
 * and both sizing parameters with the unspecified one derived from the table's row count.
 */
public final class SplitParams {

    public static final String RESERVED_PREFIX = "_splitquery_";

    private static final Pattern SIMPLE_SELECT = Pattern.compile(
            "^\\s*select\\s+(.+?)\\s+from\\s+(\\w+)(?:\\s+where\\s+(.+?))?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern UNSUPPORTED = Pattern.compile(
            "\\b(group\\s+by|having|order\\s+by|limit|join|union|distinct)\\b",
            Pattern.CASE_INSENSITIVE);

    private final BoundQuery query;
    private final String selectExpressions;
    private final String table;
    // Null if the query has no where clause.
    private final String where;
    private final List<String> splitColumns;
    private final long splitCount;
    private final long numRowsPerQueryPart;
    private final long rowCount;

    private SplitParams(BoundQuery query, String selectExpressions, String table, String where,
                        List<String> splitColumns, long splitCount, long numRowsPerQueryPart, long rowCount) {
        this.query = query;
        this.selectExpressions = selectExpressions;
        this.table = table;
        this.where = where;
        this.splitColumns = List.copyOf(splitColumns);
        this.splitCount = splitCount;
        this.numRowsPerQueryPart = numRowsPerQueryPart;
        this.rowCount = rowCount;
    }

    /** @throws ServerException BAD_INPUT if the request cannot be split */
    public static SplitParams create(QueryEngine engine, BoundQuery query, List<String> splitColumns,
                                     long splitCount, long numRowsPerQueryPart) throws ServerException {
        String sql = query.getSql();
        if (UNSUPPORTED.matcher(sql).find()) {
            throw badInput("unsupported query: %s", sql);
        }
        Matcher m = SIMPLE_SELECT.matcher(sql);
        if (!m.matches()) {
            throw badInput("not a simple select from a single table: %s", sql);
        }
        for (String name: query.getBindVariables().keySet()) {
            if (name.toLowerCase(Locale.ROOT).startsWith(RESERVED_PREFIX)) {
                throw badInput("bind variable %s uses the reserved prefix %s", name, RESERVED_PREFIX);
            }
        }
        if ((splitCount > 0) == (numRowsPerQueryPart > 0)) {
            throw badInput("exactly one of splitCount (%d) and numRowsPerQueryPart (%d) must be positive",
                    splitCount, numRowsPerQueryPart);
        }
        String table = m.group(2);
        List<String> primaryKey = engine.primaryKeyColumns(table);
        if (primaryKey.isEmpty()) {
            throw badInput("table %s has no primary key", table);
        }
        List<String> columns = splitColumns.isEmpty() ? primaryKey : splitColumns;
        if (columns.size() > primaryKey.size() || !primaryKey.subList(0, columns.size()).equals(columns)) {
            throw badInput("split columns %s must be a prefix of the primary key %s of %s", columns, primaryKey, table);
        }
        long rowCount = engine.rowCount(table);
        if (splitCount > 0) {
            numRowsPerQueryPart = Math.max(1, ceilDiv(rowCount, splitCount));
        } else {
            splitCount = Math.max(1, ceilDiv(rowCount, numRowsPerQueryPart));
        }
        return new SplitParams(query, m.group(1), table, m.group(3), columns, splitCount, numRowsPerQueryPart,
                rowCount);
    }

    private static long ceilDiv(long a, long b) {
        return (a + b - 1) / b;
    }

    static ServerException badInput(String format, Object... args) {
        return new ServerException(ErrorCode.BAD_INPUT, String.format(format, args));
    }

    public BoundQuery getQuery() {
        return query;
    }

    public String getSelectExpressions() {
        return selectExpressions;
    }

    public String getTable() {
        return table;
    }

    public String getWhere() {
        return where;
    }

    public List<String> getSplitColumns() {
        return splitColumns;
    }

    public long getSplitCount() {
        return splitCount;
    }

    public long getNumRowsPerQueryPart() {
        return numRowsPerQueryPart;
    }

    public long getRowCount() {
        return rowCount;
    }
}
