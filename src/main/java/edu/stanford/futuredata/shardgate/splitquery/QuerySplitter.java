package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns boundary tuples into query parts.  Boundaries b1..bm give the parts
 * {@code cols < b1}, {@code b(i) <= cols < b(i+1)} and {@code cols >= bm}, comparing tuples
 * lexicographically, so the parts cover the table without gaps or overlap.  Each range is
 * ANDed onto the original where clause and bound through {@code _splitquery_start_<col>}
 * and {@code _splitquery_end_<col>}.
 */
final class QuerySplitter {

    static final String START_PREFIX = SplitParams.RESERVED_PREFIX + "start_";
    static final String END_PREFIX = SplitParams.RESERVED_PREFIX + "end_";

    private QuerySplitter() {}

    static List<QuerySplit> split(SplitParams params, List<List<Value>> boundaries) {
        int numParts = boundaries.size() + 1;
        long rowsPerPart = params.getRowCount() / numParts;
        List<QuerySplit> splits = new ArrayList<>(numParts);
        for (int i = 0; i < numParts; i++) {
            List<Value> start = i == 0 ? null : boundaries.get(i - 1);
            List<Value> end = i == numParts - 1 ? null : boundaries.get(i);
            splits.add(new QuerySplit(rewrite(params, start, end), rowsPerPart));
        }
        return splits;
    }

    // A null start or end leaves that side of the range open.
    private static BoundQuery rewrite(SplitParams params, List<Value> start, List<Value> end) {
        if (start == null && end == null) {
            return params.getQuery();
        }
        List<String> columns = params.getSplitColumns();
        Map<String, Value> bindVariables = new LinkedHashMap<>(params.getQuery().getBindVariables());
        List<String> conditions = new ArrayList<>();
        if (start != null) {
            conditions.add(greaterOrEqual(columns, start.size(), 0));
            for (int i = 0; i < start.size(); i++) {
                bindVariables.put(START_PREFIX + columns.get(i), start.get(i));
            }
        }
        if (end != null) {
            conditions.add(lessThan(columns, end.size(), 0));
            for (int i = 0; i < end.size(); i++) {
                bindVariables.put(END_PREFIX + columns.get(i), end.get(i));
            }
        }
        String range = String.join(" and ", conditions);
        StringBuilder sql = new StringBuilder()
                .append("select ").append(params.getSelectExpressions())
                .append(" from ").append(params.getTable())
                .append(" where ");
        if (params.getWhere() != null) {
            sql.append('(').append(params.getWhere()).append(") and ");
        }
        sql.append(range);
        return new BoundQuery(sql.toString(), bindVariables);
    }

    // (c_i, ..., c_n) >= (:start_i, ..., :start_n)
    private static String greaterOrEqual(List<String> columns, int width, int i) {
        String c = columns.get(i);
        String bind = ":" + START_PREFIX + c;
        if (i == width - 1) {
            return String.format("%s >= %s", c, bind);
        }
        return String.format("(%s > %s or (%s = %s and %s))", c, bind, c, bind, greaterOrEqual(columns, width, i + 1));
    }

    // (c_i, ..., c_n) < (:end_i, ..., :end_n)
    private static String lessThan(List<String> columns, int width, int i) {
        String c = columns.get(i);
        String bind = ":" + END_PREFIX + c;
        if (i == width - 1) {
            return String.format("%s < %s", c, bind);
        }
        return String.format("(%s < %s or (%s = %s and %s))", c, bind, c, bind, lessThan(columns, width, i + 1));
    }
}
