package edu.stanford.futuredata.shardgate.sqltypes;

import java.util.Objects;

/** One part of a split query and the approximate number of rows it covers. */
public final class QuerySplit {
    private final BoundQuery query;
    private final long rowCount;

    public QuerySplit(BoundQuery query, long rowCount) {
        this.query = Objects.requireNonNull(query, "query");
        this.rowCount = rowCount;
    }

    public BoundQuery getQuery() {
        return query;
    }

    public long getRowCount() {
        return rowCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QuerySplit)) {
            return false;
        }
        QuerySplit other = (QuerySplit) o;
        return rowCount == other.rowCount && query.equals(other.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, rowCount);
    }

    @Override
    public String toString() {
        return String.format("QuerySplit{query=%s, rowCount=%d}", query, rowCount);
    }
}
