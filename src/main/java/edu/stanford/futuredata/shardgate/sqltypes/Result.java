package edu.stanford.futuredata.shardgate.sqltypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A materialized query result, or one chunk of a streamed result.  Streams send the fields
 * in their first chunk only.
 */
public final class Result {

    public static final Result EMPTY = new Result(List.of(), 0, 0, List.of());

    private final List<Field> fields;
    private final long rowsAffected;
    private final long insertId;
    private final List<List<Value>> rows;

    public Result(List<Field> fields, long rowsAffected, long insertId, List<List<Value>> rows) {
        this.fields = List.copyOf(fields);
        this.rowsAffected = rowsAffected;
        this.insertId = insertId;
        List<List<Value>> copy = new ArrayList<>(rows.size());
        for (List<Value> row: rows) {
            copy.add(List.copyOf(row));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Result ofRows(List<Field> fields, List<List<Value>> rows) {
        return new Result(fields, rows.size(), 0, rows);
    }

    public static Result ofRowsAffected(long rowsAffected, long insertId) {
        return new Result(List.of(), rowsAffected, insertId, List.of());
    }

    public List<Field> getFields() {
        return fields;
    }

    public long getRowsAffected() {
        return rowsAffected;
    }

    public long getInsertId() {
        return insertId;
    }

    public List<List<Value>> getRows() {
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Result)) {
            return false;
        }
        Result other = (Result) o;
        return rowsAffected == other.rowsAffected && insertId == other.insertId
                && fields.equals(other.fields) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields, rowsAffected, insertId, rows);
    }

    @Override
    public String toString() {
        return String.format("Result{fields=%s, rowsAffected=%d, insertId=%d, rows=%s}",
                fields, rowsAffected, insertId, rows);
    }
}
