package edu.stanford.futuredata.shardgate.sqltypes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** SQL text and its named bind variables. */
public final class BoundQuery {
    private final String sql;
    private final Map<String, Value> bindVariables;

    public BoundQuery(String sql, Map<String, Value> bindVariables) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.bindVariables = Collections.unmodifiableMap(new LinkedHashMap<>(bindVariables));
    }

    public BoundQuery(String sql) {
        this(sql, Map.of());
    }

    /** Bind variables given as plain Java objects are converted with {@link Value#of}. */
    public static BoundQuery of(String sql, Map<String, ?> bindVariables) {
        Map<String, Value> converted = new LinkedHashMap<>();
        if (bindVariables != null) {
            bindVariables.forEach((k, v) -> converted.put(k, Value.of(v)));
        }
        return new BoundQuery(sql, converted);
    }

    public String getSql() {
        return sql;
    }

    public Map<String, Value> getBindVariables() {
        return bindVariables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundQuery)) {
            return false;
        }
        BoundQuery other = (BoundQuery) o;
        return sql.equals(other.sql) && bindVariables.equals(other.bindVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, bindVariables);
    }

    @Override
    public String toString() {
        return String.format("BoundQuery{sql=%s, bindVariables=%s}", sql, bindVariables);
    }
}
