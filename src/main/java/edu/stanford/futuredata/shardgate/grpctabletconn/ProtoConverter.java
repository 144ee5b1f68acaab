package edu.stanford.futuredata.shardgate.grpctabletconn;

import com.google.protobuf.ByteString;
import edu.stanford.futuredata.shardgate.BoundQueryMessage;
import edu.stanford.futuredata.shardgate.FieldMessage;
import edu.stanford.futuredata.shardgate.HealthSnapshotMessage;
import edu.stanford.futuredata.shardgate.QueryResultMessage;
import edu.stanford.futuredata.shardgate.QuerySplitMessage;
import edu.stanford.futuredata.shardgate.QueryValue;
import edu.stanford.futuredata.shardgate.RPCErrorMessage;
import edu.stanford.futuredata.shardgate.RealtimeStatsMessage;
import edu.stanford.futuredata.shardgate.RowMessage;
import edu.stanford.futuredata.shardgate.TabletTarget;
import edu.stanford.futuredata.shardgate.sqltypes.BoundQuery;
import edu.stanford.futuredata.shardgate.sqltypes.Field;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.sqltypes.Type;
import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletconn.TabletType;
import edu.stanford.futuredata.shardgate.tabletconn.Target;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between the query types and their protobuf messages.  Absent messages decode
 * to defaults; an unknown type number fails with IllegalArgumentException.
 */
public final class ProtoConverter {

    private ProtoConverter() {}

    public static QueryValue toProto(Value v) {
        if (v.isNull()) {
            return QueryValue.newBuilder().setType(Type.NULL_TYPE.getNumber()).build();
        }
        return QueryValue.newBuilder().setType(v.getType().getNumber()).setValue(ByteString.copyFrom(v.raw())).build();
    }

    public static Value fromProto(QueryValue m) {
        return Value.make(Type.forNumber(m.getType()), m.getValue().toByteArray());
    }

    public static BoundQueryMessage toProto(BoundQuery q) {
        BoundQueryMessage.Builder b = BoundQueryMessage.newBuilder().setSql(q.getSql());
        q.getBindVariables().forEach((k, v) -> b.putBindVariables(k, toProto(v)));
        return b.build();
    }

    public static BoundQuery fromProto(BoundQueryMessage m) {
        Map<String, Value> bindVariables = new LinkedHashMap<>();
        m.getBindVariablesMap().forEach((k, v) -> bindVariables.put(k, fromProto(v)));
        return new BoundQuery(m.getSql(), bindVariables);
    }

    public static List<BoundQueryMessage> queriesToProto(List<BoundQuery> queries) {
        List<BoundQueryMessage> out = new ArrayList<>(queries.size());
        for (BoundQuery q: queries) {
            out.add(toProto(q));
        }
        return out;
    }

    public static List<BoundQuery> queriesFromProto(List<BoundQueryMessage> messages) {
        List<BoundQuery> out = new ArrayList<>(messages.size());
        for (BoundQueryMessage m: messages) {
            out.add(fromProto(m));
        }
        return out;
    }

    public static QueryResultMessage toProto(Result r) {
        QueryResultMessage.Builder b = QueryResultMessage.newBuilder()
                .setRowsAffected(r.getRowsAffected())
                .setInsertId(r.getInsertId());
        for (Field f: r.getFields()) {
            b.addFields(FieldMessage.newBuilder().setName(f.getName()).setType(f.getType().getNumber()));
        }
        for (List<Value> row: r.getRows()) {
            RowMessage.Builder rb = RowMessage.newBuilder();
            for (Value v: row) {
                rb.addValues(toProto(v));
            }
            b.addRows(rb);
        }
        return b.build();
    }

    public static Result fromProto(QueryResultMessage m) {
        List<Field> fields = new ArrayList<>(m.getFieldsCount());
        for (FieldMessage f: m.getFieldsList()) {
            fields.add(new Field(f.getName(), Type.forNumber(f.getType())));
        }
        List<List<Value>> rows = new ArrayList<>(m.getRowsCount());
        for (RowMessage r: m.getRowsList()) {
            List<Value> row = new ArrayList<>(r.getValuesCount());
            for (QueryValue v: r.getValuesList()) {
                row.add(fromProto(v));
            }
            rows.add(row);
        }
        return new Result(fields, m.getRowsAffected(), m.getInsertId(), rows);
    }

    public static List<QueryResultMessage> resultsToProto(List<Result> results) {
        List<QueryResultMessage> out = new ArrayList<>(results.size());
        for (Result r: results) {
            out.add(toProto(r));
        }
        return out;
    }

    public static List<Result> resultsFromProto(List<QueryResultMessage> messages) {
        List<Result> out = new ArrayList<>(messages.size());
        for (QueryResultMessage m: messages) {
            out.add(fromProto(m));
        }
        return out;
    }

    public static TabletTarget toProto(Target t) {
        return TabletTarget.newBuilder()
                .setKeyspace(t.getKeyspace())
                .setShard(t.getShard())
                .setTabletType(t.getTabletType().getNumber())
                .build();
    }

    public static Target fromProto(TabletTarget m) {
        return new Target(m.getKeyspace(), m.getShard(), TabletType.forNumber(m.getTabletType()));
    }

    public static QuerySplitMessage toProto(QuerySplit s) {
        return QuerySplitMessage.newBuilder().setQuery(toProto(s.getQuery())).setRowCount(s.getRowCount()).build();
    }

    public static QuerySplit fromProto(QuerySplitMessage m) {
        return new QuerySplit(fromProto(m.getQuery()), m.getRowCount());
    }

    public static HealthSnapshotMessage toProto(StreamHealthResponse h) {
        StreamHealthResponse.RealtimeStats stats = h.getRealtimeStats();
        HealthSnapshotMessage.Builder b = HealthSnapshotMessage.newBuilder()
                .setServing(h.isServing())
                .setTabletExternallyReparentedTimestamp(h.getTabletExternallyReparentedTimestamp())
                .setRealtimeStats(RealtimeStatsMessage.newBuilder()
                        .setHealthError(stats.getHealthError())
                        .setSecondsBehindMaster(stats.getSecondsBehindMaster())
                        .setCpuUsage(stats.getCpuUsage()));
        if (h.getTarget() != null) {
            b.setTarget(toProto(h.getTarget()));
        }
        return b.build();
    }

    public static StreamHealthResponse fromProto(HealthSnapshotMessage m) {
        RealtimeStatsMessage s = m.getRealtimeStats();
        return new StreamHealthResponse(
                m.hasTarget() ? fromProto(m.getTarget()) : null,
                m.getServing(),
                m.getTabletExternallyReparentedTimestamp(),
                new StreamHealthResponse.RealtimeStats(s.getHealthError(), s.getSecondsBehindMaster(), s.getCpuUsage()));
    }

    public static RPCErrorMessage toProto(ServerException e) {
        return RPCErrorMessage.newBuilder().setCode(e.getCode().getNumber()).setMessage(e.getServerMessage()).build();
    }

    public static ServerException fromProto(RPCErrorMessage m, long transactionId) {
        return new ServerException(ErrorCode.forNumber(m.getCode()), m.getMessage(), transactionId);
    }
}
