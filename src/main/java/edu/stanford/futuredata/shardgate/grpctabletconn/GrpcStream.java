package edu.stanford.futuredata.shardgate.grpctabletconn;

import edu.stanford.futuredata.shardgate.HealthSnapshotMessage;
import edu.stanford.futuredata.shardgate.StreamExecuteResponse;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.ResultStream;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthReader;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletStream;
import io.grpc.Context;
import io.grpc.StatusRuntimeException;

import java.util.Iterator;
import java.util.Optional;

/**
 * A server stream read through gRPC's blocking iterator.  The call runs under its own
 * cancellable context, so closing the stream cancels the call.
 */
abstract class GrpcStream<M, T> implements TabletStream<T> {

    private final Context.CancellableContext callContext;
    private final Iterator<M> responses;
    private volatile boolean closed = false;
    private boolean ended = false;
    private TabletConnException failure = null;

    GrpcStream(Context.CancellableContext callContext, Iterator<M> responses) {
        this.callContext = callContext;
        this.responses = responses;
    }

    abstract T convert(M message);

    @Override
    public Optional<T> recv() throws TabletConnException {
        if (failure != null) {
            throw failure;
        }
        if (ended || closed) {
            return Optional.empty();
        }
        // Messages the iterator already holds are not handed out once the call is cancelled.
        if (callContext.isCancelled()) {
            failure = new OperationalException(OperationalException.Kind.CANCELLED,
                    "stream context cancelled", callContext.cancellationCause());
            throw failure;
        }
        try {
            if (!responses.hasNext()) {
                ended = true;
                callContext.cancel(null);
                return Optional.empty();
            }
            return Optional.of(convert(responses.next()));
        } catch (StatusRuntimeException e) {
            if (closed) {
                return Optional.empty();
            }
            failure = GrpcErrors.fromStatusException(e);
            throw failure;
        } catch (IllegalArgumentException e) {
            failure = new OperationalException(OperationalException.Kind.NETWORK,
                    String.format("undecodable stream message: %s", e.getMessage()), e);
            callContext.cancel(e);
            throw failure;
        }
    }

    @Override
    public void close() {
        closed = true;
        callContext.cancel(null);
    }

    static final class Results extends GrpcStream<StreamExecuteResponse, Result> implements ResultStream {
        Results(Context.CancellableContext callContext, Iterator<StreamExecuteResponse> responses) {
            super(callContext, responses);
        }

        @Override
        Result convert(StreamExecuteResponse message) {
            return ProtoConverter.fromProto(message.getResult());
        }
    }

    static final class Health extends GrpcStream<HealthSnapshotMessage, StreamHealthResponse>
            implements StreamHealthReader {
        Health(Context.CancellableContext callContext, Iterator<HealthSnapshotMessage> responses) {
            super(callContext, responses);
        }

        @Override
        StreamHealthResponse convert(HealthSnapshotMessage message) {
            return ProtoConverter.fromProto(message);
        }
    }
}
