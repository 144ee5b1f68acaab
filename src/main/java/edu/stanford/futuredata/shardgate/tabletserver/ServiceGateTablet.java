package edu.stanford.futuredata.shardgate.tabletserver;

import edu.stanford.futuredata.shardgate.*;
import edu.stanford.futuredata.shardgate.grpctabletconn.GrpcErrors;
import edu.stanford.futuredata.shardgate.grpctabletconn.ProtoConverter;
import edu.stanford.futuredata.shardgate.sqltypes.QuerySplit;
import edu.stanford.futuredata.shardgate.sqltypes.Result;
import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.SplitQueryAlgorithm;
import edu.stanford.futuredata.shardgate.tabletconn.StreamHealthResponse;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

class ServiceGateTablet extends GateTabletGrpc.GateTabletImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ServiceGateTablet.class);
    private static final long FLOW_CONTROL_WAIT_MILLIS = 1;

    private final TabletService tabletService;

    ServiceGateTablet(TabletService tabletService) {
        this.tabletService = tabletService;
    }

    @Override
    public void execute(ExecuteMessage m, StreamObserver<ExecuteResponse> responseObserver) {
        unary(responseObserver, () -> {
            Result r = tabletService.execute(ProtoConverter.fromProto(m.getTarget()),
                    ProtoConverter.fromProto(m.getQuery()), m.getTransactionId());
            return ExecuteResponse.newBuilder().setResult(ProtoConverter.toProto(r)).build();
        });
    }

    @Override
    public void executeBatch(ExecuteBatchMessage m, StreamObserver<ExecuteBatchResponse> responseObserver) {
        unary(responseObserver, () -> {
            List<Result> results = tabletService.executeBatch(ProtoConverter.fromProto(m.getTarget()),
                    ProtoConverter.queriesFromProto(m.getQueriesList()), m.getAsTransaction(), m.getTransactionId());
            return ExecuteBatchResponse.newBuilder().addAllResults(ProtoConverter.resultsToProto(results)).build();
        });
    }

    @Override
    public void streamExecute(StreamExecuteMessage m, StreamObserver<StreamExecuteResponse> responseObserver) {
        ServerCallStreamObserver<StreamExecuteResponse> observer =
                (ServerCallStreamObserver<StreamExecuteResponse>) responseObserver;
        try {
            tabletService.streamExecute(ProtoConverter.fromProto(m.getTarget()), ProtoConverter.fromProto(m.getQuery()),
                    chunk -> {
                        awaitReady(observer);
                        observer.onNext(StreamExecuteResponse.newBuilder().setResult(ProtoConverter.toProto(chunk)).build());
                    });
            observer.onCompleted();
        } catch (ServerException e) {
            if (observer.isCancelled()) {
                logger.debug("Stream cancelled by client: {}", e.getMessage());
                return;
            }
            observer.onError(GrpcErrors.toStatusException(e));
        } catch (IllegalArgumentException e) {
            observer.onError(GrpcErrors.toStatusException(new ServerException(ErrorCode.BAD_INPUT, e.getMessage(), e)));
        }
    }

    @Override
    public void begin(BeginMessage m, StreamObserver<BeginResponse> responseObserver) {
        unary(responseObserver, () -> {
            long transactionId = tabletService.begin(ProtoConverter.fromProto(m.getTarget()));
            return BeginResponse.newBuilder().setTransactionId(transactionId).build();
        });
    }

    @Override
    public void commit(CommitMessage m, StreamObserver<CommitResponse> responseObserver) {
        unary(responseObserver, () -> {
            tabletService.commit(ProtoConverter.fromProto(m.getTarget()), m.getTransactionId());
            return CommitResponse.newBuilder().build();
        });
    }

    @Override
    public void rollback(RollbackMessage m, StreamObserver<RollbackResponse> responseObserver) {
        unary(responseObserver, () -> {
            tabletService.rollback(ProtoConverter.fromProto(m.getTarget()), m.getTransactionId());
            return RollbackResponse.newBuilder().build();
        });
    }

    // Errors travel in the response so that a transaction id can travel with them.
    @Override
    public void beginExecute(BeginExecuteMessage m, StreamObserver<BeginExecuteResponse> responseObserver) {
        unary(responseObserver, () -> {
            try {
                Pair<Result, Long> r = tabletService.beginExecute(ProtoConverter.fromProto(m.getTarget()),
                        ProtoConverter.fromProto(m.getQuery()));
                return BeginExecuteResponse.newBuilder()
                        .setResult(ProtoConverter.toProto(r.getValue0()))
                        .setTransactionId(r.getValue1())
                        .build();
            } catch (ServerException e) {
                return BeginExecuteResponse.newBuilder()
                        .setError(ProtoConverter.toProto(e))
                        .setTransactionId(e.getTransactionId())
                        .build();
            }
        });
    }

    @Override
    public void beginExecuteBatch(BeginExecuteBatchMessage m, StreamObserver<BeginExecuteBatchResponse> responseObserver) {
        unary(responseObserver, () -> {
            try {
                Pair<List<Result>, Long> r = tabletService.beginExecuteBatch(ProtoConverter.fromProto(m.getTarget()),
                        ProtoConverter.queriesFromProto(m.getQueriesList()), m.getAsTransaction());
                return BeginExecuteBatchResponse.newBuilder()
                        .addAllResults(ProtoConverter.resultsToProto(r.getValue0()))
                        .setTransactionId(r.getValue1())
                        .build();
            } catch (ServerException e) {
                return BeginExecuteBatchResponse.newBuilder()
                        .setError(ProtoConverter.toProto(e))
                        .setTransactionId(e.getTransactionId())
                        .build();
            }
        });
    }

    @Override
    public void splitQuery(SplitQueryMessage m, StreamObserver<SplitQueryResponse> responseObserver) {
        unary(responseObserver, () -> {
            List<QuerySplit> splits = tabletService.splitQuery(ProtoConverter.fromProto(m.getTarget()),
                    ProtoConverter.fromProto(m.getQuery()), m.getSplitColumnsList(), m.getSplitCount(),
                    m.getNumRowsPerQueryPart(), SplitQueryAlgorithm.forNumber(m.getAlgorithm()));
            SplitQueryResponse.Builder b = SplitQueryResponse.newBuilder();
            for (QuerySplit s: splits) {
                b.addQueries(ProtoConverter.toProto(s));
            }
            return b.build();
        });
    }

    @Override
    public void streamHealth(StreamHealthMessage m, StreamObserver<HealthSnapshotMessage> responseObserver) {
        ServerCallStreamObserver<HealthSnapshotMessage> observer =
                (ServerCallStreamObserver<HealthSnapshotMessage>) responseObserver;
        AtomicLong subscriptionId = new AtomicLong(0);
        observer.setOnCancelHandler(() -> tabletService.unsubscribeHealth(subscriptionId.get()));
        subscriptionId.set(tabletService.subscribeHealth(snapshot -> sendHealth(observer, snapshot)));
        // The subscription may have been cancelled before its id was known.
        if (observer.isCancelled()) {
            tabletService.unsubscribeHealth(subscriptionId.get());
        }
    }

    /* PRIVATE FUNCTIONS */

    private interface Handler<T> {
        T handle() throws ServerException;
    }

    private static <T> void unary(StreamObserver<T> responseObserver, Handler<T> handler) {
        T response;
        try {
            response = handler.handle();
        } catch (ServerException e) {
            responseObserver.onError(GrpcErrors.toStatusException(e));
            return;
        } catch (IllegalArgumentException e) {
            // Undecodable request.
            responseObserver.onError(GrpcErrors.toStatusException(new ServerException(ErrorCode.BAD_INPUT, e.getMessage(), e)));
            return;
        }
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static void awaitReady(ServerCallStreamObserver<?> observer) throws ServerException {
        while (!observer.isReady()) {
            if (observer.isCancelled()) {
                throw new ServerException(ErrorCode.CANCELLED, "stream cancelled by client");
            }
            try {
                Thread.sleep(FLOW_CONTROL_WAIT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ServerException(ErrorCode.CANCELLED, "interrupted while streaming", e);
            }
        }
        if (observer.isCancelled()) {
            throw new ServerException(ErrorCode.CANCELLED, "stream cancelled by client");
        }
    }

    // Called from the handler thread and the health daemon.
    private static void sendHealth(ServerCallStreamObserver<HealthSnapshotMessage> observer,
                                   StreamHealthResponse snapshot) throws ServerException {
        synchronized (observer) {
            if (observer.isCancelled()) {
                throw new ServerException(ErrorCode.CANCELLED, "health stream cancelled by client");
            }
            observer.onNext(ProtoConverter.toProto(snapshot));
        }
    }
}
