package edu.stanford.futuredata.shardgate.grpctabletconn;

import edu.stanford.futuredata.shardgate.tabletconn.ErrorCode;
import edu.stanford.futuredata.shardgate.tabletconn.OperationalException;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletconn.TabletConnException;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * Carries tablet error codes across gRPC.  The server maps each code to the closest status
 * and also sends the exact code in a trailer; the client prefers the trailer.
 */
public final class GrpcErrors {

    public static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of("tablet-error-code", Metadata.ASCII_STRING_MARSHALLER);

    private GrpcErrors() {}

    public static Status.Code toStatusCode(ErrorCode code) {
        switch (code) {
            case SUCCESS:
                return Status.Code.OK;
            case CANCELLED:
                return Status.Code.CANCELLED;
            case BAD_INPUT:
                return Status.Code.INVALID_ARGUMENT;
            case DEADLINE_EXCEEDED:
                return Status.Code.DEADLINE_EXCEEDED;
            case INTEGRITY_ERROR:
                return Status.Code.ALREADY_EXISTS;
            case PERMISSION_DENIED:
                return Status.Code.PERMISSION_DENIED;
            case RESOURCE_EXHAUSTED:
                return Status.Code.RESOURCE_EXHAUSTED;
            case QUERY_NOT_SERVED:
                return Status.Code.FAILED_PRECONDITION;
            case NOT_IN_TX:
                return Status.Code.ABORTED;
            case INTERNAL_ERROR:
                return Status.Code.INTERNAL;
            case TRANSIENT_ERROR:
                return Status.Code.UNAVAILABLE;
            case UNAUTHENTICATED:
                return Status.Code.UNAUTHENTICATED;
            default:
                return Status.Code.UNKNOWN;
        }
    }

    /** Server side: the status to fail a call with. */
    public static StatusRuntimeException toStatusException(ServerException e) {
        Metadata trailers = new Metadata();
        trailers.put(ERROR_CODE_KEY, Integer.toString(e.getCode().getNumber()));
        return Status.fromCode(toStatusCode(e.getCode()))
                .withDescription(e.getServerMessage())
                .asRuntimeException(trailers);
    }

    /** Client side: the exception a failed call raises. */
    public static TabletConnException fromStatusException(StatusRuntimeException e) {
        Status status = e.getStatus();
        Metadata trailers = e.getTrailers();
        String code = trailers == null ? null : trailers.get(ERROR_CODE_KEY);
        String message = status.getDescription() == null ? status.getCode().name() : status.getDescription();
        if (code != null) {
            try {
                return new ServerException(ErrorCode.forNumber(Integer.parseInt(code)), message, e);
            } catch (NumberFormatException ignored) {
                return new ServerException(ErrorCode.UNKNOWN_ERROR, message, e);
            }
        }
        switch (status.getCode()) {
            case CANCELLED:
            case DEADLINE_EXCEEDED:
                return new OperationalException(OperationalException.Kind.CANCELLED, message, e);
            default:
                return new OperationalException(OperationalException.Kind.NETWORK, message, e);
        }
    }
}
