package edu.stanford.futuredata.shardgate.tabletconn;

/** Periodic health snapshots of one tablet. */
public interface StreamHealthReader extends TabletStream<StreamHealthResponse> {
}
