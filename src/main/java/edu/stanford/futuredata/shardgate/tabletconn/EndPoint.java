package edu.stanford.futuredata.shardgate.tabletconn;

import java.util.Objects;

/** Where a tablet listens.  The summary string is how endpoints are stored in the topology. */
public final class EndPoint {

    public final int uid;
    public final String host;
    public final int port;

    public final String summaryString;

    public EndPoint(int uid, String host, int port) {
        this.uid = uid;
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.summaryString = String.format("%d\n%s\n%d", uid, host, port);
    }

    public EndPoint(String summaryString) {
        String[] values = summaryString.split("\n");
        if (values.length != 3) {
            throw new IllegalArgumentException(String.format("malformed endpoint summary %s", summaryString));
        }
        this.summaryString = summaryString;
        this.uid = Integer.parseInt(values[0]);
        this.host = values[1];
        this.port = Integer.parseInt(values[2]);
    }

    public String getAddress() {
        return String.format("%s:%d", host, port);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EndPoint)) {
            return false;
        }
        EndPoint other = (EndPoint) o;
        return uid == other.uid && port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, host, port);
    }

    @Override
    public String toString() {
        return String.format("%s (uid %d)", getAddress(), uid);
    }
}
