package edu.stanford.futuredata.shardgate.tabletconn;

/** The role a tablet plays in its shard. */
public enum TabletType {
    UNKNOWN(0),
    MASTER(1),
    REPLICA(2),
    RDONLY(3),
    SPARE(4),
    EXPERIMENTAL(5),
    BACKUP(6),
    RESTORE(7),
    WORKER(8);

    private final int number;

    TabletType(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    // Unknown numbers decode to UNKNOWN.
    public static TabletType forNumber(int number) {
        for (TabletType t: values()) {
            if (t.number == number) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
