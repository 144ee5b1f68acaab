package edu.stanford.futuredata.shardgate.tabletconn;

public enum SplitQueryAlgorithm {
    // Divide the integral range of the first split column into equal intervals.
    EQUAL_SPLITS(0),
    // Walk the split columns in order and cut every numRowsPerQueryPart rows.
    FULL_SCAN(1);

    private final int number;

    SplitQueryAlgorithm(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public static SplitQueryAlgorithm forNumber(int number) {
        for (SplitQueryAlgorithm a: values()) {
            if (a.number == number) {
                return a;
            }
        }
        throw new IllegalArgumentException(String.format("unknown split query algorithm %d", number));
    }
}
