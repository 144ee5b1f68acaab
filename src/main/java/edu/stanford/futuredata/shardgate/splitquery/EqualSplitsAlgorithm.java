package edu.stanford.futuredata.shardgate.splitquery;

import edu.stanford.futuredata.shardgate.sqltypes.Value;
import edu.stanford.futuredata.shardgate.tabletconn.ServerException;
import edu.stanford.futuredata.shardgate.tabletserver.QueryEngine;
import org.javatuples.Pair;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cuts the [min, max] range of the first split column into splitCount intervals of equal
 * width.  Only the first split column is used.  A range narrower than splitCount yields
 * fewer parts, since equal boundaries are merged, and never more parts than the range has keys.
 */
class EqualSplitsAlgorithm implements SplitAlgorithm {

    private final QueryEngine engine;

    EqualSplitsAlgorithm(QueryEngine engine) {
        this.engine = engine;
    }

    @Override
    public List<List<Value>> generateBoundaries(SplitParams params) throws ServerException {
        String column = params.getSplitColumns().get(0);
        Optional<Pair<Value, Value>> minMax = engine.minMax(params.getTable(), column);
        if (minMax.isEmpty()) {
            return List.of();
        }
        Value minValue = minMax.get().getValue0();
        Value maxValue = minMax.get().getValue1();
        if (minValue.isNull() || maxValue.isNull()) {
            return List.of();
        }
        if (!minValue.isIntegral() || !maxValue.isIntegral()) {
            throw SplitParams.badInput("EQUAL_SPLITS needs an integral first split column; %s is %s",
                    column, minValue.getType());
        }
        BigInteger min = minValue.toBigInteger();
        BigInteger max = maxValue.toBigInteger();
        BigInteger width = max.subtract(min);
        BigInteger count = BigInteger.valueOf(params.getSplitCount());
        List<List<Value>> boundaries = new ArrayList<>();
        if (count.compareTo(width) > 0) {
            // Steps narrower than one key: every key in [min, max) is a boundary.
            for (BigInteger b = min; b.compareTo(max) < 0; b = b.add(BigInteger.ONE)) {
                boundaries.add(List.of(boundary(minValue, b)));
            }
            return boundaries;
        }
        BigInteger previous = null;
        for (long k = 1; k < params.getSplitCount(); k++) {
            BigInteger b = min.add(width.multiply(BigInteger.valueOf(k)).divide(count));
            if (b.equals(previous)) {
                continue;
            }
            previous = b;
            boundaries.add(List.of(boundary(minValue, b)));
        }
        return boundaries;
    }

    private static Value boundary(Value like, BigInteger b) {
        return Value.make(like.getType(), b.toString().getBytes(StandardCharsets.US_ASCII));
    }
}
