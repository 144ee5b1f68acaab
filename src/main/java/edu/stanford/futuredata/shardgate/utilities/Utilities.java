package edu.stanford.futuredata.shardgate.utilities;

import io.grpc.Context;
import org.javatuples.Pair;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

public class Utilities {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    // Fires context deadlines.
    private static final ScheduledExecutorService deadlineScheduler =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "context-deadlines");
                t.setDaemon(true);
                return t;
            });

    /** A child of parent that is cancelled once timeout elapses.  Cancel it when done. */
    public static Context.CancellableContext withTimeout(Context parent, Duration timeout) {
        return parent.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS, deadlineScheduler);
    }

    public static Pair<String, Integer> parseConnectString(String connectString) {
        int colon = connectString.lastIndexOf(':');
        if (colon <= 0 || colon == connectString.length() - 1) {
            throw new IllegalArgumentException(String.format("malformed host:port %s", connectString));
        }
        String host = connectString.substring(0, colon);
        Integer port = Integer.parseInt(connectString.substring(colon + 1));
        return new Pair<>(host, port);
    }

    public static String toHex(byte[] b) {
        char[] out = new char[b.length * 2];
        for (int i = 0; i < b.length; i++) {
            out[2 * i] = HEX_DIGITS[(b[i] >> 4) & 0xf];
            out[2 * i + 1] = HEX_DIGITS[b[i] & 0xf];
        }
        return new String(out);
    }

    public static byte[] fromHex(String s) {
        if (s.length() % 2 != 0) {
            throw new IllegalArgumentException(String.format("odd length hex string %s", s));
        }
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException(String.format("invalid hex string %s", s));
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
