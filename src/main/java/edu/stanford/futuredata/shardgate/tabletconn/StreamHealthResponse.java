package edu.stanford.futuredata.shardgate.tabletconn;

import java.util.Objects;

/** A health snapshot of one tablet. */
public final class StreamHealthResponse {

    private final Target target;
    private final boolean serving;
    private final long tabletExternallyReparentedTimestamp;
    private final RealtimeStats realtimeStats;

    public StreamHealthResponse(Target target, boolean serving, long tabletExternallyReparentedTimestamp,
                                RealtimeStats realtimeStats) {
        this.target = target;
        this.serving = serving;
        this.tabletExternallyReparentedTimestamp = tabletExternallyReparentedTimestamp;
        this.realtimeStats = Objects.requireNonNull(realtimeStats, "realtimeStats");
    }

    public Target getTarget() {
        return target;
    }

    public boolean isServing() {
        return serving;
    }

    public long getTabletExternallyReparentedTimestamp() {
        return tabletExternallyReparentedTimestamp;
    }

    public RealtimeStats getRealtimeStats() {
        return realtimeStats;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StreamHealthResponse)) {
            return false;
        }
        StreamHealthResponse other = (StreamHealthResponse) o;
        return serving == other.serving
                && tabletExternallyReparentedTimestamp == other.tabletExternallyReparentedTimestamp
                && Objects.equals(target, other.target) && realtimeStats.equals(other.realtimeStats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, serving, tabletExternallyReparentedTimestamp, realtimeStats);
    }

    @Override
    public String toString() {
        return String.format("StreamHealthResponse{target=%s, serving=%b, reparented=%d, stats=%s}",
                target, serving, tabletExternallyReparentedTimestamp, realtimeStats);
    }

    public static final class RealtimeStats {

        public static final RealtimeStats HEALTHY = new RealtimeStats("", 0, 0.0);

        // Empty when the tablet is healthy.
        private final String healthError;
        private final int secondsBehindMaster;
        private final double cpuUsage;

        public RealtimeStats(String healthError, int secondsBehindMaster, double cpuUsage) {
            this.healthError = healthError == null ? "" : healthError;
            this.secondsBehindMaster = secondsBehindMaster;
            this.cpuUsage = cpuUsage;
        }

        public String getHealthError() {
            return healthError;
        }

        public int getSecondsBehindMaster() {
            return secondsBehindMaster;
        }

        public double getCpuUsage() {
            return cpuUsage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RealtimeStats)) {
                return false;
            }
            RealtimeStats other = (RealtimeStats) o;
            return secondsBehindMaster == other.secondsBehindMaster
                    && Double.compare(cpuUsage, other.cpuUsage) == 0 && healthError.equals(other.healthError);
        }

        @Override
        public int hashCode() {
            return Objects.hash(healthError, secondsBehindMaster, cpuUsage);
        }

        @Override
        public String toString() {
            return String.format("{healthError=%s, secondsBehindMaster=%d, cpuUsage=%.2f}",
                    healthError, secondsBehindMaster, cpuUsage);
        }
    }
}
