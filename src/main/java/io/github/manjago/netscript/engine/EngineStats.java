package io.github.manjago.netscript.engine;

/**
 * Snapshot of engine statistics.
 */
public record EngineStats(
    long started,
    long rejected,
    long finished,
    long killed,
    long crashed,
    long failedToStart,
    int live,
    int peakLive
) {

    public long exited() {
        return finished + killed + crashed + failedToStart;
    }

    @Override
    public String toString() {
        return String.format("""
            === Engine Statistics ===
            Started:          %,d
            Rejected:         %,d
            Exited:           %,d
              Finished:       %,d
              Killed:         %,d
              Crashed:        %,d
              Failed to start: %,d
            Live:             %,d (peak %,d)
            """,
            started, rejected, exited(), finished, killed, crashed, failedToStart, live, peakLive);
    }
}
