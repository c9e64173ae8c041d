package org.carball.planlens.model.postgres;

/**
 * Counters from a {@code Buffers:} line. Missing counters are zero.
 */
public record BufferStats(long sharedHit, long sharedRead, long sharedDirtied, long sharedWritten,
                          long tempRead, long tempWritten) {

    public long totalShared() {
        return sharedHit + sharedRead;
    }

    public boolean usesTemp() {
        return tempRead > 0 || tempWritten > 0;
    }
}
