package org.carball.planlens.model.postgres;

/**
 * {@code actual time=start..end} in milliseconds, per loop.
 */
public record TimeRange(double start, double end) {}
