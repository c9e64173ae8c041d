package org.carball.planlens.model.postgres;

/**
 * One entry of the flat timing list: planning, execution or a trigger.
 * {@code percentage} is relative to the sum of all timings in the same plan.
 */
public record QueryTiming(String name, double timeMs, double percentage, Integer calls) {}
