package org.carball.planlens.model.mongo;

/**
 * Per-stage counters from {@code executionStats.executionStages} or {@code allPlansExecution}.
 */
public record MongoStageExecution(long nReturned, long executionTimeMillisEstimate, long works,
                                  long advanced, long docsExamined, long keysExamined) {}
