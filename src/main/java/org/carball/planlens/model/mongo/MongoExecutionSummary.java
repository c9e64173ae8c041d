package org.carball.planlens.model.mongo;

public record MongoExecutionSummary(boolean executionSuccess, long nReturned, long executionTimeMillis,
                                    long totalKeysExamined, long totalDocsExamined) {

    public static MongoExecutionSummary empty() {
        return new MongoExecutionSummary(false, 0, 0, 0, 0);
    }
}
