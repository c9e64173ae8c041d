package org.carball.planlens.model.deadlock;

import lombok.Builder;
import lombok.Value;

/**
 * A {@code process} entry of a deadlock report.
 */
@Value
@Builder
public class DeadlockParticipant {
    String processId;
    String sessionId;
    String status;
    String waitResource;
    long waitTimeMs;
    String lockMode;
    String transactionName;
    String isolationLevel;
    String hostName;
    String loginName;
    String clientApp;
    String database;
    String inputQuery;
    boolean victim;
}
