package org.carball.planlens.model;

/**
 * Payload shapes told apart by content sniffing once the envelope is removed.
 */
public enum PayloadKind {
    SQL_SERVER_PLAN,
    POSTGRES_EXPLAIN,
    MONGO_EXPLAIN,
    DEADLOCK_XML,
    COMPRESSED_DEADLOCK,
    UNKNOWN
}
