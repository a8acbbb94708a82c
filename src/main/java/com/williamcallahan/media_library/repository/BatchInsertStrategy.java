package com.williamcallahan.media_library.repository;

/**
 * Execution plans for {@link EntityRepository#insertAll}. All of them store exactly the same
 * rows with the same values; they only trade latency against round trips and lock time.
 */
public enum BatchInsertStrategy {

    /** One insert and one commit per entity. */
    SEQUENTIAL,

    /** Statements sent as JDBC batches, committed once. */
    GROUPED,

    /** Single-row inserts inside one transaction, committed once. */
    TRANSACTIONAL
}
