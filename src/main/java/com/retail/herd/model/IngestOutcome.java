package com.retail.herd.model;

/**
 * What happened to a validated event handed to the engine.
 */
public enum IngestOutcome {
    ACCEPTED,
    // Event time falls in a bucket the key has already sealed.
    LATE,
    // Event time lies further past the wall clock than the configured skew.
    FUTURE,
    // Owning shard's queue stayed full for the whole enqueue timeout.
    OVERLOADED,
    SHUTTING_DOWN
}
