package com.ai.tutor.pool;

/** What a refill attempt did. */
public enum RefillOutcome {
    /** One new exercise was queued. */
    ADDED,
    /** The queue was already at capacity; nothing generated. */
    POOL_FULL,
    /** Another producer holds the refill right for this key. */
    BUSY,
    /** The topic has no retrievable context to generate from. */
    NO_CONTEXT,
    /** Every attempt produced an exercise already queued or already completed. */
    DUPLICATES,
    /** An exercise was generated but the cache store refused the updated queue. */
    NOT_STORED,
    UNKNOWN_TOPIC
}
