package com.eyelevel.lotprocessor.model;

/**
 * Defines the lifecycle states of a single {@link BatchLot}.
 */
public enum LotStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    /**
     * The lot produced no usable description: it had no images, no result line, or an unreadable envelope.
     */
    FAILED
}
