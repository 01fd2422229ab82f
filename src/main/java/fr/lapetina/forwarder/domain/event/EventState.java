package fr.lapetina.forwarder.domain.event;

/**
 * Lifecycle state of a batch event in the Disruptor pipeline.
 */
public enum EventState {
    /** Event just published, awaiting validation */
    CREATED,

    /** Event validated successfully */
    VALIDATED,

    /** Validation failed; the batch is dropped */
    VALIDATION_FAILED,

    /** Batch handed to the workers cache for every destination */
    DISPATCHED
}
