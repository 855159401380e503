package com.purchasingpower.toolagent.agent;

/**
 * Acknowledgement returned by a cancel call.
 *
 * @since 1.0.0
 */
public enum CancelOutcome {
    /**
     * The request was still queued and has been removed.
     */
    CANCELLED,

    /**
     * The request is executing; it is flagged and will report as cancelled when it finishes.
     */
    CANCELLATION_REQUESTED,

    /**
     * No queued or executing request has this id.
     */
    NOT_FOUND
}
