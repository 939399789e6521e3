package com.clapgrow.inbox.api.service;

/**
 * Outcome of a message status update. None of these is an error for the caller:
 * duplicate and stale callbacks are expected from delivery platforms.
 */
public enum StatusUpdateResult {
    /** The status changed and its timestamp was stamped. */
    APPLIED,
    /** The message already had this status. */
    UNCHANGED,
    /** The change would move the status backwards or out of the lifecycle; ignored. */
    REJECTED
}
