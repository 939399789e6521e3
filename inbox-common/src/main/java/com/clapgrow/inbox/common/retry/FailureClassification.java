package com.clapgrow.inbox.common.retry;

/**
 * How a processing failure affects retry bookkeeping.
 *
 * <ul>
 *   <li>PERMANENT: the input itself is bad (unknown platform, invalid envelope). Retrying cannot help.</li>
 *   <li>TRANSIENT: timeouts, broker or database hiccups. Retried until the retry budget runs out.</li>
 * </ul>
 */
public enum FailureClassification {
    PERMANENT,
    TRANSIENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
