package com.clapgrow.inbox.api.normalizer;

import java.time.Duration;

/**
 * Extraction did not finish within the configured budget. Retryable.
 */
public class NormalizationTimeoutException extends RuntimeException {

    public NormalizationTimeoutException(String platform, Duration timeout) {
        super("Extracting " + platform + " payload timed out after " + timeout.toMillis() + " ms");
    }
}
