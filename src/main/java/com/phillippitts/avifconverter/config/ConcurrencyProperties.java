package com.phillippitts.avifconverter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Bounds the number of conversions the HTTP layer lets through at once.
 *
 * <p>The orchestrator itself never throttles. This cap lives in front of it so that bursts of
 * uploads wait for a permit instead of spawning an unbounded number of codec processes.
 *
 * <p>Properties:
 * <ul>
 *   <li>converter.concurrency.max-concurrent - Maximum in-flight conversions (default: 2)</li>
 *   <li>converter.concurrency.acquire-timeout-ms - Permit wait before rejecting (default: 30000)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "converter.concurrency")
@Validated
public class ConcurrencyProperties {

    /** Maximum conversions running at the same time. */
    @Positive(message = "Max concurrent conversions must be positive")
    private int maxConcurrent = 2;

    /**
     * Timeout in milliseconds to wait for a permit before rejecting the request.
     */
    @Positive(message = "Acquire timeout must be positive")
    private int acquireTimeoutMs = 30000;

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(int acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }
}
