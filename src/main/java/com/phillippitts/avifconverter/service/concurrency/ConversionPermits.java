package com.phillippitts.avifconverter.service.concurrency;

import com.phillippitts.avifconverter.config.ConcurrencyProperties;
import com.phillippitts.avifconverter.exception.ConverterBusyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds how many conversions run at once, with a bounded wait for a permit.
 *
 * <p>Callers pair {@link #acquire()} with {@link #release()} in a finally block:
 * <pre>{@code
 * permits.acquire();
 * try {
 *     orchestrator.convert(request);
 * } finally {
 *     permits.release();
 * }
 * }</pre>
 *
 * <p>Thread-safe; the {@link Semaphore} is fair so long waits are served in arrival order.
 */
@Component
public class ConversionPermits {

    private static final Logger LOG = LogManager.getLogger(ConversionPermits.class);

    private final Semaphore semaphore;
    private final long timeoutMs;

    @Autowired
    public ConversionPermits(ConcurrencyProperties properties) {
        this(properties.getMaxConcurrent(), properties.getAcquireTimeoutMs());
    }

    public ConversionPermits(int maxConcurrent, long timeoutMs) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        this.semaphore = new Semaphore(maxConcurrent, true);
        this.timeoutMs = timeoutMs;
    }

    /**
     * Waits up to the configured timeout for a permit.
     *
     * @throws ConverterBusyException if no permit frees up in time, or the wait is interrupted
     */
    public void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.warn("Conversion capacity exhausted after {}ms wait", timeoutMs);
                throw new ConverterBusyException(timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConverterBusyException("Interrupted while waiting for a conversion permit", e);
        }
    }

    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
