package com.phillippitts.avifconverter.service.process;

import com.phillippitts.avifconverter.service.instrumentation.ResourceInstrumentation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Samples the resident size of a running stage on a fixed interval and keeps the maximum.
 *
 * <p>Runs on its own daemon thread while the caller blocks in {@link Process#waitFor()}.
 * The sampler stops on its own once the child is no longer alive, or when {@link #stop(long)}
 * is called; in both cases it is joined by the caller.
 *
 * <p>With a known pid only the child's own resident size counts. A reading that fails (child
 * not yet visible, already exited or reaped) is skipped, so a stage too short to be observed
 * reports 0. The JVM's resident size is used only when the platform gives no pid at all.
 */
final class MemorySampler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(MemorySampler.class);

    private final Process process;
    private final ResourceInstrumentation instrumentation;
    private final long intervalMs;
    private final long pid;
    private final AtomicLong peak = new AtomicLong();
    private volatile boolean stopped;
    private Thread thread;

    MemorySampler(Process process, ResourceInstrumentation instrumentation, long intervalMs) {
        this.process = process;
        this.instrumentation = instrumentation;
        this.intervalMs = intervalMs;
        this.pid = pidOf(process);
    }

    /**
     * Starts sampling on a daemon thread.
     */
    MemorySampler start(String name) {
        thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return this;
    }

    @Override
    public void run() {
        try {
            do {
                sample();
                if (stopped || !process.isAlive()) {
                    break;
                }
                Thread.sleep(intervalMs);
            } while (!stopped && process.isAlive());
        } catch (InterruptedException e) {
            // stop() interrupts the sleep; nothing left to do
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.warn("Memory sampler stopped early: {}", e.toString());
        }
    }

    private void sample() {
        long resident;
        if (pid > 0) {
            OptionalLong child = instrumentation.residentBytes(pid);
            if (child.isEmpty()) {
                return;
            }
            resident = child.getAsLong();
        } else {
            resident = instrumentation.currentResidentBytes();
        }
        peak.accumulateAndGet(resident, Math::max);
    }

    /**
     * Signals the sampler to stop and waits for it up to the given timeout.
     *
     * @param joinTimeoutMs maximum time to wait for the sampler thread
     */
    void stop(long joinTimeoutMs) {
        stopped = true;
        Thread t = this.thread;
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(joinTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    long peakBytes() {
        return peak.get();
    }

    private static long pidOf(Process process) {
        try {
            return process.pid();
        } catch (UnsupportedOperationException e) {
            return -1;
        }
    }
}
