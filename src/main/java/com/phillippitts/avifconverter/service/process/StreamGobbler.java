package com.phillippitts.avifconverter.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Drains one process stream into memory up to a cap.
 *
 * <p>Once the cap is hit the gobbler keeps reading without accumulating, so the child never
 * blocks on a full pipe, and logs a warning once.
 */
final class StreamGobbler implements Runnable {

    private static final Logger LOG = LogManager.getLogger(StreamGobbler.class);

    private final InputStream inputStream;
    private final StringBuilder sink = new StringBuilder();
    private final String name;
    private final int maxBytes;

    StreamGobbler(InputStream inputStream, String name, int maxBytes) {
        this.inputStream = inputStream;
        this.name = name;
        this.maxBytes = maxBytes;
    }

    /**
     * Starts a daemon thread running this gobbler.
     */
    Thread start() {
        Thread thread = new Thread(this, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            boolean capReached = false;
            while ((line = br.readLine()) != null) {
                synchronized (sink) {
                    if (sink.length() >= maxBytes) {
                        if (!capReached) {
                            LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                            capReached = true;
                        }
                        continue;
                    }
                    if (sink.length() > 0) {
                        sink.append('\n');
                    }
                    int available = maxBytes - sink.length();
                    if (line.length() > available) {
                        sink.append(line, 0, Math.max(0, available));
                        LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                        capReached = true;
                    } else {
                        sink.append(line);
                    }
                }
            }
        } catch (IOException e) {
            LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
        }
    }

    /**
     * Captured content so far.
     */
    String content() {
        synchronized (sink) {
            return sink.toString();
        }
    }
}
