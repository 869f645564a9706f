package com.phillippitts.avifconverter.service.instrumentation;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.MemorySnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link ResourceInstrumentation} backed by Linux procfs and cgroup files, with JMX fallbacks
 * for hosts that have neither (macOS developer machines).
 *
 * <p>Sources:
 * <ul>
 *   <li>process resident/virtual: {@code /proc/<pid>/status} (VmRSS, VmSize)</li>
 *   <li>system total/available: {@code /proc/meminfo} (MemTotal, MemAvailable)</li>
 *   <li>memory ceiling: cgroup v2 {@code memory.max}, then cgroup v1
 *       {@code memory/memory.limit_in_bytes}</li>
 * </ul>
 *
 * <p>Every read is a fresh file read; nothing is cached, so concurrent callers never share
 * mutable state.
 */
@Component
public class ProcfsResourceInstrumentation implements ResourceInstrumentation {

    private static final Logger LOG = LogManager.getLogger(ProcfsResourceInstrumentation.class);

    private static final long KIB = 1024L;
    private static final long MIB = 1024L * 1024L;

    /** cgroup v1 reports "unlimited" as a page-aligned value close to Long.MAX_VALUE. */
    private static final long UNLIMITED_THRESHOLD = 1L << 60;

    private final Path procRoot;
    private final Path cgroupRoot;
    private final long lowMemoryThresholdBytes;

    @Autowired
    public ProcfsResourceInstrumentation(ConverterProperties properties) {
        this(Path.of("/proc"), Path.of("/sys/fs/cgroup"), properties.lowMemoryThresholdMb());
    }

    ProcfsResourceInstrumentation(Path procRoot, Path cgroupRoot, long lowMemoryThresholdMb) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
        this.cgroupRoot = Objects.requireNonNull(cgroupRoot, "cgroupRoot");
        if (lowMemoryThresholdMb <= 0) {
            throw new IllegalArgumentException("lowMemoryThresholdMb must be positive");
        }
        this.lowMemoryThresholdBytes = lowMemoryThresholdMb * MIB;
    }

    @Override
    public MemorySnapshot snapshot() {
        Path selfStatus = procRoot.resolve("self").resolve("status");
        long resident = readKibField(selfStatus, "VmRSS:").orElseGet(ProcfsResourceInstrumentation::jvmCommittedBytes);
        long virtual = readKibField(selfStatus, "VmSize:").orElse(resident);

        Path meminfo = procRoot.resolve("meminfo");
        OptionalLong total = readKibField(meminfo, "MemTotal:");
        OptionalLong available = readKibField(meminfo, "MemAvailable:");
        long systemTotal = total.isPresent() ? total.getAsLong() : jmxTotalBytes();
        long systemAvailable = available.isPresent() ? available.getAsLong() : jmxFreeBytes();

        return new MemorySnapshot(resident, virtual, systemTotal, systemAvailable, memoryLimit(), Instant.now());
    }

    @Override
    public long currentResidentBytes() {
        return readKibField(procRoot.resolve("self").resolve("status"), "VmRSS:")
                .orElseGet(ProcfsResourceInstrumentation::jvmCommittedBytes);
    }

    @Override
    public OptionalLong residentBytes(long pid) {
        return readKibField(procRoot.resolve(Long.toString(pid)).resolve("status"), "VmRSS:");
    }

    @Override
    public boolean isLowMemory(MemorySnapshot snapshot) {
        return snapshot.systemAvailableBytes() > 0
                && snapshot.systemAvailableBytes() < lowMemoryThresholdBytes;
    }

    long lowMemoryThresholdBytes() {
        return lowMemoryThresholdBytes;
    }

    /**
     * Process memory ceiling from cgroups, or -1 when none is set or readable.
     */
    long memoryLimit() {
        OptionalLong v2 = readSingleValue(cgroupRoot.resolve("memory.max"));
        if (v2.isPresent()) {
            return v2.getAsLong();
        }
        OptionalLong v1 = readSingleValue(cgroupRoot.resolve("memory").resolve("memory.limit_in_bytes"));
        return v1.isPresent() ? v1.getAsLong() : -1L;
    }

    /**
     * Reads a "Key:   1234 kB" line from a procfs file and returns the value in bytes.
     */
    private static OptionalLong readKibField(Path file, String key) {
        List<String> lines = readLines(file);
        for (String line : lines) {
            if (!line.startsWith(key)) {
                continue;
            }
            String[] parts = line.substring(key.length()).trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                return OptionalLong.empty();
            }
            try {
                long value = Long.parseLong(parts[0]);
                boolean kib = parts.length < 2 || "kB".equalsIgnoreCase(parts[1]);
                return OptionalLong.of(kib ? value * KIB : value);
            } catch (NumberFormatException e) {
                LOG.debug("Unparseable {} line in {}: {}", key, file, line);
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    /**
     * Reads a cgroup file holding a single number or "max".
     */
    private static OptionalLong readSingleValue(Path file) {
        List<String> lines = readLines(file);
        if (lines.isEmpty()) {
            return OptionalLong.empty();
        }
        String value = lines.get(0).trim();
        if (value.isEmpty() || "max".equals(value)) {
            return OptionalLong.empty();
        }
        try {
            long parsed = Long.parseLong(value);
            return parsed >= UNLIMITED_THRESHOLD ? OptionalLong.empty() : OptionalLong.of(parsed);
        } catch (NumberFormatException e) {
            LOG.debug("Unparseable cgroup value in {}: {}", file, value);
            return OptionalLong.empty();
        }
    }

    private static List<String> readLines(Path file) {
        if (!Files.isReadable(file)) {
            return List.of();
        }
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // Process exited between the readability check and the read
            LOG.trace("Cannot read {}: {}", file, e.toString());
            return List.of();
        }
    }

    private static long jvmCommittedBytes() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        return memory.getHeapMemoryUsage().getCommitted() + memory.getNonHeapMemoryUsage().getCommitted();
    }

    private static long jmxTotalBytes() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getTotalMemorySize();
        }
        return Runtime.getRuntime().maxMemory();
    }

    private static long jmxFreeBytes() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getFreeMemorySize();
        }
        return Runtime.getRuntime().freeMemory();
    }
}
