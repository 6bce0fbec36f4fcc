package com.relationship.scoring.health;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.Locale;

/**
 * JVM heap utilization. DEGRADED from 80% and DOWN from 95% by default.
 */
public class MemoryHealthCheck implements HealthCheck {

    private static final long MB = 1024L * 1024L;

    private final double degradedThreshold;
    private final double downThreshold;

    public MemoryHealthCheck() {
        this(0.80, 0.95);
    }

    public MemoryHealthCheck(double degradedThreshold, double downThreshold) {
        if (degradedThreshold <= 0 || downThreshold > 1.0 || degradedThreshold >= downThreshold) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 < degraded < down <= 1");
        }
        this.degradedThreshold = degradedThreshold;
        this.downThreshold = downThreshold;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public HealthStatus check() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long used = heap.getUsed();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double usage = max > 0 ? (double) used / max : 0.0;
        String percent = String.format(Locale.ROOT, "%.1f%%", usage * 100);

        HealthStatus base;
        if (usage >= downThreshold) {
            base = HealthStatus.down("Heap usage critical: " + percent);
        } else if (usage >= degradedThreshold) {
            base = HealthStatus.degraded("Heap usage high: " + percent);
        } else {
            base = HealthStatus.up();
        }
        return base
                .withDetail("heapUsedMB", used / MB)
                .withDetail("heapMaxMB", max / MB)
                .withDetail("heapUsagePercent", Math.round(usage * 1000.0) / 10.0);
    }
}
