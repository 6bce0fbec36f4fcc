package com.relationship.scoring.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component or of the engine as a whole.
 * {@code Status} constants are ordered from best to worst.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    /**
     * Returns true if this status is worse than {@code other}.
     */
    public boolean isWorseThan(HealthStatus other) {
        return status.compareTo(other.status) > 0;
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
