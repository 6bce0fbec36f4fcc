package com.relationship.scoring.health;

/**
 * A single component check.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
