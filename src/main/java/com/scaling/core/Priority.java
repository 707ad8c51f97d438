package com.scaling.core;

import com.scaling.exception.ConfigurationException;

import java.util.Locale;

/**
 * Processing priority. Declaration order is drain order: lower ordinal is served first.
 */
public enum Priority {

    /** Real-time requests. */
    CRITICAL,
    /** Updates and derived calculations. */
    HIGH,
    /** Health checks and metric refreshes. */
    NORMAL,
    /** Background cleanup and analytics. */
    LOW;

    /**
     * Parse a priority name, case-insensitive.
     *
     * @throws ConfigurationException if the name is not a known priority
     */
    public static Priority parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Priority name cannot be empty");
        }
        try {
            return Priority.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown priority: " + name, e);
        }
    }

    public String laneName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
