package io.relay4j.core;

import io.relay4j.JobFactory;
import io.relay4j.TriggerRule;

import java.util.Objects;

/**
 * Named recurring job template.
 */
public record PeriodicDefinition(
        String name,
        TriggerRule trigger,
        JobFactory factory
) {
    public PeriodicDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(factory, "factory must not be null");
    }
}
