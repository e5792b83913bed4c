package io.relay4j;

import java.time.Instant;

/**
 * Pure "next fire time" function of a periodic definition.
 *
 * @see io.relay4j.utils.Triggers
 */
@FunctionalInterface
public interface TriggerRule {

    /**
     * @return the first fire time strictly after {@code previous}
     */
    Instant nextFireAfter(Instant previous);
}
