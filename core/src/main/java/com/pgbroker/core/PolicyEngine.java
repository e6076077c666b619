package com.pgbroker.core;

import java.util.Optional;

/**
 * Row level security policies on the message log.
 */
public interface PolicyEngine {
    PolicyPage list(PolicyFilter filter);

    Policy create(PolicySpec spec);

    Policy update(String name, PolicyPatch patch);

    /**
     * @return the dropped policy, or empty when it was absent and {@code ifExists} is set
     */
    Optional<Policy> delete(String name, boolean ifExists);
}
