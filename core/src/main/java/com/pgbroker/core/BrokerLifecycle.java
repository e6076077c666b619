package com.pgbroker.core;

public interface BrokerLifecycle {
    BrokerStatus status();

    /**
     * Provisions every missing broker object in one transaction. Safe to repeat.
     */
    LifecycleResult enable(BrokerOptions options);

    /**
     * Drops the broker schema and extension in one transaction. A broker that is
     * already disabled is left alone.
     */
    LifecycleResult disable();
}
