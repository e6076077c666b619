package com.pgbroker.core;

/**
 * Outcome of enabling or disabling the broker: the recomputed status and a short
 * human readable message.
 */
public record LifecycleResult(BrokerStatus status, String message) {
}
