package com.pgbroker.core;

public record PolicyFilter(String namePattern, int limit, int offset, boolean includeDefinition) {

    public PolicyFilter {
        if (limit < 1) {
            throw BrokerException.validation("limit must be positive");
        }
        if (offset < 0) {
            throw BrokerException.validation("offset must not be negative");
        }
    }

    public static PolicyFilter all() {
        return new PolicyFilter(null, 50, 0, true);
    }

    public boolean hasPattern() {
        return namePattern != null && !namePattern.isBlank();
    }
}
