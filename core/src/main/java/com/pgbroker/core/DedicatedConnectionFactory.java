package com.pgbroker.core;

@FunctionalInterface
public interface DedicatedConnectionFactory {
    DedicatedConnection acquire();
}
