package com.pgbroker.core;

@FunctionalInterface
public interface TransactionWork<T> {
    T apply(QueryExecutor tx);
}
