package com.pgbroker.core;

public enum PolicyMode {
    PERMISSIVE,
    RESTRICTIVE
}
