package com.pgbroker.core;

import java.util.List;

public record PolicyPage(List<Policy> policies, long total, int limit, int offset) {

    public boolean hasMore() {
        return offset + policies.size() < total;
    }
}
