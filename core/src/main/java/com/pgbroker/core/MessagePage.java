package com.pgbroker.core;

import java.util.List;

public record MessagePage(
        List<Message> messages,
        long totalCount,
        int limit,
        int offset
) {
    public boolean hasMore() {
        return offset + messages.size() < totalCount;
    }
}
