package com.pgbroker.api.tools;

import java.util.Map;

public interface Tool {
    String name();

    String description();

    /**
     * Runs the tool. Never throws; failures come back as an unsuccessful result.
     */
    ToolResult call(Map<String, Object> params);
}
