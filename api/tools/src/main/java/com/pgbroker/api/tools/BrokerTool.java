package com.pgbroker.api.tools;

import com.pgbroker.core.BrokerException;
import com.pgbroker.core.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Base for tools backed by broker services. Turns every exception into a
 * structured error result.
 */
public abstract class BrokerTool implements Tool {
    private static final Logger logger = LoggerFactory.getLogger(BrokerTool.class);

    private final String name;
    private final String description;

    protected BrokerTool(String name, String description) {
        this.name = name;
        this.description = description;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public final ToolResult call(Map<String, Object> params) {
        try {
            return handle(new Params(params));
        } catch (BrokerException e) {
            if (e.kind() == ErrorKind.TRANSACTION || e.kind() == ErrorKind.BACKEND) {
                logger.error("Failed to run {}", name, e);
            } else {
                logger.warn("{} rejected: {}", name, e.getMessage());
            }
            return ToolResult.error(e.kind(), e.getMessage());
        } catch (Exception e) {
            logger.error("Failed to run {}", name, e);
            return ToolResult.error(ErrorKind.BACKEND, "Failed to run " + name + ": " + e.getMessage());
        }
    }

    protected abstract ToolResult handle(Params params);
}
