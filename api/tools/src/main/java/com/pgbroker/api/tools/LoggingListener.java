package com.pgbroker.api.tools;

import com.pgbroker.core.RealtimeEvent;
import com.pgbroker.core.RealtimeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener for subscriptions made through tools, which have no caller to
 * push events to.
 */
public class LoggingListener implements RealtimeListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingListener.class);

    @Override
    public void onEvent(RealtimeEvent event) {
        logger.info("Realtime event on {}: {} {}.{} {}",
                event.channel(), event.event(), event.schema(), event.table(), event.data());
    }
}
