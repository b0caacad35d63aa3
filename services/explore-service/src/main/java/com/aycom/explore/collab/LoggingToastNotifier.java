package com.aycom.explore.collab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback notifier used when no UI toast surface is attached.
 */
public class LoggingToastNotifier implements ToastNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingToastNotifier.class);

    @Override
    public void error(String message) {
        log.warn("toast error message={}", message);
    }
}
