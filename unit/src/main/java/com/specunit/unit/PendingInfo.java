package com.specunit.unit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata staged for the next test method declared on one container. Consumed once.
 */
final class PendingInfo {
    private static final Logger logger = LoggerFactory.getLogger(PendingInfo.class);

    private Map<String, Object> staged;

    void stage(Map<String, ?> info) {
        for (String key : info.keySet()) {
            if (key == null) {
                throw new IllegalArgumentException("Metadata keys must not be null");
            }
        }
        if (staged != null) {
            logger.debug("Discarding unconsumed test info {}", staged);
        }
        staged = new LinkedHashMap<>(info);
    }

    boolean isStaged() {
        return staged != null;
    }

    Map<String, Object> consume() {
        Map<String, Object> consumed = staged != null ? staged : Collections.emptyMap();
        staged = null;
        return consumed;
    }
}
