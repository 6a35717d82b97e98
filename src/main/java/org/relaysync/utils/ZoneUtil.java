package org.relaysync.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;

public final class ZoneUtil {
    private static final Logger logger = LoggerFactory.getLogger(ZoneUtil.class);

    private ZoneUtil() {}

    public static boolean isValid(String zoneId) {
        if (zoneId == null || zoneId.isBlank()) return false;
        try {
            ZoneId.of(zoneId.trim());
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * Stored zone ids are only validated on API writes; a hand-edited store may still hold garbage.
     */
    public static ZoneId resolve(String zoneId, ZoneId fallback) {
        if (zoneId == null || zoneId.isBlank()) return fallback;
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            logger.warn("Invalid timezone '{}', using {}", zoneId, fallback);
            return fallback;
        }
    }
}
