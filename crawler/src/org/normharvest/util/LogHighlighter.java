package org.normharvest.util;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;
import org.slf4j.event.KeyValuePair;

import java.util.List;

import static ch.qos.logback.classic.Level.*;
import static ch.qos.logback.core.pattern.color.ANSIConstants.*;

/**
 * Colours console log lines by level. Per-year summaries, which carry a "year" key, are shown in bold so they
 * stand out from per-document chatter.
 */
public class LogHighlighter extends ForegroundCompositeConverterBase<ILoggingEvent> {
    @Override
    protected String getForegroundColorCode(ILoggingEvent event) {
        String colour = switch (event.getLevel().toInt()) {
            case ERROR_INT -> RED_FG;
            case WARN_INT -> YELLOW_FG;
            case INFO_INT -> GREEN_FG;
            case DEBUG_INT -> BLUE_FG;
            default -> DEFAULT_FG;
        };
        return hasYear(event) || event.getLevel().toInt() == ERROR_INT ? BOLD + colour : colour;
    }

    private static boolean hasYear(ILoggingEvent event) {
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs == null) return false;
        for (KeyValuePair pair : pairs) {
            if ("year".equals(pair.key)) return true;
        }
        return false;
    }
}
