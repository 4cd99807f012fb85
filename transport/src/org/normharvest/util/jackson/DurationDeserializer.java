package org.normharvest.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads durations written as "5s", "250ms", "2m" or as a bare number of milliseconds.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        return parse(jsonParser.getText());
    }

    public static Duration parse(String text) {
        String value = text.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("pt")) return Duration.parse(value.toUpperCase(Locale.ROOT));
        if (value.endsWith("ms")) return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
        if (value.chars().allMatch(Character::isDigit)) return Duration.ofMillis(Long.parseLong(value));
        return Duration.parse("PT" + value.toUpperCase(Locale.ROOT));
    }
}
