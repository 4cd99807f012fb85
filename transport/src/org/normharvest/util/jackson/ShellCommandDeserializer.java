package org.normharvest.util.jackson;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON deserializer which takes a command line like "--headless=new --proxy-server='socks://h:1080'" and returns
 * a list of ["--headless=new", "--proxy-server=socks://h:1080"]. Arrays are accepted as is.
 */
public class ShellCommandDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isTextual()) {
            return split(node.asText());
        } else if (node.isArray()) {
            List<String> tokens = new ArrayList<>();
            for (JsonNode element : node) {
                tokens.add(element.asText());
            }
            return tokens;
        } else {
            throw new JsonMappingException(jsonParser, "Invalid command line: " + node.asText(null) + " (expected string or array of strings)");
        }
    }

    /**
     * Splits on unquoted whitespace. Single quotes are literal, double quotes and bare words honour backslash
     * escapes, so {@code --user-data-dir=/tmp/chrome\ profile} stays one option.
     */
    public static List<String> split(String commandLine) throws IOException {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        char quote = 0;
        boolean inToken = false;

        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (c == '\\' && quote != '\'' && i + 1 < commandLine.length()) {
                token.append(commandLine.charAt(++i));
                inToken = true;
            } else if (quote != 0) {
                if (c == quote) quote = 0;
                else token.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(token.toString());
                    token.setLength(0);
                    inToken = false;
                }
            } else {
                token.append(c);
                inToken = true;
            }
        }
        if (quote != 0) throw new IOException("Unterminated quote in browser options: " + commandLine);
        if (inToken) tokens.add(token.toString());
        return tokens;
    }
}
