package com.kbdash.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntObjectMaps;

import java.io.IOException;

public class JsonReader {
    private final JsonFactory factory = new JsonFactory();

    public JsonNode parse(String text) throws IOException {
        try (JsonParser parser = factory.createParser(text)) {
            JsonNode value = parseValue(parser, parser.nextToken());
            if (parser.nextToken() != null) {
                throw new IOException("Trailing content after JSON value at " + parser.getTokenLocation());
            }
            return value;
        }
    }

    public MutableIntObjectMap<String> readIdentifierMap(String text) throws IOException {
        JsonNode root = parse(text);
        if (!(root instanceof JsonNode.JsonObject object)) {
            throw new IOException("Identifier map must be a JSON object");
        }

        MutableIntObjectMap<String> identifiers = IntObjectMaps.mutable.empty();
        for (var entry : object.fields().keyValuesView()) {
            int index;
            try {
                index = Integer.parseInt(entry.getOne());
            } catch (NumberFormatException e) {
                throw new IOException("Identifier map key is not an index: " + entry.getOne(), e);
            }
            if (index < 0) {
                throw new IOException("Identifier map key is negative: " + index);
            }
            if (!(entry.getTwo() instanceof JsonNode.JsonString identifier)) {
                throw new IOException("Identifier for index " + index + " must be a string");
            }
            identifiers.put(index, identifier.value());
        }
        return identifiers;
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        JsonNode.JsonObject object = JsonNode.JsonObject.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonNode value = parseValue(parser, parser.nextToken());
            object.fields().put(fieldName, value);
        }

        return object;
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.<JsonNode>empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new JsonNode.JsonArray(elements);
    }
}
