package com.kbdash.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

public sealed interface JsonNode {
    // Insertion-ordered so that emitted objects keep the key order Kibana writes
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        public static JsonObject empty() {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }

        public JsonObject with(String key, JsonNode value) {
            MutableMap<String, JsonNode> newFields = MapAdapter.adapt(new LinkedHashMap<>(fields));
            newFields.put(key, value);
            return new JsonObject(newFields);
        }

        public JsonObject with(String key, String value) {
            return with(key, value == null ? new JsonNull() : new JsonString(value));
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }

        public JsonArray with(JsonNode element) {
            MutableList<JsonNode> newElements = Lists.mutable.withAll(elements);
            newElements.add(element);
            return new JsonArray(newElements);
        }
    }

    record JsonString(String value) implements JsonNode {}

    sealed interface JsonNumber extends JsonNode {
        String toJsonString();
        Number numberValue();

        record JsonLong(long value) implements JsonNumber {
            @Override
            public String toJsonString() {
                return Long.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public String toJsonString() {
                if (value == (long) value && !Double.isInfinite(value) && !Double.isNaN(value)) {
                    return Long.toString((long) value);
                }
                return Double.toString(value);
            }

            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonNode {}
    record JsonNull() implements JsonNode {}
}
