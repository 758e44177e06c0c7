package com.kbdash.output;

import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.tuple.Pair;

public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(JsonNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        format(node, 0, sb);

        return sb.toString();
    }

    private void format(JsonNode node, int indent, StringBuilder sb) {
        if (node instanceof JsonNode.JsonObject obj) {
            formatObject(obj, indent, sb);
        } else if (node instanceof JsonNode.JsonArray arr) {
            formatArray(arr, indent, sb);
        } else if (node instanceof JsonNode.JsonString s) {
            sb.append('"').append(escapeString(s.value())).append('"');
        } else if (node instanceof JsonNode.JsonNumber n) {
            sb.append(n.toJsonString());
        } else if (node instanceof JsonNode.JsonBoolean b) {
            sb.append(b.value());
        } else {
            sb.append("null");
        }
    }

    private void formatObject(JsonNode.JsonObject obj, int indent, StringBuilder sb) {
        if (obj.fields().isEmpty()) {
            sb.append("{}");
            return;
        }

        var entries = sortKeys
            ? obj.fields().keyValuesView().toSortedListBy(Pair::getOne)
            : obj.fields().keyValuesView().toList();

        sb.append('{');
        boolean first = true;
        for (var entry : entries) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            newline(indent + 2, sb);
            sb.append('"').append(escapeString(entry.getOne())).append('"').append(prettyPrint ? ": " : ":");
            format(entry.getTwo(), indent + 2, sb);
        }
        newline(indent, sb);
        sb.append('}');
    }

    private void formatArray(JsonNode.JsonArray arr, int indent, StringBuilder sb) {
        if (arr.elements().isEmpty()) {
            sb.append("[]");
            return;
        }

        sb.append('[');
        boolean first = true;
        for (JsonNode element : arr.elements()) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            newline(indent + 2, sb);
            format(element, indent + 2, sb);
        }
        newline(indent, sb);
        sb.append(']');
    }

    private void newline(int indent, StringBuilder sb) {
        if (prettyPrint) {
            sb.append('\n').append(" ".repeat(indent));
        }
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
