package com.kbdash.formula.grammar;

import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;

public sealed interface Expression {
    int start();
    int end();

    record NumberLiteral(JsonNode.JsonNumber value, int start, int end) implements Expression {}

    // Unquoted field name or quoted string used as an operand
    record Text(String value, int start, int end) implements Expression {}

    record Binary(Operator operator, Expression left, Expression right) implements Expression {
        @Override
        public int start() {
            return left.start();
        }

        @Override
        public int end() {
            return right.end();
        }
    }

    record FunctionCall(String name, ImmutableList<Argument> arguments, int start, int end) implements Expression {}

    sealed interface Argument {
        int start();
    }

    record Positional(Expression value) implements Argument {
        @Override
        public int start() {
            return value.start();
        }
    }

    record Named(String key, ArgumentValue value, int start) implements Argument {}

    sealed interface ArgumentValue {
        String text();
        int start();

        record Quoted(String text, int start) implements ArgumentValue {}

        // text keeps the literal as written, e.g. "95" or "-1.5"
        record Numeric(JsonNode.JsonNumber value, String text, int start) implements ArgumentValue {}
    }
}
