package com.kbdash.formula.grammar;

public record Token(TokenType type, String text, int start, int end) {

    public String unquoted() {
        if (type == TokenType.STRING) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    @Override
    public String toString() {
        return String.format("Token{%s, '%s', position=%d}", type, text, start);
    }
}
