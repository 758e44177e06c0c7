package com.kbdash.formula.grammar;

import com.kbdash.formula.FormulaSyntaxException;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class FormulaLexer {
    private final String input;
    private int pos = 0;

    public FormulaLexer(String input) {
        this.input = input;
    }

    public MutableList<Token> tokenize() {
        MutableList<Token> tokens = Lists.mutable.empty();

        while (pos < input.length()) {
            char current = input.charAt(pos);

            if (Character.isWhitespace(current)) {
                pos++;
                continue;
            }

            if (current == '\'' || current == '"') {
                tokens.add(readString(current));
                continue;
            }

            if (isDigit(current)) {
                tokens.add(readNumber());
                continue;
            }

            if (isWordStart(current)) {
                tokens.add(readWord());
                continue;
            }

            tokens.add(readSymbol(current));
        }

        tokens.add(new Token(TokenType.EOF, "", input.length(), input.length()));
        return tokens;
    }

    private Token readString(char quote) {
        int start = pos;
        int close = input.indexOf(quote, start + 1);
        if (close < 0) {
            throw new FormulaSyntaxException("Unterminated string", start, input);
        }
        pos = close + 1;
        return new Token(TokenType.STRING, input.substring(start, pos), start, pos);
    }

    private Token readNumber() {
        int start = pos;
        skipDigits();

        // A fraction needs at least one digit after the dot
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && isDigit(input.charAt(pos + 1))) {
            pos++;
            skipDigits();
        }

        if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < input.length() && (input.charAt(exponent) == '+' || input.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < input.length() && isDigit(input.charAt(exponent))) {
                pos = exponent;
                skipDigits();
            }
        }

        return new Token(TokenType.NUMBER, input.substring(start, pos), start, pos);
    }

    private Token readWord() {
        int start = pos;
        while (pos < input.length() && isWordPart(input.charAt(pos))) {
            pos++;
        }
        return new Token(TokenType.WORD, input.substring(start, pos), start, pos);
    }

    private Token readSymbol(char current) {
        int start = pos;
        char next = pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';

        TokenType type = switch (current) {
            case '+' -> TokenType.PLUS;
            case '-' -> TokenType.MINUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case ',' -> TokenType.COMMA;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '>' -> next == '=' ? TokenType.GTE : TokenType.GT;
            case '<' -> next == '=' ? TokenType.LTE : TokenType.LT;
            case '=' -> next == '=' ? TokenType.EQ_EQ : TokenType.EQUALS;
            default -> throw new FormulaSyntaxException("Unexpected character '" + current + "'", start, input);
        };

        pos += switch (type) {
            case GTE, LTE, EQ_EQ -> 2;
            default -> 1;
        };
        return new Token(type, input.substring(start, pos), start, pos);
    }

    private void skipDigits() {
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || c == '_' || c == '.' || c == '@' || c == '[' || c == ']';
    }

    // Field names may contain dashes and digits after the first character
    private static boolean isWordPart(char c) {
        return isWordStart(c) || isDigit(c) || c == '-';
    }
}
