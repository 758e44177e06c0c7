package com.kbdash.formula.grammar;

import com.kbdash.formula.FormulaSyntaxException;
import com.kbdash.json.JsonNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for Lens formulas.
 *
 * <pre>
 * formula    := expression EOF
 * expression := additive [ ("&gt;" | "&lt;" | "&gt;=" | "&lt;=" | "==") additive ]
 * additive   := term { ("+" | "-") term }
 * term       := operand { ("*" | "/") operand }
 * operand    := number | "-" number | string | word | call | "(" expression ")"
 * call       := name "(" [ argument { "," argument } [","] ] ")"
 * argument   := name "=" (string | number) | expression
 * </pre>
 *
 * The parser holds no state between calls and can be shared across threads.
 */
public class FormulaParser {
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Expression parse(String formula) {
        if (formula == null) {
            throw new FormulaSyntaxException("Formula is missing", 0, "");
        }
        return new Cursor(formula, new FormulaLexer(formula).tokenize()).formula();
    }

    private static final class Cursor {
        private final String input;
        private final MutableList<Token> tokens;
        private int current = 0;

        Cursor(String input, MutableList<Token> tokens) {
            this.input = input;
            this.tokens = tokens;
        }

        Expression formula() {
            if (peek().type() == TokenType.EOF) {
                throw error("Formula is empty", peek());
            }
            Expression expression = expression();
            if (peek().type() != TokenType.EOF) {
                throw error("Unexpected " + describe(peek()), peek());
            }
            return expression;
        }

        private Expression expression() {
            Expression left = binary(1);

            Operator operator = Operator.fromToken(peek().type());
            if (operator == null || !operator.isComparison()) {
                return left;
            }
            advance();
            Expression result = new Expression.Binary(operator, left, binary(1));

            Operator chained = Operator.fromToken(peek().type());
            if (chained != null && chained.isComparison()) {
                throw error("Comparisons cannot be chained", peek());
            }
            return result;
        }

        // Precedence climbing over the arithmetic operators; all are left associative
        private Expression binary(int minPrecedence) {
            Expression left = operand();

            while (true) {
                Operator operator = Operator.fromToken(peek().type());
                if (operator == null || operator.isComparison() || operator.precedence() < minPrecedence) {
                    return left;
                }
                advance();
                Expression right = binary(operator.precedence() + 1);
                left = new Expression.Binary(operator, left, right);
            }
        }

        private Expression operand() {
            Token token = peek();

            switch (token.type()) {
                case NUMBER -> {
                    advance();
                    return new Expression.NumberLiteral(number(token.text(), token), token.start(), token.end());
                }
                case MINUS -> {
                    if (isNegativeNumber()) {
                        Token digits = tokens.get(current + 1);
                        advance();
                        advance();
                        return new Expression.NumberLiteral(number("-" + digits.text(), token), token.start(), digits.end());
                    }
                    throw error("Unexpected " + describe(token), token);
                }
                case STRING -> {
                    advance();
                    return new Expression.Text(token.unquoted(), token.start(), token.end());
                }
                case WORD -> {
                    advance();
                    if (peek().type() == TokenType.LPAREN) {
                        return call(token);
                    }
                    return new Expression.Text(token.text(), token.start(), token.end());
                }
                case LPAREN -> {
                    advance();
                    Expression inner = expression();
                    expect(TokenType.RPAREN, "Missing closing parenthesis");
                    return inner;
                }
                case EOF -> throw error("Unexpected end of formula", token);
                default -> throw error("Unexpected " + describe(token), token);
            }
        }

        private Expression call(Token name) {
            if (!FUNCTION_NAME.matcher(name.text()).matches()) {
                throw error("Invalid function name '" + name.text() + "'", name);
            }
            advance(); // (

            MutableList<Expression.Argument> arguments = Lists.mutable.empty();
            while (peek().type() != TokenType.RPAREN) {
                arguments.add(argument());

                Token separator = peek();
                if (separator.type() == TokenType.COMMA) {
                    advance();
                } else if (separator.type() == TokenType.EOF) {
                    throw error("Unclosed call to '" + name.text() + "'", separator);
                } else if (separator.type() != TokenType.RPAREN) {
                    throw error("Expected ',' or ')' but found " + describe(separator), separator);
                }
            }
            Token close = advance();

            return new Expression.FunctionCall(name.text(), arguments.toImmutable(), name.start(), close.end());
        }

        private Expression.Argument argument() {
            Token token = peek();
            if (token.type() == TokenType.WORD && lookAhead(1).type() == TokenType.EQUALS) {
                advance();
                advance();
                return new Expression.Named(token.text(), argumentValue(token.text()), token.start());
            }
            if (token.type() == TokenType.EOF) {
                throw error("Unexpected end of formula", token);
            }
            return new Expression.Positional(expression());
        }

        private Expression.ArgumentValue argumentValue(String key) {
            Token token = peek();
            if (token.type() == TokenType.STRING) {
                advance();
                return new Expression.ArgumentValue.Quoted(token.unquoted(), token.start());
            }
            if (token.type() == TokenType.NUMBER) {
                advance();
                return new Expression.ArgumentValue.Numeric(number(token.text(), token), token.text(), token.start());
            }
            if (token.type() == TokenType.MINUS && isNegativeNumber()) {
                Token digits = tokens.get(current + 1);
                advance();
                advance();
                String text = "-" + digits.text();
                return new Expression.ArgumentValue.Numeric(number(text, token), text, token.start());
            }
            throw error("Expected a quoted string or number for argument '" + key + "'", token);
        }

        // "-" glued to the digits that follow it, e.g. "-5" but not "- 5"
        private boolean isNegativeNumber() {
            Token next = lookAhead(1);
            return next.type() == TokenType.NUMBER && next.start() == peek().end();
        }

        private JsonNode.JsonNumber number(String text, Token at) {
            if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
                BigInteger integer = new BigInteger(text);
                // Integers wider than a long fall through to double
                if (integer.bitLength() < Long.SIZE) {
                    return JsonNode.JsonNumber.of(integer.longValue());
                }
            }
            double value = Double.parseDouble(text);
            if (Double.isInfinite(value)) {
                throw error("Number out of range: " + text, at);
            }
            return JsonNode.JsonNumber.of(value);
        }

        private Token expect(TokenType type, String message) {
            Token token = peek();
            if (token.type() != type) {
                throw error(message + ", found " + describe(token), token);
            }
            return advance();
        }

        private Token peek() {
            return tokens.get(current);
        }

        private Token lookAhead(int distance) {
            return tokens.get(Math.min(current + distance, tokens.size() - 1));
        }

        private Token advance() {
            Token token = tokens.get(current);
            if (token.type() != TokenType.EOF) {
                current++;
            }
            return token;
        }

        private FormulaSyntaxException error(String message, Token at) {
            return new FormulaSyntaxException(message, at.start(), input);
        }

        private static String describe(Token token) {
            return token.type() == TokenType.EOF ? "end of formula" : "'" + token.text() + "'";
        }
    }
}
