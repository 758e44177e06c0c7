package com.kbdash.formula.grammar;

public enum Operator {
    ADD("add", 1),
    SUBTRACT("subtract", 1),
    MULTIPLY("multiply", 2),
    DIVIDE("divide", 2),
    GT("gt", 0),
    LT("lt", 0),
    GTE("gte", 0),
    LTE("lte", 0),
    EQ("eq", 0);

    private final String functionName;
    private final int precedence;

    Operator(String functionName, int precedence) {
        this.functionName = functionName;
        this.precedence = precedence;
    }

    public String functionName() {
        return functionName;
    }

    // Higher binds tighter; comparisons are 0
    public int precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 0;
    }

    static Operator fromToken(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case GT -> GT;
            case LT -> LT;
            case GTE -> GTE;
            case LTE -> LTE;
            case EQ_EQ -> EQ;
            default -> null;
        };
    }
}
