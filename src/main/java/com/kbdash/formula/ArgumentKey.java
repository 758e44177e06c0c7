package com.kbdash.formula;

import com.kbdash.formula.grammar.Expression;

public enum ArgumentKey {
    FIELD("field", FunctionCategory.AGGREGATION),
    KQL("kql", FunctionCategory.AGGREGATION),
    LUCENE("lucene", FunctionCategory.AGGREGATION),
    PERCENTILE("percentile", FunctionCategory.AGGREGATION),
    SHIFT("shift", FunctionCategory.AGGREGATION),
    REDUCED_TIME_RANGE("reducedTimeRange", FunctionCategory.AGGREGATION),
    WINDOW("window", FunctionCategory.PIPELINE),
    UNIT("unit", FunctionCategory.PIPELINE);

    private final String keyword;
    private final FunctionCategory acceptedBy;

    ArgumentKey(String keyword, FunctionCategory acceptedBy) {
        this.keyword = keyword;
        this.acceptedBy = acceptedBy;
    }

    public String keyword() {
        return keyword;
    }

    public FunctionCategory acceptedBy() {
        return acceptedBy;
    }

    // Exact spelling; null when unknown
    public static ArgumentKey fromKeyword(String keyword) {
        for (ArgumentKey key : values()) {
            if (key.keyword.equals(keyword)) {
                return key;
            }
        }
        return null;
    }

    // Numbers given to string keys are taken as written, so shift=1 reads as "1"
    public String stringValue(Expression.ArgumentValue value) {
        return value.text();
    }

    public Double numberValue(Expression.ArgumentValue value, String formula) {
        if (value instanceof Expression.ArgumentValue.Numeric numeric) {
            return numeric.value().numberValue().doubleValue();
        }
        try {
            return Double.parseDouble(value.text().trim());
        } catch (NumberFormatException e) {
            throw new FormulaSyntaxException(
                    "Argument '" + keyword + "' expects a number but got '" + value.text() + "'", value.start(), formula);
        }
    }

    public Integer integerValue(Expression.ArgumentValue value, String formula) {
        double number = numberValue(value, formula);
        if (number != Math.rint(number) || Math.abs(number) > Integer.MAX_VALUE) {
            throw new FormulaSyntaxException(
                    "Argument '" + keyword + "' expects a whole number but got '" + value.text() + "'", value.start(), formula);
        }
        return (int) number;
    }
}
