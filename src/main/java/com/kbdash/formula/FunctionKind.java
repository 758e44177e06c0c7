package com.kbdash.formula;

// Math functions have no kind; they keep the name they were written with
public enum FunctionKind {
    COUNT("count", FunctionCategory.AGGREGATION),
    SUM("sum", FunctionCategory.AGGREGATION),
    AVERAGE("average", FunctionCategory.AGGREGATION),
    MAX("max", FunctionCategory.AGGREGATION),
    MIN("min", FunctionCategory.AGGREGATION),
    MEDIAN("median", FunctionCategory.AGGREGATION),
    PERCENTILE("percentile", FunctionCategory.AGGREGATION),
    PERCENTILE_RANK("percentile_rank", FunctionCategory.AGGREGATION),
    UNIQUE_COUNT("unique_count", FunctionCategory.AGGREGATION),
    LAST_VALUE("last_value", FunctionCategory.AGGREGATION),
    STANDARD_DEVIATION("standard_deviation", FunctionCategory.AGGREGATION),

    COUNTER_RATE("counter_rate", FunctionCategory.PIPELINE),
    CUMULATIVE_SUM("cumulative_sum", FunctionCategory.PIPELINE),
    DIFFERENCES("differences", FunctionCategory.PIPELINE),
    MOVING_AVERAGE("moving_average", FunctionCategory.PIPELINE),
    NORMALIZE("normalize", FunctionCategory.PIPELINE),
    OVERALL_SUM("overall_sum", FunctionCategory.PIPELINE),
    OVERALL_AVERAGE("overall_average", FunctionCategory.PIPELINE),
    OVERALL_MAX("overall_max", FunctionCategory.PIPELINE),
    OVERALL_MIN("overall_min", FunctionCategory.PIPELINE),
    TIME_SCALE("time_scale", FunctionCategory.PIPELINE);

    private final String operationType;
    private final FunctionCategory category;

    FunctionKind(String operationType, FunctionCategory category) {
        this.operationType = operationType;
        this.category = category;
    }

    public String operationType() {
        return operationType;
    }

    public FunctionCategory category() {
        return category;
    }

    public boolean takesPercentile() {
        return this == PERCENTILE || this == PERCENTILE_RANK;
    }
}
