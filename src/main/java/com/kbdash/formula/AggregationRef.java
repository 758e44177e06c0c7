package com.kbdash.formula;

public record AggregationRef(
        String writtenName,
        FunctionKind operationKind,
        String field,
        String filter,
        FilterLanguage filterLanguage,
        Double percentile,
        String timeShift,
        String reducedTimeRange,
        Span span,
        String matchedText) {

    public String operationType() {
        return operationKind.operationType();
    }
}
