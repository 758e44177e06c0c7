package com.kbdash.formula;

// innerIndex points into ParseOutcome.aggregations(); window and unit are null when not given
public record PipelineRef(
        String writtenName,
        FunctionKind operationKind,
        int innerIndex,
        Integer window,
        String unit,
        Span span,
        String matchedText) {

    public String operationType() {
        return operationKind.operationType();
    }
}
