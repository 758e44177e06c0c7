package com.kbdash.formula;

public enum FunctionCategory {
    AGGREGATION,
    // Wraps exactly one aggregation
    PIPELINE,
    MATH
}
