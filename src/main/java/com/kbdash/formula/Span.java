package com.kbdash.formula;

public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public String slice(String text) {
        return text.substring(start, end);
    }
}
