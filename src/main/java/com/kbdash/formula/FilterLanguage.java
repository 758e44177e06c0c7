package com.kbdash.formula;

public enum FilterLanguage {
    KQL("kuery"),
    LUCENE("lucene");

    private final String queryLanguage;

    FilterLanguage(String queryLanguage) {
        this.queryLanguage = queryLanguage;
    }

    public String queryLanguage() {
        return queryLanguage;
    }
}
