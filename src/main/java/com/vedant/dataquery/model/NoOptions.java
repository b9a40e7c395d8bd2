package com.vedant.dataquery.model;

public final class NoOptions implements LoadOptions {

    public static final NoOptions INSTANCE = new NoOptions();

    private NoOptions() {}

    @Override
    public String toString() {
        return "NoOptions";
    }
}
