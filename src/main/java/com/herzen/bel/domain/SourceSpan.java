package com.herzen.bel.domain;

public record SourceSpan(int start, int end) {
    public static final SourceSpan UNKNOWN = new SourceSpan(-1, -1);

    public static SourceSpan at(int position) {
        return new SourceSpan(position, position + 1);
    }
}
