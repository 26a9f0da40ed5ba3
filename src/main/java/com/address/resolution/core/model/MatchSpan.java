package com.address.resolution.core.model;

/**
 * Half-open range {@code [start, end)} of code points in a query string.
 */
public record MatchSpan(int start, int end) {
    public MatchSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public MatchSpan shift(int offset) {
        return new MatchSpan(start + offset, end + offset);
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
