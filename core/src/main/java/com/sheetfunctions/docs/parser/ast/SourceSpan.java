package com.sheetfunctions.docs.parser.ast;

import java.util.Objects;

/** Half-open character range {@code [start, end)} into the normalized formula text. */
public final class SourceSpan {
    private final int start;
    private final int end;

    public SourceSpan(int start, int end) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static SourceSpan empty(int position) {
        return new SourceSpan(position, position);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public String slice(String source) {
        Objects.requireNonNull(source, "source");
        return source.substring(start, end);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceSpan)) {
            return false;
        }
        SourceSpan other = (SourceSpan) obj;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
