package org.rbtyper.core;

/**
 * A half-open range of UTF-16 char offsets into a {@link SourceFile}.
 * <p>
 * Offsets index the Java string returned by {@link SourceFile#source()}, so
 * slicing a range never splits a surrogate pair as long as the parser that
 * produced it reported char positions.
 */
public final class LocOffsets {
    private static final LocOffsets NONE = new LocOffsets(-1, -1);

    public final int beginPos;
    public final int endPos;

    public LocOffsets(int beginPos, int endPos) {
        this.beginPos = beginPos;
        this.endPos = endPos;
    }

    public static LocOffsets none() {
        return NONE;
    }

    /**
     * Builds a range, pulling {@code endPos} up to {@code beginPos} when the
     * arithmetic that produced it ran past the start.
     */
    public static LocOffsets clamped(int beginPos, int endPos) {
        return new LocOffsets(beginPos, Math.max(beginPos, endPos));
    }

    public boolean exists() {
        return beginPos >= 0 && endPos >= beginPos;
    }

    public int length() {
        return exists() ? endPos - beginPos : 0;
    }

    public LocOffsets withBegin(int newBegin) {
        return clamped(newBegin, endPos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocOffsets other)) return false;
        return beginPos == other.beginPos && endPos == other.endPos;
    }

    @Override
    public int hashCode() {
        return 31 * beginPos + endPos;
    }

    @Override
    public String toString() {
        return exists() ? "[" + beginPos + "," + endPos + ")" : "[none]";
    }
}
