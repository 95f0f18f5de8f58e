package org.rbtyper.core;

import java.util.ArrayList;
import java.util.List;

/**
 * An already-loaded source file. The rewriter never reads from disk; the
 * surrounding driver hands in the text it parsed.
 */
public class SourceFile {
    private final String path;
    private final String source;

    // Offsets at which each line starts, built on first use
    private List<Integer> lineStarts;

    public SourceFile(String path, String source) {
        this.path = path;
        this.source = source == null ? "" : source;
    }

    public String path() {
        return path;
    }

    public String source() {
        return source;
    }

    /**
     * Returns the text covered by {@code loc}, or an empty string when the
     * range is synthetic or falls outside this file.
     */
    public String slice(LocOffsets loc) {
        if (loc == null || !loc.exists() || loc.endPos > source.length()) {
            return "";
        }
        return source.substring(loc.beginPos, loc.endPos);
    }

    /**
     * Returns the 1-based line number containing {@code offset}.
     */
    public int lineNumber(int offset) {
        if (lineStarts == null) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts;
        }
        int low = 0;
        int high = lineStarts.size() - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts.get(mid) <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    @Override
    public String toString() {
        return path;
    }
}
