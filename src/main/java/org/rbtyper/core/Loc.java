package org.rbtyper.core;

/**
 * A {@link LocOffsets} range anchored to the file it belongs to.
 */
public final class Loc {
    public final SourceFile file;
    public final LocOffsets offsets;

    public Loc(SourceFile file, LocOffsets offsets) {
        this.file = file;
        this.offsets = offsets;
    }

    public String source() {
        return file == null ? "" : file.slice(offsets);
    }

    public int line() {
        if (file == null || !offsets.exists()) {
            return 0;
        }
        return file.lineNumber(offsets.beginPos);
    }

    @Override
    public String toString() {
        return (file == null ? "<unknown>" : file.path()) + ":" + line();
    }
}
