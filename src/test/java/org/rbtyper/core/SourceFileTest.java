package org.rbtyper.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceFileTest {

    private static final SourceFile FILE = new SourceFile("order.rb", "class Order\n  prop :id, Integer\nend");

    @Test
    public void testSlice() {
        assertEquals("Order", FILE.slice(new LocOffsets(6, 11)));
        assertEquals("", FILE.slice(LocOffsets.none()));
        assertEquals("", FILE.slice(new LocOffsets(30, 400)));
        assertEquals("", FILE.slice(null));
    }

    @Test
    public void testLineNumbers() {
        assertEquals(1, FILE.lineNumber(0));
        assertEquals(1, FILE.lineNumber(11));
        assertEquals(2, FILE.lineNumber(12));
        assertEquals(3, FILE.lineNumber(FILE.source().length() - 1));
    }

    @Test
    public void testLocOffsets() {
        assertFalse(LocOffsets.none().exists());
        assertEquals(0, LocOffsets.none().length());
        assertEquals(new LocOffsets(5, 5), LocOffsets.clamped(5, 2));
        assertEquals(new LocOffsets(7, 9), new LocOffsets(6, 9).withBegin(7));
        assertEquals("[6,9)", new LocOffsets(6, 9).toString());
    }

    @Test
    public void testLoc() {
        Loc loc = new Loc(FILE, new LocOffsets(14, 18));

        assertEquals("prop", loc.source());
        assertEquals(2, loc.line());
        assertEquals("order.rb:2", loc.toString());
        assertEquals(0, new Loc(FILE, LocOffsets.none()).line());
    }
}
