package org.rbtyper.symbols;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.ibm.icu.text.Normalizer2;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interning table for identifiers.
 * <p>
 * Names are normalized to NFC before they are entered, so two spellings of
 * the same identifier that differ only in composition intern to one entry.
 * The table is shared by every class body a driver processes and may be
 * entered from several threads at once.
 */
public class NameTable {
    private static final Normalizer2 NFC = Normalizer2.getNFCInstance();

    private final ConcurrentMap<String, String> names = new ConcurrentHashMap<>();

    public NameTable() {
        for (String name : Names.ALL) {
            enterName(name);
        }
    }

    /**
     * Interns {@code text} and returns the canonical instance.
     *
     * @param text the raw identifier
     * @return the interned, NFC-normalized identifier
     */
    public String enterName(String text) {
        String normalized = NFC.normalize(text);
        return names.computeIfAbsent(normalized, k -> k);
    }

    /**
     * Looks up an identifier without entering it.
     *
     * @return the interned identifier, or null if it was never entered
     */
    public String lookup(String text) {
        return names.get(NFC.normalize(text));
    }

    public boolean contains(String text) {
        return lookup(text) != null;
    }

    public int size() {
        return names.size();
    }

    /** {@code foo} becomes {@code @foo}. */
    public String instanceVariableName(String name) {
        return enterName("@" + name);
    }

    /** {@code foo} becomes {@code foo=}. */
    public String setterName(String name) {
        return enterName(name + "=");
    }

    /**
     * Checks whether {@code name} can be written as a bare method or symbol
     * name: an XID_Start character (or underscore) followed by XID_Continue
     * characters, optionally ending in one of {@code ? ! =}.
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int end = name.length();
        char last = name.charAt(end - 1);
        if (end > 1 && (last == '?' || last == '!' || last == '=')) {
            end--;
        }
        int i = 0;
        boolean first = true;
        while (i < end) {
            int cp = name.codePointAt(i);
            boolean ok = first
                    ? cp == '_' || UCharacter.hasBinaryProperty(cp, UProperty.XID_START)
                    : UCharacter.hasBinaryProperty(cp, UProperty.XID_CONTINUE);
            if (!ok) {
                return false;
            }
            first = false;
            i += Character.charCount(cp);
        }
        return true;
    }
}
