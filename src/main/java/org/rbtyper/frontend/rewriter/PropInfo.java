package org.rbtyper.frontend.rewriter;

import org.rbtyper.core.LocOffsets;
import org.rbtyper.frontend.astnode.Node;

/**
 * What {@link PropParser} learned from one property declaration.
 * <p>
 * The node fields are owned by this record and never placed in the tree
 * themselves; synthesis copies them at every use.
 */
public class PropInfo {
    public LocOffsets loc;
    public boolean isImmutable = false;
    public String name;
    public LocOffsets nameLoc = LocOffsets.none();
    public Node type;
    public Node defaultValue;
    public String computedByMethodName;
    public LocOffsets computedByMethodNameLoc = LocOffsets.none();
    public Node foreign;
    public Node ifunset;

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String toString() {
        return "PropInfo{name=" + name
                + ", immutable=" + isImmutable
                + ", default=" + (defaultValue != null)
                + ", computedBy=" + computedByMethodName
                + ", foreign=" + (foreign != null)
                + ", ifunset=" + (ifunset != null)
                + "}";
    }
}
