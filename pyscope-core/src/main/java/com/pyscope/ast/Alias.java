package com.pyscope.ast;

/**
 * One imported name, with its optional {@code as} name. Not a node: import
 * statements keep aliases as literal field values.
 */
public record Alias(
    String name,
    String asname  // Can be null
) {

    /**
     * The name the import binds in the importing scope. A plain dotted import
     * binds its first component.
     */
    public String boundName(boolean dottedImport) {
        if (asname != null) {
            return asname;
        }
        if (dottedImport) {
            int dot = name.indexOf('.');
            return dot < 0 ? name : name.substring(0, dot);
        }
        return name;
    }
}
