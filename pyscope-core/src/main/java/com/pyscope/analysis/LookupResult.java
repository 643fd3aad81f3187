package com.pyscope.analysis;

import com.pyscope.ast.Node;
import com.pyscope.ast.Scope;

import java.util.List;

/**
 * The scope a name was found in and the binding occurrences that can reach
 * the use site, in source order. An empty binding list means the name is
 * unresolved.
 */
public record LookupResult(Scope scope, List<Node> bindings) {

    public boolean isResolved() {
        return !bindings.isEmpty();
    }
}
