package com.pyscope.tree;

import com.pyscope.ast.Alias;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.DelName;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.Global;
import com.pyscope.ast.Import;
import com.pyscope.ast.ImportFrom;
import com.pyscope.ast.Lambda;
import com.pyscope.ast.Node;
import com.pyscope.ast.Scope;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fills the per-scope locals of a freshly built tree, in source order.
 */
final class ScopeBinder {
    private static final Logger logger = LogManager.getLogger(ScopeBinder.class);

    private final SyntaxTree tree;
    private final Map<Scope, Set<String>> globals = new IdentityHashMap<>();

    ScopeBinder(SyntaxTree tree) {
        this.tree = tree;
    }

    void bind() {
        collectGlobals();
        int bindings = 0;
        for (Node node : tree.nodes()) {
            if (node instanceof AssignName assignName) {
                bindName(assignName.name(), node);
                bindings++;
            } else if (node instanceof DelName delName) {
                bindName(delName.name(), node);
                bindings++;
            } else if (node instanceof FunctionDef function) {
                bindName(function.name(), node);
                bindings++;
            } else if (node instanceof ClassDef classDef) {
                bindName(classDef.name(), node);
                bindings++;
            } else if (node instanceof Import importNode) {
                for (Alias alias : importNode.names()) {
                    bindName(alias.boundName(true), node);
                    bindings++;
                }
            } else if (node instanceof ImportFrom importFrom) {
                for (Alias alias : importFrom.names()) {
                    if (!"*".equals(alias.name())) {
                        bindName(alias.boundName(false), node);
                        bindings++;
                    }
                }
            }
        }
        logger.debug("Bound {} names in module {}", bindings, tree.root().name());
    }

    private void collectGlobals() {
        for (Node node : tree.nodes()) {
            if (node instanceof Global global) {
                Scope frame = tree.enclosingFrame(node);
                globals.computeIfAbsent(frame, f -> new HashSet<>()).addAll(global.names());
            }
        }
    }

    private void bindName(String name, Node binding) {
        Scope scope = tree.enclosingFrame(tree.parent(binding));
        if (isGlobalIn(scope, name)) {
            scope = tree.root();
        }
        tree.addLocal(scope, name, binding);
    }

    private boolean isGlobalIn(Scope scope, String name) {
        if (!(scope instanceof FunctionDef) && !(scope instanceof Lambda)) {
            return false;
        }
        Set<String> declared = globals.get(scope);
        return declared != null && declared.contains(name);
    }
}
