package com.pyscope.analysis;

import com.pyscope.ast.Arguments;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.Decorators;
import com.pyscope.ast.Expression;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.Lambda;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.Node;
import com.pyscope.ast.Scope;
import com.pyscope.tree.SyntaxTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Resolves a name from a use site by walking outwards through the enclosing
 * scopes, then the builtins module.
 */
public final class NameResolver {
    private static final Logger logger = LogManager.getLogger(NameResolver.class);

    private final SyntaxTree tree;
    private final LookupFilter filter;
    private final SyntaxTree builtins;  // Can be null

    public NameResolver(SyntaxTree tree) {
        this(tree, null);
    }

    public NameResolver(SyntaxTree tree, SyntaxTree builtins) {
        this(tree, new LookupFilter(tree), builtins);
    }

    public NameResolver(SyntaxTree tree, LookupFilter filter, SyntaxTree builtins) {
        this.tree = tree;
        this.filter = filter;
        this.builtins = builtins;
    }

    public LookupResult lookup(Name name) {
        return lookup(name, name.name());
    }

    /**
     * Returns the scope owning {@code name} as seen from {@code use}, with the
     * bindings that can reach {@code use}.
     */
    public LookupResult lookup(Node use, String name) {
        Scope scope = tree.enclosingScope(use);
        while (true) {
            Scope frame = scope;
            int offset = 0;
            if (resolvesInOuterFrame(scope, use, name)) {
                frame = tree.enclosingFrame(tree.parent(scope));
                offset = LookupFilter.OUTER_FRAME_OFFSET;
            }

            List<Node> bindings = filter.filter(use, tree.localBindings(frame, name), frame, offset);
            if (!bindings.isEmpty()) {
                logger.debug("'{}' resolved in {} {} to {} binding(s)", name, frame.type(), frame.name(), bindings.size());
                return new LookupResult(frame, bindings);
            }

            Node parent = tree.parent(frame);
            if (parent == null) {
                return builtinLookup(name);
            }
            Scope parentScope = tree.enclosingScope(parent);
            if (!isFunction(parentScope)) {
                // class bodies do not enclose nested scopes
                parentScope = tree.root();
            }
            scope = parentScope;
        }
    }

    private boolean resolvesInOuterFrame(Scope scope, Node use, String name) {
        if (tree.parent(scope) == null) {
            return false;
        }
        if (scope instanceof FunctionDef function) {
            return isDefault(function.args(), use);
        }
        if (scope instanceof Lambda lambda) {
            return isDefault(lambda.args(), use);
        }
        if (scope instanceof ClassDef classDef) {
            for (Expression base : classDef.bases()) {
                if (base == use || tree.isAncestor(base, use)) {
                    return true;
                }
            }
            return tree.parent(use) instanceof Decorators && isBuiltin(name);
        }
        return false;
    }

    private static boolean isDefault(Arguments args, Node use) {
        return containsIdentity(args.defaults(), use) || containsIdentity(args.kwDefaults(), use);
    }

    private static boolean isFunction(Scope scope) {
        return scope instanceof FunctionDef || scope instanceof Lambda;
    }

    private boolean isBuiltin(String name) {
        return builtins != null && !builtins.localBindings(builtins.root(), name).isEmpty();
    }

    private LookupResult builtinLookup(String name) {
        if (builtins == null) {
            logger.debug("'{}' is unresolved in module {}", name, tree.root().name());
            return new LookupResult(tree.root(), List.of());
        }
        Module module = builtins.root();
        return new LookupResult(module, builtins.localBindings(module, name));
    }

    private static boolean containsIdentity(List<? extends Node> nodes, Node node) {
        for (Node candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }
}
