package com.pyscope.analysis;

import com.pyscope.ast.ExceptHandler;
import com.pyscope.ast.If;
import com.pyscope.ast.Node;
import com.pyscope.ast.TryExcept;
import com.pyscope.tree.ChildLocation;
import com.pyscope.tree.SyntaxTree;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether two nodes of a tree lie on control paths that cannot both
 * run in one execution.
 *
 * <p>The answer only looks at the nearest common ancestor of the two nodes.
 * Conditionals split on their branches; try/except splits between its body,
 * its handlers and its else block. Every other construct is treated as
 * sequential. Stateless and safe to share between threads.</p>
 */
public final class BranchExclusivity {

    private static final String BODY = "body";
    private static final String HANDLERS = "handlers";
    private static final String ORELSE = "orelse";

    private final SyntaxTree tree;

    public BranchExclusivity(SyntaxTree tree) {
        this.tree = tree;
    }

    public boolean areExclusive(Node first, Node second) {
        return areExclusive(first, second, null);
    }

    /**
     * @param exceptionNames when non-null, conditional branches are ignored and
     *                       only handlers catching one of these names count
     */
    public boolean areExclusive(Node first, Node second, Set<String> exceptionNames) {
        if (!tree.contains(first) || !tree.contains(second)) {
            return false;
        }
        // ancestor of first -> child of that ancestor on the way down to first
        Map<Node, Node> firstPath = new IdentityHashMap<>();
        Node previous = first;
        Node node = tree.parent(first);
        while (node != null) {
            firstPath.put(node, previous);
            previous = node;
            node = tree.parent(node);
        }

        previous = second;
        node = tree.parent(second);
        while (node != null) {
            Node firstBranch = firstPath.get(node);
            if (firstBranch != null) {
                return exclusiveAt(node, firstBranch, previous, exceptionNames);
            }
            previous = node;
            node = tree.parent(node);
        }
        return false;
    }

    private boolean exclusiveAt(Node common, Node firstBranch, Node secondBranch, Set<String> exceptionNames) {
        if (common instanceof If && exceptionNames == null) {
            ChildLocation firstLocation = tree.locateChild(common, firstBranch);
            ChildLocation secondLocation = tree.locateChild(common, secondBranch);
            return !firstLocation.field().equals(secondLocation.field());
        }
        if (common instanceof TryExcept) {
            String firstField = tree.locateChild(common, firstBranch).field();
            String secondField = tree.locateChild(common, secondBranch).field();
            if (!firstField.equals(secondField)) {
                return (secondField.equals(BODY) && firstField.equals(HANDLERS) && catches(firstBranch, exceptionNames))
                    || (secondField.equals(HANDLERS) && firstField.equals(BODY) && catches(secondBranch, exceptionNames))
                    || (secondField.equals(HANDLERS) && firstField.equals(ORELSE))
                    || (secondField.equals(ORELSE) && firstField.equals(HANDLERS));
            }
            if (firstField.equals(HANDLERS)) {
                return firstBranch != secondBranch;
            }
        }
        return false;
    }

    private static boolean catches(Node handler, Set<String> exceptionNames) {
        return handler instanceof ExceptHandler exceptHandler && exceptHandler.catches(exceptionNames);
    }
}
