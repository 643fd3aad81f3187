package com.pyscope.tree;

import com.pyscope.ast.AssignAttr;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.AssignType;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.Decorators;
import com.pyscope.ast.DelAttr;
import com.pyscope.ast.DelName;
import com.pyscope.ast.Arguments;
import com.pyscope.ast.ListLiteral;
import com.pyscope.ast.Module;
import com.pyscope.ast.Node;
import com.pyscope.ast.NodeFields;
import com.pyscope.ast.Scope;
import com.pyscope.ast.Starred;
import com.pyscope.ast.Statement;
import com.pyscope.ast.TupleLiteral;
import com.pyscope.ast.WithItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena over an immutable module tree.
 *
 * <p>Nodes are numbered in pre-order when the tree is built. Parents are kept
 * as indices into that numbering, so the records themselves never point
 * upwards. Start and end lines are computed on first use and cached; the
 * cache is write-once and the computed values are deterministic, so
 * concurrent readers need no locking. Per-scope {@code locals} maps are
 * populated once by {@link ScopeBinder} and read-only afterwards.</p>
 */
public final class SyntaxTree {
    private static final Logger logger = LogManager.getLogger(SyntaxTree.class);

    private static final int NO_PARENT = -1;
    private static final int UNSET = Integer.MIN_VALUE;

    private final Module root;
    private final Node[] nodes;
    private final int[] parents;
    private final IdentityHashMap<Node, Integer> indices;
    private final int[] fromLines;
    private final int[] toLines;
    private final IdentityHashMap<Scope, Map<String, List<Node>>> locals = new IdentityHashMap<>();

    private SyntaxTree(Module root, List<Node> order, int[] parents, IdentityHashMap<Node, Integer> indices) {
        this.root = root;
        this.nodes = order.toArray(new Node[0]);
        this.parents = parents;
        this.indices = indices;
        this.fromLines = new int[nodes.length];
        this.toLines = new int[nodes.length];
        Arrays.fill(fromLines, UNSET);
        Arrays.fill(toLines, UNSET);
    }

    /**
     * Builds the arena for {@code module} and binds every scope's locals.
     *
     * @throws MalformedTreeException if a node instance is reachable twice
     */
    public static SyntaxTree of(Module module) {
        List<Node> order = new ArrayList<>();
        List<Integer> parentOrder = new ArrayList<>();
        IdentityHashMap<Node, Integer> indices = new IdentityHashMap<>();

        record Pending(Node node, int parent) {}
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(module, NO_PARENT));
        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            Node node = pending.node();
            if (indices.containsKey(node)) {
                throw new MalformedTreeException(
                    node.type() + " at line " + node.line() + " appears more than once in the tree");
            }
            int index = order.size();
            indices.put(node, index);
            order.add(node);
            parentOrder.add(pending.parent());
            List<Node> children = NodeFields.children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Pending(children.get(i), index));
            }
        }

        int[] parents = new int[parentOrder.size()];
        for (int i = 0; i < parents.length; i++) {
            parents[i] = parentOrder.get(i);
        }
        SyntaxTree tree = new SyntaxTree(module, order, parents, indices);
        new ScopeBinder(tree).bind();
        logger.debug("Built tree for module {}: {} nodes, {} scopes", module.name(), parents.length, tree.locals.size());
        return tree;
    }

    public Module root() {
        return root;
    }

    public int size() {
        return nodes.length;
    }

    public boolean contains(Node node) {
        return indices.containsKey(node);
    }

    /**
     * All nodes in pre-order (source order for well-formed trees).
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(Arrays.asList(nodes));
    }

    /**
     * Returns the parent of {@code node}, or null for the root.
     */
    public Node parent(Node node) {
        int parent = parents[indexOf(node)];
        return parent == NO_PARENT ? null : nodes[parent];
    }

    public List<Node> children(Node node) {
        indexOf(node);
        return NodeFields.children(node);
    }

    /**
     * Whether {@code ancestor} is a strict ancestor of {@code node}.
     */
    public boolean isAncestor(Node ancestor, Node node) {
        int target = indexOf(ancestor);
        int current = parents[indexOf(node)];
        while (current != NO_PARENT) {
            if (current == target) {
                return true;
            }
            current = parents[current];
        }
        return false;
    }

    /**
     * The node itself if it is a statement, else its nearest statement
     * ancestor. The module stands in for nodes above every statement.
     */
    public Node enclosingStatement(Node node) {
        Node current = node;
        while (true) {
            if (current instanceof Statement || current instanceof Module) {
                return current;
            }
            current = requireParent(current);
        }
    }

    /**
     * The nearest scope at or above {@code node}. This is the frame whose
     * locals the lookup filter works against.
     */
    public Scope enclosingFrame(Node node) {
        Node current = node;
        while (!(current instanceof Scope)) {
            current = requireParent(current);
        }
        return (Scope) current;
    }

    /**
     * Like {@link #enclosingFrame(Node)}, except that names inside a decorator
     * list belong to the scope around the decorated definition.
     */
    public Scope enclosingScope(Node node) {
        Node current = node;
        while (!(current instanceof Scope)) {
            Node parent = requireParent(current);
            if (parent instanceof Decorators) {
                // skip the decorated function or class
                current = requireParent(requireParent(parent));
            } else {
                current = parent;
            }
        }
        return (Scope) current;
    }

    /**
     * Identifies which field of {@code parent} leads to {@code descendant}.
     *
     * @throws MalformedTreeException if {@code descendant} is not below {@code parent}
     */
    public ChildLocation locateChild(Node parent, Node descendant) {
        int parentIndex = indexOf(parent);
        int current = indexOf(descendant);
        while (current != NO_PARENT && parents[current] != parentIndex) {
            current = parents[current];
        }
        if (current == NO_PARENT) {
            throw new MalformedTreeException(
                descendant.type() + " is not a descendant of " + parent.type());
        }
        Node child = nodes[current];
        for (NodeFields.Field field : NodeFields.fields(parent)) {
            Object value = field.value();
            if (value == child) {
                return new ChildLocation(field.name(), child);
            }
            if (value instanceof List<?> list && containsIdentity(list, child)) {
                return new ChildLocation(field.name(), child);
            }
        }
        throw new MalformedTreeException(child.type() + " is not held by any field of " + parent.type());
    }

    /**
     * The construct governing a binding occurrence.
     *
     * @throws MalformedTreeException if no assign type is found
     */
    public AssignType assignType(Node node) {
        Node current = node;
        while (true) {
            if (current instanceof AssignType assignType) {
                return assignType;
            }
            if (!delegatesAssignType(current)) {
                throw new MalformedTreeException(
                    "Binding node " + node.type() + " at line " + node.line() + " has no assign type");
            }
            Node parent = parent(current);
            if (parent == null) {
                throw new MalformedTreeException(
                    "Binding node " + node.type() + " at line " + node.line() + " has no assign type");
            }
            current = parent;
        }
    }

    private static boolean delegatesAssignType(Node node) {
        return node instanceof AssignName
            || node instanceof DelName
            || node instanceof AssignAttr
            || node instanceof DelAttr
            || node instanceof Starred
            || node instanceof TupleLiteral
            || node instanceof ListLiteral
            || node instanceof WithItem;
    }

    /**
     * Whether {@code candidate} is a class definition listing {@code node}
     * among its bases.
     */
    public boolean definesBaseReferencing(Node candidate, Node node) {
        return candidate instanceof ClassDef classDef && classDef.hasBase(node);
    }

    /**
     * First source line of a node: its own line, else the first line found
     * down the chain of first children, else the nearest ancestor's line.
     * Returns 0 when no line is known anywhere.
     */
    public int fromLine(Node node) {
        int index = indexOf(node);
        int cached = fromLines[index];
        if (cached != UNSET) {
            return cached;
        }
        int line = fixedSourceLine(node);
        if (node instanceof Arguments) {
            Node function = parent(node);
            if (function != null) {
                line = Math.max(line, fromLine(function));
            }
        }
        fromLines[index] = line;
        return line;
    }

    private int fixedSourceLine(Node node) {
        int line = node.line();
        Node current = node;
        while (line == 0) {
            List<Node> children = NodeFields.children(current);
            if (children.isEmpty()) {
                break;
            }
            current = children.get(0);
            line = current.line();
        }
        current = parent(node);
        while (line == 0 && current != null) {
            line = current.line();
            current = parent(current);
        }
        return line;
    }

    /**
     * Last source line of a node: the last line of its last child, or its
     * first line if it has no children.
     */
    public int toLine(Node node) {
        int index = indexOf(node);
        int cached = toLines[index];
        if (cached != UNSET) {
            return cached;
        }
        Node current = node;
        Node last = NodeFields.lastChild(current);
        while (last != null) {
            current = last;
            last = NodeFields.lastChild(current);
        }
        int line = fromLine(current);
        toLines[index] = line;
        return line;
    }

    /**
     * The name to bindings map of {@code scope}, in source order.
     */
    public Map<String, List<Node>> locals(Scope scope) {
        indexOf(scope);
        Map<String, List<Node>> scopeLocals = locals.get(scope);
        return scopeLocals == null ? Map.of() : Collections.unmodifiableMap(scopeLocals);
    }

    public List<Node> localBindings(Scope scope, String name) {
        List<Node> bindings = locals(scope).get(name);
        return bindings == null ? List.of() : Collections.unmodifiableList(bindings);
    }

    void addLocal(Scope scope, String name, Node binding) {
        locals.computeIfAbsent(scope, s -> new LinkedHashMap<>())
            .computeIfAbsent(name, n -> new ArrayList<>())
            .add(binding);
    }

    private Node requireParent(Node node) {
        Node parent = parent(node);
        if (parent == null) {
            throw new MalformedTreeException(node.type() + " has no enclosing module");
        }
        return parent;
    }

    private int indexOf(Node node) {
        Integer index = indices.get(node);
        if (index == null) {
            throw new MalformedTreeException(node.type() + " at line " + node.line() + " is not part of this tree");
        }
        return index;
    }

    private static boolean containsIdentity(List<?> list, Object element) {
        for (Object candidate : list) {
            if (candidate == element) {
                return true;
            }
        }
        return false;
    }
}
