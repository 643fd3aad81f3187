package com.pyscope.ast;

import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Generic access to the named fields of a node.
 *
 * <p>Fields are the record components in declaration order, without the
 * position components. A field holds a node, a list of nodes, or a literal
 * (string, number, alias list). Null entries are absent children.</p>
 */
public final class NodeFields {

    private static final Set<String> POSITION_COMPONENTS = Set.of("line", "col");

    private static final ClassValue<List<RecordComponent>> COMPONENTS = new ClassValue<>() {
        @Override
        protected List<RecordComponent> computeValue(Class<?> type) {
            RecordComponent[] components = type.getRecordComponents();
            if (components == null) {
                return List.of();
            }
            return Arrays.stream(components)
                .filter(c -> !POSITION_COMPONENTS.contains(c.getName()))
                .toList();
        }
    };

    public record Field(String name, Object value) {}

    private NodeFields() {
        // Utility class
    }

    public static List<Field> fields(Node node) {
        List<RecordComponent> components = COMPONENTS.get(node.getClass());
        List<Field> fields = new ArrayList<>(components.size());
        for (RecordComponent component : components) {
            fields.add(new Field(component.getName(), read(component, node)));
        }
        return fields;
    }

    /**
     * Child nodes in field declaration order, skipping absent children.
     */
    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (RecordComponent component : COMPONENTS.get(node.getClass())) {
            Object value = read(component, node);
            if (value instanceof Node child) {
                children.add(child);
            } else if (value instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Node child) {
                        children.add(child);
                    }
                }
            }
        }
        return children;
    }

    public static Node lastChild(Node node) {
        List<Node> children = children(node);
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * The node and all its descendants, in pre-order.
     */
    public static List<Node> walk(Node root) {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            result.add(node);
            List<Node> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    private static Object read(RecordComponent component, Node node) {
        try {
            return component.getAccessor().invoke(node);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException(
                "Cannot read field '" + component.getName() + "' of " + node.type(), e);
        }
    }
}
