package com.pyscope.inference;

import com.pyscope.ast.Const;
import com.pyscope.ast.DictLiteral;
import com.pyscope.ast.Expression;
import com.pyscope.ast.ListLiteral;
import com.pyscope.ast.Node;
import com.pyscope.ast.TupleLiteral;
import com.pyscope.ast.Uninferable;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Item access on literal containers.
 */
public final class Containers {

    private Containers() {
        // Utility class
    }

    /**
     * Indexes a list, tuple, string constant or dict literal.
     *
     * @param keyInference infers dict keys; unused for sequences
     * @throws ItemNotFoundException if the container has no item for {@code key}
     */
    public static Node getItem(Node container, Object key, Function<Node, List<Node>> keyInference) {
        if (container instanceof ListLiteral list) {
            return sequenceItem(list.elts(), key);
        }
        if (container instanceof TupleLiteral tuple) {
            return sequenceItem(tuple.elts(), key);
        }
        if (container instanceof Const constant && constant.value() instanceof String text) {
            int index = normalizeIndex(key, text.codePointCount(0, text.length()));
            int codePoint = text.codePointAt(text.offsetByCodePoints(0, index));
            return new Const(constant.line(), constant.col(), new String(Character.toChars(codePoint)));
        }
        if (container instanceof DictLiteral dict) {
            return dictItem(dict, key, keyInference);
        }
        throw new ItemNotFoundException(key, container.type() + " does not support item access");
    }

    private static Node sequenceItem(List<Expression> elts, Object key) {
        return elts.get(normalizeIndex(key, elts.size()));
    }

    private static int normalizeIndex(Object key, int size) {
        if (!isIntegral(key)) {
            throw new ItemNotFoundException(key, "Sequence index must be an integer: " + key);
        }
        long index = ((Number) key).longValue();
        if (index < 0) {
            index += size;
        }
        if (index < 0 || index >= size) {
            throw new ItemNotFoundException(key, "Index out of range: " + key);
        }
        return (int) index;
    }

    private static Node dictItem(DictLiteral dict, Object key, Function<Node, List<Node>> keyInference) {
        for (int i = 0; i < dict.keys().size(); i++) {
            for (Node inferredKey : keyInference.apply(dict.keys().get(i))) {
                if (inferredKey == Uninferable.INSTANCE) {
                    continue;
                }
                if (inferredKey instanceof Const constant && constEquals(constant.value(), key)) {
                    return dict.values().get(i);
                }
            }
        }
        throw new ItemNotFoundException(key);
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte
            || value instanceof BigInteger;
    }

    /**
     * Compares constant values the way the source language does for numbers:
     * {@code 1 == 1.0}.
     */
    static boolean constEquals(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            if (isIntegral(a) && isIntegral(b)) {
                return a.longValue() == b.longValue();
            }
            return a.doubleValue() == b.doubleValue();
        }
        return Objects.equals(left, right);
    }
}
