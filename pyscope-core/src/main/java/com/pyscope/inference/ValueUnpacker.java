package com.pyscope.inference;

import com.pyscope.ast.ListLiteral;
import com.pyscope.ast.Node;
import com.pyscope.ast.TupleLiteral;
import com.pyscope.ast.Uninferable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Flattens the values of a node that may denote nested literal containers
 * into the terminal values inside them.
 */
public final class ValueUnpacker {
    private static final Logger logger = LogManager.getLogger(ValueUnpacker.class);

    private final Inferrer inferrer;
    private final int maxDepth;

    public ValueUnpacker(Inferrer inferrer, int maxDepth) {
        this.inferrer = inferrer;
        this.maxDepth = maxDepth;
    }

    /**
     * Returns a lazy stream of terminal values. Nothing is inferred until the
     * stream is consumed; every call starts from scratch.
     */
    public Stream<Node> unpack(Node node) {
        return Stream.of(node).flatMap(n -> unpack(n, 0));
    }

    private Stream<Node> unpack(Node node, int depth) {
        if (depth > maxDepth) {
            logger.warn("Unpacking stopped at depth {} on {} line {}", maxDepth, node.type(), node.line());
            return Stream.of(Uninferable.INSTANCE);
        }
        if (node instanceof ListLiteral list) {
            return list.elts().stream().flatMap(element -> unpack(element, depth + 1));
        }
        if (node instanceof TupleLiteral tuple) {
            return tuple.elts().stream().flatMap(element -> unpack(element, depth + 1));
        }
        Optional<Node> first = inferrer.infer(node, newContext()).findFirst();
        if (first.isEmpty()) {
            return Stream.empty();
        }
        if (first.get() == node) {
            return Stream.of(node);
        }
        return inferrer.infer(node, newContext())
            .flatMap(value -> value == Uninferable.INSTANCE
                ? Stream.of(value)
                : unpack(value, depth + 1));
    }

    private InferenceContext newContext() {
        return new InferenceContext(maxDepth);
    }
}
