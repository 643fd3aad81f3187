package com.pyscope.inference;

import com.pyscope.ast.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * State of one inference: the nodes currently being inferred, and how deep
 * the inference has gone. Not thread-safe; use one context per call.
 */
public final class InferenceContext {
    private static final Logger logger = LogManager.getLogger(InferenceContext.class);

    private final Set<Node> path = Collections.newSetFromMap(new IdentityHashMap<>());
    private final int maxDepth;
    private int depth;

    public InferenceContext(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Marks {@code node} as being inferred.
     *
     * @return false if the node is already being inferred or the depth limit
     *         is reached, in which case nothing is recorded
     */
    public boolean enter(Node node) {
        if (path.contains(node)) {
            logger.trace("Recursive inference of {} at line {}", node.type(), node.line());
            return false;
        }
        if (depth >= maxDepth) {
            logger.warn("Inference depth limit {} reached at {} line {}", maxDepth, node.type(), node.line());
            return false;
        }
        path.add(node);
        depth++;
        return true;
    }

    public void leave(Node node) {
        if (path.remove(node)) {
            depth--;
        }
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
