package com.pyscope.inference;

import com.pyscope.ast.Node;

import java.util.stream.Stream;

/**
 * Computes the possible values of a node. Values are nodes themselves:
 * literals, definitions, or {@link com.pyscope.ast.Uninferable}.
 */
public interface Inferrer {

    /**
     * @return a finite stream of possible values, never empty
     */
    Stream<Node> infer(Node node, InferenceContext context);
}
