package com.pyscope.json;

import com.pyscope.AnalyzerOptions;
import com.pyscope.ScopeAnalyzer;
import com.pyscope.ast.AssignAttr;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.DelAttr;
import com.pyscope.ast.DelName;
import com.pyscope.ast.Module;
import com.pyscope.ast.Node;
import com.pyscope.tree.MalformedTreeException;
import com.pyscope.tree.SyntaxTree;

/**
 * Reads syntax trees produced by a front end from JSON.
 *
 * <p>Implementations only need to map JSON to node records. Building and
 * checking the tree is shared: {@link #deserializeTree(String)} rejects trees
 * the lookup filter would fail on, so a bad front end output surfaces here as
 * a {@link TreeJsonException} rather than later in the middle of a lookup.</p>
 */
public interface TreeJsonDeserializer {

    /**
     * @throws TreeJsonException if the JSON is not a module
     */
    Module deserializeModule(String json) throws TreeJsonException;

    /**
     * Reads a single node of the given kind, for fragments and tests.
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws TreeJsonException;

    /**
     * Reads a module and builds its tree, checking that every binding
     * occurrence sits under a binding construct.
     *
     * @throws TreeJsonException if the JSON cannot be read or the tree is malformed
     */
    default SyntaxTree deserializeTree(String json) throws TreeJsonException {
        Module module = deserializeModule(json);
        Node current = module;
        try {
            SyntaxTree tree = SyntaxTree.of(module);
            for (Node node : tree.nodes()) {
                current = node;
                if (node instanceof AssignName || node instanceof DelName
                        || node instanceof AssignAttr || node instanceof DelAttr) {
                    tree.assignType(node);
                }
            }
            return tree;
        } catch (MalformedTreeException e) {
            throw new TreeJsonException("Malformed tree in module " + module.name() + ": " + e.getMessage(),
                current.type(), e);
        }
    }

    /**
     * Reads a module and returns an analyzer over it.
     *
     * @throws TreeJsonException if the JSON cannot be read or the tree is malformed
     */
    default ScopeAnalyzer deserializeAnalyzer(String json, AnalyzerOptions options) throws TreeJsonException {
        return ScopeAnalyzer.of(deserializeTree(json), options);
    }
}
