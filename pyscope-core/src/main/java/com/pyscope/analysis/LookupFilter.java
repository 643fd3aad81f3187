package com.pyscope.analysis;

import com.pyscope.ast.AssignName;
import com.pyscope.ast.AssignType;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.Comprehension;
import com.pyscope.ast.Const;
import com.pyscope.ast.DelName;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.Import;
import com.pyscope.ast.ImportFrom;
import com.pyscope.ast.Name;
import com.pyscope.ast.Node;
import com.pyscope.ast.Scope;
import com.pyscope.tree.SyntaxTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Narrows the bindings of a name in one scope down to those that can still
 * be live at a given use site.
 *
 * <p>The scan walks the candidates in source order and keeps an accumulator
 * of live bindings. Later unconditional assignments in the same block drop
 * earlier ones, loop and comprehension targets shadow everything before them
 * when the use sits inside their construct, deletions reset the accumulator,
 * and bindings on branches exclusive with the use are never kept.</p>
 */
public final class LookupFilter {
    private static final Logger logger = LogManager.getLogger(LookupFilter.class);

    /**
     * Offset for names that must resolve as seen from the scope around the
     * current frame: class bases, argument defaults, builtin-named decorators.
     */
    public static final int OUTER_FRAME_OFFSET = -1;

    private final SyntaxTree tree;
    private final BranchExclusivity exclusivity;

    public LookupFilter(SyntaxTree tree) {
        this(tree, new BranchExclusivity(tree));
    }

    public LookupFilter(SyntaxTree tree, BranchExclusivity exclusivity) {
        this.tree = tree;
        this.exclusivity = exclusivity;
    }

    /**
     * Filters {@code candidates}, the ordered bindings of one name in
     * {@code home}, for a use at {@code use}.
     *
     * @param offset 0, or {@link #OUTER_FRAME_OFFSET}
     * @return {@code candidates} itself when the use is not in {@code home},
     *         otherwise a new list of the reachable bindings
     * @throws com.pyscope.tree.MalformedTreeException if a candidate has no assign type
     */
    public List<Node> filter(Node use, List<Node> candidates, Scope home, int offset) {
        Scope useFrame = offset == OUTER_FRAME_OFFSET ? outerFrameOf(use) : definingFrameOf(use);
        if (useFrame != home || use == home) {
            return candidates;
        }

        Node useStatement = tree.enclosingStatement(use);
        Node useBlock = tree.parent(useStatement);
        int horizon = tree.fromLine(useStatement) + offset;

        List<Node> live = new ArrayList<>();
        List<Node> liveBlocks = new ArrayList<>();
        for (Node candidate : candidates) {
            Node statement = tree.enclosingStatement(candidate);
            Node block = tree.parent(statement);
            if (horizon > 0 && tree.fromLine(statement) > horizon) {
                break;
            }
            AssignType assignType = tree.assignType(candidate);

            if (tree.definesBaseReferencing(candidate, use)) {
                break;
            }

            Optional<List<Node>> shortCircuit = shortCircuit(assignType, candidate, use, useStatement, live);
            if (shortCircuit.isPresent()) {
                logger.trace("{} at line {} ends the scan", candidate.type(), candidate.line());
                return shortCircuit.get();
            }

            boolean optional = assignType.optionalAssign();
            if (optional && tree.isAncestor(assignType, use)) {
                // the use runs inside the loop: its target hides earlier bindings
                live = new ArrayList<>(List.of(candidate));
                liveBlocks = new ArrayList<>(Collections.singletonList(block));
                continue;
            }

            int sameBlock = indexOfIdentity(liveBlocks, block);
            if (sameBlock >= 0) {
                Node earlier = live.get(sameBlock);
                if (tree.isAncestor(tree.assignType(earlier), assignType)) {
                    continue;
                }
                if (!optional && !exclusivity.areExclusive(earlier, candidate)) {
                    live.remove(sameBlock);
                    liveBlocks.remove(sameBlock);
                }
            }

            if (candidate instanceof AssignName) {
                if (!optional && block == useBlock) {
                    live.clear();
                    liveBlocks.clear();
                }
            } else if (candidate instanceof DelName) {
                live.clear();
                liveBlocks.clear();
                continue;
            }

            if (!exclusivity.areExclusive(use, candidate)) {
                live.add(candidate);
                liveBlocks.add(block);
            }
        }
        logger.debug("{} of {} bindings reach {} at line {}", live.size(), candidates.size(), use.type(), use.line());
        return live;
    }

    /**
     * Per binding construct rule that can end the scan early. Empty means the
     * scan goes on.
     */
    private Optional<List<Node>> shortCircuit(AssignType assignType, Node candidate, Node use,
                                              Node useStatement, List<Node> live) {
        if (assignType instanceof Comprehension) {
            if (assignType == useStatement) {
                return use instanceof Name || use instanceof Const
                    ? Optional.of(List.of(use))
                    : Optional.empty();
            }
            return tree.enclosingStatement(assignType) == useStatement
                ? Optional.of(List.of(candidate))
                : Optional.empty();
        }
        if (assignType instanceof FunctionDef
                || assignType instanceof ClassDef
                || assignType instanceof Import
                || assignType instanceof ImportFrom) {
            return tree.enclosingStatement(assignType) == useStatement
                ? Optional.of(List.of(candidate))
                : Optional.empty();
        }
        // Assign, AugAssign, For, With, Delete, ExceptHandler, Arguments
        if (assignType == useStatement) {
            return Optional.of(live);
        }
        if (tree.enclosingStatement(assignType) == useStatement) {
            return Optional.of(List.of(candidate));
        }
        return Optional.empty();
    }

    /**
     * The frame around the use's own frame. A module has nothing around it
     * and stands for itself.
     */
    private Scope outerFrameOf(Node use) {
        Scope frame = tree.enclosingFrame(use);
        Node parent = tree.parent(frame);
        return parent == null ? frame : tree.enclosingFrame(parent);
    }

    /**
     * The use's frame, except for uses in a definition header (argument
     * defaults, annotations): those run in the frame around the definition.
     */
    private Scope definingFrameOf(Node use) {
        Scope frame = tree.enclosingFrame(use);
        Node parent = tree.parent(frame);
        if (tree.enclosingStatement(use) == frame && parent != null) {
            return tree.enclosingFrame(parent);
        }
        return frame;
    }

    private static int indexOfIdentity(List<Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
