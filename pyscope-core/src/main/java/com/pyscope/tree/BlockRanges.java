package com.pyscope.tree;

import com.pyscope.ast.BlockRange;
import com.pyscope.ast.ExceptHandler;
import com.pyscope.ast.For;
import com.pyscope.ast.If;
import com.pyscope.ast.Statement;
import com.pyscope.ast.TryExcept;
import com.pyscope.ast.TryFinally;
import com.pyscope.ast.While;
import com.pyscope.ast.With;

import java.util.List;

/**
 * Line spans of the sub-blocks of compound statements.
 */
public final class BlockRanges {

    private BlockRanges() {
        // Utility class
    }

    /**
     * Returns the span, starting at {@code line}, of the block of {@code node}
     * that contains {@code line}.
     */
    public static LineRange blockRange(SyntaxTree tree, BlockRange node, int line) {
        if (node instanceof If ifNode) {
            return ifRange(tree, ifNode, line);
        }
        if (node instanceof For forNode) {
            return elsedRange(tree, node, line, forNode.orelse(), 0);
        }
        if (node instanceof While whileNode) {
            return elsedRange(tree, node, line, whileNode.orelse(), 0);
        }
        if (node instanceof TryExcept tryExcept) {
            return tryExceptRange(tree, tryExcept, line);
        }
        if (node instanceof TryFinally tryFinally) {
            return tryFinallyRange(tree, tryFinally, line);
        }
        if (node instanceof With) {
            return new LineRange(line, tree.toLine(node));
        }
        throw new IllegalArgumentException("Unsupported block node: " + node.type());
    }

    private static LineRange ifRange(SyntaxTree tree, If node, int line) {
        List<Statement> body = node.body();
        if (body.isEmpty()) {
            return elsedRange(tree, node, line, node.orelse(), 0);
        }
        if (line == tree.fromLine(body.get(0))) {
            return new LineRange(line, line);
        }
        int bodyEnd = tree.toLine(body.get(body.size() - 1));
        if (line <= bodyEnd) {
            return new LineRange(line, bodyEnd);
        }
        return elsedRange(tree, node, line, node.orelse(), tree.fromLine(body.get(0)) - 1);
    }

    private static LineRange tryExceptRange(SyntaxTree tree, TryExcept node, int line) {
        int last = 0;
        for (ExceptHandler handler : node.handlers()) {
            if (handler.exceptionType() != null && line == tree.fromLine(handler.exceptionType())) {
                return new LineRange(line, line);
            }
            List<Statement> body = handler.body();
            if (!body.isEmpty()) {
                int start = tree.fromLine(body.get(0));
                int end = tree.toLine(body.get(body.size() - 1));
                if (start <= line && line <= end) {
                    return new LineRange(line, end);
                }
                if (last == 0) {
                    last = start - 1;
                }
            }
        }
        return elsedRange(tree, node, line, node.orelse(), last);
    }

    private static LineRange tryFinallyRange(SyntaxTree tree, TryFinally node, int line) {
        // try/except/finally in one statement: lines of the inner try are its own
        if (!node.body().isEmpty() && node.body().get(0) instanceof TryExcept inner
                && tree.fromLine(inner) == tree.fromLine(node)
                && line > tree.fromLine(node)
                && line <= tree.toLine(inner)) {
            return tryExceptRange(tree, inner, line);
        }
        return elsedRange(tree, node, line, node.finalbody(), 0);
    }

    private static LineRange elsedRange(SyntaxTree tree, BlockRange node, int line, List<Statement> orelse, int last) {
        if (line == tree.fromLine(node)) {
            return new LineRange(line, line);
        }
        if (!orelse.isEmpty()) {
            int elseStart = tree.fromLine(orelse.get(0));
            if (line >= elseStart) {
                return new LineRange(line, tree.toLine(orelse.get(orelse.size() - 1)));
            }
            return new LineRange(line, elseStart - 1);
        }
        return new LineRange(line, last != 0 ? last : tree.toLine(node));
    }
}
