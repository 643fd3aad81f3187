package com.pyscope.analysis;

import com.pyscope.ast.AssignName;
import com.pyscope.ast.AugAssign;
import com.pyscope.ast.Call;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.Comprehension;
import com.pyscope.ast.Expression;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.ListComp;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.Node;
import com.pyscope.ast.Pass;
import com.pyscope.ast.Return;
import com.pyscope.ast.With;
import com.pyscope.ast.WithItem;
import com.pyscope.tree.MalformedTreeException;
import com.pyscope.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pyscope.Py.*;
import static org.junit.jupiter.api.Assertions.*;

public class LookupFilterTest {

    private static List<Node> filter(SyntaxTree tree, Node use, String name) {
        Module module = tree.root();
        return new LookupFilter(tree).filter(use, tree.localBindings(module, name), module, 0);
    }

    private static void assertBindings(List<? extends Node> expected, List<Node> actual) {
        assertEquals(expected.size(), actual.size(), "bindings: " + actual);
        for (int i = 0; i < expected.size(); i++) {
            assertSame(expected.get(i), actual.get(i), "binding " + i);
        }
    }

    @Test
    void testLoopTargetHidesEarlierBindingInsideLoop() {
        // x = 10
        // for x in range(5):
        //     print(x)
        // if x > 0:
        //     print('#' * x)
        AssignName initial = target(1, "x");
        AssignName loopTarget = target(2, "x");
        Name inLoop = name(3, "x");
        Name inTest = name(4, "x");
        Name inIf = name(5, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, initial, num(1, 10)),
            forStmt(2, loopTarget, call(2, "range", num(2, 5)), print(3, inLoop)),
            ifStmt(4, greater(4, inTest, num(4, 0)),
                block(print(5, binOp(5, num(5, "#"), "*", inIf))), block())));

        assertBindings(List.of(loopTarget), filter(tree, inLoop, "x"));
        // the loop may run zero times
        assertBindings(List.of(initial, loopTarget), filter(tree, inTest, "x"));
        assertBindings(List.of(initial, loopTarget), filter(tree, inIf, "x"));
    }

    @Test
    void testSequentialReassignment() {
        AssignName first = target(1, "x");
        AssignName second = target(2, "x");
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, first, num(1, 1)),
            assign(2, second, num(2, 2)),
            print(3, use)));

        assertBindings(List.of(second), filter(tree, use, "x"));
    }

    @Test
    void testExclusiveBranchesAreBothKept() {
        AssignName inBody = target(2, "x");
        AssignName inElse = target(4, "x");
        Name use = name(5, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            ifStmt(1, name(1, "c"),
                block(assign(2, inBody, num(2, 1))),
                block(assign(4, inElse, num(4, 2)))),
            print(5, use)));

        assertBindings(List.of(inBody, inElse), filter(tree, use, "x"));
    }

    @Test
    void testAssignmentAfterBranchesDominates() {
        AssignName after = target(5, "x");
        Name use = name(6, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            ifStmt(1, name(1, "c"),
                block(assign(2, "x", num(2, 1))),
                block(assign(4, "x", num(4, 2)))),
            assign(5, after, num(5, 3)),
            print(6, use)));

        assertBindings(List.of(after), filter(tree, use, "x"));
    }

    @Test
    void testUseInsideBranchIgnoresOtherBranch() {
        // x = 0
        // if c:
        //     x = 1
        // else:
        //     if d:
        //         print(x)
        AssignName before = target(1, "x");
        AssignName inBody = target(3, "x");
        Name inElse = name(6, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, before, num(1, 0)),
            ifStmt(2, name(2, "c"),
                block(assign(3, inBody, num(3, 1))),
                block(ifStmt(5, name(5, "d"), block(print(6, inElse)), block())))));

        assertBindings(List.of(before), filter(tree, inElse, "x"));
    }

    @Test
    void testDeletionClearsEarlierBindings() {
        Name afterDelete = name(3, "x");
        AssignName rebound = target(4, "x");
        Name afterRebind = name(5, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, "x", num(1, 1)),
            delete(2, "x"),
            print(3, afterDelete),
            assign(4, rebound, num(4, 2)),
            print(5, afterRebind)));

        assertTrue(filter(tree, afterDelete, "x").isEmpty());
        assertBindings(List.of(rebound), filter(tree, afterRebind, "x"));
    }

    @Test
    void testSelfReferencingAssignmentSeesPreviousBinding() {
        // x = 1
        // x = x + 1
        AssignName first = target(1, "x");
        Name use = name(2, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, first, num(1, 1)),
            assign(2, "x", binOp(2, use, "+", num(2, 1)))));

        assertBindings(List.of(first), filter(tree, use, "x"));
    }

    @Test
    void testLaterBindingsAreBeyondHorizon() {
        Name use = name(1, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            print(1, use),
            assign(2, "x", num(2, 1))));

        assertTrue(filter(tree, use, "x").isEmpty());
    }

    @Test
    void testMissingLinesDisableHorizon() {
        Name use = name(0, "x");
        AssignName later = target(0, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            print(0, use),
            assign(0, later, num(0, 1))));

        assertBindings(List.of(later), filter(tree, use, "x"));
    }

    @Test
    void testAssignmentInsideLoopOverridesLoopTarget() {
        // for x in y:
        //     x = 3
        //     print(x)
        AssignName inner = target(2, "x");
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            forStmt(1, target(1, "x"), name(1, "y"),
                assign(2, inner, num(2, 3)),
                print(3, use))));

        assertBindings(List.of(inner), filter(tree, use, "x"));
    }

    @Test
    void testComprehensionTargetResolvesWithinItsStatement() {
        // x = 5
        // r = [x for x in y]
        Name element = name(2, "x");
        AssignName comprehensionTarget = target(2, "x");
        ListComp listComp = new ListComp(2, 0, element,
            List.of(new Comprehension(2, 0, comprehensionTarget, name(2, "y"), List.of())));
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, "x", num(1, 5)),
            assign(2, "r", listComp)));

        assertBindings(List.of(comprehensionTarget), filter(tree, element, "x"));
    }

    @Test
    void testHandlerNameIsVisibleInHandler() {
        AssignName caught = target(3, "e");
        Name use = name(4, "e");
        SyntaxTree tree = SyntaxTree.of(module(
            tryExcept(1,
                block(new Pass(2, 0)),
                List.of(handler(3, "ValueError", caught, print(4, use))),
                block())));

        assertBindings(List.of(caught), filter(tree, use, "e"));
    }

    @Test
    void testClassBaseCannotSeeItsOwnClass() {
        // A = 1
        // class A(A): pass
        AssignName first = target(0, "A");
        Name base = name(0, "A");
        ClassDef classDef = classDef(0, "A", List.of(base), new Pass(0, 0));
        SyntaxTree tree = SyntaxTree.of(module(assign(0, first, num(0, 1)), classDef));
        Module module = tree.root();

        List<Node> bindings = new LookupFilter(tree).filter(
            base, tree.localBindings(module, "A"), module, LookupFilter.OUTER_FRAME_OFFSET);

        assertBindings(List.of(first), bindings);
    }

    @Test
    void testUseInOtherFrameReturnsCandidatesUnchanged() {
        Name inFunction = name(3, "x");
        FunctionDef function = def(2, "f", args(2), new Return(3, 0, inFunction));
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, "x", num(1, 1)),
            function,
            assign(4, "x", num(4, 2))));
        List<Node> candidates = tree.localBindings(tree.root(), "x");

        List<Node> filtered = new LookupFilter(tree).filter(inFunction, candidates, tree.root(), 0);

        assertSame(candidates, filtered);
    }

    @Test
    void testFilteringIsRepeatable() {
        Name use = name(5, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            ifStmt(1, name(1, "c"),
                block(assign(2, "x", num(2, 1))),
                block(assign(4, "x", num(4, 2)))),
            print(5, use)));

        List<Node> first = filter(tree, use, "x");
        List<Node> second = filter(tree, use, "x");
        assertBindings(first, second);
    }

    @Test
    void testBindingWithoutAssignTypeIsRejected() {
        Name use = name(2, "x");
        Expression misplaced = target(1, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            expr(1, new Call(1, 0, name(1, "f"), List.of(misplaced), List.of())),
            print(2, use)));

        assertThrows(MalformedTreeException.class, () -> filter(tree, use, "x"));
    }

    @Test
    void testComprehensionTargetNestedInLoopHeaderKeepsLoopTarget() {
        // for x in [1 for x in z]:
        //     pass
        // print(x)
        AssignName loopTarget = target(1, "x");
        AssignName comprehensionTarget = target(1, "x");
        ListComp listComp = new ListComp(1, 0, num(1, 1),
            List.of(new Comprehension(1, 0, comprehensionTarget, name(1, "z"), List.of())));
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            forStmt(1, loopTarget, listComp, new Pass(2, 0)),
            print(3, use)));

        assertBindings(List.of(loopTarget, comprehensionTarget), tree.localBindings(tree.root(), "x"));
        assertBindings(List.of(loopTarget), filter(tree, use, "x"));
    }

    @Test
    void testWithTargetHidesEarlierBindingInsideBlock() {
        // x = 0
        // with open() as x:
        //     print(x)
        AssignName initial = target(1, "x");
        AssignName alias = target(2, "x");
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, initial, num(1, 0)),
            new With(2, 0, List.of(new WithItem(2, 0, call(2, "open"), alias)), block(print(3, use)))));

        assertBindings(List.of(alias), filter(tree, use, "x"));
    }

    @Test
    void testWithTargetIsOptionalAfterBlock() {
        // x = 0
        // with open() as x:
        //     pass
        // print(x)
        AssignName initial = target(1, "x");
        AssignName alias = target(2, "x");
        Name use = name(4, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, initial, num(1, 0)),
            new With(2, 0, List.of(new WithItem(2, 0, call(2, "open"), alias)), block(new Pass(3, 0))),
            print(4, use)));

        assertBindings(List.of(initial, alias), filter(tree, use, "x"));
    }

    @Test
    void testAugmentedAssignmentReplacesEarlierBinding() {
        // x = 1
        // x += 1
        // print(x)
        AssignName augmented = target(2, "x");
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, "x", num(1, 1)),
            new AugAssign(2, 0, augmented, "+", num(2, 1)),
            print(3, use)));

        assertBindings(List.of(augmented), filter(tree, use, "x"));
    }
}
