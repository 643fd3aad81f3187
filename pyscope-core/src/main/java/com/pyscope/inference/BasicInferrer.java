package com.pyscope.inference;

import com.pyscope.analysis.LookupResult;
import com.pyscope.analysis.NameResolver;
import com.pyscope.ast.Arguments;
import com.pyscope.ast.Assign;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.BinOp;
import com.pyscope.ast.BoolOp;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.Const;
import com.pyscope.ast.DictComp;
import com.pyscope.ast.DictLiteral;
import com.pyscope.ast.Expression;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.GeneratorExp;
import com.pyscope.ast.IfExp;
import com.pyscope.ast.Lambda;
import com.pyscope.ast.ListComp;
import com.pyscope.ast.ListLiteral;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.NoDefaultException;
import com.pyscope.ast.Node;
import com.pyscope.ast.SetComp;
import com.pyscope.ast.SetLiteral;
import com.pyscope.ast.Subscript;
import com.pyscope.ast.TupleLiteral;
import com.pyscope.ast.Uninferable;
import com.pyscope.tree.SyntaxTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Small eager inferrer over one tree, with an optional inferrer for the
 * builtins tree that names may resolve into.
 *
 * <p>Handles constants and literal containers, names through
 * {@link NameResolver}, plain and tuple-unpacking assignments, argument
 * defaults, sequence repetition and concatenation, constant arithmetic,
 * subscripts on literals, and conditional expressions. Anything else is
 * {@link Uninferable}.</p>
 */
public final class BasicInferrer implements Inferrer {
    private static final Logger logger = LogManager.getLogger(BasicInferrer.class);

    static final int MAX_SEQUENCE_LENGTH = 10_000;

    private final SyntaxTree tree;
    private final NameResolver resolver;
    private final BasicInferrer builtins;  // Can be null

    public BasicInferrer(SyntaxTree tree, NameResolver resolver) {
        this(tree, resolver, null);
    }

    public BasicInferrer(SyntaxTree tree, NameResolver resolver, BasicInferrer builtins) {
        this.tree = tree;
        this.resolver = resolver;
        this.builtins = builtins;
    }

    @Override
    public Stream<Node> infer(Node node, InferenceContext context) {
        return inferAll(node, context).stream();
    }

    List<Node> inferAll(Node node, InferenceContext context) {
        if (isSelfInferring(node)) {
            return List.of(node);
        }
        BasicInferrer owner = ownerOf(node);
        if (!context.enter(node)) {
            return List.of(Uninferable.INSTANCE);
        }
        try {
            List<Node> values = owner.inferNode(node, context);
            return values.isEmpty() ? List.of(Uninferable.INSTANCE) : values;
        } finally {
            context.leave(node);
        }
    }

    /**
     * The single value of {@code node}, or {@link Uninferable} when there is
     * none or more than one.
     */
    Node safeInfer(Node node, InferenceContext context) {
        List<Node> values = inferAll(node, context);
        return values.size() == 1 ? values.get(0) : Uninferable.INSTANCE;
    }

    private static boolean isSelfInferring(Node node) {
        return node instanceof Const
            || node instanceof ListLiteral
            || node instanceof TupleLiteral
            || node instanceof SetLiteral
            || node instanceof DictLiteral
            || node instanceof ListComp
            || node instanceof SetComp
            || node instanceof DictComp
            || node instanceof GeneratorExp
            || node instanceof FunctionDef
            || node instanceof ClassDef
            || node instanceof Lambda
            || node instanceof Module
            || node == Uninferable.INSTANCE;
    }

    private BasicInferrer ownerOf(Node node) {
        if (!tree.contains(node) && builtins != null && builtins.tree.contains(node)) {
            return builtins;
        }
        return this;
    }

    private List<Node> inferNode(Node node, InferenceContext context) {
        if (node instanceof Name name) {
            return inferName(name, context);
        }
        if (node instanceof AssignName assignName) {
            return inferAssignName(assignName, context);
        }
        if (node instanceof BinOp binOp) {
            return inferBinOp(binOp, context);
        }
        if (node instanceof Subscript subscript) {
            return inferSubscript(subscript, context);
        }
        if (node instanceof IfExp ifExp) {
            List<Node> values = new ArrayList<>(inferAll(ifExp.body(), context));
            values.addAll(inferAll(ifExp.orelse(), context));
            return values;
        }
        if (node instanceof BoolOp boolOp) {
            List<Node> values = new ArrayList<>();
            for (Expression value : boolOp.values()) {
                values.addAll(inferAll(value, context));
            }
            return values;
        }
        return List.of(Uninferable.INSTANCE);
    }

    private List<Node> inferName(Name name, InferenceContext context) {
        if (!tree.contains(name)) {
            return List.of(Uninferable.INSTANCE);
        }
        LookupResult result = resolver.lookup(name);
        if (!result.isResolved()) {
            logger.debug("Name '{}' at line {} is unresolved", name.name(), name.line());
            return List.of(Uninferable.INSTANCE);
        }
        List<Node> values = new ArrayList<>();
        for (Node binding : result.bindings()) {
            values.addAll(inferBinding(binding, context));
        }
        return values;
    }

    private List<Node> inferBinding(Node binding, InferenceContext context) {
        if (binding instanceof FunctionDef || binding instanceof ClassDef) {
            return List.of(binding);
        }
        if (binding instanceof AssignName) {
            return inferAll(binding, context);
        }
        // imports, deletions, and the use itself for comprehension targets
        return List.of(Uninferable.INSTANCE);
    }

    private List<Node> inferAssignName(AssignName target, InferenceContext context) {
        if (!tree.contains(target)) {
            return List.of(Uninferable.INSTANCE);
        }
        Node parent = tree.parent(target);
        if (parent instanceof Assign assign) {
            return inferAll(assign.value(), context);
        }
        if (parent instanceof Arguments args) {
            return inferArgument(args, target, context);
        }
        if ((parent instanceof TupleLiteral || parent instanceof ListLiteral)
                && tree.parent(parent) instanceof Assign assign) {
            List<Expression> targets = elementsOf(parent);
            int index = indexOfIdentity(targets, target);
            List<Node> values = new ArrayList<>();
            for (Node value : inferAll(assign.value(), context)) {
                List<Expression> elements = elementsOf(value);
                if (elements != null && elements.size() == targets.size()) {
                    values.addAll(inferAll(elements.get(index), context));
                } else {
                    values.add(Uninferable.INSTANCE);
                }
            }
            return values;
        }
        return List.of(Uninferable.INSTANCE);
    }

    /**
     * Without a call site an argument can be its default value, or anything.
     */
    private List<Node> inferArgument(Arguments args, AssignName target, InferenceContext context) {
        List<Node> values = new ArrayList<>();
        try {
            values.addAll(inferAll(args.defaultValue(target.name()), context));
        } catch (NoDefaultException e) {
            logger.trace("Argument '{}' has no default", e.getArgName());
        }
        values.add(Uninferable.INSTANCE);
        return values;
    }

    private List<Node> inferBinOp(BinOp binOp, InferenceContext context) {
        List<Node> values = new ArrayList<>();
        for (Node left : inferAll(binOp.left(), context)) {
            for (Node right : inferAll(binOp.right(), context)) {
                values.add(binaryOperation(left, binOp.op(), right, context));
            }
        }
        return values;
    }

    private Node binaryOperation(Node left, String op, Node right, InferenceContext context) {
        if (left == Uninferable.INSTANCE || right == Uninferable.INSTANCE) {
            return Uninferable.INSTANCE;
        }
        List<Expression> leftElements = elementsOf(left);
        if (leftElements != null && "*".equals(op) && right instanceof Const count
                && Containers.isIntegral(count.value())) {
            return repeat(left, leftElements, ((Number) count.value()).longValue(), context);
        }
        if (leftElements != null && "+".equals(op) && right.getClass() == left.getClass()) {
            List<Expression> elements = new ArrayList<>();
            addInferred(elements, leftElements, context);
            addInferred(elements, elementsOf(right), context);
            return sequenceLike(left, elements);
        }
        if (left instanceof Const a && right instanceof Const b) {
            return ConstFolding.fold(a, op, b);
        }
        return Uninferable.INSTANCE;
    }

    private Node repeat(Node sequence, List<Expression> elements, long times, InferenceContext context) {
        if (!elements.isEmpty() && times > MAX_SEQUENCE_LENGTH / elements.size()) {
            logger.debug("Repetition of {} elements {} times is too long to infer", elements.size(), times);
            return Uninferable.INSTANCE;
        }
        List<Expression> single = new ArrayList<>(elements.size());
        for (Expression element : elements) {
            single.add(asExpression(safeInfer(element, context)));
        }
        List<Expression> repeated = new ArrayList<>();
        for (long i = 0; i < times; i++) {
            repeated.addAll(single);
        }
        return sequenceLike(sequence, repeated);
    }

    private void addInferred(List<Expression> target, List<Expression> elements, InferenceContext context) {
        for (Expression element : elements) {
            for (Node value : inferAll(element, context)) {
                if (value != Uninferable.INSTANCE) {
                    target.add(asExpression(value));
                }
            }
        }
    }

    private List<Node> inferSubscript(Subscript subscript, InferenceContext context) {
        List<Node> values = new ArrayList<>();
        for (Node container : inferAll(subscript.value(), context)) {
            for (Node index : inferAll(subscript.slice(), context)) {
                if (!(index instanceof Const key) || container == Uninferable.INSTANCE) {
                    values.add(Uninferable.INSTANCE);
                    continue;
                }
                try {
                    Node item = Containers.getItem(container, key.value(), k -> inferAll(k, context));
                    values.addAll(inferAll(item, context));
                } catch (ItemNotFoundException e) {
                    logger.debug("Subscript at line {}: {}", subscript.line(), e.getMessage());
                    values.add(Uninferable.INSTANCE);
                }
            }
        }
        return values;
    }

    private static List<Expression> elementsOf(Node node) {
        if (node instanceof ListLiteral list) {
            return list.elts();
        }
        if (node instanceof TupleLiteral tuple) {
            return tuple.elts();
        }
        return null;
    }

    private static int indexOfIdentity(List<Expression> elements, Node node) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    private static Node sequenceLike(Node sequence, List<Expression> elements) {
        if (sequence instanceof TupleLiteral) {
            return new TupleLiteral(sequence.line(), sequence.col(), List.copyOf(elements));
        }
        return new ListLiteral(sequence.line(), sequence.col(), List.copyOf(elements));
    }

    private static Expression asExpression(Node value) {
        return value instanceof Expression expression ? expression : Uninferable.INSTANCE;
    }
}
