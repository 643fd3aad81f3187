package com.pyscope;

import com.pyscope.analysis.BranchExclusivity;
import com.pyscope.analysis.LookupFilter;
import com.pyscope.analysis.LookupResult;
import com.pyscope.analysis.NameResolver;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.Node;
import com.pyscope.inference.BasicInferrer;
import com.pyscope.inference.InferenceContext;
import com.pyscope.inference.ValueUnpacker;
import com.pyscope.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Entry point: name lookup, branch exclusivity, inference and unpacking
 * over one module.
 *
 * <pre>{@code
 * ScopeAnalyzer analyzer = ScopeAnalyzer.of(module);
 * LookupResult result = analyzer.lookup(nameNode);
 * }</pre>
 *
 * <p>Instances are immutable once built and may be shared between threads;
 * each inference call uses its own context.</p>
 */
public final class ScopeAnalyzer {

    private final SyntaxTree tree;
    private final AnalyzerOptions options;
    private final BranchExclusivity exclusivity;
    private final NameResolver resolver;
    private final BasicInferrer inferrer;
    private final ValueUnpacker unpacker;

    private ScopeAnalyzer(SyntaxTree tree, AnalyzerOptions options) {
        this.tree = tree;
        this.options = options;
        this.exclusivity = new BranchExclusivity(tree);

        SyntaxTree builtinsTree = options.builtins() == null ? null : SyntaxTree.of(options.builtins());
        this.resolver = new NameResolver(tree, new LookupFilter(tree, exclusivity), builtinsTree);
        BasicInferrer builtinsInferrer = builtinsTree == null
            ? null
            : new BasicInferrer(builtinsTree, new NameResolver(builtinsTree));
        this.inferrer = new BasicInferrer(tree, resolver, builtinsInferrer);
        this.unpacker = new ValueUnpacker(inferrer, options.maxInferenceDepth());
    }

    public static ScopeAnalyzer of(Module module) {
        return of(module, AnalyzerOptions.defaults());
    }

    /**
     * @throws com.pyscope.tree.MalformedTreeException if a node instance appears twice
     */
    public static ScopeAnalyzer of(Module module, AnalyzerOptions options) {
        return new ScopeAnalyzer(SyntaxTree.of(module), options);
    }

    /**
     * Analyzer over a tree that is already built.
     */
    public static ScopeAnalyzer of(SyntaxTree tree, AnalyzerOptions options) {
        return new ScopeAnalyzer(tree, options);
    }

    public SyntaxTree tree() {
        return tree;
    }

    public AnalyzerOptions options() {
        return options;
    }

    public LookupResult lookup(Node use, String name) {
        return resolver.lookup(use, name);
    }

    public LookupResult lookup(Name name) {
        return resolver.lookup(name);
    }

    public boolean areExclusive(Node first, Node second) {
        return exclusivity.areExclusive(first, second);
    }

    public boolean areExclusive(Node first, Node second, Set<String> exceptionNames) {
        return exclusivity.areExclusive(first, second, exceptionNames);
    }

    public Stream<Node> infer(Node node) {
        return inferrer.infer(node, newContext());
    }

    /**
     * Inferred values of every binding a lookup of {@code name} from
     * {@code use} returns.
     */
    public List<Node> inferredLookup(Node use, String name) {
        LookupResult result = lookup(use, name);
        List<Node> values = new ArrayList<>();
        InferenceContext context = newContext();
        for (Node binding : result.bindings()) {
            inferrer.infer(binding, context).forEach(values::add);
        }
        return values;
    }

    public Stream<Node> unpack(Node node) {
        return unpacker.unpack(node);
    }

    private InferenceContext newContext() {
        return new InferenceContext(options.maxInferenceDepth());
    }
}
