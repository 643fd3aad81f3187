package com.pyscope.analysis;

import com.pyscope.ast.Alias;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.ClassDef;
import com.pyscope.ast.FunctionDef;
import com.pyscope.ast.Global;
import com.pyscope.ast.Import;
import com.pyscope.ast.Lambda;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.Pass;
import com.pyscope.ast.Return;
import com.pyscope.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.pyscope.Py.*;
import static org.junit.jupiter.api.Assertions.*;

public class NameResolverTest {

    @Test
    void testArgumentDefaultResolvesBeforeTheFunction() {
        // func = 1
        // def func(a=func): pass
        AssignName first = target(1, "func");
        Name defaultValue = name(2, "func");
        FunctionDef function = def(2, "func", argsWithDefaults(2, List.of(target(2, "a")), defaultValue),
            new Pass(2, 0));
        SyntaxTree tree = SyntaxTree.of(module(assign(1, first, num(1, 1)), function));

        LookupResult result = new NameResolver(tree).lookup(defaultValue);

        assertSame(tree.root(), result.scope());
        assertEquals(1, result.bindings().size());
        assertSame(first, result.bindings().get(0));
    }

    @Test
    void testLambdaDefaultResolvesInEnclosingScope() {
        // y = 1
        // f = lambda a=y: a
        AssignName y = target(1, "y");
        Name defaultValue = name(2, "y");
        Lambda lambda = new Lambda(2, 4, argsWithDefaults(2, List.of(target(2, "a")), defaultValue), name(2, "a"));
        SyntaxTree tree = SyntaxTree.of(module(assign(1, y, num(1, 1)), assign(2, "f", lambda)));

        LookupResult result = new NameResolver(tree).lookup(defaultValue);

        assertSame(tree.root(), result.scope());
        assertSame(y, result.bindings().get(0));
    }

    @Test
    void testClassBaseResolvesBeforeTheClass() {
        // A = 1
        // class A(A): pass
        AssignName first = target(1, "A");
        Name base = name(2, "A");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, first, num(1, 1)),
            classDef(2, "A", List.of(base), new Pass(2, 0))));

        LookupResult result = new NameResolver(tree).lookup(base);

        assertSame(tree.root(), result.scope());
        assertEquals(1, result.bindings().size());
        assertSame(first, result.bindings().get(0));
    }

    @Test
    void testClassScopeIsSkippedByMethods() {
        // x = 1
        // class C:
        //     x = 2
        //     def m(self):
        //         return x
        AssignName moduleLevel = target(1, "x");
        Name use = name(5, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, moduleLevel, num(1, 1)),
            classDef(2, "C", List.of(),
                assign(3, "x", num(3, 2)),
                def(4, "m", args(4, target(4, "self")), new Return(5, 0, use)))));

        LookupResult result = new NameResolver(tree).lookup(use);

        assertSame(tree.root(), result.scope());
        assertEquals(List.of(moduleLevel), result.bindings());
        assertSame(moduleLevel, result.bindings().get(0));
    }

    @Test
    void testClosureResolvesInEnclosingFunction() {
        // def outer():
        //     v = 1
        //     def inner():
        //         return v
        AssignName v = target(2, "v");
        Name use = name(4, "v");
        FunctionDef outer = def(1, "outer", args(1),
            assign(2, v, num(2, 1)),
            def(3, "inner", args(3), new Return(4, 0, use)));
        SyntaxTree tree = SyntaxTree.of(module(outer));

        LookupResult result = new NameResolver(tree).lookup(use);

        assertSame(outer, result.scope());
        assertSame(v, result.bindings().get(0));
    }

    @Test
    void testGlobalDeclarationBindsInModule() {
        // def f():
        //     global g
        //     g = 1
        // print(g)
        AssignName g = target(3, "g");
        Name use = name(4, "g");
        FunctionDef f = def(1, "f", args(1),
            new Global(2, 0, List.of("g")),
            assign(3, g, num(3, 1)));
        SyntaxTree tree = SyntaxTree.of(module(f, print(4, use)));

        assertTrue(tree.localBindings(f, "g").isEmpty());
        LookupResult result = new NameResolver(tree).lookup(use);
        assertSame(tree.root(), result.scope());
        assertSame(g, result.bindings().get(0));
    }

    @Test
    void testImportBindsFirstDottedComponent() {
        Import importNode = new Import(1, 0, List.of(new Alias("os.path", null), new Alias("json", "j")));
        Name os = name(2, "os");
        Name j = name(2, "j");
        SyntaxTree tree = SyntaxTree.of(module(importNode, print(2, os), print(3, j)));
        NameResolver resolver = new NameResolver(tree);

        assertSame(importNode, resolver.lookup(os).bindings().get(0));
        assertSame(importNode, resolver.lookup(j).bindings().get(0));
        assertFalse(resolver.lookup(j, "json").isResolved(), "an aliased import binds only its alias");
    }

    @Test
    void testUnresolvedNameFallsBackToBuiltins() {
        Module builtins = new Module("builtins", List.of(
            def(1, "len", args(1, target(1, "obj")), new Pass(1, 0))));
        SyntaxTree builtinsTree = SyntaxTree.of(builtins);
        Name len = name(1, "len");
        Name missing = name(2, "missing");
        SyntaxTree tree = SyntaxTree.of(module(print(1, len), print(2, missing)));
        NameResolver resolver = new NameResolver(tree, builtinsTree);

        LookupResult found = resolver.lookup(len);
        assertSame(builtins, found.scope());
        assertSame(builtins.body().get(0), found.bindings().get(0));

        LookupResult notFound = resolver.lookup(missing);
        assertSame(builtins, notFound.scope());
        assertFalse(notFound.isResolved());
    }

    @Test
    void testUnresolvedNameWithoutBuiltinsBelongsToModule() {
        Name missing = name(1, "missing");
        SyntaxTree tree = SyntaxTree.of(module(print(1, missing)));

        LookupResult result = new NameResolver(tree).lookup(missing);

        assertSame(tree.root(), result.scope());
        assertTrue(result.bindings().isEmpty());
    }

    @Test
    void testBuiltinNamedDecoratorInClassLooksOutside() {
        // class C:
        //     property = 1
        //     @property
        //     def p(self): pass
        Module builtins = new Module("builtins", List.of(classDef(1, "property", List.of(), new Pass(1, 0))));
        Name decorator = name(3, "property");
        ClassDef c = classDef(1, "C", List.of(),
            assign(2, "property", num(2, 1)),
            decoratedDef(4, "p", decorator, new Pass(4, 0)));
        SyntaxTree tree = SyntaxTree.of(module(c));

        LookupResult withBuiltins = new NameResolver(tree, SyntaxTree.of(builtins)).lookup(decorator);
        assertSame(builtins, withBuiltins.scope());

        LookupResult withoutBuiltins = new NameResolver(tree).lookup(decorator);
        assertSame(c, withoutBuiltins.scope());
    }

    @Test
    void testLookupIsRepeatable() {
        Name use = name(3, "x");
        SyntaxTree tree = SyntaxTree.of(module(
            assign(1, "x", num(1, 1)),
            forStmt(2, target(2, "x"), name(2, "y"), print(3, use))));
        NameResolver resolver = new NameResolver(tree);

        LookupResult first = resolver.lookup(use);
        LookupResult second = resolver.lookup(use);

        assertSame(first.scope(), second.scope());
        assertEquals(first.bindings().size(), second.bindings().size());
        for (int i = 0; i < first.bindings().size(); i++) {
            assertSame(first.bindings().get(i), second.bindings().get(i));
        }
    }
}
