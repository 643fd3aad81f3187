package com.pyscope.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyscope.ScopeAnalyzer;
import com.pyscope.analysis.LookupResult;
import com.pyscope.ast.AssignName;
import com.pyscope.ast.Call;
import com.pyscope.ast.Const;
import com.pyscope.ast.Expr;
import com.pyscope.ast.Module;
import com.pyscope.ast.Name;
import com.pyscope.ast.Node;
import com.pyscope.json.TreeJsonException;
import com.pyscope.json.TreeJsonProvider;
import com.pyscope.tree.MalformedTreeException;
import com.pyscope.tree.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTreeJsonProviderTest {

    private static String fixture(String name) throws IOException {
        try (InputStream in = JacksonTreeJsonProviderTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(in, "missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testProviderDiscovery() {
        assertTrue(TreeJsonProvider.isProviderAvailable());

        TreeJsonProvider provider = TreeJsonProvider.getProvider("jackson");

        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonTreeJsonProvider.class, provider);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> TreeJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("Jackson"), "lists available providers: " + e.getMessage());
        assertEquals(1, TreeJsonProvider.availableProviders().size());
    }

    @Test
    void testFixtureFeedsAnalyzer() throws Exception {
        Module module = TreeJsonProvider.getProvider().getDeserializer().deserializeModule(fixture("if_else_module.json"));

        assertEquals("branches", module.name());
        Expr statement = (Expr) module.body().get(1);
        Name use = (Name) ((Call) statement.value()).args().get(0);
        assertEquals(5, use.line());
        assertEquals(6, use.col());

        ScopeAnalyzer analyzer = ScopeAnalyzer.of(module);
        LookupResult result = analyzer.lookup(use);
        assertEquals(2, result.bindings().size());
        assertEquals(2, ((AssignName) result.bindings().get(0)).line());
        assertEquals(4, ((AssignName) result.bindings().get(1)).line());

        List<Node> values = analyzer.inferredLookup(use, "x");
        assertEquals(1, ((Const) values.get(0)).value());
        assertEquals(2.5, ((Const) values.get(1)).value());
    }

    @Test
    void testProviderBuildsAnalyzer() throws Exception {
        ScopeAnalyzer analyzer = TreeJsonProvider.getProvider("Jackson").analyze(fixture("if_else_module.json"));

        Module module = analyzer.tree().root();
        Expr statement = (Expr) module.body().get(1);
        Name use = (Name) ((Call) statement.value()).args().get(0);
        assertTrue(analyzer.tree().contains(use));
        assertEquals(2, analyzer.lookup(use).bindings().size());
    }

    @Test
    void testMalformedTreeIsRejectedOnLoad() {
        String json = """
            { "type": "Module", "name": "bad", "body": [
              { "type": "Expr", "lineno": 1, "col_offset": 0, "value":
                { "type": "Call", "lineno": 1, "col_offset": 0,
                  "func": { "type": "Name", "lineno": 1, "col_offset": 0, "name": "f" },
                  "args": [ { "type": "AssignName", "lineno": 1, "col_offset": 2, "name": "x" } ],
                  "keywords": [] } } ] }
            """;
        TreeJsonProvider provider = new JacksonTreeJsonProvider();

        assertNotNull(provider.getDeserializer().deserializeModule(json), "the JSON itself is readable");
        TreeJsonException e = assertThrows(TreeJsonException.class, () -> provider.analyze(json));
        System.out.println("Rejected: " + e.getMessage());
        assertEquals("AssignName", e.getNodeType());
        assertInstanceOf(MalformedTreeException.class, e.getCause());
        assertTrue(e.getMessage().contains("bad"), e.getMessage());
    }

    @Test
    void testSerializeBuiltTree() throws Exception {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        SyntaxTree tree = provider.getDeserializer().deserializeTree(fixture("if_else_module.json"));

        assertEquals(provider.getSerializer().serialize(tree.root()), provider.getSerializer().serialize(tree));
    }

    @Test
    void testRoundTripUsesWireNames() throws Exception {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();
        Module module = provider.getDeserializer().deserializeModule(fixture("if_else_module.json"));

        String json = provider.getSerializer().serialize(module);
        System.out.println("Serialized tree:\n" + provider.getSerializer().serializePretty(module));

        assertTrue(json.contains("\"lineno\":1"), "positions use lineno");
        assertTrue(json.contains("\"col_offset\":6"), "positions use col_offset");
        assertFalse(json.contains("\"line\""), "should NOT have line field");
        assertFalse(json.contains("\"col\""), "should NOT have col field");
        assertEquals(module, provider.getDeserializer().deserializeModule(json));
    }

    @Test
    void testConstValues() throws Exception {
        ObjectMapper mapper = PyScopeJackson.createObjectMapper();

        String infinity = mapper.writeValueAsString(new Const(1, 0, Double.POSITIVE_INFINITY));
        String negative = mapper.writeValueAsString(new Const(1, 0, Double.NEGATIVE_INFINITY));
        String nan = mapper.writeValueAsString(new Const(1, 0, Double.NaN));
        String none = mapper.writeValueAsString(new Const(1, 0, null));
        String whole = mapper.writeValueAsString(new Const(1, 0, 2.0));

        assertTrue(infinity.contains("\"value\":Infinity"), infinity);
        assertTrue(negative.contains("\"value\":-Infinity"), negative);
        assertTrue(nan.contains("\"value\":NaN"), nan);
        assertTrue(none.contains("\"value\":null"), "None is written explicitly: " + none);
        assertTrue(whole.contains("\"value\":2.0"), "floats keep their decimal point: " + whole);

        assertEquals(Double.POSITIVE_INFINITY, mapper.readValue(infinity, Const.class).value());
        assertEquals(Double.NEGATIVE_INFINITY, mapper.readValue(negative, Const.class).value());
        assertTrue(Double.isNaN((Double) mapper.readValue(nan, Const.class).value()));
        assertNull(mapper.readValue(none, Const.class).value());
        assertEquals(2.0, mapper.readValue(whole, Const.class).value());
    }

    @Test
    void testPolymorphicRead() throws Exception {
        ObjectMapper mapper = PyScopeJackson.createObjectMapper();
        String json = """
            { "type": "Name", "lineno": 3, "col_offset": 7, "end_col_offset": 8, "name": "y" }
            """;

        Node node = mapper.readValue(json, Node.class);

        assertEquals(new Name(3, 7, "y"), node);
        JsonNode written = mapper.readTree(mapper.writeValueAsString(node));
        assertEquals("Name", written.get("type").asText());
        assertEquals(3, written.get("lineno").asInt());
    }

    @Test
    void testMalformedJson() {
        TreeJsonProvider provider = new JacksonTreeJsonProvider();

        TreeJsonException e = assertThrows(TreeJsonException.class,
            () -> provider.getDeserializer().deserializeModule("{ \"type\": \"Module\", \"body\": [ { } ] }"));
        System.out.println("Rejected: " + e.getMessage());
        assertThrows(TreeJsonException.class, () -> provider.getDeserializer().deserializeModule("not json"));
    }
}
