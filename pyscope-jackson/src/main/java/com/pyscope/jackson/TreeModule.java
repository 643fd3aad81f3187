package com.pyscope.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.util.NameTransformer;
import com.pyscope.ast.Const;
import com.pyscope.ast.Expression;
import com.pyscope.ast.Node;
import com.pyscope.ast.Statement;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson module that configures serialization/deserialization for the tree classes.
 *
 * This module handles:
 * - Polymorphic type handling via the "type" property, one named subtype per record
 * - Writing line/col as lineno/col_offset, and the reverse on read
 * - Always writing Const values, with float-preserving number output
 */
public class TreeModule extends SimpleModule {

    private static final Map<String, String> WIRE_NAMES = Map.of("line", "lineno", "col", "col_offset");
    private static final Map<String, String> RECORD_NAMES = Map.of("lineno", "line", "col_offset", "col");

    public TreeModule() {
        super("TreeModule", new Version(1, 0, 0, null, "com.pyscope", "pyscope-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);

        // Mixins on interfaces are not reliably inherited by records, so every
        // node record gets its own
        List<NamedType> subtypes = new ArrayList<>();
        for (Class<?> recordClass : nodeRecords()) {
            subtypes.add(new NamedType(recordClass, recordClass.getSimpleName()));
            if (recordClass != Const.class) {
                context.setMixInAnnotations(recordClass, NodeMixin.class);
            }
        }
        context.setMixInAnnotations(Const.class, ConstMixin.class);
        context.registerSubtypes(subtypes.toArray(new NamedType[0]));

        context.addBeanSerializerModifier(new TreeSerializerModifier());
        context.addBeanDeserializerModifier(new TreeDeserializerModifier());
    }

    /**
     * All record classes below the sealed {@link Node} hierarchy.
     */
    static List<Class<?>> nodeRecords() {
        List<Class<?>> records = new ArrayList<>();
        Deque<Class<?>> pending = new ArrayDeque<>();
        pending.push(Node.class);
        while (!pending.isEmpty()) {
            Class<?> type = pending.pop();
            if (type.isRecord()) {
                if (!records.contains(type)) {
                    records.add(type);
                }
            } else if (type.isSealed()) {
                for (Class<?> permitted : type.getPermittedSubclasses()) {
                    pending.push(permitted);
                }
            }
        }
        return records;
    }

    // ==================== Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    private abstract static class ConstMixin extends NodeMixin {
        @JsonSerialize(using = ConstValueSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    // ==================== Serializer Modifier ====================

    private static class TreeSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> renamed = new ArrayList<>(beanProperties.size());
            for (BeanPropertyWriter prop : beanProperties) {
                renamed.add(WIRE_NAMES.containsKey(prop.getName()) ? prop.rename(POSITION_NAMES) : prop);
            }
            return renamed;
        }
    }

    private static final NameTransformer POSITION_NAMES = new NameTransformer() {
        @Override
        public String transform(String name) {
            return WIRE_NAMES.getOrDefault(name, name);
        }

        @Override
        public String reverse(String transformed) {
            return RECORD_NAMES.getOrDefault(transformed, transformed);
        }
    };

    // ==================== Deserializer Modifier ====================

    private static class TreeDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                      BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new TreeNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    private static class TreeNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {
        // Nesting of node deserialization per thread; only the outermost call rewrites the tree
        private static final ThreadLocal<Integer> DEPTH = ThreadLocal.withInitial(() -> 0);

        private final JsonDeserializer<?> delegate;

        TreeNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer resolvable) {
                resolvable.resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            int depth = DEPTH.get();
            JsonNode node = p.readValueAsTree();
            if (depth == 0) {
                renamePositions(node);
            }

            DEPTH.set(depth + 1);
            try {
                JsonParser jp = node.traverse(p.getCodec());
                jp.nextToken();
                return delegate.deserialize(jp, ctxt);
            } finally {
                DEPTH.set(depth);
            }
        }

        /**
         * Rewrites lineno/col_offset to line/col in every object of the tree.
         */
        private static void renamePositions(JsonNode root) {
            Deque<JsonNode> pending = new ArrayDeque<>();
            pending.push(root);
            while (!pending.isEmpty()) {
                JsonNode node = pending.pop();
                if (node.isObject()) {
                    ObjectNode object = (ObjectNode) node;
                    for (Map.Entry<String, String> rename : RECORD_NAMES.entrySet()) {
                        if (object.has(rename.getKey())) {
                            object.set(rename.getValue(), object.remove(rename.getKey()));
                        }
                    }
                }
                Iterator<JsonNode> children = node.elements();
                while (children.hasNext()) {
                    pending.push(children.next());
                }
            }
        }
    }
}
