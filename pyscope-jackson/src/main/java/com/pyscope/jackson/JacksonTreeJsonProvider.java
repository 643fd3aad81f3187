package com.pyscope.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pyscope.ast.Module;
import com.pyscope.ast.Node;
import com.pyscope.json.TreeJsonDeserializer;
import com.pyscope.json.TreeJsonException;
import com.pyscope.json.TreeJsonProvider;
import com.pyscope.json.TreeJsonSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Jackson-based implementation of TreeJsonProvider.
 */
public class JacksonTreeJsonProvider implements TreeJsonProvider {
    private static final Logger logger = LogManager.getLogger(JacksonTreeJsonProvider.class);

    private final ObjectMapper mapper;
    private final TreeJsonSerializer serializer;
    private final TreeJsonDeserializer deserializer;

    public JacksonTreeJsonProvider() {
        this.mapper = PyScopeJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public TreeJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public TreeJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements TreeJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws TreeJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + node.type() + " node", node.type(), e);
            }
        }

        @Override
        public String serializePretty(Node node) throws TreeJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new TreeJsonException("Failed to serialize " + node.type() + " node", node.type(), e);
            }
        }
    }

    private static class JacksonDeserializer implements TreeJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Module deserializeModule(String json) throws TreeJsonException {
            return deserialize(json, Module.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws TreeJsonException {
            try {
                T node = mapper.readValue(json, type);
                logger.debug("Read {} from {} characters of JSON", type.getSimpleName(), json.length());
                return node;
            } catch (Exception e) {
                throw new TreeJsonException("Failed to deserialize " + type.getSimpleName(), type.getSimpleName(), e);
            }
        }
    }
}
