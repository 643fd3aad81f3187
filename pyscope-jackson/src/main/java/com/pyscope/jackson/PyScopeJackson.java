package com.pyscope.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances configured for syntax tree JSON.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = PyScopeJackson.createObjectMapper();
 * Module module = mapper.readValue(json, Module.class);
 * String out = mapper.writeValueAsString(module);
 * </pre>
 */
public final class PyScopeJackson {

    private PyScopeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization/deserialization.
     *
     * The returned mapper:
     * - Writes positions as lineno/col_offset and reads them back into line/col
     * - Handles polymorphic Node types via the "type" property
     * - Omits absent optional children, but always writes Const values
     * - Reads and writes non-finite float constants as bare Infinity/NaN tokens
     * - Ignores unknown properties
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();
        mapper.registerModule(new ParameterNamesModule());

        // Absent children are left out; Const values are forced back in by TreeModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new TreeModule());

        return mapper;
    }
}
