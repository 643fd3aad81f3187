package com.pyscope;

import com.pyscope.ast.Module;

/**
 * Settings for a {@link ScopeAnalyzer}.
 *
 * @param builtins          module consulted after the module scope; can be null
 * @param maxInferenceDepth nesting limit for inference and unpacking
 */
public record AnalyzerOptions(Module builtins, int maxInferenceDepth) {

    public static final int DEFAULT_MAX_INFERENCE_DEPTH = 64;

    public AnalyzerOptions {
        if (maxInferenceDepth < 1) {
            throw new IllegalArgumentException("maxInferenceDepth must be positive: " + maxInferenceDepth);
        }
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(null, DEFAULT_MAX_INFERENCE_DEPTH);
    }

    public AnalyzerOptions withBuiltins(Module builtins) {
        return new AnalyzerOptions(builtins, maxInferenceDepth);
    }

    public AnalyzerOptions withMaxInferenceDepth(int maxInferenceDepth) {
        return new AnalyzerOptions(builtins, maxInferenceDepth);
    }
}
