package com.pyscope.json;

import com.pyscope.AnalyzerOptions;
import com.pyscope.ScopeAnalyzer;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * A JSON binding for syntax trees, discovered with {@link ServiceLoader}.
 *
 * <pre>{@code
 * ScopeAnalyzer analyzer = TreeJsonProvider.getProvider().analyze(json);
 * LookupResult result = analyzer.lookup(use);
 * }</pre>
 */
public interface TreeJsonProvider {

    TreeJsonSerializer getSerializer();

    TreeJsonDeserializer getDeserializer();

    /**
     * Name used to select this provider, e.g. "Jackson".
     */
    String getName();

    /**
     * Reads a module and returns an analyzer over it with default options.
     */
    default ScopeAnalyzer analyze(String json) throws TreeJsonException {
        return analyze(json, AnalyzerOptions.defaults());
    }

    default ScopeAnalyzer analyze(String json, AnalyzerOptions options) throws TreeJsonException {
        return getDeserializer().deserializeAnalyzer(json, options);
    }

    /**
     * Every provider on the classpath, in ServiceLoader order.
     */
    static List<TreeJsonProvider> availableProviders() {
        List<TreeJsonProvider> providers = new ArrayList<>();
        ServiceLoader.load(TreeJsonProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static TreeJsonProvider getProvider() {
        List<TreeJsonProvider> providers = availableProviders();
        if (providers.isEmpty()) {
            throw new IllegalStateException(
                "No TreeJsonProvider found on the classpath; add pyscope-jackson to the dependencies");
        }
        return providers.get(0);
    }

    /**
     * @param name provider name, compared ignoring case
     * @throws IllegalStateException if no provider has that name
     */
    static TreeJsonProvider getProvider(String name) {
        List<TreeJsonProvider> providers = availableProviders();
        for (TreeJsonProvider provider : providers) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        String available = providers.stream().map(TreeJsonProvider::getName).collect(Collectors.joining(", "));
        throw new IllegalStateException(
            "No TreeJsonProvider named '" + name + "'; available: [" + available + "]");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(TreeJsonProvider.class).findFirst().isPresent();
    }
}
