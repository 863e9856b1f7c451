package com.jsunparser.json;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * A JSON binding for the node records, found at runtime through
 * {@link ServiceLoader}. Putting unparser-jackson on the classpath registers one.
 *
 * <pre>{@code
 * Program program = AstJsonProvider.getProvider().getDeserializer().deserializeProgram(json);
 * String source = Unparser.standard().renderProgram(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name used by {@link #getProvider(String)}, matched ignoring case.
     */
    String getName();

    /**
     * All registered providers, in classpath order.
     */
    static List<AstJsonProvider> providers() {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .collect(Collectors.toList());
    }

    /**
     * @throws IllegalStateException if nothing is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No JSON binding for syntax trees is registered; add unparser-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException if no registered provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        List<AstJsonProvider> all = providers();
        return all.stream()
            .filter(p -> p.getName().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No JSON binding named '" + name + "'; registered: "
                + all.stream().map(AstJsonProvider::getName).collect(Collectors.joining(", ", "[", "]"))));
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
