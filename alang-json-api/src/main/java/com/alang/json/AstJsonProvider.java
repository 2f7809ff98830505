package com.alang.json;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Entry point for AST JSON support. Implementations are discovered with
 * {@link ServiceLoader}; putting {@code alang-jackson} on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(Parser.parse(source));
 * Program program = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * Returns the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            Holder.LOG.debug("Using AST JSON provider {}", provider.getName());
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add alang-jackson (or another provider) to your dependencies.");
    }

    /**
     * Returns the provider whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no such provider is on the classpath
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                Holder.LOG.debug("Using AST JSON provider {}", provider.getName());
                return provider;
            }
            Holder.LOG.trace("Skipping AST JSON provider {}", provider.getName());
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }

    // Interfaces cannot hold private static fields
    final class Holder {
        private static final Logger LOG = LoggerFactory.getLogger(AstJsonProvider.class);

        private Holder() {
        }
    }
}
