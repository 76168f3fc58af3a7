// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses between the real chain binding and the {@link DevModeSimulator}.
 *
 * <p>
 * The non-production flag is read once, when the provider is built. Nothing
 * downstream checks it again; the executor only sees a {@link ChainProvider}.
 *
 * <pre>{@code
 * ChainProvider provider = ChainProviders.fromSystemProperty(
 *         () -> JsonRpcChainProvider.http(rpcUrl),
 *         DevModeSimulator::new);
 * }</pre>
 */
public final class ChainProviders {

    private static final Logger log = LoggerFactory.getLogger(ChainProviders.class);

    /** System property holding the dev-mode flag. */
    public static final String DEV_MODE_PROPERTY = "drawpool.dev-mode";

    private ChainProviders() {
    }

    /**
     * Builds exactly one of the two providers; the other supplier is never
     * called.
     */
    public static ChainProvider select(
            final boolean nonProduction,
            final Supplier<? extends ChainProvider> real,
            final Supplier<? extends ChainProvider> simulator) {
        Objects.requireNonNull(real, "real");
        Objects.requireNonNull(simulator, "simulator");
        if (nonProduction) {
            log.warn("Dev mode enabled: transactions are simulated and never reach a chain");
            return Objects.requireNonNull(simulator.get(), "simulator supplier returned null");
        }
        return Objects.requireNonNull(real.get(), "real provider supplier returned null");
    }

    /**
     * {@link #select} driven by the {@value #DEV_MODE_PROPERTY} system property.
     */
    public static ChainProvider fromSystemProperty(
            final Supplier<? extends ChainProvider> real,
            final Supplier<? extends ChainProvider> simulator) {
        return select(Boolean.getBoolean(DEV_MODE_PROPERTY), real, simulator);
    }
}
