// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ChainProvidersTest {

    private final AtomicInteger realCalls = new AtomicInteger();
    private final AtomicInteger simulatorCalls = new AtomicInteger();
    private final FakeChainProvider real = new FakeChainProvider();

    private final Supplier<ChainProvider> realSupplier = () -> {
        realCalls.incrementAndGet();
        return real;
    };
    private final Supplier<ChainProvider> simulatorSupplier = () -> {
        simulatorCalls.incrementAndGet();
        return new DevModeSimulator();
    };

    @AfterEach
    void clearProperty() {
        System.clearProperty(ChainProviders.DEV_MODE_PROPERTY);
    }

    @Test
    void productionBuildsOnlyTheRealProvider() {
        ChainProvider provider = ChainProviders.select(false, realSupplier, simulatorSupplier);

        assertSame(real, provider);
        assertEquals(1, realCalls.get());
        assertEquals(0, simulatorCalls.get());
    }

    @Test
    void devModeBuildsOnlyTheSimulator() {
        ChainProvider provider = ChainProviders.select(true, realSupplier, simulatorSupplier);

        assertInstanceOf(DevModeSimulator.class, provider);
        assertEquals(0, realCalls.get());
        assertEquals(1, simulatorCalls.get());
    }

    @Test
    void readsDevModeFromSystemProperty() {
        System.setProperty(ChainProviders.DEV_MODE_PROPERTY, "true");
        assertInstanceOf(DevModeSimulator.class, ChainProviders.fromSystemProperty(realSupplier, simulatorSupplier));

        System.setProperty(ChainProviders.DEV_MODE_PROPERTY, "false");
        assertSame(real, ChainProviders.fromSystemProperty(realSupplier, simulatorSupplier));
    }

    @Test
    void unsetPropertyMeansProduction() {
        assertSame(real, ChainProviders.fromSystemProperty(realSupplier, simulatorSupplier));
    }

    @Test
    void rejectsNullSupplierResult() {
        assertThrows(NullPointerException.class, () -> ChainProviders.select(false, () -> null, simulatorSupplier));
    }
}
