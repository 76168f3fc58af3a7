// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.chain;

import io.drawpool.core.types.Wei;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public final class ChainProfiles {
    private ChainProfiles() {}

    public static final ChainProfile WORLDCHAIN = new ChainProfile(
            480L,
            "World Chain",
            "https://worldchain-mainnet.g.alchemy.com/public",
            "https://worldchain.blockscout.com",
            Wei.gwei(new BigDecimal("1.5")));

    public static final ChainProfile WORLDCHAIN_SEPOLIA = new ChainProfile(
            4801L,
            "World Chain Sepolia",
            "https://worldchain-sepolia.g.alchemy.com/public",
            "https://worldchain-sepolia.blockscout.com",
            Wei.gwei(new BigDecimal("1.5")));

    public static final ChainProfile ANVIL_LOCAL = new ChainProfile(
            31337L,
            "Local Anvil",
            "http://127.0.0.1:8545",
            "http://127.0.0.1:8545",
            Wei.of(1_000_000_000L));

    private static final List<ChainProfile> ALL = List.of(WORLDCHAIN, WORLDCHAIN_SEPOLIA, ANVIL_LOCAL);

    public static Optional<ChainProfile> byChainId(final long chainId) {
        return ALL.stream().filter(p -> p.chainId() == chainId).findFirst();
    }
}
