// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.chain;

import io.drawpool.core.types.Wei;
import java.util.Objects;

/**
 * Static description of a chain the pool is deployed on.
 *
 * @param chainId                  EIP-155 chain id, must be positive
 * @param name                     display name
 * @param defaultRpcUrl            public RPC endpoint used when none is
 *                                 configured
 * @param blockExplorerUrl         base URL for transaction links
 * @param defaultPriorityFeePerGas tip applied when estimating fees
 */
public record ChainProfile(
        long chainId,
        String name,
        String defaultRpcUrl,
        String blockExplorerUrl,
        Wei defaultPriorityFeePerGas) {

    public ChainProfile {
        if (chainId <= 0) {
            throw new IllegalArgumentException("chainId must be positive, got: " + chainId);
        }
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(defaultRpcUrl, "defaultRpcUrl cannot be null");
        if (defaultRpcUrl.isBlank()) {
            throw new IllegalArgumentException("defaultRpcUrl cannot be empty");
        }
        Objects.requireNonNull(blockExplorerUrl, "blockExplorerUrl cannot be null");
        Objects.requireNonNull(defaultPriorityFeePerGas, "defaultPriorityFeePerGas cannot be null");
    }

    /**
     * Link to a transaction on this chain's block explorer.
     */
    public String explorerTxUrl(final String txHash) {
        final String base = blockExplorerUrl.endsWith("/")
                ? blockExplorerUrl.substring(0, blockExplorerUrl.length() - 1)
                : blockExplorerUrl;
        return base + "/tx/" + txHash;
    }
}
