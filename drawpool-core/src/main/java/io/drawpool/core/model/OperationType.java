// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

/**
 * Kind of pool operation a transaction performs. Selects the static gas profile
 * used when live estimation is unavailable.
 */
public enum OperationType {
    /** Token transfer into the pool plus share accounting. */
    DEPOSIT,
    /** Withdrawal of principal from the pool. */
    WITHDRAW,
    /** ERC-20 allowance for the pool contract. */
    APPROVAL,
    /** On-chain identity proof verification. */
    VERIFICATION,
    /** Prize draw and claim operations. */
    LOTTERY
}
